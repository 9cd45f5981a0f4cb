package io.sendshield;

import io.sendshield.cli.SendShieldCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new SendShieldCommand()).execute(args);
        System.exit(code);
    }
}

package io.sendshield.cli;

import io.sendshield.config.SendShieldConfig;
import io.sendshield.model.Priority;
import io.sendshield.model.SendRequest;
import io.sendshield.runtime.RuntimeOptions;
import io.sendshield.runtime.SendShieldRuntime;
import io.sendshield.runtime.StoreKind;
import io.sendshield.util.Jsons;
import io.sendshield.web.ControlApi;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "sendshield",
        mixinStandardHelpOptions = true,
        description = "Paced, health-gated dispatch of outbound messages for automated accounts",
        subcommands = {
                SendShieldCommand.InitCommand.class,
                SendShieldCommand.ServeCommand.class,
                SendShieldCommand.EnqueueCommand.class,
                SendShieldCommand.StatusCommand.class,
                SendShieldCommand.SettingsCommand.class
        }
)
public final class SendShieldCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--store"}, description = "Message store: memory | sqlite", defaultValue = "memory")
    String store;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | serve | enqueue | status | settings");
    }

    SendShieldRuntime runtime() {
        SendShieldConfig config = SendShieldConfig.fromRoot(root);
        return new SendShieldRuntime(config, RuntimeOptions.defaults().withStore(StoreKind.fromString(store)));
    }

    @Command(name = "init", description = "Initialize the data root, audit trail and (for sqlite) the schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SendShieldCommand parent;

        @Override
        public Integer call() {
            try (SendShieldRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println("Initialized SendShield at: " + runtime.config().rootDir());
            }
            return 0;
        }
    }

    @Command(name = "serve", description = "Run the dispatch loop and the control API (dry-run account client)")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        SendShieldCommand parent;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "Bind host")
        String host;

        @Option(names = {"--port"}, defaultValue = "8088", description = "Bind port")
        int port;

        @Option(names = {"--admin-token"}, defaultValue = "${env:SENDSHIELD_ADMIN_TOKEN}",
                description = "Bearer token required on admin routes (default: $SENDSHIELD_ADMIN_TOKEN)")
        String adminToken;

        @Option(names = {"--write-limit-per-min"}, defaultValue = "120",
                description = "Mutating requests per remote address per minute (0 disables)")
        int writeLimitPerMin;

        @Override
        public Integer call() throws Exception {
            SendShieldRuntime runtime = parent.runtime();
            runtime.init();
            ControlApi api = new ControlApi(runtime, adminToken, writeLimitPerMin, Clock.systemUTC());
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                api.close();
                runtime.close();
                stopped.countDown();
            }, "sendshield-shutdown"));
            runtime.start();
            api.start(host, port);
            System.out.println("SendShield listening on http://" + host + ":" + api.port());
            stopped.await();
            return 0;
        }
    }

    @Command(name = "enqueue", description = "Queue a text message (use with --store sqlite and a running serve)")
    static final class EnqueueCommand implements Callable<Integer> {
        @ParentCommand
        SendShieldCommand parent;

        @Option(names = {"--account"}, required = true, description = "Sending account id")
        String account;

        @Option(names = {"--to"}, required = true, description = "Recipient")
        String to;

        @Option(names = {"--text"}, required = true, description = "Message body")
        String text;

        @Option(names = {"--priority"}, defaultValue = "normal", description = "high | normal | low")
        String priority;

        @Override
        public Integer call() {
            try (SendShieldRuntime runtime = parent.runtime()) {
                runtime.init();
                String id = runtime.enqueue(SendRequest.text(account, to, text).withPriority(Priority.fromString(priority)));
                System.out.println(Jsons.toJson(Map.of("messageId", id, "status", "queued")));
            }
            return 0;
        }
    }

    @Command(name = "status", description = "Print queue counts and account health as JSON")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        SendShieldCommand parent;

        @Override
        public Integer call() {
            try (SendShieldRuntime runtime = parent.runtime()) {
                runtime.init();
                System.out.println(Jsons.toJson(runtime.dashboard()));
            }
            return 0;
        }
    }

    @Command(name = "settings", description = "Reload sendshield-settings.json and print effective values")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        SendShieldCommand parent;

        @Override
        public Integer call() {
            try (SendShieldRuntime runtime = parent.runtime()) {
                runtime.init();
                SendShieldRuntime.SettingsReloadOutcome out = runtime.reloadSettings("cli");
                System.out.println(Jsons.toJson(out));
            }
            return 0;
        }
    }
}

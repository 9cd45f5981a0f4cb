package io.sendshield.model;

import java.util.List;

public record SendOptions(
        String quotedMessageId,
        List<String> mentions
) {
    public static final SendOptions NONE = new SendOptions(null, List.of());

    public SendOptions {
        mentions = mentions == null ? List.of() : List.copyOf(mentions);
    }
}

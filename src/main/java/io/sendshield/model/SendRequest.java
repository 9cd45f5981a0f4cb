package io.sendshield.model;

/**
 * Producer-side request accepted by the dispatch queue. {@code priority} and {@code maxAttempts}
 * are optional; the queue fills them from its active configuration.
 */
public record SendRequest(
        String accountId,
        String recipient,
        MessageKind kind,
        MessagePayload payload,
        SendOptions options,
        Priority priority,
        Integer maxAttempts
) {
    public static SendRequest text(String accountId, String recipient, String body) {
        return new SendRequest(accountId, recipient, MessageKind.TEXT, MessagePayload.text(body), SendOptions.NONE, Priority.NORMAL, null);
    }

    public SendRequest withPriority(Priority value) {
        return new SendRequest(accountId, recipient, kind, payload, options, value, maxAttempts);
    }

    public SendRequest withMaxAttempts(int value) {
        return new SendRequest(accountId, recipient, kind, payload, options, priority, value);
    }
}

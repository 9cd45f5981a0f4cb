package io.sendshield.model;

public record DeviceQueueStatus(
        String accountId,
        int messagesInLast60s,
        Long lastMessageTime,
        int queuedMessages
) {
}

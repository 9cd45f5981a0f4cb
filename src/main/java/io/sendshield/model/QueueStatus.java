package io.sendshield.model;

public record QueueStatus(int pending, int processing, int totalQueued) {
    public static QueueStatus of(int pending, int processing) {
        return new QueueStatus(pending, processing, pending + processing);
    }
}

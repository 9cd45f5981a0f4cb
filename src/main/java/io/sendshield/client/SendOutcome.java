package io.sendshield.client;

public record SendOutcome(String providerMessageId, long acceptedAtMs) {
}

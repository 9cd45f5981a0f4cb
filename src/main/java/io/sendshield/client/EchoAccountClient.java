package io.sendshield.client;

import io.sendshield.model.MessageKind;
import io.sendshield.model.MessagePayload;
import io.sendshield.model.SendOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Dry-run client: accepts every message and logs it instead of delivering it.
 */
public final class EchoAccountClient implements AccountClient {
    private static final Logger log = LoggerFactory.getLogger(EchoAccountClient.class);

    private final Clock clock;
    private final AtomicLong sentTotal = new AtomicLong();

    public EchoAccountClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    public SendOutcome send(String accountId, String recipient, MessageKind kind, MessagePayload payload, SendOptions options) {
        sentTotal.incrementAndGet();
        log.info("dry-run send account={} to={} kind={} textLength={}", accountId, recipient, kind.wireName(), payload.textLength());
        return new SendOutcome("echo_" + UUID.randomUUID(), clock.millis());
    }

    public long sentTotal() {
        return sentTotal.get();
    }
}

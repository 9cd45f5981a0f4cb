package io.sendshield.client;

import io.sendshield.model.MessageKind;
import io.sendshield.model.MessagePayload;
import io.sendshield.model.SendOptions;

/**
 * Capability that physically delivers a message through the automation session of an account.
 * Owned by the device lifecycle manager; the dispatch queue only calls it. Implementations may
 * block for the duration of the round-trip.
 */
public interface AccountClient {
    SendOutcome send(String accountId, String recipient, MessageKind kind, MessagePayload payload, SendOptions options)
            throws TransportException;

    /**
     * Shows a "typing" indicator towards the recipient. Optional; the default does nothing.
     */
    default void sendTyping(String accountId, String recipient, boolean typing) throws TransportException {
    }
}

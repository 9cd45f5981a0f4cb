package io.sendshield.client;

import io.sendshield.model.ActivityType;

/**
 * Receives connection changes of an account's automation session.
 */
@FunctionalInterface
public interface DeviceEventListener {
    /**
     * @param type   {@link ActivityType#DISCONNECTED} or {@link ActivityType#RECONNECTED}
     * @param detail disconnect reason, may be null
     */
    void onDeviceEvent(String accountId, ActivityType type, String detail);
}

package io.sendshield.client;

@FunctionalInterface
public interface DeviceLifecycle {
    DeviceLifecycle ALWAYS_READY = accountId -> true;

    boolean isReady(String accountId);

    /**
     * Registers a sink for disconnects and reconnects. Lifecycles that cannot observe the session
     * ignore it; the control API accepts the same events.
     */
    default void addListener(DeviceEventListener listener) {
    }
}

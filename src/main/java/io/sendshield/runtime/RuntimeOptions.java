package io.sendshield.runtime;

import io.sendshield.client.AccountClient;
import io.sendshield.client.DeviceLifecycle;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Collaborators the runtime does not build itself. A null {@code client} selects the dry-run
 * client; a null {@code dispatchExecutor} selects a bounded daemon pool owned by the runtime.
 */
public record RuntimeOptions(
        StoreKind store,
        AccountClient client,
        DeviceLifecycle lifecycle,
        Clock clock,
        Map<String, String> env,
        Executor dispatchExecutor
) {
    public RuntimeOptions {
        store = store == null ? StoreKind.MEMORY : store;
        lifecycle = lifecycle == null ? DeviceLifecycle.ALWAYS_READY : lifecycle;
        clock = clock == null ? Clock.systemUTC() : clock;
        env = env == null ? Map.of() : Map.copyOf(env);
    }

    public static RuntimeOptions defaults() {
        return new RuntimeOptions(StoreKind.MEMORY, null, null, null, System.getenv(), null);
    }

    public RuntimeOptions withStore(StoreKind value) {
        return new RuntimeOptions(value, client, lifecycle, clock, env, dispatchExecutor);
    }

    public RuntimeOptions withClient(AccountClient value) {
        return new RuntimeOptions(store, value, lifecycle, clock, env, dispatchExecutor);
    }
}

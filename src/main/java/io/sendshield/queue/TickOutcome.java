package io.sendshield.queue;

/**
 * What one {@link DispatchQueue#tick()} did. Deferred counts are split by the gate that held
 * the message back.
 */
public record TickOutcome(
        int dispatched,
        int deferredNotReady,
        int deferredUnsafe,
        int deferredRateLimited,
        int skippedInFlight,
        int lostClaims
) {
    public int deferred() {
        return deferredNotReady + deferredUnsafe + deferredRateLimited;
    }
}

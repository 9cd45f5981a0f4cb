package io.sendshield.client;

/**
 * Delivery failure raised by an {@link AccountClient}. Always retryable from the queue's point of
 * view; {@code providerRejected} marks errors the messaging network itself signalled (rate
 * warnings, spam flags) so that the health monitor can open a cooldown for the account.
 */
public class TransportException extends Exception {
    private final boolean providerRejected;

    public TransportException(String message) {
        this(message, false, null);
    }

    public TransportException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public TransportException(String message, boolean providerRejected, Throwable cause) {
        super(message, cause);
        this.providerRejected = providerRejected;
    }

    public static TransportException providerRejected(String message) {
        return new TransportException(message, true, null);
    }

    public boolean providerRejected() {
        return providerRejected;
    }
}

package io.sendshield.queue;

/**
 * A send request was rejected at enqueue time. Nothing is stored when this is thrown.
 */
public final class ValidationException extends RuntimeException {
    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String field() {
        return field;
    }
}

package io.maas.sdk;

/**
 * Raised when a response body does not have the structure a typed result requires.
 */
public final class DeserializationException extends MaasException {

    private static final long serialVersionUID = 1L;

    public DeserializationException(String message) {
        super(message);
    }

    public DeserializationException(String message, Throwable cause) {
        super(cause == null ? message : message + ": " + cause.getMessage(), cause);
    }
}

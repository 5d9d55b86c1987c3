package io.maas.sdk;

/**
 * Base exception thrown by the MAAS Java SDK.
 */
public class MaasException extends Exception {

    private static final long serialVersionUID = 1L;

    public MaasException(String message) {
        super(message);
    }

    public MaasException(String message, Throwable cause) {
        super(message, cause);
    }
}

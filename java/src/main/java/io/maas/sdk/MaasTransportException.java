package io.maas.sdk;

/**
 * Raised when a request could not be completed at the transport level: no HTTP response was obtained
 * (DNS failure, refused connection, broken framing, malformed request or interruption).
 * The dispatcher never retries these.
 */
public class MaasTransportException extends MaasException {

    private static final long serialVersionUID = 1L;

    public MaasTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

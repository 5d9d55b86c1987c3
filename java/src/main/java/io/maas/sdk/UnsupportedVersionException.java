package io.maas.sdk;

/**
 * Raised by {@link VersionNegotiator} when the requested API version is unknown to the SDK, or when the server
 * offers none of the candidate versions.
 */
public final class UnsupportedVersionException extends MaasException {

    private static final long serialVersionUID = 1L;

    public UnsupportedVersionException(String message) {
        super(message);
    }

    public UnsupportedVersionException(String message, Throwable cause) {
        super(message, cause);
    }
}

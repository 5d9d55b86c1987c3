package io.maas.sdk;

/**
 * Server error raised for a 401 or 403 on the credential probe or on an authenticated resource call.
 * Distinguished from other server errors so callers can prompt for new credentials.
 */
public final class PermissionDeniedException extends MaasServerException {

    private static final long serialVersionUID = 1L;

    public PermissionDeniedException(MaasServerException source) {
        super(source.getBodyMessage(), source);
    }
}

package io.maas.sdk;

/**
 * Server error raised for a 400 Bad Request on a resource call. The body usually explains which parameter the server rejected.
 */
public final class BadRequestException extends MaasServerException {

    private static final long serialVersionUID = 1L;

    public BadRequestException(MaasServerException source) {
        super(source.getBodyMessage(), source);
    }
}

package io.maas.sdk;

/**
 * Server error raised for a 409 Conflict on a resource call: the request was understood but the server cannot
 * carry it out in its current state.
 */
public final class CannotCompleteException extends MaasServerException {

    private static final long serialVersionUID = 1L;

    public CannotCompleteException(MaasServerException source) {
        super(source.getBodyMessage(), source);
    }
}

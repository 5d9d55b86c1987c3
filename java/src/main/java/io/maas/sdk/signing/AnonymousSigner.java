package io.maas.sdk.signing;

import io.maas.sdk.http.PreparedRequest;

/**
 * Signer used for anonymous access; requests pass through unchanged.
 */
public final class AnonymousSigner implements RequestSigner {

    @Override
    public PreparedRequest sign(PreparedRequest request) {
        return request;
    }
}

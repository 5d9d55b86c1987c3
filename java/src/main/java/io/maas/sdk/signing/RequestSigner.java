package io.maas.sdk.signing;

import io.maas.sdk.Credentials;
import io.maas.sdk.http.PreparedRequest;

/**
 * Adds authentication to a request. Implementations must leave method, URI and body untouched and must be safe to
 * call repeatedly on the same request, since a request is re-signed before every retry.
 */
public interface RequestSigner {

    PreparedRequest sign(PreparedRequest request);

    static RequestSigner forCredentials(Credentials credentials) {
        if (credentials == null || credentials.isAnonymous()) {
            return new AnonymousSigner();
        }
        return new PlainTextOAuthSigner(credentials);
    }
}

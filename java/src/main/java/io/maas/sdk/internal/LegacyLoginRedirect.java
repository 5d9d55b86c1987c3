package io.maas.sdk.internal;

import java.nio.charset.StandardCharsets;

/**
 * MAAS 1.9.4 answers an unauthenticated {@code GET /api/2.0/version/} with a redirect to its HTML login page
 * instead of a 404 (LP: #1583715). Version negotiation treats such a body as "version not offered".
 *
 * <p>
 * Only a body starting with {@code <html><head} at offset zero qualifies. Do not broaden the match; any other
 * unparseable body is a genuine deserialization failure. Delete this class once 1.9.4 servers are gone.
 * </p>
 */
public final class LegacyLoginRedirect {

    private static final byte[] PREFIX = "<html><head".getBytes(StandardCharsets.US_ASCII);

    private LegacyLoginRedirect() {
    }

    public static boolean matches(byte[] body) {
        if (body == null || body.length < PREFIX.length) {
            return false;
        }
        for (int i = 0; i < PREFIX.length; i++) {
            if (body[i] != PREFIX[i]) {
                return false;
            }
        }
        return true;
    }
}

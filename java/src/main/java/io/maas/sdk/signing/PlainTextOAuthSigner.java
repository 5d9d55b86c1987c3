package io.maas.sdk.signing;

import io.maas.sdk.Credentials;
import io.maas.sdk.http.PreparedRequest;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * OAuth 1.0a signer using the {@code PLAINTEXT} method, which is what MAAS expects.
 *
 * <p>
 * The signature is the consumer secret and the token secret joined by {@code &}. MAAS API keys carry no consumer
 * secret, so the signature is always {@code "&" + tokenSecret}; the secret relies on TLS for confidentiality.
 * A fresh nonce and timestamp are generated on every call.
 * </p>
 */
public final class PlainTextOAuthSigner implements RequestSigner {

    static final String AUTHORIZATION = "Authorization";

    private final Credentials credentials;
    private final Clock clock;

    public PlainTextOAuthSigner(Credentials credentials) {
        this(credentials, Clock.systemUTC());
    }

    public PlainTextOAuthSigner(Credentials credentials, Clock clock) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (credentials.isAnonymous()) {
            throw new IllegalArgumentException("PLAINTEXT signing requires an API key");
        }
    }

    @Override
    public PreparedRequest sign(PreparedRequest request) {
        return request.withHeader(AUTHORIZATION, authorizationHeader());
    }

    String authorizationHeader() {
        Map<String, String> authData = new LinkedHashMap<>();
        authData.put("realm", "");
        authData.put("oauth_consumer_key", credentials.consumerKey());
        authData.put("oauth_token", credentials.tokenKey());
        authData.put("oauth_signature_method", "PLAINTEXT");
        authData.put("oauth_signature", "&" + credentials.tokenSecret());
        authData.put("oauth_timestamp", String.valueOf(clock.instant().getEpochSecond()));
        authData.put("oauth_nonce", UUID.randomUUID().toString());
        authData.put("oauth_version", "1.0");

        StringJoiner header = new StringJoiner(", ", "OAuth ", "");
        for (Map.Entry<String, String> entry : authData.entrySet()) {
            header.add(entry.getKey() + "=\"" + URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8) + "\"");
        }
        return header.toString();
    }

    Credentials credentials() {
        return credentials;
    }
}

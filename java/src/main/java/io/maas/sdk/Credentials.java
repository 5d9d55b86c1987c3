package io.maas.sdk;

import java.util.Objects;

/**
 * MAAS API credentials. A MAAS API key has the form {@code consumerKey:tokenKey:tokenSecret}; the consumer secret
 * is always empty and therefore not part of the key. An empty key selects anonymous access.
 */
public final class Credentials {

    private static final Credentials ANONYMOUS = new Credentials(null, null, null);

    private final String consumerKey;
    private final String tokenKey;
    private final String tokenSecret;

    private Credentials(String consumerKey, String tokenKey, String tokenSecret) {
        this.consumerKey = consumerKey;
        this.tokenKey = tokenKey;
        this.tokenSecret = tokenSecret;
    }

    public static Credentials anonymous() {
        return ANONYMOUS;
    }

    public static Credentials keyed(String consumerKey, String tokenKey, String tokenSecret) {
        return new Credentials(
            Objects.requireNonNull(consumerKey, "consumerKey"),
            Objects.requireNonNull(tokenKey, "tokenKey"),
            Objects.requireNonNull(tokenSecret, "tokenSecret")
        );
    }

    /**
     * Parses an API key. Components are taken as-is (empty components are allowed); anything other than exactly
     * three components is rejected.
     *
     * @param apiKey key in {@code consumerKey:tokenKey:tokenSecret} form, or {@code null}/empty for anonymous access.
     * @throws IllegalArgumentException when the key does not have exactly three components.
     */
    public static Credentials parse(String apiKey) {
        if (apiKey == null || apiKey.isEmpty()) {
            return ANONYMOUS;
        }
        String[] elements = apiKey.split(":", -1);
        if (elements.length != 3) {
            throw new IllegalArgumentException(
                "invalid API key \"" + redact(apiKey) + "\"; expected \"<consumer key>:<token key>:<token secret>\"");
        }
        return new Credentials(elements[0], elements[1], elements[2]);
    }

    public boolean isAnonymous() {
        return consumerKey == null;
    }

    public String consumerKey() {
        return consumerKey;
    }

    public String tokenKey() {
        return tokenKey;
    }

    public String tokenSecret() {
        return tokenSecret;
    }

    @Override
    public String toString() {
        return isAnonymous() ? "Credentials[anonymous]" : "Credentials[consumerKey=" + consumerKey + "]";
    }

    private static String redact(String apiKey) {
        int separator = apiKey.indexOf(':');
        return separator < 0 ? "***" : apiKey.substring(0, separator) + ":***";
    }
}

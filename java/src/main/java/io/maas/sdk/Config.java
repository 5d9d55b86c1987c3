package io.maas.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link VersionNegotiator} and {@link MaasClient} instances.
 */
public final class Config {

    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_NUMBER_OF_RETRIES = 4;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ZERO;
    public static final Duration DEFAULT_MAX_RETRY_DELAY = Duration.ofSeconds(30);

    /**
     * API versions understood by this SDK, in the order they are probed.
     */
    public static final List<String> DEFAULT_SUPPORTED_VERSIONS = List.of("2.0", "2.1", "2.3", "2.4");

    private final String baseUrl;
    private final String apiKey;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Integer numberOfRetries;
    private final Duration retryDelay;
    private final Duration maxRetryDelay;
    private final List<String> supportedVersions;

    private Config(Builder builder) {
        this.baseUrl = builder.baseUrl;
        this.apiKey = builder.apiKey;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.numberOfRetries = builder.numberOfRetries;
        this.retryDelay = builder.retryDelay;
        this.maxRetryDelay = builder.maxRetryDelay;
        this.supportedVersions = builder.supportedVersions == null ? null : List.copyOf(builder.supportedVersions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Config withDefaults() {
        String resolvedBaseUrl = sanitizeUrl(baseUrl);

        // Fail on a malformed key here rather than on the first request.
        Credentials.parse(apiKey);

        Duration resolvedTimeout = Optional.ofNullable(httpTimeout).orElse(DEFAULT_HTTP_TIMEOUT);
        if (resolvedTimeout.isNegative() || resolvedTimeout.isZero()) {
            resolvedTimeout = DEFAULT_HTTP_TIMEOUT;
        }

        int resolvedRetries = Optional.ofNullable(numberOfRetries).orElse(DEFAULT_NUMBER_OF_RETRIES);
        if (resolvedRetries < 0) {
            throw new IllegalArgumentException("NumberOfRetries cannot be negative");
        }

        Duration resolvedRetryDelay = Optional.ofNullable(retryDelay).orElse(DEFAULT_RETRY_DELAY);
        if (resolvedRetryDelay.isNegative()) {
            throw new IllegalArgumentException("RetryDelay cannot be negative");
        }

        Duration resolvedMaxRetryDelay = Optional.ofNullable(maxRetryDelay).orElse(DEFAULT_MAX_RETRY_DELAY);
        if (resolvedMaxRetryDelay.isNegative()) {
            throw new IllegalArgumentException("MaxRetryDelay cannot be negative");
        }
        if (resolvedRetryDelay.compareTo(resolvedMaxRetryDelay) > 0) {
            throw new IllegalArgumentException("RetryDelay cannot exceed MaxRetryDelay");
        }

        List<String> resolvedVersions = supportedVersions == null ? DEFAULT_SUPPORTED_VERSIONS : supportedVersions.stream()
            .filter(Objects::nonNull)
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .distinct()
            .toList();
        if (resolvedVersions.isEmpty()) {
            throw new IllegalArgumentException("SupportedVersions must name at least one version");
        }
        for (String version : resolvedVersions) {
            ApiVersion.parse(version);
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            // MAAS 1.9.4 redirects unknown API versions to its HTML login page; it has to be followed to be recognised.
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        }

        return new Builder()
            .baseUrl(resolvedBaseUrl)
            .apiKey(apiKey)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .numberOfRetries(resolvedRetries)
            .retryDelay(resolvedRetryDelay)
            .maxRetryDelay(resolvedMaxRetryDelay)
            .supportedVersions(resolvedVersions)
            .buildInternal();
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("BaseURL is required");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        return trimmed;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Credentials getCredentials() {
        return Credentials.parse(apiKey);
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public int getNumberOfRetries() {
        return numberOfRetries == null ? DEFAULT_NUMBER_OF_RETRIES : numberOfRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public Duration getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public List<String> getSupportedVersions() {
        return supportedVersions;
    }

    @Override
    public String toString() {
        return "Config[baseUrl=" + baseUrl + ", numberOfRetries=" + numberOfRetries
            + ", supportedVersions=" + supportedVersions + "]";
    }

    public static final class Builder {
        private String baseUrl;
        private String apiKey;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Integer numberOfRetries;
        private Duration retryDelay;
        private Duration maxRetryDelay;
        private List<String> supportedVersions;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        /**
         * Number of times a request answered with {@code 503 Service Unavailable} is re-sent. A request is issued at
         * most {@code numberOfRetries + 1} times.
         */
        public Builder numberOfRetries(int numberOfRetries) {
            this.numberOfRetries = numberOfRetries;
            return this;
        }

        /**
         * Pause before re-sending after a 503 without a usable {@code Retry-After} header.
         */
        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = retryDelay;
            return this;
        }

        /**
         * Upper bound on any pause between retries, including one requested by the server through
         * {@code Retry-After}.
         */
        public Builder maxRetryDelay(Duration maxRetryDelay) {
            this.maxRetryDelay = maxRetryDelay;
            return this;
        }

        public Builder supportedVersions(List<String> supportedVersions) {
            this.supportedVersions = supportedVersions == null ? null : new ArrayList<>(supportedVersions);
            return this;
        }

        public Config build() {
            return new Config(this).withDefaults();
        }

        private Config buildInternal() {
            return new Config(this);
        }
    }
}

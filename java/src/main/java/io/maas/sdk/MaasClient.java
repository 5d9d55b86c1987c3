package io.maas.sdk;

import io.maas.sdk.http.DispatchOutcome;
import io.maas.sdk.http.Dispatcher;
import io.maas.sdk.http.PreparedRequest;
import io.maas.sdk.internal.Urls;
import io.maas.sdk.signing.RequestSigner;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Low-level MAAS client bound to one versioned API URL such as {@code http://host/MAAS/api/2.0/}.
 *
 * <p>
 * The client knows how to address the API and how to dispatch signed requests through a {@link Dispatcher}; it does
 * not know which version the server actually speaks. Use {@link VersionNegotiator} to obtain a {@link BoundClient}
 * unless the version has already been established.
 * </p>
 *
 * <p>
 * Server failures surface as plain {@link MaasServerException}s, network failures as
 * {@link MaasTransportException}s. Instances are immutable and thread-safe.
 * </p>
 */
public final class MaasClient {

    static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

    private final String apiUrl;
    private final Dispatcher dispatcher;

    MaasClient(String apiUrl, Dispatcher dispatcher) {
        this.apiUrl = Urls.ensureTrailingSlash(Objects.requireNonNull(apiUrl, "apiUrl"));
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Creates a client for an already versioned API URL using the supplied configuration's transport settings and
     * credentials.
     */
    public static MaasClient create(Config config, String apiUrl) {
        Objects.requireNonNull(config, "config");
        return create(config, apiUrl, new AtomicLong());
    }

    static MaasClient create(Config config, String apiUrl, AtomicLong requestCounter) {
        Dispatcher dispatcher = new Dispatcher(
            config.getHttpClient(),
            RequestSigner.forCredentials(config.getCredentials()),
            config.getNumberOfRetries(),
            config.getRetryDelay(),
            config.getMaxRetryDelay(),
            config.getHttpTimeout(),
            requestCounter
        );
        return new MaasClient(apiUrl, dispatcher);
    }

    /**
     * Creates an unauthenticated client for {@code baseUrl} at the given API version.
     */
    public static MaasClient anonymous(String baseUrl, String apiVersion) {
        Config config = Config.builder().baseUrl(baseUrl).build();
        return create(config, Urls.addApiVersion(config.getBaseUrl(), apiVersion));
    }

    /**
     * Creates a client signing every request with the given API key.
     *
     * @param apiUrl versioned API URL; a missing trailing slash is added.
     * @param apiKey key of the form {@code consumerKey:tokenKey:tokenSecret}.
     * @throws IllegalArgumentException when the key is malformed.
     */
    public static MaasClient authenticated(String apiUrl, String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("invalid API key: an authenticated client needs \"<consumer key>:<token key>:<token secret>\"");
        }
        Config config = Config.builder().baseUrl(apiUrl).apiKey(apiKey).build();
        return create(config, config.getBaseUrl());
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    /**
     * Dispatches an arbitrary prepared request. Collaborators that need their own request shape (for example file
     * uploads) build a {@link PreparedRequest} against {@link #resolve(String, String, Map)} and come through here.
     */
    public DispatchOutcome dispatch(PreparedRequest request) {
        return dispatcher.dispatch(request);
    }

    /**
     * Resolves an API path against the versioned URL. Path segments are percent-encoded and the path always gets a
     * trailing slash.
     */
    public URI resolve(String path, String op, Map<String, List<String>> params) {
        String target = Urls.ensureTrailingSlash(Urls.join(apiUrl, Urls.encodePath(path == null ? "" : path)));
        return URI.create(target + Urls.query(op, params));
    }

    /**
     * {@code GET {api}/{path}/?op=...&params}.
     */
    public byte[] get(String path, String op, Map<String, List<String>> params) throws MaasException {
        return dispatch(PreparedRequest.get(resolve(path, op, params))).bodyOrThrow();
    }

    /**
     * {@code POST {api}/{path}/?op=...} with the parameters sent as a form body.
     */
    public byte[] post(String path, String op, Map<String, List<String>> params) throws MaasException {
        PreparedRequest request = PreparedRequest.of("POST", resolve(path, op, null))
            .withBody(Urls.encodeParams(params).getBytes(StandardCharsets.UTF_8), FORM_CONTENT_TYPE);
        return dispatch(request).bodyOrThrow();
    }

    /**
     * {@code PUT {api}/{path}/} with the parameters sent as a form body.
     */
    public byte[] put(String path, Map<String, List<String>> params) throws MaasException {
        PreparedRequest request = PreparedRequest.of("PUT", resolve(path, null, null))
            .withBody(Urls.encodeParams(params).getBytes(StandardCharsets.UTF_8), FORM_CONTENT_TYPE);
        return dispatch(request).bodyOrThrow();
    }

    public void delete(String path) throws MaasException {
        dispatch(PreparedRequest.of("DELETE", resolve(path, null, null))).bodyOrThrow();
    }
}

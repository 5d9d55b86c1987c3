package io.maas.sdk;

import com.fasterxml.jackson.databind.JsonNode;
import io.maas.sdk.http.DispatchOutcome;
import io.maas.sdk.http.PreparedRequest;
import io.maas.sdk.internal.Json;
import io.maas.sdk.internal.LegacyLoginRedirect;
import io.maas.sdk.internal.Urls;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * <p>
 * Entry point for talking to a MAAS server: works out which API version the server offers, reads its capabilities,
 * verifies the credentials, and hands back a {@link BoundClient} fixed to that version.
 * </p>
 *
 * <h2>Negotiation</h2>
 * <ul>
 *   <li>If the configured base URL already names a version ({@code .../api/2.0/}) only that version is tried. A
 *       version outside {@link Config#getSupportedVersions()} is rejected before any request is sent.</li>
 *   <li>Otherwise the supported versions are probed in order with {@code GET {base}/api/{version}/version/}. A 404
 *       or 410, or the HTML login page MAAS 1.9.4 redirects to (see {@link LegacyLoginRedirect}), means the version
 *       is not offered and the next one is tried. The login page is only seen when the {@code HttpClient} follows
 *       redirects, as the default one does.</li>
 *   <li>Every other failure stops negotiation and is rethrown as-is, so outages are never mistaken for a version
 *       mismatch.</li>
 *   <li>Once a version answers, {@code GET users/?op=whoami} checks the credentials. 401 and 403 become
 *       {@link PermissionDeniedException}.</li>
 * </ul>
 * <p>
 * Negotiation has no side effects on the server. Each call to {@link #negotiate()} starts again from the first
 * candidate and returns a new {@link BoundClient}.
 * </p>
 */
public final class VersionNegotiator {

    private static final Logger LOGGER = Logger.getLogger(VersionNegotiator.class.getName());

    private final Config config;
    private final AtomicLong requestCounter = new AtomicLong();

    /**
     * @param config configuration; defaults are applied if the caller has not already done so.
     */
    public VersionNegotiator(Config config) {
        Objects.requireNonNull(config, "config");
        this.config = config.withDefaults();
    }

    /**
     * Convenience for {@code new VersionNegotiator(config).negotiate()}.
     */
    public static BoundClient connect(Config config) throws MaasException {
        return new VersionNegotiator(config).negotiate();
    }

    /**
     * Runs the negotiation.
     *
     * @return a client bound to the first version the server offers.
     * @throws UnsupportedVersionException when the named version is unknown or no candidate is offered.
     * @throws PermissionDeniedException   when the server rejects the credentials.
     * @throws DeserializationException    when the version document is malformed.
     * @throws MaasServerException         for any other failure status while probing.
     * @throws MaasTransportException      when the server cannot be reached.
     */
    public BoundClient negotiate() throws MaasException {
        String baseUrl = config.getBaseUrl();
        List<String> candidates = config.getSupportedVersions();

        Urls.VersionedUrl split = Urls.splitVersionedUrl(baseUrl);
        if (split.versioned()) {
            String version = split.version();
            if (!candidates.contains(version)) {
                throw new UnsupportedVersionException("version " + version + " is not one of " + candidates);
            }
            LOGGER.info(() -> String.format(Locale.ROOT, "[maas-sdk] using API version %s named in %s", version, baseUrl));
            return tryVersion(split.baseUrl(), version)
                .orElseThrow(() -> new UnsupportedVersionException(
                    "MAAS at " + split.baseUrl() + " does not offer API version " + version));
        }

        LOGGER.info(() -> String.format(Locale.ROOT, "[maas-sdk] negotiating API version with %s, candidates %s", baseUrl, candidates));
        for (String version : candidates) {
            Optional<BoundClient> bound = tryVersion(baseUrl, version);
            if (bound.isPresent()) {
                return bound.get();
            }
        }
        throw new UnsupportedVersionException("MAAS at " + baseUrl + " does not support any of " + candidates);
    }

    private Optional<BoundClient> tryVersion(String baseUrl, String version) throws MaasException {
        ApiVersion apiVersion = ApiVersion.parse(version);
        MaasClient client = MaasClient.create(config, Urls.addApiVersion(baseUrl, version), requestCounter);

        Optional<Set<String>> capabilities = readVersionInfo(client);
        if (capabilities.isEmpty()) {
            LOGGER.fine(() -> String.format(Locale.ROOT, "[maas-sdk] API version %s not offered at %s", version, baseUrl));
            return Optional.empty();
        }

        checkCredentials(client);

        BoundClient bound = new BoundClient(client, apiVersion, capabilities.get());
        LOGGER.info(() -> String.format(Locale.ROOT,
            "[maas-sdk] bound to %s (version %s, %d capabilities)",
            bound.getApiUrl(), apiVersion, bound.getCapabilities().size()));
        return Optional.of(bound);
    }

    /**
     * @return the advertised capabilities, or empty when this version is not offered.
     */
    private Optional<Set<String>> readVersionInfo(MaasClient client) throws MaasException {
        DispatchOutcome outcome = client.dispatch(PreparedRequest.get(client.resolve("version", null, null)));
        if (outcome.kind() == DispatchOutcome.Kind.SERVER && indicatesVersionNotOffered(outcome.statusCode())) {
            return Optional.empty();
        }
        byte[] body = outcome.bodyOrThrow();
        if (isRedirect(outcome.statusCode())) {
            throw new DeserializationException(String.format(Locale.ROOT,
                "version response: redirected with status %d; the HttpClient must follow redirects",
                outcome.statusCode()));
        }

        JsonNode root;
        try {
            root = Json.mapper().readTree(body);
        } catch (IOException ex) {
            if (LegacyLoginRedirect.matches(body)) {
                LOGGER.fine(() -> "[maas-sdk] version probe redirected to the HTML login page");
                return Optional.empty();
            }
            throw new DeserializationException("version response", ex);
        }
        return Optional.of(parseCapabilities(root));
    }

    private static Set<String> parseCapabilities(JsonNode root) throws DeserializationException {
        if (root == null || !root.isObject()) {
            throw new DeserializationException("version response: expected a JSON object");
        }
        JsonNode values = root.has("capabilities") ? root.get("capabilities") : root.get("Capabilities");
        if (values == null || !values.isArray()) {
            throw new DeserializationException("version response: capabilities must be a list");
        }
        Set<String> capabilities = new LinkedHashSet<>();
        for (JsonNode value : values) {
            if (!value.isTextual()) {
                throw new DeserializationException("version response: capability " + value + " is not a string");
            }
            capabilities.add(value.asText());
        }
        return capabilities;
    }

    private static void checkCredentials(MaasClient client) throws MaasException {
        DispatchOutcome outcome = client.dispatch(PreparedRequest.get(client.resolve("users", "whoami", null)));
        Optional<MaasServerException> serverError = outcome.serverError();
        if (serverError.isPresent()) {
            int status = serverError.get().getStatusCode();
            if (status == 401 || status == 403) {
                throw new PermissionDeniedException(serverError.get());
            }
        }
        outcome.bodyOrThrow();
    }

    private static boolean isRedirect(int statusCode) {
        return statusCode >= 300 && statusCode < 400;
    }

    // Only these two statuses mean "not offered"; widening this would hide real outages.
    private static boolean indicatesVersionNotOffered(int statusCode) {
        return statusCode == 404 || statusCode == 410;
    }
}

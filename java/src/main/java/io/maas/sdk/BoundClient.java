package io.maas.sdk;

import io.maas.sdk.internal.ServerErrorDecoder;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * A MAAS client fixed to the API version and capability set established by {@link VersionNegotiator}.
 *
 * <p>
 * Instances are immutable once negotiation returns them and can be shared freely between threads. Resource code
 * calls the verbs below; compared to {@link MaasClient} they translate well-known failure statuses into
 * {@link BadRequestException} (400), {@link PermissionDeniedException} (401/403) and
 * {@link CannotCompleteException} (409).
 * </p>
 */
public final class BoundClient {

    private static final Logger LOGGER = Logger.getLogger(BoundClient.class.getName());

    private final MaasClient client;
    private final ApiVersion version;
    private final Set<String> capabilities;

    BoundClient(MaasClient client, ApiVersion version, Set<String> capabilities) {
        this.client = Objects.requireNonNull(client, "client");
        this.version = Objects.requireNonNull(version, "version");
        this.capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(capabilities, "capabilities")));
    }

    public ApiVersion getVersion() {
        return version;
    }

    /**
     * @return the capability strings advertised by the server; unmodifiable.
     */
    public Set<String> getCapabilities() {
        return capabilities;
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public String getApiUrl() {
        return client.getApiUrl();
    }

    /**
     * @return the underlying client, for collaborators that need raw {@link io.maas.sdk.http.DispatchOutcome}s.
     */
    public MaasClient getClient() {
        return client;
    }

    public byte[] get(String path, String op, Map<String, List<String>> params) throws MaasException {
        try {
            return client.get(path, op, params);
        } catch (MaasServerException ex) {
            throw translate("GET", path, ex);
        }
    }

    public byte[] post(String path, String op, Map<String, List<String>> params) throws MaasException {
        try {
            return client.post(path, op, params);
        } catch (MaasServerException ex) {
            throw translate("POST", path, ex);
        }
    }

    public byte[] put(String path, Map<String, List<String>> params) throws MaasException {
        try {
            return client.put(path, params);
        } catch (MaasServerException ex) {
            throw translate("PUT", path, ex);
        }
    }

    public void delete(String path) throws MaasException {
        try {
            client.delete(path);
        } catch (MaasServerException ex) {
            throw translate("DELETE", path, ex);
        }
    }

    private static MaasServerException translate(String method, String path, MaasServerException ex) {
        LOGGER.fine(() -> String.format(Locale.ROOT, "[maas-sdk] %s %s failed with status %d", method, path, ex.getStatusCode()));
        return ServerErrorDecoder.classify(ex);
    }

    @Override
    public String toString() {
        return "BoundClient[" + getApiUrl() + ", version=" + version + ", capabilities=" + capabilities + "]";
    }
}

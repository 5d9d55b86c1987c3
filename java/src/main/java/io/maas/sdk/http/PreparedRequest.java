package io.maas.sdk.http;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * An HTTP request ready for {@link Dispatcher#dispatch(PreparedRequest)}.
 *
 * <p>
 * Instances are immutable and own a fully buffered copy of the body, so the same request can be sent again when the
 * server answers 503. Streaming bodies must be read into memory with {@link #withBody(InputStream, String)} before
 * the first attempt. Header names are case-insensitive; {@link #withHeader(String, String)} replaces any earlier
 * value, which keeps re-signing idempotent.
 * </p>
 */
public final class PreparedRequest {

    private static final byte[] EMPTY = new byte[0];

    private final String method;
    private final URI uri;
    private final Map<String, String> headers;
    private final byte[] body;

    private PreparedRequest(String method, URI uri, Map<String, String> headers, byte[] body) {
        this.method = method;
        this.uri = uri;
        this.headers = headers;
        this.body = body;
    }

    public static PreparedRequest of(String method, URI uri) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        return new PreparedRequest(method, uri, emptyHeaders(), EMPTY);
    }

    public static PreparedRequest get(URI uri) {
        return of("GET", uri);
    }

    public PreparedRequest withHeader(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(headers);
        copy.put(name, value);
        return new PreparedRequest(method, uri, Collections.unmodifiableMap(copy), body);
    }

    /**
     * Returns a copy carrying the given body. The array is copied, so later changes by the caller have no effect.
     */
    public PreparedRequest withBody(byte[] content, String contentType) {
        Objects.requireNonNull(content, "content");
        PreparedRequest withBody = new PreparedRequest(method, uri, headers, content.clone());
        if (contentType == null || contentType.isBlank()) {
            return withBody;
        }
        return withBody.withHeader("Content-Type", contentType);
    }

    /**
     * Reads the stream to the end, closes it, and returns a copy carrying the buffered bytes as its body.
     *
     * @throws IOException when the stream cannot be read.
     */
    public PreparedRequest withBody(InputStream content, String contentType) throws IOException {
        Objects.requireNonNull(content, "content");
        byte[] buffered;
        try (InputStream in = content) {
            buffered = in.readAllBytes();
        }
        PreparedRequest withBody = new PreparedRequest(method, uri, headers, buffered);
        if (contentType == null || contentType.isBlank()) {
            return withBody;
        }
        return withBody.withHeader("Content-Type", contentType);
    }

    public String method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    /**
     * @return an unmodifiable, case-insensitive view of the headers.
     */
    public Map<String, String> headers() {
        return headers;
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name));
    }

    /**
     * @return a copy of the buffered body; empty when the request has none.
     */
    public byte[] body() {
        return body.clone();
    }

    public boolean hasBody() {
        return body.length > 0;
    }

    byte[] bodyUnsafe() {
        return body;
    }

    @Override
    public String toString() {
        return method + " " + uri;
    }

    private static Map<String, String> emptyHeaders() {
        return Collections.unmodifiableMap(new TreeMap<>(String.CASE_INSENSITIVE_ORDER));
    }
}

package io.maas.sdk;

import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Exception representing a non-success HTTP response from the MAAS server. The full response body is retained so
 * callers can inspect both the status and whatever explanation the server returned.
 */
public class MaasServerException extends MaasException {

    private static final long serialVersionUID = 1L;

    private static final Map<Integer, String> REASONS = Map.ofEntries(
        Map.entry(400, "Bad Request"),
        Map.entry(401, "Unauthorized"),
        Map.entry(403, "Forbidden"),
        Map.entry(404, "Not Found"),
        Map.entry(405, "Method Not Allowed"),
        Map.entry(409, "Conflict"),
        Map.entry(410, "Gone"),
        Map.entry(500, "Internal Server Error"),
        Map.entry(502, "Bad Gateway"),
        Map.entry(503, "Service Unavailable"),
        Map.entry(504, "Gateway Timeout")
    );

    private final int statusCode;
    private final byte[] body;
    private final transient HttpHeaders headers;

    public MaasServerException(int statusCode, byte[] body, HttpHeaders headers) {
        super(defaultMessage(statusCode, body));
        this.statusCode = statusCode;
        this.body = body == null ? new byte[0] : body.clone();
        this.headers = headers;
    }

    /**
     * Re-types an existing server error, keeping its status, body and headers and chaining it as the cause.
     */
    protected MaasServerException(String message, MaasServerException source) {
        super(message == null || message.isBlank() ? source.getMessage() : message, source);
        this.statusCode = source.statusCode;
        this.body = source.body;
        this.headers = source.headers;
    }

    /**
     * @return HTTP status code returned by the server.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return a copy of the raw response body.
     */
    public byte[] getBody() {
        return body.clone();
    }

    /**
     * @return the response body decoded as UTF-8.
     */
    public String getBodyMessage() {
        return new String(body, StandardCharsets.UTF_8);
    }

    /**
     * @return the first value of the named response header, if the server sent one.
     */
    public Optional<String> header(String name) {
        if (headers == null) {
            return Optional.empty();
        }
        return headers.firstValue(name);
    }

    static String reasonPhrase(int statusCode) {
        return REASONS.getOrDefault(statusCode, "");
    }

    private static String defaultMessage(int statusCode, byte[] body) {
        String reason = reasonPhrase(statusCode);
        String status = reason.isEmpty() ? String.valueOf(statusCode) : statusCode + " " + reason;
        String text = body == null ? "" : new String(body, StandardCharsets.UTF_8);
        return "ServerError: " + status + " (" + text + ")";
    }
}

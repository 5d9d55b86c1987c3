package io.maas.sdk.http;

import io.maas.sdk.MaasException;
import io.maas.sdk.MaasServerException;
import io.maas.sdk.MaasTransportException;

import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one {@link Dispatcher#dispatch(PreparedRequest) dispatch}. Exactly one of three shapes:
 * <ul>
 *   <li>{@link Kind#SUCCESS}: status below 400, with the drained response body;</li>
 *   <li>{@link Kind#TRANSPORT}: no HTTP response was obtained, with a {@link MaasTransportException};</li>
 *   <li>{@link Kind#SERVER}: status 400 or above, with a {@link MaasServerException} carrying status and body.</li>
 * </ul>
 * Callers switch on {@link #kind()} rather than inspecting exception types.
 */
public final class DispatchOutcome {

    public enum Kind {
        SUCCESS,
        TRANSPORT,
        SERVER
    }

    private final Kind kind;
    private final int statusCode;
    private final byte[] body;
    private final MaasException error;

    private DispatchOutcome(Kind kind, int statusCode, byte[] body, MaasException error) {
        this.kind = kind;
        this.statusCode = statusCode;
        this.body = body;
        this.error = error;
    }

    public static DispatchOutcome success(int statusCode, byte[] body) {
        return new DispatchOutcome(Kind.SUCCESS, statusCode, body == null ? new byte[0] : body.clone(), null);
    }

    public static DispatchOutcome transportFailure(MaasTransportException error) {
        return new DispatchOutcome(Kind.TRANSPORT, 0, null, Objects.requireNonNull(error, "error"));
    }

    public static DispatchOutcome serverFailure(MaasServerException error) {
        Objects.requireNonNull(error, "error");
        return new DispatchOutcome(Kind.SERVER, error.getStatusCode(), null, error);
    }

    public Kind kind() {
        return kind;
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    /**
     * @return the HTTP status, or {@code 0} for a transport failure.
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * @return the response body of a successful dispatch.
     * @throws IllegalStateException when the outcome is a failure.
     */
    public byte[] body() {
        if (kind != Kind.SUCCESS) {
            throw new IllegalStateException("no body on a " + kind + " outcome");
        }
        return body.clone();
    }

    public String bodyText() {
        return new String(body(), StandardCharsets.UTF_8);
    }

    public Optional<MaasException> error() {
        return Optional.ofNullable(error);
    }

    /**
     * @return the server error when, and only when, the server answered with a failure status.
     */
    public Optional<MaasServerException> serverError() {
        if (kind != Kind.SERVER) {
            return Optional.empty();
        }
        return Optional.of((MaasServerException) error);
    }

    /**
     * @return the body of a successful dispatch.
     * @throws MaasException the transport or server error carried by a failed dispatch.
     */
    public byte[] bodyOrThrow() throws MaasException {
        if (kind != Kind.SUCCESS) {
            throw error;
        }
        return body.clone();
    }

    @Override
    public String toString() {
        switch (kind) {
            case SUCCESS:
                return "Success[status=" + statusCode + ", bytes=" + body.length + "]";
            case SERVER:
                return "ServerFailure[status=" + statusCode + "]";
            default:
                return "TransportFailure[" + error.getMessage() + "]";
        }
    }
}

package io.maas.sdk.http;

import io.maas.sdk.MaasServerException;
import io.maas.sdk.MaasTransportException;
import io.maas.sdk.internal.ServerErrorDecoder;
import io.maas.sdk.signing.RequestSigner;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Sends prepared requests to MAAS and classifies the result.
 *
 * <h2>Behaviour</h2>
 * <ol>
 *   <li>Every attempt is signed afresh through the configured {@link RequestSigner}.</li>
 *   <li>When no HTTP response is obtained the outcome is {@link DispatchOutcome.Kind#TRANSPORT}; these are never
 *       retried.</li>
 *   <li>A {@code 503 Service Unavailable} answer is retried up to {@code numberOfRetries} times, re-sending the same
 *       buffered body. The pause before each retry honours a numeric {@code Retry-After} header, capped at
 *       {@code maxRetryDelay}, and otherwise uses the configured retry delay. No other status is retried.</li>
 *   <li>Status 400 and above (including a 503 that outlived the retries) yields {@link DispatchOutcome.Kind#SERVER};
 *       anything below 400 yields {@link DispatchOutcome.Kind#SUCCESS}.</li>
 * </ol>
 * <p>
 * Response bodies are drained and closed on every path. The dispatcher holds no mutable state apart from a request
 * counter used to correlate log lines, so one instance may be shared by any number of threads.
 * </p>
 */
public final class Dispatcher {

    private static final Logger LOGGER = Logger.getLogger(Dispatcher.class.getName());

    static final int SERVICE_UNAVAILABLE = 503;
    static final String RETRY_AFTER = "Retry-After";

    private final HttpClient httpClient;
    private final RequestSigner signer;
    private final int numberOfRetries;
    private final Duration retryDelay;
    private final Duration maxRetryDelay;
    private final Duration requestTimeout;
    private final AtomicLong requestCounter;

    public Dispatcher(
        HttpClient httpClient,
        RequestSigner signer,
        int numberOfRetries,
        Duration retryDelay,
        Duration maxRetryDelay,
        Duration requestTimeout,
        AtomicLong requestCounter
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.signer = Objects.requireNonNull(signer, "signer");
        if (numberOfRetries < 0) {
            throw new IllegalArgumentException("numberOfRetries cannot be negative");
        }
        this.numberOfRetries = numberOfRetries;
        Objects.requireNonNull(maxRetryDelay, "maxRetryDelay");
        if (maxRetryDelay.isNegative()) {
            throw new IllegalArgumentException("maxRetryDelay cannot be negative");
        }
        this.maxRetryDelay = maxRetryDelay;
        this.retryDelay = retryDelay == null || retryDelay.isNegative() ? Duration.ZERO : cap(retryDelay);
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? null : requestTimeout;
        this.requestCounter = Objects.requireNonNull(requestCounter, "requestCounter");
    }

    /**
     * Signs and sends the request, retrying on 503, and returns the classified outcome. This method never throws for
     * network or server problems; those are reported through the returned {@link DispatchOutcome}.
     */
    public DispatchOutcome dispatch(PreparedRequest request) {
        Objects.requireNonNull(request, "request");
        long requestId = requestCounter.incrementAndGet();
        LOGGER.finest(() -> String.format(Locale.ROOT, "[maas-sdk] request %x: %s %s", requestId, request.method(), request.uri()));

        int attempt = 0;
        while (true) {
            attempt++;
            HttpResponse<InputStream> response;
            try {
                response = httpClient.send(toHttpRequest(signer.sign(request)), HttpResponse.BodyHandlers.ofInputStream());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return transportFailure(requestId, request, "interrupted", ex);
            } catch (IOException ex) {
                return transportFailure(requestId, request, ex.getMessage(), ex);
            } catch (IllegalArgumentException ex) {
                // Relative URIs and restricted headers are rejected before anything reaches the wire.
                return transportFailure(requestId, request, "invalid request: " + ex.getMessage(), ex);
            }

            if (response.statusCode() == SERVICE_UNAVAILABLE && attempt <= numberOfRetries) {
                try (InputStream discarded = response.body()) {
                    discarded.readAllBytes();
                } catch (IOException ex) {
                    return transportFailure(requestId, request, "drain 503 response: " + ex.getMessage(), ex);
                }
                Duration wait = retryWait(response.headers());
                int retry = attempt;
                LOGGER.fine(() -> String.format(Locale.ROOT,
                    "[maas-sdk] request %x: 503 from %s, retry %d of %d in %d ms",
                    requestId, request.uri(), retry, numberOfRetries, wait.toMillis()));
                if (!pause(wait)) {
                    return transportFailure(requestId, request, "interrupted while waiting to retry", null);
                }
                continue;
            }

            return readOutcome(requestId, response);
        }
    }

    public int getNumberOfRetries() {
        return numberOfRetries;
    }

    private DispatchOutcome readOutcome(long requestId, HttpResponse<InputStream> response) {
        int status = response.statusCode();
        try (InputStream bodyStream = response.body()) {
            if (status >= 400) {
                MaasServerException error = ServerErrorDecoder.decode(status, bodyStream, response.headers());
                LOGGER.finest(() -> String.format(Locale.ROOT, "[maas-sdk] response %x: error: %s", requestId, error.getMessage()));
                return DispatchOutcome.serverFailure(error);
            }
            byte[] body = bodyStream.readAllBytes();
            LOGGER.finest(() -> String.format(Locale.ROOT, "[maas-sdk] response %x: %d, %d bytes", requestId, status, body.length));
            return DispatchOutcome.success(status, body);
        } catch (IOException ex) {
            return DispatchOutcome.transportFailure(new MaasTransportException("read response body: " + ex.getMessage(), ex));
        }
    }

    private HttpRequest toHttpRequest(PreparedRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(request.uri());
        byte[] body = request.bodyUnsafe();
        if (body.length == 0) {
            builder.method(request.method(), HttpRequest.BodyPublishers.noBody());
        } else {
            builder.method(request.method(), HttpRequest.BodyPublishers.ofByteArray(body));
        }
        for (Map.Entry<String, String> header : request.headers().entrySet()) {
            builder.setHeader(header.getKey(), header.getValue());
        }
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        return builder.build();
    }

    private Duration retryWait(HttpHeaders headers) {
        Optional<String> retryAfter = headers.firstValue(RETRY_AFTER);
        if (retryAfter.isPresent()) {
            try {
                long seconds = Long.parseLong(retryAfter.get().trim());
                if (seconds > maxRetryDelay.getSeconds()) {
                    LOGGER.fine(() -> String.format(Locale.ROOT,
                        "[maas-sdk] Retry-After of %d s exceeds the %d ms cap", seconds, maxRetryDelay.toMillis()));
                    return maxRetryDelay;
                }
                if (seconds >= 0) {
                    return Duration.ofSeconds(seconds);
                }
            } catch (NumberFormatException ex) {
                LOGGER.fine(() -> "[maas-sdk] ignoring non-numeric Retry-After header: " + retryAfter.get());
            }
        }
        return retryDelay;
    }

    private Duration cap(Duration wait) {
        return wait.compareTo(maxRetryDelay) > 0 ? maxRetryDelay : wait;
    }

    private static boolean pause(Duration wait) {
        if (wait.isZero()) {
            return true;
        }
        try {
            Thread.sleep(wait.toMillis());
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static DispatchOutcome transportFailure(long requestId, PreparedRequest request, String detail, Throwable cause) {
        LOGGER.finest(() -> String.format(Locale.ROOT, "[maas-sdk] response %x: transport error: %s", requestId, detail));
        return DispatchOutcome.transportFailure(
            new MaasTransportException(request.method() + " " + request.uri() + ": " + detail, cause));
    }
}

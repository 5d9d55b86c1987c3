package io.maas.sdk.http;

import io.maas.sdk.Credentials;
import io.maas.sdk.MaasException;
import io.maas.sdk.MaasServerException;
import io.maas.sdk.MaasTransportException;
import io.maas.sdk.signing.AnonymousSigner;
import io.maas.sdk.signing.PlainTextOAuthSigner;
import io.maas.sdk.signing.RequestSigner;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class DispatcherTest {

    private static final int RETRIES = 4;
    private static final String PATH = "/some/url/";

    private HttpServer server;
    private URI baseUri;
    private final AtomicInteger requestCount = new AtomicInteger();
    private final List<String> requestBodies = new CopyOnWriteArrayList<>();
    private final List<String> authorizationHeaders = new CopyOnWriteArrayList<>();
    private final DelegatingHandler handler = new DelegatingHandler();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", exchange -> {
            requestCount.incrementAndGet();
            requestBodies.add(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            String authorization = exchange.getRequestHeaders().getFirst("Authorization");
            authorizationHeaders.add(authorization == null ? "" : authorization);
            handler.handle(exchange);
        });
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        requestCount.set(0);
        requestBodies.clear();
        authorizationHeaders.clear();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void returnsServerErrorWithStatusAndBody() {
        handler.delegate = exchange -> respond(exchange, 400, "expected:result");

        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), RETRIES).dispatch(get());

        assertEquals(DispatchOutcome.Kind.SERVER, outcome.kind());
        MaasServerException error = outcome.serverError().orElseThrow();
        assertEquals(400, error.getStatusCode());
        assertEquals("expected:result", error.getBodyMessage());
        assertEquals("ServerError: 400 Bad Request (expected:result)", error.getMessage());
        assertEquals(1, requestCount.get());
    }

    @Test
    void retries503AndResendsTheSameBody() throws Exception {
        handler.delegate = flaky(503, RETRIES);

        PreparedRequest request = PreparedRequest.of("POST", baseUri.resolve(PATH))
            .withBody("Content".getBytes(StandardCharsets.UTF_8), "text/plain");
        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), RETRIES).dispatch(request);

        assertTrue(outcome.isSuccess(), outcome::toString);
        assertEquals("ok", new String(outcome.bodyOrThrow(), StandardCharsets.UTF_8));
        assertEquals(RETRIES + 1, requestCount.get());
        List<String> expected = new ArrayList<>();
        for (int i = 0; i < RETRIES + 1; i++) {
            expected.add("Content");
        }
        assertEquals(expected, requestBodies);
    }

    @Test
    void doesNotRetry200() {
        handler.delegate = flaky(200, 10);

        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), RETRIES).dispatch(get());

        assertTrue(outcome.isSuccess());
        assertEquals(1, requestCount.get());
    }

    @Test
    void retriesAreLimited() {
        handler.delegate = flaky(503, RETRIES + 1);

        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), RETRIES).dispatch(get());

        assertEquals(RETRIES + 1, requestCount.get());
        assertEquals(503, outcome.serverError().orElseThrow().getStatusCode());
    }

    @Test
    void doesNotRetryOtherServerErrors() {
        handler.delegate = exchange -> respond(exchange, 500, "kablooey");

        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), RETRIES).dispatch(get());

        assertEquals(1, requestCount.get());
        assertEquals(500, outcome.statusCode());
        assertEquals(DispatchOutcome.Kind.SERVER, outcome.kind());
    }

    @Test
    void zeroRetriesSendsOnce() {
        handler.delegate = exchange -> respond(exchange, 503, "busy");

        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), 0).dispatch(get());

        assertEquals(1, requestCount.get());
        assertEquals(503, outcome.statusCode());
    }

    @Test
    void honoursRetryAfterHeader() {
        handler.delegate = retryAfterOnce("0");

        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), RETRIES).dispatch(get());

        assertTrue(outcome.isSuccess());
        assertEquals(2, requestCount.get());
    }

    @Test
    void capsOversizedRetryAfterHeader() {
        handler.delegate = retryAfterOnce(String.valueOf(Long.MAX_VALUE));

        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), RETRIES, Duration.ZERO).dispatch(get());

        assertTrue(outcome.isSuccess(), outcome::toString);
        assertEquals(2, requestCount.get());
    }

    @Test
    void longRetryAfterWaitsNoLongerThanTheCap() {
        handler.delegate = retryAfterOnce("3600");
        Dispatcher dispatcher = dispatcher(new AnonymousSigner(), RETRIES, Duration.ofMillis(50));

        long started = System.nanoTime();
        DispatchOutcome outcome = dispatcher.dispatch(get());
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

        assertTrue(outcome.isSuccess(), outcome::toString);
        assertTrue(elapsed.compareTo(Duration.ofSeconds(10)) < 0, elapsed::toString);
        assertEquals(2, requestCount.get());
    }

    @Test
    void unreachableServerIsTransportFailure() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }

        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), RETRIES)
            .dispatch(PreparedRequest.get(URI.create("http://127.0.0.1:" + closedPort + PATH)));

        assertEquals(DispatchOutcome.Kind.TRANSPORT, outcome.kind());
        assertTrue(outcome.serverError().isEmpty());
        assertInstanceOf(MaasTransportException.class, outcome.error().orElseThrow());
        assertThrows(MaasTransportException.class, outcome::bodyOrThrow);
        assertThrows(IllegalStateException.class, outcome::body);
    }

    @Test
    void malformedRequestIsTransportFailure() {
        DispatchOutcome outcome = dispatcher(new AnonymousSigner(), RETRIES).dispatch(PreparedRequest.get(URI.create("/")));

        assertEquals(DispatchOutcome.Kind.TRANSPORT, outcome.kind());
        assertTrue(outcome.serverError().isEmpty());
        assertEquals(0, requestCount.get());
    }

    @Test
    void signsEveryAttempt() throws MaasException {
        handler.delegate = flaky(503, 1);
        RequestSigner signer = new PlainTextOAuthSigner(Credentials.parse("the:api:key"));

        byte[] body = dispatcher(signer, RETRIES).dispatch(get()).bodyOrThrow();

        assertEquals("ok", new String(body, StandardCharsets.UTF_8));
        assertEquals(2, authorizationHeaders.size());
        for (String header : authorizationHeaders) {
            assertTrue(header.startsWith("OAuth "), header);
            assertTrue(header.contains("oauth_token=\"api\""), header);
        }
        assertNotEquals(authorizationHeaders.get(0), authorizationHeaders.get(1), "nonce must change between attempts");
    }

    @Test
    void anonymousRequestsCarryNoAuthorization() {
        handler.delegate = exchange -> respond(exchange, 200, "ok");

        dispatcher(new AnonymousSigner(), RETRIES).dispatch(get());

        assertEquals(List.of(""), authorizationHeaders);
    }

    @Test
    void concurrentDispatchesShareTheRequestCounter() throws Exception {
        handler.delegate = exchange -> respond(exchange, 200, "ok");
        AtomicLong counter = new AtomicLong();
        Dispatcher dispatcher = new Dispatcher(
            HttpClient.newHttpClient(), new AnonymousSigner(), RETRIES, Duration.ZERO, Duration.ofSeconds(1),
            Duration.ofSeconds(5), counter);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<DispatchOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> dispatcher.dispatch(get())));
            }
            for (Future<DispatchOutcome> future : futures) {
                assertTrue(future.get().isSuccess());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(8, counter.get());
        assertEquals(8, requestCount.get());
    }

    @Test
    void rejectsNegativeRetryCount() {
        assertThrows(IllegalArgumentException.class, () -> dispatcher(new AnonymousSigner(), -1));
    }

    @Test
    void rejectsNegativeRetryCap() {
        assertThrows(IllegalArgumentException.class,
            () -> dispatcher(new AnonymousSigner(), RETRIES, Duration.ofSeconds(-1)));
    }

    private PreparedRequest get() {
        return PreparedRequest.get(baseUri.resolve(PATH + "?param1=test"));
    }

    private Dispatcher dispatcher(RequestSigner signer, int retries) {
        return dispatcher(signer, retries, Duration.ofSeconds(1));
    }

    private Dispatcher dispatcher(RequestSigner signer, int retries, Duration maxRetryDelay) {
        return new Dispatcher(
            HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
            signer,
            retries,
            Duration.ZERO,
            maxRetryDelay,
            Duration.ofSeconds(5),
            new AtomicLong()
        );
    }

    /**
     * Answers {@code status} for the first {@code times} requests and 200 afterwards.
     */
    private static HttpHandler flaky(int status, int times) {
        AtomicInteger served = new AtomicInteger();
        return exchange -> {
            if (served.incrementAndGet() <= times) {
                respond(exchange, status, status == 200 ? "ok" : "flaky");
            } else {
                respond(exchange, 200, "ok");
            }
        };
    }

    /**
     * Answers 503 with the given {@code Retry-After} once, then 200.
     */
    private static HttpHandler retryAfterOnce(String retryAfter) {
        AtomicInteger served = new AtomicInteger();
        return exchange -> {
            if (served.incrementAndGet() == 1) {
                exchange.getResponseHeaders().add("Retry-After", retryAfter);
                respond(exchange, 503, "busy");
            } else {
                respond(exchange, 200, "ok");
            }
        };
    }

    private static class DelegatingHandler implements HttpHandler {
        volatile HttpHandler delegate;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (delegate == null) {
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            } else {
                delegate.handle(exchange);
            }
        }
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}

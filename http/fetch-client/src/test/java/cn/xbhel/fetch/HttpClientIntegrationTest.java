package cn.xbhel.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import cn.xbhel.fetch.retry.Attempt;
import cn.xbhel.fetch.retry.RetryDelayStrategy;
import cn.xbhel.fetch.retry.RetryOptions;
import cn.xbhel.fetch.timeout.PhaseTimeoutException;

/**
 * Runs the client with its default transport against a local server.
 */
class HttpClientIntegrationTest {

    /** Retries after 10 ms instead of the default backoff. */
    private static final RetryDelayStrategy FAST = RetryDelayStrategy.of(
            context -> context.getComputedValue() == 0 ? 0 : 10);

    private HttpServer server;
    private ExecutorService serverExecutor;
    private String baseUrl;
    private HttpClient client;
    private final List<String> connections = new CopyOnWriteArrayList<>();
    private final List<Long> hits = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
        client = HttpClient.builder()
                .eventListener(new HttpEventListener() {
                    @Override
                    public void onConnection(Attempt attempt, String connectionId) {
                        connections.add(connectionId);
                    }
                })
                .build();
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
        server.stop(0);
        serverExecutor.shutdownNow();
    }

    private static void respond(HttpExchange exchange, int status, Map<String, String> headers, String body)
            throws IOException {
        headers.forEach(exchange.getResponseHeaders()::add);
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        try (var in = exchange.getRequestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void testRetriesServerErrorThenSucceeds() throws Exception {
        var count = new AtomicInteger();
        server.createContext("/", exchange -> {
            if (count.incrementAndGet() == 1) {
                respond(exchange, 500, Map.of(), "not ok");
            } else {
                respond(exchange, 200, Map.of(), "who`s there?");
            }
        });

        var response = client.execute(new HttpRequest(baseUrl + "/", "GET")
                .setRetry(RetryOptions.builder().calculateDelay(FAST).build()));

        assertEquals("who`s there?", response.getBodyAsString());
        assertEquals(1, response.getRetryCount());
    }

    @Test
    void testKeepAliveReusesTheSocket() throws Exception {
        var count = new AtomicInteger();
        server.createContext("/", exchange -> {
            readBody(exchange);
            respond(exchange, count.incrementAndGet() == 1 ? 503 : 200, Map.of(), "body");
        });

        var response = client.execute(new HttpRequest(baseUrl + "/", "GET")
                .setRetry(RetryOptions.builder().calculateDelay(FAST).build()));

        assertEquals(1, response.getRetryCount());
        assertThat(connections).hasSize(2);
        assertEquals(connections.get(0), connections.get(1));
    }

    @Test
    void testRespectsRetryAfterSeconds() throws Exception {
        server.createContext("/", exchange -> {
            hits.add(System.currentTimeMillis());
            respond(exchange, 413, Map.of("Retry-After", "1"), "");
        });

        var response = client.execute(new HttpRequest(baseUrl + "/", "GET").setThrowHttpErrors(false).retry(1));

        assertEquals(413, response.getStatusCode());
        assertEquals(1, response.getRetryCount());
        assertThat(hits).hasSize(2);
        assertThat(hits.get(1) - hits.get(0)).isGreaterThanOrEqualTo(1000L);
    }

    @Test
    void testRespectsRetryAfterDate() throws Exception {
        var advertised = new CopyOnWriteArrayList<Long>();
        server.createContext("/", exchange -> {
            hits.add(System.currentTimeMillis());
            // HTTP dates carry whole seconds
            var retryAt = ZonedDateTime.now(ZoneOffset.UTC).plusSeconds(2).truncatedTo(ChronoUnit.SECONDS);
            advertised.add(retryAt.toInstant().toEpochMilli());
            respond(exchange, 413, Map.of("Retry-After", DateTimeFormatter.RFC_1123_DATE_TIME.format(retryAt)), "");
        });

        var response = client.execute(new HttpRequest(baseUrl + "/", "GET").setThrowHttpErrors(false).retry(1));

        assertEquals(1, response.getRetryCount());
        assertThat(hits).hasSize(2);
        assertThat(hits.get(1)).isGreaterThanOrEqualTo(advertised.get(0));
    }

    @Test
    void testRedirectDoesNotConsumeRetries() {
        var redirects = new AtomicInteger();
        var errors = new AtomicInteger();
        server.createContext("/redirect", exchange -> {
            redirects.incrementAndGet();
            respond(exchange, 302, Map.of("Location", "/"), "");
        });
        server.createContext("/", exchange -> {
            errors.incrementAndGet();
            respond(exchange, 500, Map.of(), "");
        });

        assertThatThrownBy(() -> client.execute(new HttpRequest(baseUrl + "/redirect", "GET")
                .setRetry(RetryOptions.builder().calculateDelay(FAST).build())))
                .isInstanceOf(HttpStatusException.class)
                .hasMessage("Response code 500 (Internal Server Error)");
        assertEquals(1, redirects.get());
        assertEquals(3, errors.get());
    }

    @Test
    void testResendsRepeatableBody() throws Exception {
        var bodies = new CopyOnWriteArrayList<String>();
        server.createContext("/", exchange -> {
            bodies.add(readBody(exchange));
            respond(exchange, bodies.size() == 1 ? 502 : 200, Map.of(), "");
        });

        client.execute(new HttpRequest(baseUrl + "/", "PUT")
                .setData(Map.of("name", "fetch"))
                .setRetry(RetryOptions.builder().calculateDelay(FAST).build()));

        assertThat(bodies).containsExactly("{\"name\":\"fetch\"}", "{\"name\":\"fetch\"}");
    }

    @Test
    void testStreamBodyIsNotRetried() throws Exception {
        var count = new AtomicInteger();
        server.createContext("/", exchange -> {
            count.incrementAndGet();
            readBody(exchange);
            respond(exchange, 500, Map.of(), "not ok");
        });

        var response = client.execute(new HttpRequest(baseUrl + "/", "POST")
                .setData(new ByteArrayInputStream("hello".getBytes(StandardCharsets.UTF_8)))
                .setRetry(RetryOptions.builder().methods(Set.of("POST")).calculateDelay(FAST).build())
                .setThrowHttpErrors(false));

        assertEquals(500, response.getStatusCode());
        assertEquals(0, response.getRetryCount());
        assertEquals(1, count.get());
    }

    @Test
    void testSocketTimeoutIsRetried() throws Exception {
        var count = new AtomicInteger();
        server.createContext("/", exchange -> {
            if (count.incrementAndGet() == 1) {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            respond(exchange, 200, Map.of(), "ok");
        });

        var response = client.execute(new HttpRequest(baseUrl + "/", "GET")
                .setRetry(RetryOptions.builder().calculateDelay(FAST).build())
                .timeout(300));

        assertEquals("ok", response.getBodyAsString());
        assertEquals(1, response.getRetryCount());
    }

    @Test
    void testSocketTimeoutWithoutRetry() {
        server.createContext("/", exchange -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, Map.of(), "ok");
        });

        assertThatThrownBy(() -> client.execute(new HttpRequest(baseUrl + "/", "GET").retry(0).timeout(300)))
                .isInstanceOf(PhaseTimeoutException.class)
                .hasMessage("Timeout awaiting 'socket' for 300ms");
    }

    @Test
    void testStreamCanRetry() throws Exception {
        var count = new AtomicInteger();
        server.createContext("/", exchange -> {
            respond(exchange, count.incrementAndGet() == 1 ? 500 : 200, Map.of(), count.get() == 1 ? "not ok" : "ok");
        });
        var request = new HttpRequest(baseUrl + "/", "GET")
                .setRetry(RetryOptions.builder().calculateDelay(FAST).build());
        var done = new CompletableFuture<String>();
        var retries = new AtomicInteger();

        stream(request, 0, new StringBuilder(), retries, done);

        assertEquals("ok", done.get(10, TimeUnit.SECONDS));
        assertEquals(1, retries.get());
    }

    private void stream(HttpRequest request, int retryCount, StringBuilder sink, AtomicInteger retries,
            CompletableFuture<String> done) {
        var stream = client.stream(request);
        stream.setRetryCount(retryCount);
        stream.onData(chunk -> sink.append(new String(chunk, StandardCharsets.UTF_8)))
                .onRetry((count, error) -> {
                    retries.incrementAndGet();
                    stream(request, count, sink, retries, done);
                })
                .onError(done::completeExceptionally)
                .onEnd(() -> done.complete(sink.toString()))
                .start();
    }

}

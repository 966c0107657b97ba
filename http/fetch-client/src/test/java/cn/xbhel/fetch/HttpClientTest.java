package cn.xbhel.fetch;

import static cn.xbhel.fetch.ScriptedTransport.respond;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.core.type.TypeReference;

import cn.xbhel.fetch.timeout.TimerService;

class HttpClientTest {

    private static final String URL = "http://localhost/";

    private ScriptedTransport transport;
    private RecordingTimerService timers;
    private HttpClient client;

    @BeforeEach
    void setUp() {
        transport = new ScriptedTransport();
        timers = new RecordingTimerService();
        client = HttpClient.builder().transport(transport).timerService(timers).build();
    }

    @AfterEach
    void tearDown() throws IOException {
        client.close();
    }

    public static class Item {
        public String name;
        public int count;
    }

    @Test
    void testGetInstance_isShared() {
        var instance = HttpClient.getInstance();
        assertNotNull(instance);
        assertSame(instance, HttpClient.getInstance());
    }

    @Test
    void testBuilder_defaults() throws IOException {
        try (var defaults = HttpClient.builder().build()) {
            assertNotNull(defaults.transport);
            assertNotNull(defaults.timerService);
            assertNotNull(defaults.executor);
            assertSame(HttpEventListener.NOOP, defaults.eventListener);
        }
    }

    @Test
    void testExecuteAsString_usesRequestCharset() throws Exception {
        transport.then((request, listener) -> new FakeResponse(200, Map.of(),
                new ByteArrayInputStream("café".getBytes(StandardCharsets.ISO_8859_1))));

        var body = client.executeAsString(new HttpRequest(URL, "GET").setCharset(StandardCharsets.ISO_8859_1));

        assertEquals("café", body);
    }

    @Test
    void testExecute_mapsJsonToType() throws Exception {
        transport.then(respond(200, Map.of(), "{\"name\":\"apple\",\"count\":3,\"extra\":true}"));

        var item = client.execute(new HttpRequest(URL, "GET"), Item.class);

        assertEquals("apple", item.name);
        assertEquals(3, item.count);
    }

    @Test
    void testExecute_mapsJsonToTypeReference() throws Exception {
        transport.then(respond(200, Map.of(), "[\"a\",\"b\"]"));

        List<String> values = client.execute(new HttpRequest(URL, "GET"), new TypeReference<List<String>>() {
        });

        assertThat(values).containsExactly("a", "b");
    }

    @Test
    void testExecute_withResponseHandler() throws Exception {
        transport.then(respond(201));

        int status = client.execute(new HttpRequest(URL, "POST"), HttpResponse::getStatusCode);

        assertEquals(201, status);
    }

    @Test
    void testExecuteAsync() throws Exception {
        transport.then(respond(500)).then(respond(200, Map.of(), "ok"));

        var response = client.executeAsync(new HttpRequest(URL, "GET")).get(10, TimeUnit.SECONDS);

        assertEquals("ok", response.getBodyAsString());
        assertEquals(1, response.getRetryCount());
    }

    @Test
    void testExecuteAsync_failure() {
        transport.then(respond(404));

        var future = client.executeAsync(new HttpRequest(URL, "GET"));

        assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(HttpStatusException.class)
                .hasMessageContaining("Response code 404 (Not Found)");
    }

    @Test
    void testExecuteAsync_cancelAbortsTheExchange() throws Exception {
        transport.then(transport.hang());

        var future = client.executeAsync(new HttpRequest(URL, "GET"));
        assertTrue(transport.awaitHanging());
        future.cancel(true);

        assertTrue(future.isCancelled());
        assertEquals(1, transport.getAborts());
    }

    @Test
    void testClose_releasesResources() throws IOException {
        var timerService = mock(TimerService.class);
        var closing = HttpClient.builder().transport(transport).timerService(timerService).build();

        closing.close();

        assertTrue(transport.isClosed());
        verify(timerService).close();
        assertTrue(closing.executor.isShutdown());
    }

    @Test
    void testClose_forcesShutdownAfterTimeout() throws Exception {
        var executor = mock(ExecutorService.class);
        when(executor.awaitTermination(anyLong(), eq(TimeUnit.MILLISECONDS))).thenReturn(false);
        var closing = HttpClient.builder()
                .transport(transport)
                .timerService(timers)
                .executor(executor)
                .terminationTimeout(Duration.ofMillis(10))
                .build();

        closing.close();

        verify(executor).shutdown();
        verify(executor).awaitTermination(10L, TimeUnit.MILLISECONDS);
        verify(executor).shutdownNow();
    }

}

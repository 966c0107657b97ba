package cn.xbhel.fetch;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;

import cn.xbhel.fetch.retry.DelayScheduler;
import cn.xbhel.fetch.retry.RetryPolicyEvaluator;
import cn.xbhel.fetch.timeout.ScheduledTimerService;
import cn.xbhel.fetch.timeout.TimerService;
import cn.xbhel.fetch.transport.ApacheHttpTransport;
import cn.xbhel.fetch.transport.Transport;

/**
 * An HTTP client that retries, times out and follows redirects on its own.
 *
 * <p>
 * Key features:
 * </p>
 * <ul>
 * <li><b>Automatic Retry</b> - Configurable per request through
 * {@link cn.xbhel.fetch.retry.RetryOptions}, honouring {@code Retry-After}</li>
 * <li><b>Phase Timeouts</b> - Independent deadlines for lookup, connect, TLS,
 * send, response, read, inactivity and the whole exchange</li>
 * <li><b>Streaming</b> - Incremental delivery through {@link HttpStream} with the
 * same retry decisions as buffered requests</li>
 * <li><b>Connection Pooling</b> - One transport per client, keep-alive
 * connections are reused across attempts</li>
 * </ul>
 *
 * <p>
 * Usage example:
 * </p>
 *
 * <pre>
 * // Using shared instance (recommended for most cases)
 * HttpClient client = HttpClient.getInstance();
 *
 * // Or create custom instance
 * HttpClient client = HttpClient.builder()
 *         .transport(ApacheHttpTransport.builder().maxConnTotal(50).build())
 *         .build();
 *
 * HttpResponse response = client.execute(new HttpRequest("https://example.com", "GET")
 *         .retry(3)
 *         .timeout(5_000));
 * </pre>
 *
 * @author xbhel
 */
public class HttpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(HttpClient.class);

    final Transport transport;
    final TimerService timerService;
    final ExecutorService executor;
    final HttpEventListener eventListener;
    final Clock clock;
    private final Duration terminationTimeout;
    private final AttemptRunner runner;
    private final RetryCoordinator coordinator;

    HttpClient(Transport transport, TimerService timerService, ExecutorService executor,
            HttpEventListener eventListener, Clock clock, Duration terminationTimeout) {
        this.transport = transport;
        this.timerService = timerService;
        this.executor = executor;
        this.eventListener = eventListener;
        this.clock = clock;
        this.terminationTimeout = terminationTimeout;
        this.runner = new AttemptRunner(transport, timerService, eventListener);
        this.coordinator = new RetryCoordinator(RetryPolicyEvaluator.INSTANCE, new DelayScheduler(clock));
    }

    /**
     * Using the shared instance is enough in the most case.
     */
    public static HttpClient getInstance() {
        return Builder.INSTANCE;
    }

    /**
     * Use the builder to create a new instance.
     */
    public static Builder builder() {
        return new Builder();
    }

    public HttpResponse execute(HttpRequest request) throws Exception {
        return newExecution(request).execute();
    }

    public String executeAsString(HttpRequest request) throws Exception {
        var charset = Optional.ofNullable(request.getCharset()).orElse(StandardCharsets.UTF_8);
        return execute(request).getBodyAsString(charset);
    }

    public <T> T execute(HttpRequest request, Class<T> type) throws Exception {
        return RequestFactory.OBJECT_MAPPER.readValue(execute(request).getBody(), type);
    }

    public <T> T execute(HttpRequest request, TypeReference<T> typeReference) throws Exception {
        return RequestFactory.OBJECT_MAPPER.readValue(execute(request).getBody(), typeReference);
    }

    public <T> T execute(HttpRequest request, Function<HttpResponse, T> responseHandler) throws Exception {
        return responseHandler.apply(execute(request));
    }

    /**
     * Creates an execution that is not started yet, keep it to cancel the request
     * from another thread.
     */
    public RequestExecution newExecution(HttpRequest request) {
        return new RequestExecution(request, runner, coordinator, timerService, eventListener, clock);
    }

    /**
     * Executes the request on the client executor. Cancelling the returned future
     * cancels the request.
     */
    public CompletableFuture<HttpResponse> executeAsync(HttpRequest request) {
        var execution = newExecution(request);
        var future = CompletableFuture.supplyAsync(() -> {
            try {
                return execution.execute();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new CompletionException(e);
            }
        }, executor);
        future.whenComplete((response, error) -> {
            if (future.isCancelled()) {
                execution.cancel();
            }
        });
        return future;
    }

    /**
     * Creates a stream for the request, register listeners then
     * {@link HttpStream#start() start} it.
     */
    public HttpStream stream(HttpRequest request) {
        return new HttpStream(request, runner, coordinator, timerService, eventListener, executor, clock);
    }

    @Override
    public void close() throws IOException {
        gracefulShutdown();
        timerService.close();
        transport.close();
    }

    protected void gracefulShutdown() {
        // shuts down an ExecutorService in two phases, first by calling shutdown to
        // reject incoming tasks, and then calling shutdownNow
        executor.shutdown();
        try {
            if (!executor.awaitTermination(terminationTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Executor did not terminate in {}, forcing shutdown.", terminationTimeout);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            // (Re-)Cancel if current thread also interrupted
            executor.shutdownNow();
            // Preserve interrupt status
            Thread.currentThread().interrupt();
        }
    }

    public static class Builder {
        static final Duration DEFAULT_TERMINATION_TIMEOUT = Duration.ofSeconds(10);
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();

        // A singleton instance that is lazily initialized for thread safety.
        // This ensures the HttpClient is only created when first accessed.
        // Initialized after the constants it reads.
        static final HttpClient INSTANCE = builder().build();

        private Transport transport;
        private TimerService timerService;
        private ExecutorService executor;
        private HttpEventListener eventListener = HttpEventListener.NOOP;
        private Clock clock = Clock.systemUTC();
        private Duration terminationTimeout = DEFAULT_TERMINATION_TIMEOUT;

        /**
         * The transport used by every attempt. Defaults to an
         * {@link ApacheHttpTransport} with default pool settings.
         */
        public Builder transport(Transport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Drives phase timeouts and retry waits.
         */
        public Builder timerService(TimerService timerService) {
            this.timerService = timerService;
            return this;
        }

        /**
         * Runs asynchronous executions and streams. Defaults to a cached pool of
         * daemon threads.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder eventListener(HttpEventListener eventListener) {
            this.eventListener = eventListener;
            return this;
        }

        /**
         * The clock used to resolve {@code Retry-After} dates.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder terminationTimeout(Duration terminationTimeout) {
            this.terminationTimeout = terminationTimeout;
            return this;
        }

        public HttpClient build() {
            return new HttpClient(
                    Optional.ofNullable(transport).orElseGet(() -> ApacheHttpTransport.builder().build()),
                    Optional.ofNullable(timerService).orElseGet(ScheduledTimerService::new),
                    Optional.ofNullable(executor).orElseGet(Builder::defaultExecutor),
                    eventListener,
                    clock,
                    terminationTimeout);
        }

        static ExecutorService defaultExecutor() {
            var poolId = POOL_COUNTER.incrementAndGet();
            var threadCounter = new AtomicInteger();
            return Executors.newCachedThreadPool(runnable -> {
                var thread = new Thread(runnable, "fetch-worker-" + poolId + "-" + threadCounter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        }
    }

}

package cn.xbhel.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

import javax.annotation.Nullable;

import cn.xbhel.fetch.retry.AttemptTracker;
import cn.xbhel.fetch.retry.DelayDecision;
import cn.xbhel.fetch.retry.ExecutionState;
import cn.xbhel.fetch.timeout.TimerService;
import cn.xbhel.util.ThreadUtils;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Delivers a response incrementally through listeners.
 * <p>
 * A stream performs a single attempt. When it fails in a retryable way, a retry
 * listener is registered and no body chunk has been delivered yet, the stream
 * tears the attempt down, waits the retry delay and notifies the retry listener
 * with the retry count for the next stream. It is then up to the caller to
 * create that stream:
 * </p>
 *
 * <pre>
 * void fetch(int retryCount) {
 *     var stream = client.stream(request);
 *     stream.setRetryCount(retryCount);
 *     stream.onData(chunk -&gt; sink.write(chunk))
 *             .onRetry((count, error) -&gt; fetch(count))
 *             .onError(error -&gt; sink.fail(error))
 *             .onEnd(sink::close)
 *             .start();
 * }
 * </pre>
 * <p>
 * When {@code throwHttpErrors} is enabled, the body of a response outside the
 * successful range is never delivered: it is attached to the
 * {@link HttpStatusException} passed to the error listener.
 * </p>
 *
 * @author xbhel
 */
@Slf4j
public class HttpStream extends AbstractExecution {

    private static final int CHUNK_SIZE = 8 * 1024;

    private final AttemptRunner runner;
    private final RetryCoordinator coordinator;
    private final HttpEventListener eventListener;
    private final Executor executor;
    private final Clock clock;
    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean delivered = new AtomicBoolean();
    private final AtomicBoolean errorReported = new AtomicBoolean();
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    /** The number of retries that preceded this stream. */
    @Getter
    @Setter
    private int retryCount;

    private Consumer<HttpResponse> responseListener = response -> {};
    private Consumer<byte[]> dataListener = chunk -> {};
    private Runnable endListener = () -> {};
    @Nullable
    private Consumer<Throwable> errorListener;
    @Nullable
    private BiConsumer<Integer, HttpExecutionException> retryListener;

    HttpStream(HttpRequest request, AttemptRunner runner, RetryCoordinator coordinator, TimerService timerService,
            HttpEventListener eventListener, Executor executor, Clock clock) {
        super(request, timerService);
        this.runner = runner;
        this.coordinator = coordinator;
        this.eventListener = eventListener;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * The response head, received before the first chunk of the body.
     */
    public HttpStream onResponse(Consumer<HttpResponse> listener) {
        this.responseListener = listener;
        return this;
    }

    public HttpStream onData(Consumer<byte[]> listener) {
        this.dataListener = listener;
        return this;
    }

    public HttpStream onEnd(Runnable listener) {
        this.endListener = listener;
        return this;
    }

    public HttpStream onError(Consumer<Throwable> listener) {
        this.errorListener = listener;
        return this;
    }

    /**
     * Registers the retry listener. Without it the stream never retries.
     */
    public HttpStream onRetry(BiConsumer<Integer, HttpExecutionException> listener) {
        this.retryListener = listener;
        return this;
    }

    /**
     * Starts the stream on the client executor. The returned future completes
     * after the end or retry notification, or exceptionally with the error passed
     * to the error listener.
     */
    public CompletableFuture<Void> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("The stream has already been started: " + request);
        }
        CompletableFuture.runAsync(this::run, executor).whenComplete((ignored, error) -> {
            if (error != null) {
                // listeners threw
                fail(ThreadUtils.unwrap(error));
            }
        });
        return completion;
    }

    private void run() {
        var tracker = AttemptTracker.resumingFrom(retryCount, clock);
        var attempt = tracker.begin();
        PreparedRequest prepared;
        try {
            prepared = RequestFactory.prepare(request);
        } catch (IOException e) {
            fail(new TransportException(e));
            return;
        } catch (HttpExecutionException e) {
            fail(e);
            return;
        }
        eventListener.onAttempt(request, attempt);
        var hop = new AtomicReference<>(prepared);
        try {
            var response = runner.run(tracker, hop, request, this::deliver, request.isThrowHttpErrors(), this);
            attempt.setResponse(response);
            setState(ExecutionState.SUCCEEDED);
            endListener.run();
            completion.complete(null);
        } catch (HttpExecutionException error) {
            attempt.setError(error);
            handleFailure(tracker, hop.get(), error);
        }
    }

    private HttpResponse deliver(HttpResponse head, InputStream body) throws IOException {
        if (request.isThrowHttpErrors() && !AttemptRunner.isOk(head.getStatusCode(), request.isFollowRedirect())) {
            return head.withBody(body.readAllBytes());
        }
        responseListener.accept(head);
        var buffer = new byte[CHUNK_SIZE];
        int count;
        while ((count = body.read(buffer)) != -1) {
            if (count > 0) {
                delivered.set(true);
                dataListener.accept(Arrays.copyOf(buffer, count));
            }
        }
        return head;
    }

    private void handleFailure(AttemptTracker tracker, PreparedRequest prepared, HttpExecutionException error) {
        var attempt = tracker.current();
        if (retryListener == null || delivered.get()) {
            fail(error);
            return;
        }
        try {
            setState(ExecutionState.EVALUATING);
            DelayDecision decision = await(coordinator.evaluate(attempt, error, request, prepared));
            if (decision.isStop()) {
                fail(error);
                return;
            }
            var delay = decision.getDelayMillis();
            log.warn("Request failed for {}. Retrying attempt #{} after {} ms delay",
                    request, attempt.getOrdinal(), delay);
            eventListener.beforeRetry(attempt, error, delay);
            setState(ExecutionState.WAITING);
            awaitDelay(delay);
        } catch (Exception e) {
            fail(e);
            return;
        }
        setState(ExecutionState.SUCCEEDED);
        // the next stream is retried once more than this one
        retryListener.accept(tracker.finalCount() + 1, error);
        completion.complete(null);
    }

    private void fail(Throwable error) {
        if (completion.isDone()) {
            return;
        }
        setState(ExecutionState.FAILED);
        if (errorListener != null && errorReported.compareAndSet(false, true)) {
            try {
                errorListener.accept(error);
            } finally {
                completion.completeExceptionally(error);
            }
            return;
        }
        log.error("Failed to execute [{}].", request, error);
        completion.completeExceptionally(error);
    }

}

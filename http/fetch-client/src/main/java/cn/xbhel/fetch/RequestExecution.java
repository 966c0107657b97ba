package cn.xbhel.fetch;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import cn.xbhel.fetch.retry.AttemptTracker;
import cn.xbhel.fetch.retry.DelayDecision;
import cn.xbhel.fetch.retry.ExecutionState;
import cn.xbhel.fetch.timeout.TimerService;
import lombok.extern.slf4j.Slf4j;

/**
 * A buffered request execution: attempts run one after another on the calling
 * thread until one succeeds, the retry budget is spent or the delay strategy
 * stops. A retry is sent to the last redirect target of the previous attempt.
 * The execution can be {@link #cancel() cancelled} from any thread.
 *
 * <pre>
 * var execution = client.newExecution(request);
 * executor.submit(execution::execute);
 * ...
 * execution.cancel();
 * </pre>
 *
 * @author xbhel
 */
@Slf4j
public class RequestExecution extends AbstractExecution {

    private static final ResponseConsumer BUFFERING = (head, body) -> head.withBody(body.readAllBytes());

    private final AttemptRunner runner;
    private final RetryCoordinator coordinator;
    private final HttpEventListener eventListener;
    private final Clock clock;
    private final AtomicBoolean started = new AtomicBoolean();

    RequestExecution(HttpRequest request, AttemptRunner runner, RetryCoordinator coordinator,
            TimerService timerService, HttpEventListener eventListener, Clock clock) {
        super(request, timerService);
        this.runner = runner;
        this.coordinator = coordinator;
        this.eventListener = eventListener;
        this.clock = clock;
    }

    /**
     * Runs the request to completion. May be called only once.
     *
     * @return the final response, with {@code throwHttpErrors} disabled it may have
     *         an error status
     * @throws HttpExecutionException the terminal failure of the last attempt
     * @throws Exception              what the retry delay strategy failed with
     */
    public HttpResponse execute() throws Exception {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("The request execution has already been started: " + request);
        }
        var tracker = new AttemptTracker(clock);
        try {
            var hop = new AtomicReference<>(RequestFactory.prepare(request));
            while (true) {
                throwIfCancelled();
                setState(ExecutionState.ATTEMPTING);
                var attempt = tracker.begin();
                eventListener.onAttempt(request, attempt);
                try {
                    var response = runner.run(tracker, hop, request, BUFFERING, true, this);
                    attempt.setResponse(response);
                    setState(ExecutionState.SUCCEEDED);
                    return response;
                } catch (HttpExecutionException error) {
                    attempt.setError(error);
                    setState(ExecutionState.EVALUATING);
                    DelayDecision decision = await(coordinator.evaluate(attempt, error, request, hop.get()));
                    if (decision.isStop()) {
                        var response = surface(error);
                        setState(ExecutionState.SUCCEEDED);
                        return response;
                    }
                    var delay = decision.getDelayMillis();
                    log.warn("Request failed for {}. Retrying attempt #{} after {} ms delay",
                            request, attempt.getOrdinal(), delay);
                    eventListener.beforeRetry(attempt, error, delay);
                    setState(ExecutionState.WAITING);
                    awaitDelay(delay);
                }
            }
        } catch (Exception e) {
            setState(ExecutionState.FAILED);
            throw e;
        }
    }

    /**
     * A final error status is returned as a response when {@code throwHttpErrors}
     * is disabled, every other failure is thrown.
     */
    private HttpResponse surface(HttpExecutionException error) {
        if (error instanceof HttpStatusException statusError && !request.isThrowHttpErrors()) {
            return statusError.getResponse();
        }
        throw error;
    }

}

package cn.xbhel.fetch;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

import javax.annotation.Nullable;

import cn.xbhel.fetch.retry.Attempt;
import cn.xbhel.fetch.retry.DelayDecision;
import cn.xbhel.fetch.retry.DelayScheduler;
import cn.xbhel.fetch.retry.RetryPolicyEvaluator;
import cn.xbhel.fetch.timeout.Phase;
import cn.xbhel.fetch.timeout.TimeoutOptions;

/**
 * Combines eligibility and delay into the single retry decision used by both
 * buffered executions and streams.
 *
 * @author xbhel
 */
class RetryCoordinator {

    private final RetryPolicyEvaluator evaluator;
    private final DelayScheduler scheduler;

    RetryCoordinator(RetryPolicyEvaluator evaluator, DelayScheduler scheduler) {
        this.evaluator = evaluator;
        this.scheduler = scheduler;
    }

    /**
     * @param prepared the last request sent by the attempt, its method and body
     *                 decide eligibility
     */
    CompletableFuture<DelayDecision> evaluate(Attempt attempt, HttpExecutionException error, HttpRequest request,
            PreparedRequest prepared) {
        var options = request.getRetry();
        if (!evaluator.isEligible(attempt, error, options, prepared.getMethod(), prepared.isReplayable())) {
            return CompletableFuture.completedFuture(DelayDecision.STOP);
        }
        var maxRetryAfter = options.getMaxRetryAfter() != null
                ? options.getMaxRetryAfter()
                : deriveMaxRetryAfter(request.getTimeout());
        return scheduler.decide(attempt.getOrdinal(), error, options, maxRetryAfter);
    }

    /**
     * The shorter of the request and connect timeouts, {@code null} when neither is
     * set.
     */
    @Nullable
    static Long deriveMaxRetryAfter(TimeoutOptions timeout) {
        return Stream.of(timeout.get(Phase.REQUEST), timeout.get(Phase.CONNECT))
                .filter(Objects::nonNull)
                .min(Long::compare)
                .orElse(null);
    }

}

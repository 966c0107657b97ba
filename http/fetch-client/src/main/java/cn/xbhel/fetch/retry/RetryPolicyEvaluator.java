package cn.xbhel.fetch.retry;

import java.util.Locale;

import cn.xbhel.fetch.HttpExecutionException;
import cn.xbhel.fetch.RequestCancelledException;
import cn.xbhel.fetch.RetryStrategyException;
import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a failed attempt may be retried at all. It does not compute a
 * delay, see {@link DelayScheduler}.
 *
 * @author xbhel
 */
@Slf4j
public class RetryPolicyEvaluator {

    public static final RetryPolicyEvaluator INSTANCE = new RetryPolicyEvaluator();

    /**
     * @param attempt    the attempt that just failed
     * @param error      its terminal error, for an error status the response is
     *                   attached to it
     * @param options    the retry options of the request
     * @param method     the method of the original request
     * @param replayable whether the request body can be sent again
     */
    public boolean isEligible(Attempt attempt, HttpExecutionException error, RetryOptions options, String method,
            boolean replayable) {
        if (error instanceof RequestCancelledException || error instanceof RetryStrategyException) {
            return false;
        }
        if (!replayable) {
            log.debug("Attempt #{} is not retried, the request body cannot be replayed.", attempt.getOrdinal());
            return false;
        }
        if (attempt.getOrdinal() >= options.getLimit() + 1) {
            return false;
        }
        if (!options.getMethods().contains(method.toUpperCase(Locale.ROOT))) {
            return false;
        }
        var response = error.getResponse();
        if (response != null) {
            return options.getStatusCodes().contains(response.getStatusCode());
        }
        return options.getErrorCodes().contains(error.getCode());
    }

}

package cn.xbhel.fetch;

import java.net.URI;

import cn.xbhel.fetch.retry.Attempt;

/**
 * Observes request executions. Callbacks run on the thread executing the
 * request and must not block.
 *
 * @author xbhel
 */
public interface HttpEventListener {

    HttpEventListener NOOP = new HttpEventListener() {
    };

    /**
     * An attempt is about to start.
     */
    default void onAttempt(HttpRequest request, Attempt attempt) {
    }

    /**
     * The attempt obtained a connection, fresh or reused from the pool.
     */
    default void onConnection(Attempt attempt, String connectionId) {
    }

    default void onRedirect(Attempt attempt, URI from, URI to) {
    }

    /**
     * A retry has been scheduled, the next attempt starts after the delay.
     */
    default void beforeRetry(Attempt attempt, HttpExecutionException error, long delayMillis) {
    }

}

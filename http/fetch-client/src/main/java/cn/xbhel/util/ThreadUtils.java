package cn.xbhel.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * @author xbhel
 */
public final class ThreadUtils {

    private ThreadUtils() {}

    /**
     * Waits for the future and returns its value. A failure of the future is
     * rethrown as it is, without the {@link ExecutionException} or
     * {@link CompletionException} wrappers.
     *
     * @throws InterruptedException if the current thread was interrupted while
     *                              waiting, the interrupt status is kept
     */
    public static <T> T await(Future<T> future) throws Exception {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            throw rethrow(unwrap(e.getCause()));
        }
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} layers.
     */
    public static Throwable unwrap(Throwable throwable) {
        var current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Exception rethrow(Throwable throwable) {
        if (throwable instanceof Error error) {
            throw error;
        }
        return (Exception) throwable;
    }

}

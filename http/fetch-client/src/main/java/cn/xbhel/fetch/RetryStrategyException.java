package cn.xbhel.fetch;

import cn.xbhel.fetch.transport.ErrorCodes;

/**
 * Raised when the configured delay strategy produced a value that is not a
 * usable delay. It always ends the request.
 *
 * @author xbhel
 */
public class RetryStrategyException extends HttpExecutionException {

    public RetryStrategyException(String message) {
        super(ErrorCodes.ERR_RETRY_STRATEGY, message);
    }

}

package cn.xbhel.fetch;

import cn.xbhel.fetch.transport.ErrorCodes;

/**
 * Raised when a request is cancelled by its caller. Cancellation is never retried.
 *
 * @author xbhel
 */
public class RequestCancelledException extends HttpExecutionException {

    public RequestCancelledException() {
        super(ErrorCodes.ERR_CANCELED, "Request has been cancelled");
    }

    public RequestCancelledException(Throwable cause) {
        super(ErrorCodes.ERR_CANCELED, "Request has been cancelled", cause);
    }

}

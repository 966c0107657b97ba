package cn.xbhel.fetch;

import cn.xbhel.fetch.transport.ErrorCodes;

/**
 * @author xbhel
 */
public class MaxRedirectsException extends HttpExecutionException {

    public MaxRedirectsException(int maxRedirects) {
        super(ErrorCodes.ERR_TOO_MANY_REDIRECTS, "Redirected " + maxRedirects + " times. Aborting.");
    }

}

package cn.xbhel.fetch;

import cn.xbhel.fetch.transport.ErrorCodes;

/**
 * Raised when the final response of an attempt has a status code outside the
 * successful range. The full response, body included, is kept on the exception.
 *
 * @author xbhel
 */
public class HttpStatusException extends HttpExecutionException {

    public HttpStatusException(HttpResponse response) {
        super(ErrorCodes.ERR_NON_2XX_3XX_RESPONSE,
                String.format("Response code %d (%s)", response.getStatusCode(), response.getReasonPhrase()),
                response, null);
    }

    @Override
    public HttpResponse getResponse() {
        return super.getResponse();
    }

    public int getStatusCode() {
        return getResponse().getStatusCode();
    }

}

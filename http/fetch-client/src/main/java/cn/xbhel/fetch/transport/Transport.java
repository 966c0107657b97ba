package cn.xbhel.fetch.transport;

import java.io.Closeable;
import java.io.IOException;

import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;

/**
 * Performs single network exchanges. A transport owns its connection pool, the
 * same instance is used for every attempt of every request so consecutive
 * attempts to one origin may share a keep-alive connection.
 * <p>
 * Implementations must honour {@link HttpUriRequest#abort()} called from another
 * thread: the blocked {@link #execute} call fails with an {@link IOException} and
 * no further event is reported.
 * </p>
 *
 * @author xbhel
 */
public interface Transport extends Closeable {

    /**
     * Sends the request and returns once the response head has arrived. The body
     * is read by the caller from the returned response.
     */
    CloseableHttpResponse execute(HttpUriRequest request, TransportListener listener) throws IOException;

}

package cn.xbhel.fetch;

import java.io.IOException;
import java.util.Optional;

import cn.xbhel.fetch.transport.ErrorCodes;

/**
 * A low-level network failure reported by the transport, tagged with the error
 * code resolved from the underlying {@link IOException}.
 *
 * @author xbhel
 */
public class TransportException extends HttpExecutionException {

    public TransportException(IOException cause) {
        super(ErrorCodes.resolve(cause),
                Optional.ofNullable(cause.getMessage()).orElse(cause.getClass().getName()),
                cause);
    }

    @Override
    public synchronized IOException getCause() {
        return (IOException) super.getCause();
    }

}

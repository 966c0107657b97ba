package cn.xbhel.fetch.transport;

/**
 * Receives the progress of a single network exchange. Events arrive in order on
 * the thread that executes the exchange; phases that do not happen (e.g. the
 * handshake of a plain connection, or the lookup of a pooled connection) are
 * simply not reported.
 *
 * @author xbhel
 */
public interface TransportListener {

    TransportListener NOOP = new TransportListener() {
    };

    /**
     * The remote address has been resolved.
     */
    default void onLookup() {
    }

    /**
     * The TCP connection has been established.
     */
    default void onConnect() {
    }

    /**
     * The TLS handshake has completed.
     */
    default void onSecureConnect() {
    }

    /**
     * A connection, fresh or reused from the pool, is ready and the request is
     * about to be written.
     *
     * @param connectionId identifies the underlying connection, equal ids mean the
     *                     same socket
     */
    default void onSocketReady(String connectionId) {
    }

    /**
     * The request head and body have been written.
     */
    default void onRequestSent() {
    }

    /**
     * The response head has been received.
     */
    default void onResponse() {
    }

    /**
     * Bytes of the response body have been read.
     */
    default void onData(int bytes) {
    }

}

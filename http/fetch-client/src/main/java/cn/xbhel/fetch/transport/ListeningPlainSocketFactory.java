package cn.xbhel.fetch.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

import org.apache.http.HttpHost;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.protocol.HttpContext;

/**
 * Reports lookup and connect progress of plain connections.
 * The remote address is already resolved when {@code connectSocket} is entered.
 *
 * @author xbhel
 */
class ListeningPlainSocketFactory extends PlainConnectionSocketFactory {

    @Override
    public Socket connectSocket(int connectTimeout, Socket socket, HttpHost host, InetSocketAddress remoteAddress,
            InetSocketAddress localAddress, HttpContext context) throws IOException {
        var listener = ApacheHttpTransport.listenerOf(context);
        listener.onLookup();
        var connected = super.connectSocket(connectTimeout, socket, host, remoteAddress, localAddress, context);
        listener.onConnect();
        return connected;
    }

}

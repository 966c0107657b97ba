package cn.xbhel.fetch.transport;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.SSLContext;

import org.apache.http.HttpHost;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.protocol.HttpContext;

/**
 * Reports lookup, connect and handshake progress of TLS connections. The plain
 * socket is connected before {@link #createLayeredSocket} upgrades it.
 *
 * @author xbhel
 */
class ListeningSslSocketFactory extends SSLConnectionSocketFactory {

    ListeningSslSocketFactory(SSLContext sslContext, HostnameVerifier hostnameVerifier) {
        super(sslContext, hostnameVerifier);
    }

    @Override
    public Socket connectSocket(int connectTimeout, Socket socket, HttpHost host, InetSocketAddress remoteAddress,
            InetSocketAddress localAddress, HttpContext context) throws IOException {
        ApacheHttpTransport.listenerOf(context).onLookup();
        return super.connectSocket(connectTimeout, socket, host, remoteAddress, localAddress, context);
    }

    @Override
    public Socket createLayeredSocket(Socket socket, String target, int port, HttpContext context)
            throws IOException {
        var listener = ApacheHttpTransport.listenerOf(context);
        listener.onConnect();
        var secured = super.createLayeredSocket(socket, target, port, context);
        listener.onSecureConnect();
        return secured;
    }

}

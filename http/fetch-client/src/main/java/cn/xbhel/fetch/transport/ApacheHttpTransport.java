package cn.xbhel.fetch.transport;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.config.Registry;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.protocol.HttpContext;
import org.apache.http.ssl.SSLContexts;

/**
 * A {@link Transport} backed by Apache HttpClient with a pooling connection
 * manager.
 * <p>
 * Phase progress is reported through socket factories and a request executor
 * that look up the {@link TransportListener} of the exchange in its
 * {@link HttpContext}. Automatic retries and redirect handling of HttpClient are
 * disabled, both are driven by the request engine.
 * </p>
 *
 * <pre>
 * Transport transport = ApacheHttpTransport.builder()
 *         .maxConnTotal(50)
 *         .connKeepAliveTime(30_000)
 *         .build();
 * </pre>
 *
 * @author xbhel
 */
public class ApacheHttpTransport implements Transport {

    public static final String REQUEST_ID_ATTRIBUTE = "request-id";
    static final String LISTENER_ATTRIBUTE = "transport-listener";

    final CloseableHttpClient internalHttpClient;

    ApacheHttpTransport(CloseableHttpClient internalHttpClient) {
        this.internalHttpClient = internalHttpClient;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public CloseableHttpResponse execute(HttpUriRequest request, TransportListener listener) throws IOException {
        // The HttpContext allows storing custom attributes that can be accessed
        // throughout the request execution lifecycle
        var context = HttpClientContext.create();
        context.setAttribute(REQUEST_ID_ATTRIBUTE, UUID.randomUUID().toString());
        context.setAttribute(LISTENER_ATTRIBUTE, listener);
        return internalHttpClient.execute(request, context);
    }

    static TransportListener listenerOf(HttpContext context) {
        var listener = context == null ? null : context.getAttribute(LISTENER_ATTRIBUTE);
        return listener instanceof TransportListener transportListener ? transportListener : TransportListener.NOOP;
    }

    @Override
    public void close() throws IOException {
        if (internalHttpClient != null) {
            internalHttpClient.close();
        }
    }

    public static class Builder {

        static final int UNLIMITED = -1;
        static final int ONE_MINUTE_IN_MILLIS = 60_000;
        static final int DEFAULT_MAX_CONN_TOTAL = 20;
        static final int DEFAULT_MAX_CONN_PER_ROUTE = 5;
        static final int DEFAULT_VALIDATE_CONN_AFTER_INACTIVITY = 2_000;

        private int connectTimeout = ONE_MINUTE_IN_MILLIS;
        private int socketTimeout = ONE_MINUTE_IN_MILLIS;
        private int connectionRequestTimeout = ONE_MINUTE_IN_MILLIS;
        private int maxConnTotal = DEFAULT_MAX_CONN_TOTAL;
        private int maxConnPerRoute = DEFAULT_MAX_CONN_PER_ROUTE;
        private long maxConnIdleTime = UNLIMITED;
        private long connKeepAliveTime = UNLIMITED;
        private int validateConnAfterInactivity = DEFAULT_VALIDATE_CONN_AFTER_INACTIVITY;

        /**
         * Determines the timeout in milliseconds until a connection is established.
         * This is a safety net below the per-request {@code connect} phase timeout.
         */
        public Builder connectTimeout(int connectTimeoutMillis) {
            this.connectTimeout = connectTimeoutMillis;
            return this;
        }

        /**
         * Defines the socket timeout (SO_TIMEOUT) in milliseconds, which is the timeout
         * for waiting for data or, put differently, a maximum period inactivity between
         * two consecutive data packets.
         */
        public Builder socketTimeout(int socketTimeoutMillis) {
            this.socketTimeout = socketTimeoutMillis;
            return this;
        }

        /**
         * Returns the timeout in milliseconds used when requesting a connection from
         * the connection manager.
         */
        public Builder connectionRequestTimeout(int connectionRequestTimeoutMillis) {
            this.connectionRequestTimeout = connectionRequestTimeoutMillis;
            return this;
        }

        /**
         * TTL defines maximum life span of persistent connections regardless of their
         * expiration setting. No persistent connection will be re-used past its TTL
         * value. The default value is -1 (UNLIMITED).
         */
        public Builder connKeepAliveTime(long connKeepAliveTimeMillis) {
            this.connKeepAliveTime = connKeepAliveTimeMillis;
            return this;
        }

        /**
         * The maximum number of connections that will be allowed. The default value is
         * 20.
         */
        public Builder maxConnTotal(int maxConnTotal) {
            this.maxConnTotal = maxConnTotal;
            return this;
        }

        /**
         * The maximum number of connections that will be allowed per route. The default
         * value is 5.
         */
        public Builder maxConnPerRoute(int maxConnPerRoute) {
            this.maxConnPerRoute = maxConnPerRoute;
            return this;
        }

        /**
         * Checks the connection if the elapsed time since the last use of the
         * connection exceeds the timeout that has been set. The default value is 2s.
         */
        public Builder validateConnAfterInactivity(int validateConnAfterInactivityMillis) {
            this.validateConnAfterInactivity = validateConnAfterInactivityMillis;
            return this;
        }

        /**
         * Makes the transport proactively evict idle connections from the connection
         * pool using a background thread. The default value is -1 (UNLIMITED).
         */
        public Builder maxConnIdleTime(long maxConnIdleTimeMillis) {
            this.maxConnIdleTime = maxConnIdleTimeMillis;
            return this;
        }

        public ApacheHttpTransport build() {
            var requestConfig = RequestConfig.custom()
                    .setConnectTimeout(connectTimeout)
                    .setSocketTimeout(socketTimeout)
                    .setConnectionRequestTimeout(connectionRequestTimeout)
                    .setRedirectsEnabled(false)
                    .build();
            var connManager = new PoolingHttpClientConnectionManager(
                    socketFactoryRegistry(), null, null, null, connKeepAliveTime, TimeUnit.MILLISECONDS);
            connManager.setMaxTotal(maxConnTotal);
            connManager.setDefaultMaxPerRoute(maxConnPerRoute);
            connManager.setValidateAfterInactivity(validateConnAfterInactivity);
            var httpClientBuilder = HttpClientBuilder.create();
            if (connKeepAliveTime > 0 && maxConnIdleTime > 0) {
                httpClientBuilder.evictIdleConnections(maxConnIdleTime, TimeUnit.MILLISECONDS);
            }
            var closeableHttpClient = httpClientBuilder
                    .setConnectionManager(connManager)
                    .setDefaultRequestConfig(requestConfig)
                    .setRequestExecutor(new ListeningRequestExecutor())
                    // Redirects are followed by the engine so that every hop runs under
                    // its own phase timeouts and stays within the same attempt.
                    .disableRedirectHandling()
                    // By default, Apache HttpClient retries at most 3 times all idempotent requests
                    // completed with IOException, retries are owned by the retry options instead.
                    .disableAutomaticRetries()
                    .build();
            return new ApacheHttpTransport(closeableHttpClient);
        }

        static Registry<ConnectionSocketFactory> socketFactoryRegistry() {
            return RegistryBuilder.<ConnectionSocketFactory>create()
                    .register("http", new ListeningPlainSocketFactory())
                    .register("https", new ListeningSslSocketFactory(
                            SSLContexts.createDefault(), SSLConnectionSocketFactory.getDefaultHostnameVerifier()))
                    .build();
        }
    }

}

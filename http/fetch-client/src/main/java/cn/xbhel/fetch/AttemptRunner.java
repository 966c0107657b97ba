package cn.xbhel.fetch;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.http.Header;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpStatus;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.util.EntityUtils;

import cn.xbhel.fetch.retry.Attempt;
import cn.xbhel.fetch.retry.AttemptTracker;
import cn.xbhel.fetch.timeout.TimeoutComposer;
import cn.xbhel.fetch.timeout.TimerService;
import cn.xbhel.fetch.transport.Transport;
import cn.xbhel.fetch.transport.TransportListener;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a single attempt: one exchange per redirect hop, each under its own
 * {@link TimeoutComposer}, until a final response is consumed or the attempt
 * fails. The attempt ordinal never changes while redirects are followed.
 *
 * @author xbhel
 */
@Slf4j
class AttemptRunner {

    private final Transport transport;
    private final TimerService timerService;
    private final HttpEventListener eventListener;

    AttemptRunner(Transport transport, TimerService timerService, HttpEventListener eventListener) {
        this.transport = transport;
        this.timerService = timerService;
        this.eventListener = eventListener;
    }

    /**
     * @param tracker      the tracker of the request, its current attempt is the
     *                     one being run
     * @param hop          the request to send first, updated with every redirect
     *                     target so that a retry resumes from the last one
     * @param failOnStatus whether a final response outside the successful range
     *                     fails the attempt with an {@link HttpStatusException}
     */
    HttpResponse run(AttemptTracker tracker, AtomicReference<PreparedRequest> hop, HttpRequest request,
            ResponseConsumer consumer, boolean failOnStatus, AbstractExecution execution) {
        var attempt = Objects.requireNonNull(tracker.current(), "No attempt has begun");
        var current = hop.get();
        attempt.setCurrentUrl(current.getUri());
        var redirects = 0;
        while (true) {
            var exchange = RequestFactory.toHttpUriRequest(current);
            var composer = new TimeoutComposer(request.getTimeout(), timerService, exchange::abort,
                    current.isSecure());
            var listener = new AttemptListener(attempt, composer);
            execution.bind(exchange, composer);
            composer.start();
            try (var response = transport.execute(exchange, listener)) {
                var head = toHead(response, current, attempt, tracker.finalCount());
                var statusCode = head.getStatusCode();
                var location = head.getHeader(HttpHeaders.LOCATION);
                if (request.isFollowRedirect() && RedirectHandler.isRedirect(statusCode, location)) {
                    if (redirects >= request.getMaxRedirects()) {
                        throw new MaxRedirectsException(request.getMaxRedirects());
                    }
                    // release the connection for the next hop
                    EntityUtils.consume(response.getEntity());
                    var next = RedirectHandler.follow(current, statusCode, location);
                    log.debug("Following redirect {} from {} to {}.", statusCode, current.getUri(), next.getUri());
                    eventListener.onRedirect(attempt, current.getUri(), next.getUri());
                    attempt.addRedirect(next.getUri());
                    hop.set(next);
                    current = next;
                    redirects++;
                    continue;
                }

                var result = consume(response, head, consumer, listener);
                if (composer.isTimedOut()) {
                    throw composer.getTimeout();
                }
                if (failOnStatus && !isOk(statusCode, request.isFollowRedirect())) {
                    throw new HttpStatusException(result);
                }
                return result;
            } catch (IOException e) {
                throw translate(e, composer, execution);
            } finally {
                composer.complete();
                execution.unbind();
            }
        }
    }

    private static HttpResponse consume(CloseableHttpResponse response, HttpResponse head, ResponseConsumer consumer,
            TransportListener listener) throws IOException {
        var entity = response.getEntity();
        var content = entity == null ? null : entity.getContent();
        try (var body = content == null
                ? InputStream.nullInputStream()
                : new ProgressInputStream(content, listener)) {
            return consumer.consume(head, body);
        }
    }

    /**
     * A response is OK when it is 2xx or 304, or any 3xx when redirects are not
     * followed.
     */
    static boolean isOk(int statusCode, boolean followRedirect) {
        var limit = followRedirect ? 299 : 399;
        return (statusCode >= 200 && statusCode <= limit) || statusCode == HttpStatus.SC_NOT_MODIFIED;
    }

    static HttpResponse toHead(CloseableHttpResponse response, PreparedRequest request, Attempt attempt,
            int retryCount) {
        var headers = new LinkedHashMap<String, String>();
        for (Header header : response.getAllHeaders()) {
            headers.merge(header.getName(), header.getValue(), (first, second) -> first + ", " + second);
        }
        var statusLine = response.getStatusLine();
        return HttpResponse.builder()
                .statusCode(statusLine.getStatusCode())
                .reasonPhrase(statusLine.getReasonPhrase())
                .headers(headers)
                .url(request.getUri())
                .redirectUrls(attempt.getRedirectUrls())
                .retryCount(retryCount)
                .build();
    }

    /**
     * An aborted exchange fails with an {@link IOException}, report the reason of
     * the abort instead.
     */
    static HttpExecutionException translate(IOException error, TimeoutComposer composer,
            AbstractExecution execution) {
        var timeout = composer.getTimeout();
        if (timeout != null) {
            if (timeout.getCause() == null) {
                timeout.initCause(error);
            }
            return timeout;
        }
        if (execution.isCancelled()) {
            return new RequestCancelledException(error);
        }
        return new TransportException(error);
    }

    class AttemptListener implements TransportListener {

        private final Attempt attempt;
        private final TimeoutComposer composer;

        AttemptListener(Attempt attempt, TimeoutComposer composer) {
            this.attempt = attempt;
            this.composer = composer;
        }

        @Override
        public void onLookup() {
            composer.onLookup();
        }

        @Override
        public void onConnect() {
            composer.onConnect();
        }

        @Override
        public void onSecureConnect() {
            composer.onSecureConnect();
        }

        @Override
        public void onSocketReady(String connectionId) {
            composer.onSocketReady(connectionId);
            attempt.addConnection(connectionId);
            eventListener.onConnection(attempt, connectionId);
        }

        @Override
        public void onRequestSent() {
            composer.onRequestSent();
        }

        @Override
        public void onResponse() {
            composer.onResponse();
        }

        @Override
        public void onData(int bytes) {
            composer.onData(bytes);
        }
    }

}

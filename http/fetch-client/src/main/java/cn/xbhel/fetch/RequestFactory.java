package cn.xbhel.fetch;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.FileEntity;
import org.apache.http.entity.InputStreamEntity;
import org.apache.http.entity.StringEntity;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import cn.xbhel.fetch.transport.ErrorCodes;

/**
 * Converts {@link HttpRequest}s into their wire form and Apache requests.
 *
 * @author xbhel
 */
public final class RequestFactory {

    static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_IGNORED_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(SerializationFeature.WRITE_DATE_KEYS_AS_TIMESTAMPS);

    private RequestFactory() {
    }

    public static PreparedRequest prepare(HttpRequest request) throws IOException {
        Objects.requireNonNull(request, "The request is required");
        Objects.requireNonNull(request.getMethod(), "The request method is required");
        Objects.requireNonNull(request.getUrl(), "The request url is required");

        var defaultRequestHeaders = new LinkedHashMap<String, String>();
        // use application/json;charset=UTF-8 as the default accept type
        defaultRequestHeaders.put(HttpHeaders.ACCEPT, ContentType.APPLICATION_JSON.toString());
        Optional.ofNullable(request.getHeaders()).ifPresent(defaultRequestHeaders::putAll);

        var charset = Optional.ofNullable(request.getCharset()).orElse(StandardCharsets.UTF_8);
        HttpEntity entity = null;
        if (request.getData() != null) {
            entity = createEntity(request.getData(), charset, defaultRequestHeaders.get(HttpHeaders.CONTENT_TYPE));
            if (entity.getContentType() != null) {
                defaultRequestHeaders.putIfAbsent(HttpHeaders.CONTENT_TYPE, entity.getContentType().getValue());
            }
        }

        try {
            var uriBuilder = new URIBuilder(request.getUrl()).setCharset(charset);
            Optional.ofNullable(request.getQueryParams()).ifPresent(params -> params.forEach(uriBuilder::addParameter));
            return new PreparedRequest(request.getMethod().toUpperCase(Locale.ROOT), uriBuilder.build(), defaultRequestHeaders,
                    entity, charset);
        } catch (URISyntaxException e) {
            throw new HttpExecutionException(ErrorCodes.ERR_INVALID_URL, "Invalid url: " + request.getUrl(), e);
        }
    }

    public static HttpUriRequest toHttpUriRequest(PreparedRequest prepared) {
        var requestBuilder = RequestBuilder.create(prepared.getMethod())
                .setUri(prepared.getUri())
                .setCharset(prepared.getCharset());
        prepared.getHeaders().forEach(requestBuilder::addHeader);
        Optional.ofNullable(prepared.getEntity()).ifPresent(requestBuilder::setEntity);
        return requestBuilder.build();
    }

    static HttpEntity createEntity(Object data, Charset charset, String contentType) throws IOException {
        if (data instanceof HttpEntity httpEntity) {
            return httpEntity;
        }

        var ct = Optional.ofNullable(contentType)
                .map(x -> ContentType.parse(x).withCharset(charset)).orElse(null);

        if (data instanceof CharSequence str) {
            return new StringEntity(str.toString(), ct);
        }

        if (data instanceof byte[] bytes) {
            return new ByteArrayEntity(bytes, ct);
        }

        if (data instanceof File file) {
            return new FileEntity(file, ct);
        }

        if (data instanceof InputStream input) {
            // An input stream can only be consumed once, requests carrying one are never retried
            return new InputStreamEntity(input, ct);
        }

        // use application/json;charset=UTF-8 as the default content type
        if (contentType == null || ContentType.APPLICATION_JSON.getMimeType().equals(contentType)) {
            return new StringEntity(OBJECT_MAPPER.writeValueAsString(data),
                    ContentType.APPLICATION_JSON.withCharset(charset));
        }

        throw new UnsupportedOperationException(String.format(
                "Unsupported data type: %s with contentType: %s", data.getClass().getName(), contentType));
    }

}

package cn.xbhel.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class HttpResponseTest {

    private static final URI URL = URI.create("http://localhost/");

    @Test
    void testReasonPhraseFallsBackToStandardText() {
        assertEquals("Internal Server Error", HttpResponse.builder().statusCode(500).url(URL).build().getReasonPhrase());
        assertEquals("Teapot", HttpResponse.builder().statusCode(418).reasonPhrase("Teapot").url(URL).build()
                .getReasonPhrase());
        assertEquals("Unknown", HttpResponse.builder().statusCode(599).url(URL).build().getReasonPhrase());
    }

    @Test
    void testHeadersAreCaseInsensitiveAndReadOnly() {
        var response = HttpResponse.builder()
                .statusCode(200)
                .headers(Map.of("Retry-After", "2"))
                .url(URL)
                .build();

        assertEquals("2", response.getHeader("retry-after"));
        assertThrows(UnsupportedOperationException.class, () -> response.getHeaders().put("X", "y"));
    }

    @Test
    void testWithBodyKeepsTheHead() {
        var head = HttpResponse.builder()
                .statusCode(201)
                .url(URL)
                .redirectUrls(List.of(URI.create("http://localhost/next")))
                .retryCount(2)
                .build();

        var response = head.withBody("créé".getBytes(StandardCharsets.UTF_8));

        assertEquals(201, response.getStatusCode());
        assertEquals(2, response.getRetryCount());
        assertEquals("créé", response.getBodyAsString());
        assertThat(response.getRedirectUrls()).hasSize(1);
        assertThat(head.getBody()).isEmpty();
    }

}

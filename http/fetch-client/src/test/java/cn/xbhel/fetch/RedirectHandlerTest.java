package cn.xbhel.fetch;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.http.HttpHeaders;
import org.apache.http.entity.StringEntity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import cn.xbhel.fetch.transport.ErrorCodes;

class RedirectHandlerTest {

    private static PreparedRequest post(String url) {
        return new PreparedRequest("POST", URI.create(url),
                Map.of(HttpHeaders.CONTENT_TYPE, "text/plain", HttpHeaders.AUTHORIZATION, "Bearer token"),
                new StringEntity("payload", StandardCharsets.UTF_8), StandardCharsets.UTF_8);
    }

    @ParameterizedTest
    @ValueSource(ints = { 301, 302, 303, 307, 308 })
    void testIsRedirect(int statusCode) {
        assertTrue(RedirectHandler.isRedirect(statusCode, "/next"));
        assertFalse(RedirectHandler.isRedirect(statusCode, null));
        assertFalse(RedirectHandler.isRedirect(statusCode, " "));
    }

    @ParameterizedTest
    @ValueSource(ints = { 200, 300, 304, 305 })
    void testIsRedirect_otherStatuses(int statusCode) {
        assertFalse(RedirectHandler.isRedirect(statusCode, "/next"));
    }

    @ParameterizedTest
    @CsvSource({
            "303, POST, true",
            "303, GET, true",
            "303, HEAD, false",
            "301, POST, true",
            "302, PUT, true",
            "301, GET, false",
            "302, HEAD, false",
            "307, POST, false",
            "308, POST, false"
    })
    void testSwitchesToGet(int statusCode, String method, boolean expected) {
        assertEquals(expected, RedirectHandler.switchesToGet(statusCode, method));
    }

    @Test
    void testFollow_relativeLocation() {
        var next = RedirectHandler.follow(post("http://localhost/a/b"), 307, "c?x=1");

        assertEquals("http://localhost/a/c?x=1", next.getUri().toString());
        assertEquals("POST", next.getMethod());
        assertEquals("text/plain", next.getHeaders().get(HttpHeaders.CONTENT_TYPE));
        assertEquals("Bearer token", next.getHeaders().get(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testFollow_seeOtherDropsTheBody() {
        var current = post("http://localhost/form");

        var next = RedirectHandler.follow(current, 303, "/result");

        assertEquals("GET", next.getMethod());
        assertNull(next.getEntity());
        assertNull(next.getHeaders().get(HttpHeaders.CONTENT_TYPE));
        assertEquals("http://localhost/result", next.getUri().toString());
    }

    @Test
    void testFollow_keepsTheBodyOnPermanentRedirect() {
        var current = post("http://localhost/form");

        var next = RedirectHandler.follow(current, 308, "/moved");

        assertSame(current.getEntity(), next.getEntity());
    }

    @Test
    void testFollow_dropsCredentialsOnHostChange() {
        var next = RedirectHandler.follow(post("http://localhost/"), 307, "http://elsewhere.test/");

        assertEquals("elsewhere.test", next.getUri().getHost());
        assertNull(next.getHeaders().get(HttpHeaders.AUTHORIZATION));
    }

    @Test
    void testFollow_invalidLocation() {
        assertThatThrownBy(() -> RedirectHandler.follow(post("http://localhost/"), 302, "http://bad host/"))
                .isInstanceOf(HttpExecutionException.class)
                .extracting("code").isEqualTo(ErrorCodes.ERR_INVALID_URL);
    }

}

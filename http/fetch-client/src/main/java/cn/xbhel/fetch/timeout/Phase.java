package cn.xbhel.fetch.timeout;

import java.util.Arrays;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The stages of a network attempt that can be bounded by a timeout.
 *
 * @author xbhel
 */
@Getter
@RequiredArgsConstructor
public enum Phase {

    /** Resolving the remote address. */
    LOOKUP("lookup"),
    /** Establishing the TCP connection. */
    CONNECT("connect"),
    /** Completing the TLS handshake. */
    SECURE_CONNECT("secureConnect"),
    /** Inactivity: the longest gap allowed between two progress events. */
    SOCKET("socket"),
    /** Writing the request once the connection is ready. */
    SEND("send"),
    /** Waiting for the response head once the request is written. */
    RESPONSE("response"),
    /** Downloading the response body. */
    READ("read"),
    /** The whole exchange, from start to the end of the body. */
    REQUEST("request");

    private final String id;

    public static Phase fromId(String id) {
        return Arrays.stream(values())
                .filter(phase -> phase.id.equals(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown timeout phase: " + id));
    }

    @Override
    public String toString() {
        return id;
    }

}

package cn.xbhel.fetch;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the body of the final response of an attempt.
 *
 * @author xbhel
 */
@FunctionalInterface
interface ResponseConsumer {

    /**
     * @param head the response without body
     * @param body the body stream, every read counts as progress of the attempt
     * @return the response to report, usually {@code head} with its body
     */
    HttpResponse consume(HttpResponse head, InputStream body) throws IOException;

}

package cn.xbhel.fetch.transport;

import java.io.IOException;

import lombok.Getter;

/**
 * An {@link IOException} that names its own error code. Custom transports throw
 * it to report failures the built-in mapping does not know about.
 *
 * @author xbhel
 */
@Getter
public class CodedIOException extends IOException {

    private final String code;

    public CodedIOException(String code, String message) {
        super(message);
        this.code = code;
    }

    public CodedIOException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

}

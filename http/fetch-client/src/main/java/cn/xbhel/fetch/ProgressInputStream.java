package cn.xbhel.fetch;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

import cn.xbhel.fetch.transport.TransportListener;

/**
 * Reports every chunk of the response body read through it.
 *
 * @author xbhel
 */
class ProgressInputStream extends FilterInputStream {

    private final TransportListener listener;

    ProgressInputStream(InputStream in, TransportListener listener) {
        super(in);
        this.listener = listener;
    }

    @Override
    public int read() throws IOException {
        var value = super.read();
        if (value >= 0) {
            listener.onData(1);
        }
        return value;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        var count = super.read(b, off, len);
        if (count > 0) {
            listener.onData(count);
        }
        return count;
    }

}

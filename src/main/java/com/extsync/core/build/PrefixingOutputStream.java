package com.extsync.core.build;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Line-buffered stream that writes every complete line to a shared target,
 * prefixed with a fixed label. Bytes are passed through unchanged, so ANSI
 * sequences survive. Closing this stream never closes the target.
 */
public class PrefixingOutputStream extends OutputStream {

    private final PrintStream target;
    private final byte[] prefix;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream();

    public PrefixingOutputStream(PrintStream target, String prefix) {
        this.target = target;
        this.prefix = prefix.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public synchronized void write(int b) {
        line.write(b);
        if (b == '\n') {
            emitLine();
        }
    }

    @Override
    public synchronized void write(byte[] b, int off, int len) {
        for (int i = off; i < off + len; i++) {
            write(b[i]);
        }
    }

    @Override
    public synchronized void close() {
        if (line.size() > 0) {
            line.write('\n');
            emitLine();
        }
    }

    private void emitLine() {
        // One write per line keeps concurrent builds from interleaving mid-line
        synchronized (target) {
            target.write(prefix, 0, prefix.length);
            target.write(line.toByteArray(), 0, line.size());
            target.flush();
        }
        line.reset();
    }
}

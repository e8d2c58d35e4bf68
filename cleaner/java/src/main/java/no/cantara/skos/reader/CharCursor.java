package no.cantara.skos.reader;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;

/**
 * Reads characters through a fixed-size buffer with a few characters of lookahead, counting lines.
 */
final class CharCursor {

    private static final int BUFFER_SIZE = 8192;

    private final Reader in;
    private final char[] buf = new char[BUFFER_SIZE];
    private int pos;
    private int limit;
    private boolean eof;
    private int line = 1;

    CharCursor(Reader in) {
        this.in = in;
    }

    int line() {
        return line;
    }

    int peek() {
        return peek(0);
    }

    /** @return the character {@code ahead} positions on, or -1 past the end */
    int peek(int ahead) {
        if (pos + ahead >= limit) fill(ahead + 1);
        return pos + ahead < limit ? buf[pos + ahead] : -1;
    }

    int next() {
        int c = peek(0);
        if (c >= 0) {
            pos++;
            if (c == '\n') line++;
        }
        return c;
    }

    private void fill(int needed) {
        if (eof) return;
        if (pos > 0) {
            System.arraycopy(buf, pos, buf, 0, limit - pos);
            limit -= pos;
            pos = 0;
        }
        try {
            while (limit < needed && !eof) {
                int n = in.read(buf, limit, buf.length - limit);
                if (n < 0) {
                    eof = true;
                } else {
                    limit += n;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package io.customers.server.spi;

import java.io.ByteArrayOutputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Caps how many bytes of a request body are read.
 *
 * <p>Hosts map {@link PayloadTooLargeException} to 413 Payload Too Large.
 */
public final class BodySizeLimiter {

    /** No limit; the hosting framework is trusted to enforce one. */
    public static final long UNLIMITED = Long.MAX_VALUE;

    private BodySizeLimiter() {}

    /**
     * Wraps a body so that reading past {@code maxBytes} fails.
     *
     * @return {@code null} for a {@code null} body; the body itself when {@code maxBytes} is
     *         non-positive or {@link #UNLIMITED}
     */
    public static InputStream limit(InputStream body, long maxBytes) {
        if (body == null) return null;
        if (maxBytes <= 0 || maxBytes == UNLIMITED) return body;
        return new CappedInputStream(body, maxBytes);
    }

    /**
     * Reads a whole body, failing once more than {@code maxBytes} have been seen.
     *
     * @return the body bytes; an empty array for a {@code null} body
     */
    public static byte[] readAll(InputStream body, long maxBytes) throws IOException {
        if (body == null) return new byte[0];
        try (InputStream in = limit(body, maxBytes)) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buf = new byte[4096];
            int n;
            while ((n = in.read(buf)) >= 0) {
                out.write(buf, 0, n);
            }
            return out.toByteArray();
        }
    }

    /**
     * Thrown when a body exceeds the configured limit.
     */
    public static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;

        public PayloadTooLargeException(long maxBytes) {
            super("request body exceeds " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        public long maxBytes() {
            return maxBytes;
        }
    }

    private static final class CappedInputStream extends FilterInputStream {
        private final long maxBytes;
        private long seen;

        CappedInputStream(InputStream in, long maxBytes) {
            super(in);
            this.maxBytes = maxBytes;
        }

        @Override
        public int read() throws IOException {
            int b = super.read();
            if (b >= 0) count(1);
            return b;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (len == 0) return 0;
            // one byte past the cap is enough to detect overflow
            int toRead = (int) Math.max(1, Math.min(len, maxBytes - seen + 1));
            int n = super.read(b, off, toRead);
            if (n > 0) count(n);
            return n;
        }

        @Override
        public long skip(long n) throws IOException {
            long skipped = super.skip(Math.min(n, maxBytes - seen + 1));
            count(skipped);
            return skipped;
        }

        private void count(long n) throws PayloadTooLargeException {
            seen += n;
            if (seen > maxBytes) throw new PayloadTooLargeException(maxBytes);
        }
    }
}

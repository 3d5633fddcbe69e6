package io.kuberde.tunnel;

import io.kuberde.mux.MuxStream;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * First bytes of every relay-opened stream: the target service name followed by {@code \n}.
 */
public final class Preamble {
    public static final int MAX_BYTES = 256;

    private Preamble() {
    }

    public static void write(OutputStream out, String service) throws IOException {
        if (service == null || service.isBlank() || service.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Invalid service selector: " + service);
        }
        byte[] bytes = (service + "\n").getBytes(StandardCharsets.UTF_8);
        if (bytes.length > MAX_BYTES) {
            throw new IllegalArgumentException("Service selector too long: " + service.length());
        }
        out.write(bytes);
        out.flush();
    }

    /**
     * Reads the selector under a deadline and clears the deadline afterwards.
     *
     * @throws java.net.SocketTimeoutException when no newline arrived in time
     */
    public static String read(MuxStream stream, Duration timeout) throws IOException {
        stream.setReadTimeout(timeout);
        try {
            return read(stream.getInputStream());
        } finally {
            stream.setReadTimeout(null);
        }
    }

    static String read(InputStream in) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(32);
        while (true) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException("stream ended before the service selector");
            }
            if (b == '\n') {
                break;
            }
            if (buffer.size() >= MAX_BYTES - 1) {
                throw new IOException("service selector exceeds " + MAX_BYTES + " bytes");
            }
            buffer.write(b);
        }
        String selector = buffer.toString(StandardCharsets.UTF_8).trim();
        if (selector.isEmpty()) {
            throw new IOException("empty service selector");
        }
        return selector;
    }
}

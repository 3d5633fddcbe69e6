package io.kuberde.tunnel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Request line (or status line) plus headers of one HTTP/1.x message, as read off the wire. The raw
 * bytes are kept so a buffered request can be replayed verbatim into a tunnel stream.
 */
public record HttpHead(String startLine, List<Header> headers, byte[] raw) {
    public HttpHead {
        headers = List.copyOf(headers);
    }

    public String method() {
        int idx = startLine.indexOf(' ');
        return idx > 0 ? startLine.substring(0, idx) : startLine;
    }

    public String target() {
        String[] parts = startLine.split(" ", 3);
        return parts.length >= 2 ? parts[1] : "";
    }

    /**
     * Status code of a response head, or -1 when the start line is not a status line.
     */
    public int status() {
        String[] parts = startLine.split(" ", 3);
        if (parts.length < 2 || !parts[0].startsWith("HTTP/")) {
            return -1;
        }
        try {
            return Integer.parseInt(parts[1]);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public String header(String name) {
        for (Header header : headers) {
            if (header.nameEquals(name)) {
                return header.value();
            }
        }
        return null;
    }

    public boolean headerContainsToken(String name, String token) {
        String value = header(name);
        if (value == null) {
            return false;
        }
        for (String part : value.split(",")) {
            if (part.trim().equalsIgnoreCase(token)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reads byte by byte until the blank line that ends the head, so nothing past the head is
     * consumed from {@code in}.
     *
     * @return the parsed head, or {@code null} when the stream ended before a complete head or the
     *     head exceeded {@code maxBytes}
     */
    public static HttpHead read(InputStream in, int maxBytes) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(512);
        int b0 = -1;
        int b1 = -1;
        int b2 = -1;
        boolean complete = false;
        while (buffer.size() < maxBytes) {
            int b = in.read();
            if (b == -1) {
                break;
            }
            buffer.write(b);
            if (b0 == '\r' && b1 == '\n' && b2 == '\r' && b == '\n') {
                complete = true;
                break;
            }
            b0 = b1;
            b1 = b2;
            b2 = b;
        }
        if (!complete) {
            return null;
        }
        byte[] data = buffer.toByteArray();
        String text = new String(data, StandardCharsets.ISO_8859_1);
        String[] lines = text.split("\r\n");
        if (lines.length == 0 || lines[0].isBlank()) {
            return null;
        }
        List<Header> headers = new ArrayList<>();
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isEmpty()) {
                break;
            }
            int sep = line.indexOf(':');
            if (sep <= 0) {
                continue;
            }
            headers.add(new Header(line.substring(0, sep).trim(), line.substring(sep + 1).trim()));
        }
        return new HttpHead(lines[0], headers, data);
    }

    public static byte[] toWire(String startLine, List<Header> headers) {
        StringBuilder builder = new StringBuilder();
        builder.append(startLine).append("\r\n");
        for (Header header : headers) {
            builder.append(header.name()).append(": ").append(header.value()).append("\r\n");
        }
        builder.append("\r\n");
        return builder.toString().getBytes(StandardCharsets.ISO_8859_1);
    }

    public record Header(String name, String value) {
        public boolean nameEquals(String other) {
            return name.toLowerCase(Locale.ROOT).equals(other.toLowerCase(Locale.ROOT));
        }
    }
}

package io.kuberde.tunnel;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

final class HttpHeadTest {

    @Test
    void readsHeadWithoutConsumingBody() throws Exception {
        String wire = "POST /api/run?x=1 HTTP/1.1\r\n"
                + "Host: user-alice-dev.rde.example.com:8080\r\n"
                + "Connection: keep-alive, Upgrade\r\n"
                + "Content-Length: 4\r\n"
                + "\r\n"
                + "body";
        InputStream in = new ByteArrayInputStream(wire.getBytes(StandardCharsets.ISO_8859_1));
        HttpHead head = HttpHead.read(in, 32 * 1024);

        Assertions.assertNotNull(head);
        Assertions.assertEquals("POST", head.method());
        Assertions.assertEquals("/api/run?x=1", head.target());
        Assertions.assertEquals("user-alice-dev.rde.example.com:8080", head.header("host"));
        Assertions.assertTrue(head.headerContainsToken("Connection", "upgrade"));
        Assertions.assertFalse(head.headerContainsToken("Connection", "close"));
        Assertions.assertEquals(-1, head.status());
        Assertions.assertEquals(wire.length() - 4, head.raw().length);
        Assertions.assertEquals("body", new String(in.readAllBytes(), StandardCharsets.ISO_8859_1));
    }

    @Test
    void incompleteOrOversizedHeadYieldsNull() throws Exception {
        byte[] truncated = "GET / HTTP/1.1\r\nHost: a\r\n".getBytes(StandardCharsets.ISO_8859_1);
        Assertions.assertNull(HttpHead.read(new ByteArrayInputStream(truncated), 1024));

        byte[] large = ("GET / HTTP/1.1\r\nX-Pad: " + "a".repeat(200) + "\r\n\r\n").getBytes(StandardCharsets.ISO_8859_1);
        Assertions.assertNull(HttpHead.read(new ByteArrayInputStream(large), 64));
    }

    @Test
    void parsesStatusLine() throws Exception {
        byte[] wire = "HTTP/1.1 101 Switching Protocols\r\nUpgrade: kuberde-mux\r\n\r\n".getBytes(StandardCharsets.ISO_8859_1);
        HttpHead head = HttpHead.read(new ByteArrayInputStream(wire), 1024);
        Assertions.assertEquals(101, head.status());
        Assertions.assertEquals("kuberde-mux", head.header("Upgrade"));
    }
}

package io.kuberde.mux;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class MuxSessionTest {
    private static final MuxConfig CONFIG = MuxConfig.of(Duration.ofSeconds(5), Duration.ZERO, Duration.ofSeconds(10));

    private MuxSession agent;
    private MuxSession relay;

    @BeforeEach
    void connect() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            CompletableFuture<Socket> accepted = CompletableFuture.supplyAsync(() -> {
                try {
                    return server.accept();
                } catch (IOException e) {
                    throw new RuntimeException(e);
                }
            });
            Socket dialed = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
            Socket inbound = accepted.get(5, TimeUnit.SECONDS);
            agent = MuxSession.client(dialed, CONFIG, "agent");
            relay = MuxSession.server(inbound, CONFIG, "relay");
        }
    }

    @AfterEach
    void close() {
        if (agent != null) {
            agent.close();
        }
        if (relay != null) {
            relay.close();
        }
    }

    @Test
    void relayOpenedStreamCarriesBytesBothWays() throws Exception {
        MuxStream outbound = relay.openStream();
        Assertions.assertEquals(0, outbound.id() % 2);
        outbound.getOutputStream().write("hello".getBytes(StandardCharsets.UTF_8));

        MuxStream inbound = agent.acceptStream(Duration.ofSeconds(5));
        Assertions.assertNotNull(inbound);
        Assertions.assertEquals(outbound.id(), inbound.id());
        Assertions.assertEquals("hello", new String(readExactly(inbound.getInputStream(), 5), StandardCharsets.UTF_8));

        inbound.getOutputStream().write("world".getBytes(StandardCharsets.UTF_8));
        inbound.closeWrite();
        InputStream in = outbound.getInputStream();
        Assertions.assertEquals("world", new String(readExactly(in, 5), StandardCharsets.UTF_8));
        Assertions.assertEquals(-1, in.read());
    }

    @Test
    void transfersMoreThanOneWindowWithFlowControl() throws Exception {
        byte[] payload = new byte[MuxConfig.DEFAULT_WINDOW * 4 + 123];
        new Random(7).nextBytes(payload);
        MuxStream outbound = relay.openStream();
        CompletableFuture<Void> writer = CompletableFuture.runAsync(() -> {
            try {
                outbound.getOutputStream().write(payload);
                outbound.closeWrite();
            } catch (IOException e) {
                throw new RuntimeException(e);
            }
        });

        MuxStream inbound = agent.acceptStream(Duration.ofSeconds(5));
        ByteArrayOutputStream received = new ByteArrayOutputStream();
        inbound.getInputStream().transferTo(received);
        writer.get(10, TimeUnit.SECONDS);
        Assertions.assertArrayEquals(payload, received.toByteArray());
    }

    @Test
    void resetAbortsOnlyThatStream() throws Exception {
        MuxStream first = relay.openStream();
        MuxStream second = relay.openStream();
        MuxStream acceptedFirst = agent.acceptStream(Duration.ofSeconds(5));
        MuxStream acceptedSecond = agent.acceptStream(Duration.ofSeconds(5));

        Assertions.assertEquals(2, agent.streamCount());
        acceptedFirst.reset();
        Assertions.assertEquals(1, agent.streamCount());
        Assertions.assertThrows(IOException.class, () -> first.getInputStream().read());
        Assertions.assertTrue(first.isReset());

        second.getOutputStream().write(new byte[]{42});
        Assertions.assertEquals(42, acceptedSecond.getInputStream().read());
        Assertions.assertFalse(agent.isClosed());
    }

    @Test
    void sessionCloseResetsOpenStreamsOnBothSides() throws Exception {
        MuxStream outbound = relay.openStream();
        MuxStream inbound = agent.acceptStream(Duration.ofSeconds(5));

        agent.close();
        Assertions.assertTrue(relay.awaitClosed(Duration.ofSeconds(5)));
        Assertions.assertThrows(IOException.class, () -> outbound.getInputStream().read());
        Assertions.assertThrows(IOException.class, () -> inbound.getInputStream().read());
        Assertions.assertThrows(MuxException.class, () -> relay.openStream());
        Assertions.assertThrows(MuxException.class, () -> agent.acceptStream(Duration.ofMillis(10)));
    }

    @Test
    void readTimeoutAndAcceptTimeoutReturnControl() throws Exception {
        Assertions.assertNull(agent.acceptStream(Duration.ofMillis(150)));
        MuxStream outbound = relay.openStream();
        MuxStream inbound = agent.acceptStream(Duration.ofSeconds(5));
        inbound.setReadTimeout(Duration.ofMillis(100));
        Assertions.assertThrows(java.net.SocketTimeoutException.class, () -> inbound.getInputStream().read());
        outbound.getOutputStream().write(1);
        Assertions.assertEquals(1, inbound.getInputStream().read());
    }

    @Test
    void pingRoundTrips() throws Exception {
        Duration rtt = agent.ping(Duration.ofSeconds(5));
        Assertions.assertFalse(rtt.isNegative());
        Assertions.assertTrue(relay.millisSinceLastFrame() < 5_000L);
    }

    @Test
    void acceptedReauthIsAcknowledged() throws Exception {
        AtomicReference<String> seen = new AtomicReference<>();
        CompletableFuture<Boolean> acked = new CompletableFuture<>();
        relay.setControlHandler(token -> {
            seen.set(token);
            return true;
        });
        agent.setControlHandler(new MuxSession.ControlHandler() {
            @Override
            public boolean onReauth(String token) {
                return false;
            }

            @Override
            public void onReauthAccepted() {
                acked.complete(true);
            }
        });
        agent.sendReauth("fresh-token");
        Assertions.assertTrue(acked.get(5, TimeUnit.SECONDS));
        Assertions.assertEquals("fresh-token", seen.get());
        Assertions.assertFalse(relay.isClosed());
    }

    @Test
    void rejectedReauthClosesSession() throws Exception {
        relay.setControlHandler(token -> false);
        agent.sendReauth("stale");
        Assertions.assertTrue(relay.awaitClosed(Duration.ofSeconds(5)));
        Assertions.assertTrue(agent.awaitClosed(Duration.ofSeconds(5)));
    }

    @Test
    void heartbeatTimeoutClosesSilentSession() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
             Socket dialed = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
             Socket silentPeer = server.accept()) {
            MuxConfig strict = MuxConfig.of(Duration.ofMillis(50), Duration.ofMillis(200), Duration.ofSeconds(5));
            MuxSession lonely = MuxSession.client(dialed, strict, "lonely");
            Assertions.assertTrue(lonely.awaitClosed(Duration.ofSeconds(5)));
            Assertions.assertInstanceOf(MuxException.class, lonely.closeCause());
            Assertions.assertNotNull(silentPeer);
        }
    }

    private static byte[] readExactly(InputStream in, int n) throws IOException {
        byte[] out = in.readNBytes(n);
        Assertions.assertEquals(n, out.length);
        return out;
    }
}

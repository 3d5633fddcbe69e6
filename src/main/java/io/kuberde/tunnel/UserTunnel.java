package io.kuberde.tunnel;

import javax.net.SocketFactory;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.time.Duration;

/**
 * Client end of {@code /connect/{identity}}: one upgraded socket carrying the bytes of a single
 * agent service, typically driven by an SSH {@code ProxyCommand}.
 */
public final class UserTunnel {
    private static final int BUFFER_SIZE = 32 * 1024;

    private UserTunnel() {
    }

    /**
     * Dials the relay and upgrades {@code connectUrl}. The caller owns the returned socket.
     *
     * @throws HandshakeRejectedException when the relay refuses (401, 403, 404, 503)
     */
    public static Socket open(URI connectUrl, String bearerToken, SocketFactory factory, Duration timeout) throws IOException {
        Socket socket = TunnelSockets.dial(factory, connectUrl, timeout);
        try {
            TunnelHandshake.connect(socket, connectUrl, bearerToken, timeout);
            return socket;
        } catch (IOException | RuntimeException e) {
            socket.close();
            throw e;
        }
    }

    /**
     * Copies {@code in} to the socket and the socket to {@code out} until the relay side ends.
     * End of {@code in} half-closes the socket so the service sees end of input. The socket is
     * closed on return.
     *
     * @return bytes written to {@code out}
     */
    public static long pipe(Socket socket, InputStream in, OutputStream out) throws IOException, InterruptedException {
        Thread upstream = new Thread(() -> {
            byte[] buffer = new byte[BUFFER_SIZE];
            try {
                OutputStream toRelay = socket.getOutputStream();
                int read;
                while ((read = in.read(buffer)) != -1) {
                    toRelay.write(buffer, 0, read);
                    toRelay.flush();
                }
                if (!socket.isClosed()) {
                    socket.shutdownOutput();
                }
            } catch (IOException e) {
                if (!socket.isClosed()) {
                    System.err.println("WARN upstream copy ended: " + e.getMessage());
                }
            }
        }, "kuberde-connect-upstream");
        upstream.setDaemon(true);
        upstream.start();

        long received = 0L;
        try (socket) {
            InputStream fromRelay = socket.getInputStream();
            byte[] buffer = new byte[BUFFER_SIZE];
            int read;
            while ((read = fromRelay.read(buffer)) != -1) {
                out.write(buffer, 0, read);
                out.flush();
                received += read;
            }
        }
        upstream.join(100L);
        return received;
    }
}

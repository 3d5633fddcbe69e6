package io.kuberde.tunnel;

import io.kuberde.util.HttpExchanges;
import io.kuberde.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HTTP/1.1 upgrade exchanges on the tunnel listener. An agent upgrades its path to a mux session,
 * naming its identity in the query, its credential in {@code Authorization} and its services in
 * {@code X-Kuberde-Services}. A user upgrades {@code /connect/{identity}} to a raw byte stream to
 * one agent service. The relay answers {@code 101} or an error status and closes.
 */
public final class TunnelHandshake {
    public static final String UPGRADE_PROTOCOL = "kuberde-mux";
    public static final String CONNECT_PROTOCOL = "kuberde-connect";
    public static final String CONNECT_PATH = "/connect/";
    public static final String SERVICES_HEADER = "X-Kuberde-Services";
    public static final int MAX_HANDSHAKE_BYTES = 16 * 1024;

    private TunnelHandshake() {
    }

    /**
     * Agent side. Leaves the socket positioned at the first mux frame on success.
     */
    public static void upgrade(
            Socket socket,
            URI serverUrl,
            String agentId,
            String bearerToken,
            List<String> services,
            Duration timeout
    ) throws IOException {
        String path = serverUrl.getRawPath() == null || serverUrl.getRawPath().isBlank() ? "/" : serverUrl.getRawPath();
        String target = path + "?id=" + URLEncoder.encode(agentId, StandardCharsets.UTF_8);
        List<HttpHead.Header> headers = new ArrayList<>();
        headers.add(new HttpHead.Header(SERVICES_HEADER, String.join(",", services)));
        exchange(socket, serverUrl, target, bearerToken, UPGRADE_PROTOCOL, headers, timeout);
    }

    /**
     * User side of {@code /connect/{identity}}. Leaves the socket carrying the service's bytes.
     */
    public static void connect(Socket socket, URI connectUrl, String bearerToken, Duration timeout) throws IOException {
        String path = connectUrl.getRawPath() == null ? "" : connectUrl.getRawPath();
        if (!path.startsWith(CONNECT_PATH) || path.length() == CONNECT_PATH.length()) {
            throw new IllegalArgumentException("connect URL must end in " + CONNECT_PATH + "<identity>: " + connectUrl);
        }
        exchange(socket, connectUrl, path, bearerToken, CONNECT_PROTOCOL, List.of(), timeout);
    }

    private static void exchange(
            Socket socket,
            URI url,
            String target,
            String bearerToken,
            String protocol,
            List<HttpHead.Header> extra,
            Duration timeout
    ) throws IOException {
        String host = url.getPort() > 0 ? url.getHost() + ":" + url.getPort() : url.getHost();
        List<HttpHead.Header> headers = new ArrayList<>();
        headers.add(new HttpHead.Header("Host", host));
        if (bearerToken != null) {
            headers.add(new HttpHead.Header("Authorization", "Bearer " + bearerToken));
        }
        headers.add(new HttpHead.Header("Connection", "Upgrade"));
        headers.add(new HttpHead.Header("Upgrade", protocol));
        headers.addAll(extra);

        int previousTimeout = socket.getSoTimeout();
        socket.setSoTimeout((int) Math.max(1L, timeout.toMillis()));
        try {
            OutputStream out = socket.getOutputStream();
            out.write(HttpHead.toWire("GET " + target + " HTTP/1.1", headers));
            out.flush();
            HttpHead response = HttpHead.read(socket.getInputStream(), MAX_HANDSHAKE_BYTES);
            if (response == null) {
                throw new IOException("relay closed the connection during the handshake");
            }
            int status = response.status();
            if (status != 101) {
                throw new HandshakeRejectedException(status, response.startLine());
            }
            if (!response.headerContainsToken("Upgrade", protocol)) {
                throw new IOException("relay switched to an unexpected protocol: " + response.header("Upgrade"));
            }
        } finally {
            socket.setSoTimeout(previousTimeout);
        }
    }

    /**
     * Relay side.
     *
     * @return the parsed request, or {@code null} when the head was incomplete or oversized
     */
    public static UpgradeRequest readRequest(InputStream in) throws IOException {
        HttpHead head = HttpHead.read(in, MAX_HANDSHAKE_BYTES);
        if (head == null) {
            return null;
        }
        URI target;
        try {
            target = URI.create(head.target());
        } catch (IllegalArgumentException e) {
            return null;
        }
        Map<String, String> query = HttpExchanges.parseQuery(target);
        String authorization = head.header("Authorization");
        String bearer = null;
        if (authorization != null && authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
            bearer = authorization.substring(7).trim();
        }
        List<String> services = new ArrayList<>();
        String declared = head.header(SERVICES_HEADER);
        if (declared != null) {
            for (String part : declared.split(",")) {
                if (!part.isBlank()) {
                    services.add(part.trim());
                }
            }
        }
        String protocol = null;
        if (head.headerContainsToken("Connection", "upgrade")) {
            if (head.headerContainsToken("Upgrade", UPGRADE_PROTOCOL)) {
                protocol = UPGRADE_PROTOCOL;
            } else if (head.headerContainsToken("Upgrade", CONNECT_PROTOCOL)) {
                protocol = CONNECT_PROTOCOL;
            }
        }
        return new UpgradeRequest(
                head.method(),
                target.getPath() == null ? "" : target.getPath(),
                query.get("id"),
                bearer == null || bearer.isEmpty() ? null : bearer,
                services,
                protocol
        );
    }

    public static void accept(OutputStream out) throws IOException {
        accept(out, UPGRADE_PROTOCOL);
    }

    public static void accept(OutputStream out, String protocol) throws IOException {
        out.write(HttpHead.toWire("HTTP/1.1 101 Switching Protocols", List.of(
                new HttpHead.Header("Connection", "Upgrade"),
                new HttpHead.Header("Upgrade", protocol)
        )));
        out.flush();
    }

    public static void reject(OutputStream out, int status, String error) throws IOException {
        byte[] body = Jsons.toCompactJson(Map.of("error", error)).getBytes(StandardCharsets.UTF_8);
        out.write(HttpHead.toWire("HTTP/1.1 " + status + " " + reasonPhrase(status), List.of(
                new HttpHead.Header("Content-Type", "application/json; charset=utf-8"),
                new HttpHead.Header("Content-Length", Integer.toString(body.length)),
                new HttpHead.Header("Connection", "close")
        )));
        out.write(body);
        out.flush();
    }

    static String reasonPhrase(int status) {
        return switch (status) {
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 405 -> "Method Not Allowed";
            case 503 -> "Service Unavailable";
            default -> "Error";
        };
    }

    /**
     * @param protocol the requested upgrade, {@code null} when the request is not an upgrade to a
     *                 protocol the relay speaks
     */
    public record UpgradeRequest(
            String method,
            String path,
            String agentId,
            String bearerToken,
            List<String> services,
            String protocol
    ) {
        public UpgradeRequest {
            services = List.copyOf(services);
        }

        public boolean upgradesTo(String expected) {
            return expected.equals(protocol);
        }

        /**
         * Identity named by a {@code /connect/{identity}} path, or {@code null} for any other path.
         */
        public String connectTarget() {
            if (path == null || !path.startsWith(CONNECT_PATH)) {
                return null;
            }
            return path.substring(CONNECT_PATH.length());
        }
    }
}

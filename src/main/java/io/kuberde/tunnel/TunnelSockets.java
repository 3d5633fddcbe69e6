package io.kuberde.tunnel;

import javax.net.SocketFactory;
import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLSocket;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Dials the relay's tunnel listener. TLS sockets get hostname verification and SNI before the
 * upgrade request is written.
 */
public final class TunnelSockets {
    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private TunnelSockets() {
    }

    public static Socket dial(SocketFactory factory, URI url, Duration connectTimeout) throws IOException {
        String host = url.getHost();
        int port = portOf(url);
        Socket socket = (factory == null ? SocketFactory.getDefault() : factory).createSocket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            socket.setTcpNoDelay(true);
            socket.setKeepAlive(true);
            if (socket instanceof SSLSocket) {
                SSLSocket ssl = (SSLSocket) socket;
                SSLParameters params = ssl.getSSLParameters();
                params.setEndpointIdentificationAlgorithm("HTTPS");
                if (!IPV4.matcher(host).matches() && !host.contains(":")) {
                    params.setServerNames(List.of(new SNIHostName(host)));
                }
                ssl.setSSLParameters(params);
                ssl.startHandshake();
            }
            return socket;
        } catch (IOException e) {
            socket.close();
            throw e;
        }
    }

    public static boolean secure(URI url) {
        String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
        return scheme.equals("wss") || scheme.equals("https");
    }

    public static int portOf(URI url) {
        if (url.getPort() > 0) {
            return url.getPort();
        }
        String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
        return switch (scheme) {
            case "wss", "https" -> 443;
            case "ws", "http" -> 80;
            default -> throw new IllegalArgumentException("unsupported relay scheme: " + url.getScheme());
        };
    }
}

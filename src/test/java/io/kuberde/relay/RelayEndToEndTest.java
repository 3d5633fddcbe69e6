package io.kuberde.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import io.kuberde.agent.AgentRuntime;
import io.kuberde.agent.ConnectionState;
import io.kuberde.auth.ActorKind;
import io.kuberde.auth.ClientRegistry;
import io.kuberde.auth.JsonWebKeySet;
import io.kuberde.auth.SessionStore;
import io.kuberde.auth.TokenIssuer;
import io.kuberde.auth.TokenVerifier;
import io.kuberde.config.AgentConfig;
import io.kuberde.config.RelayConfig;
import io.kuberde.model.ServiceSpec;
import io.kuberde.model.ServiceTable;
import io.kuberde.tunnel.HandshakeRejectedException;
import io.kuberde.tunnel.TunnelHandshake;
import io.kuberde.tunnel.UserTunnel;
import io.kuberde.util.Backoff;
import io.kuberde.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class RelayEndToEndTest {
    private static final String IDENTITY = "user-alice-dev";

    private final HttpClient http = HttpClient.newHttpClient();
    private Path tempDir;
    private ServerSocket echo;
    private HttpServer web;
    private TokenIssuer issuer;
    private RelayServer relay;
    private AgentRuntime agent;

    @BeforeEach
    void start() throws Exception {
        tempDir = Files.createTempDirectory("kuberde-relay-e2e");
        echo = startEcho();
        web = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        web.createContext("/", exchange -> {
            byte[] body = ("hello from web " + exchange.getRequestURI().getPath()).getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        web.start();

        Clock clock = Clock.systemUTC();
        JsonWebKeySet keys = JsonWebKeySet.generateHs256("test-1");
        issuer = new TokenIssuer(keys, "kuberde-relay", clock);
        SessionStore sessionStore = new SessionStore(clock);
        TokenVerifier verifier = new TokenVerifier(keys, Set.of("kuberde-relay"), TokenVerifier.DEFAULT_CLOCK_SKEW, clock, sessionStore);
        RelayConfig config = RelayConfig.builder()
                .bindHost("127.0.0.1")
                .tunnelPort(0)
                .httpPort(0)
                .mgmtPort(0)
                .tcpPortRange(1024, 65535)
                .dataRoot(tempDir)
                .auditSigningSecret("test-secret")
                .build();
        relay = new RelayServer(config, verifier, issuer, ClientRegistry.empty(), sessionStore, null, clock);
        relay.start();
        Assertions.assertTrue(relay.isReady());

        AgentConfig agentConfig = new AgentConfig(
                URI.create("ws://127.0.0.1:" + relay.tunnelPort() + "/ws"),
                IDENTITY,
                ServiceTable.of(List.of(ServiceSpec.tcp("echo", echo.getLocalPort()), ServiceSpec.http("web", web.getAddress().getPort()))),
                "kuberde-agent",
                "unused",
                URI.create("http://127.0.0.1:1/token"),
                "127.0.0.1",
                null,
                null,
                null,
                Duration.ofSeconds(30),
                Backoff.of(50L, 500L, 2.0d),
                Backoff.of(50L, 500L, 2.0d),
                Duration.ofSeconds(2),
                Duration.ofMillis(100),
                Duration.ofSeconds(5),
                Duration.ofSeconds(5),
                0.8d,
                3
        );
        agent = new AgentRuntime(agentConfig,
                () -> issuer.issue(TokenIssuer.TokenRequest.agent("user-alice", IDENTITY, Duration.ofMinutes(10))),
                clock, error -> { });
        agent.start();
        Thread runner = new Thread(agent::run, "test-agent");
        runner.setDaemon(true);
        runner.start();
        awaitSession(IDENTITY);
    }

    @AfterEach
    void stop() throws IOException {
        if (agent != null) {
            agent.close();
        }
        if (relay != null) {
            relay.close();
        }
        if (web != null) {
            web.stop(0);
        }
        if (echo != null) {
            echo.close();
        }
        deleteRecursively(tempDir);
    }

    @Test
    void tcpRouteCarriesBytesToAgentService() throws Exception {
        int port = freePort();
        HttpResponse<String> registered = mgmt("POST", "/mgmt/services/tcp?agentID=" + IDENTITY + "&service=echo&port=" + port,
                systemToken("kuberde-controller"));
        Assertions.assertEquals(200, registered.statusCode(), registered.body());
        Assertions.assertEquals("created", Jsons.mapper().readTree(registered.body()).path("status").asText());

        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), port)) {
            socket.setSoTimeout(5_000);
            OutputStream out = socket.getOutputStream();
            out.write("ping over tunnel\n".getBytes(StandardCharsets.UTF_8));
            out.flush();
            socket.shutdownOutput();
            String echoed = new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            Assertions.assertEquals("ping over tunnel\n", echoed);
        }

        HttpResponse<String> stats = mgmt("GET", "/mgmt/agents/" + IDENTITY, systemToken("kuberde-controller"));
        Assertions.assertEquals(200, stats.statusCode());
        JsonNode json = Jsons.mapper().readTree(stats.body());
        Assertions.assertTrue(json.path("online").asBoolean());
    }

    @Test
    void derivedHostRoutesHttpToAgentService() throws Exception {
        String response = httpRequest("web." + IDENTITY, "/index.html");
        Assertions.assertTrue(response.startsWith("HTTP/1.1 200"), response);
        Assertions.assertTrue(response.endsWith("hello from web /index.html"), response);

        String unknown = httpRequest("web.user-nobody-dev", "/");
        Assertions.assertTrue(unknown.startsWith("HTTP/1.1 404"), unknown);
    }

    @Test
    void parkedRouteAnswersServiceUnavailable() throws Exception {
        String token = systemToken("kuberde-controller");
        Assertions.assertEquals(200, mgmt("POST",
                "/mgmt/services/http?agentID=" + IDENTITY + "&service=web&hostnamePrefix=ide.example", token).statusCode());
        Assertions.assertTrue(httpRequest("ide.example", "/").startsWith("HTTP/1.1 200"));

        HttpResponse<String> parked = mgmt("DELETE", "/mgmt/services/http?hostnamePrefix=ide.example&reason=idle", token);
        Assertions.assertEquals(200, parked.statusCode());
        Assertions.assertEquals("parked", Jsons.mapper().readTree(parked.body()).path("status").asText());

        String response = httpRequest("ide.example", "/");
        Assertions.assertTrue(response.startsWith("HTTP/1.1 503"), response);
        Assertions.assertTrue(response.contains("Retry-After: 5"), response);

        Assertions.assertEquals(200, mgmt("DELETE", "/mgmt/services/http?hostnamePrefix=ide.example", token).statusCode());
        Assertions.assertEquals(404, mgmt("DELETE", "/mgmt/services/http?hostnamePrefix=ide.example", token).statusCode());
    }

    @Test
    void foreignWorkloadGetsConflictEvenFromTheSameRegistrant() throws Exception {
        String controller = systemToken("kuberde-controller");
        Assertions.assertEquals(200, mgmt("POST",
                "/mgmt/services/http?agentID=" + IDENTITY + "-web&service=web&hostnamePrefix=shared", controller).statusCode());
        HttpResponse<String> conflict = mgmt("POST",
                "/mgmt/services/http?agentID=user-bob-dev-web&service=web&hostnamePrefix=shared", controller);
        Assertions.assertEquals(409, conflict.statusCode());
        Assertions.assertEquals(IDENTITY + "-web", Jsons.mapper().readTree(conflict.body()).path("agentID").asText());
        Assertions.assertEquals(409, mgmt("POST",
                "/mgmt/services/http?agentID=user-bob-dev-web&service=web&hostnamePrefix=shared", systemToken("someone-else"))
                .statusCode());
    }

    @Test
    void userConnectCarriesBytesToOneAgentService() throws Exception {
        Socket socket = UserTunnel.open(connectUrl(IDENTITY + "-echo"), userToken("alice-id", "alice"), null,
                Duration.ofSeconds(5));
        ByteArrayOutputStream received = new ByteArrayOutputStream();
        long count = UserTunnel.pipe(socket,
                new ByteArrayInputStream("ssh bytes\n".getBytes(StandardCharsets.UTF_8)), received);

        Assertions.assertEquals("ssh bytes\n", received.toString(StandardCharsets.UTF_8));
        Assertions.assertEquals(10L, count);
        Assertions.assertTrue(socket.isClosed());
    }

    @Test
    void userConnectIsRefusedWithoutAccess() throws Exception {
        Assertions.assertEquals(401, refusedStatus(IDENTITY + "-echo", null));
        Assertions.assertEquals(401, refusedStatus(IDENTITY + "-echo", "not-a-token"));
        Assertions.assertEquals(403, refusedStatus(IDENTITY + "-echo", userToken("bob-id", "bob")));
        Assertions.assertEquals(404, refusedStatus("user-alice-gone-ssh", userToken("alice-id", "alice")));
        Assertions.assertEquals(404, refusedStatus(IDENTITY, userToken("alice-id", "alice")));

        String controller = systemToken("kuberde-controller");
        Assertions.assertEquals(200, mgmt("POST",
                "/mgmt/services/http?agentID=user-alice-idle-ssh&service=ssh&hostnamePrefix=idle-ssh", controller).statusCode());
        Assertions.assertEquals(200, mgmt("DELETE", "/mgmt/services/http?hostnamePrefix=idle-ssh&reason=idle", controller)
                .statusCode());
        Assertions.assertEquals(503, refusedStatus("user-alice-idle-ssh", userToken("alice-id", "alice")));
        Assertions.assertEquals(503, refusedStatus("user-alice-idle", userToken("alice-id", "alice")));
    }

    @Test
    void adminMayConnectToAnyWorkload() throws Exception {
        Socket socket = UserTunnel.open(connectUrl(IDENTITY + "-echo"), systemToken("ops"), null, Duration.ofSeconds(5));
        ByteArrayOutputStream received = new ByteArrayOutputStream();
        UserTunnel.pipe(socket, new ByteArrayInputStream("admin\n".getBytes(StandardCharsets.UTF_8)), received);
        Assertions.assertEquals("admin\n", received.toString(StandardCharsets.UTF_8));
    }

    @Test
    void managementRequiresSystemCredential() throws Exception {
        Assertions.assertEquals(401, mgmt("GET", "/readyz", null).statusCode());
        HttpResponse<String> ready = mgmt("GET", "/readyz", systemToken("readiness-check"));
        Assertions.assertEquals(200, ready.statusCode());
        Assertions.assertEquals(1, Jsons.mapper().readTree(ready.body()).path("sessions").asInt());

        String agentToken = issuer.issue(TokenIssuer.TokenRequest.agent("user-alice", IDENTITY, Duration.ofMinutes(5))).value();
        Assertions.assertEquals(403, mgmt("POST",
                "/mgmt/services/tcp?agentID=" + IDENTITY + "&service=echo&port=" + freePort(), agentToken).statusCode());
        Assertions.assertEquals(400, mgmt("POST",
                "/mgmt/services/tcp?agentID=" + IDENTITY + "&service=echo&port=80", systemToken("kuberde-controller")).statusCode());
    }

    @Test
    void agentReconnectsAfterRelayDropsSession() throws Exception {
        AgentSession first = relay.sessions().find(IDENTITY).orElseThrow();
        first.close("dropped by test");
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (true) {
            AgentSession current = relay.sessions().find(IDENTITY).orElse(null);
            if (current != null && current != first) {
                break;
            }
            if (System.nanoTime() > deadline) {
                Assertions.fail("agent did not reconnect");
            }
            Thread.sleep(20);
        }
        Assertions.assertEquals(ConnectionState.STREAMING, agent.client().state());
        Assertions.assertTrue(httpRequest("web." + IDENTITY, "/again").endsWith("hello from web /again"));
    }

    private String userToken(String subjectId, String username) {
        return issuer.issue(new TokenIssuer.TokenRequest(subjectId, username, ActorKind.USER, List.of(), null, null,
                Duration.ofMinutes(5))).value();
    }

    private URI connectUrl(String identity) {
        return URI.create("ws://127.0.0.1:" + relay.tunnelPort() + TunnelHandshake.CONNECT_PATH + identity);
    }

    private int refusedStatus(String identity, String token) {
        HandshakeRejectedException refused = Assertions.assertThrows(HandshakeRejectedException.class,
                () -> UserTunnel.open(connectUrl(identity), token, null, Duration.ofSeconds(5)));
        return refused.status();
    }

    private String systemToken(String subject) {
        return issuer.issue(TokenIssuer.TokenRequest.system(subject, Duration.ofMinutes(5))).value();
    }

    private HttpResponse<String> mgmt(String method, String pathAndQuery, String token) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + relay.mgmtPort() + pathAndQuery))
                .timeout(Duration.ofSeconds(5))
                .method(method, HttpRequest.BodyPublishers.noBody());
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private String httpRequest(String host, String path) throws IOException {
        try (Socket socket = new Socket(InetAddress.getLoopbackAddress(), relay.httpPort())) {
            socket.setSoTimeout(5_000);
            String request = "GET " + path + " HTTP/1.1\r\nHost: " + host + "\r\nConnection: close\r\n\r\n";
            socket.getOutputStream().write(request.getBytes(StandardCharsets.US_ASCII));
            socket.getOutputStream().flush();
            return new String(socket.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private void awaitSession(String identity) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!relay.sessions().hasLiveSession(identity)) {
            if (System.nanoTime() > deadline) {
                Assertions.fail("agent did not connect");
            }
            Thread.sleep(20);
        }
    }

    private static int freePort() throws IOException {
        try (ServerSocket free = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            return free.getLocalPort();
        }
    }

    private static ServerSocket startEcho() throws IOException {
        ServerSocket server = new ServerSocket(0, 16, InetAddress.getLoopbackAddress());
        Thread acceptor = new Thread(() -> {
            while (!server.isClosed()) {
                try {
                    Socket socket = server.accept();
                    Thread worker = new Thread(() -> {
                        try (socket; InputStream in = socket.getInputStream(); OutputStream out = socket.getOutputStream()) {
                            in.transferTo(out);
                        } catch (IOException ignored) {
                            // connection torn down by the test
                        }
                    });
                    worker.setDaemon(true);
                    worker.start();
                } catch (IOException e) {
                    return;
                }
            }
        }, "test-echo");
        acceptor.setDaemon(true);
        acceptor.start();
        return server;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}

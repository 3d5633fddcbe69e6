package io.kuberde.cli;

import io.kuberde.agent.AgentRuntime;
import io.kuberde.auth.AccessToken;
import io.kuberde.auth.ActorKind;
import io.kuberde.auth.CachingTokenSource;
import io.kuberde.auth.ClientCredentialsTokenSource;
import io.kuberde.auth.ClientRegistry;
import io.kuberde.auth.JsonWebKeySet;
import io.kuberde.auth.LoopbackLogin;
import io.kuberde.auth.OidcLoginFlow;
import io.kuberde.auth.SessionStore;
import io.kuberde.auth.StoredToken;
import io.kuberde.auth.TokenIssuer;
import io.kuberde.auth.TokenSource;
import io.kuberde.auth.TokenVerifier;
import io.kuberde.auth.VerifiedToken;
import io.kuberde.config.AgentConfig;
import io.kuberde.config.ControllerConfig;
import io.kuberde.config.RelayConfig;
import io.kuberde.controller.ControllerServer;
import io.kuberde.controller.HttpRelayApi;
import io.kuberde.controller.KubernetesClusterClient;
import io.kuberde.relay.RelayServer;
import io.kuberde.security.TunnelTls;
import io.kuberde.tunnel.HandshakeRejectedException;
import io.kuberde.tunnel.TunnelSockets;
import io.kuberde.tunnel.UserTunnel;
import io.kuberde.util.Durations;
import io.kuberde.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import javax.net.SocketFactory;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeoutException;

@Command(
        name = "kuberde",
        mixinStandardHelpOptions = true,
        description = "KubeRDE relay, agent and controller",
        subcommands = {
                KubeRdeCommand.RelayCommand.class,
                KubeRdeCommand.AgentCommand.class,
                KubeRdeCommand.ControllerCommand.class,
                KubeRdeCommand.IssueTokenCommand.class,
                KubeRdeCommand.KeygenCommand.class,
                KubeRdeCommand.LoginCommand.class,
                KubeRdeCommand.ConnectCommand.class
        }
)
public final class KubeRdeCommand implements Runnable {
    public static final int EXIT_CREDENTIALS = 70;
    static final String DEFAULT_ISSUER = "kuberde-relay";
    private static final Duration CONTROLLER_TOKEN_TTL = Duration.ofMinutes(15);

    @Option(names = {"--data-root"}, description = "Directory for audit logs", defaultValue = "${env:KUBERDE_DATA_ROOT:-data}")
    String dataRoot;

    @Option(names = {"--audit-signing-secret"}, description = "Optional HMAC secret for audit rows",
            defaultValue = "${env:KUBERDE_AUDIT_SECRET}")
    String auditSigningSecret;

    @Override
    public void run() {
        System.out.println("Use subcommands: relay | agent | controller | issue-token | keygen | login | connect");
    }

    static JsonWebKeySet loadKeys(String file) throws Exception {
        if (file == null || file.isBlank()) {
            throw new IllegalArgumentException("--jwks-file is required");
        }
        return JsonWebKeySet.load(Paths.get(file));
    }

    static void awaitShutdown(String name, AutoCloseable resource) throws InterruptedException {
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                resource.close();
            } catch (Exception e) {
                System.err.println("WARN " + name + " shutdown failed: " + e.getMessage());
            }
            stopped.countDown();
        }, "kuberde-" + name + "-shutdown"));
        stopped.await();
    }

    @Command(name = "relay", description = "Run the relay server (tunnel, HTTP, TCP and management listeners)")
    static final class RelayCommand implements Callable<Integer> {
        @ParentCommand
        KubeRdeCommand parent;

        @Option(names = {"--bind"}, defaultValue = "${env:KUBERDE_BIND:-0.0.0.0}", description = "Bind address")
        String bind;

        @Option(names = {"--tunnel-port"}, defaultValue = "${env:KUBERDE_TUNNEL_PORT:-8081}", description = "Agent tunnel port")
        int tunnelPort;

        @Option(names = {"--http-port"}, defaultValue = "${env:KUBERDE_HTTP_PORT:-8080}", description = "HTTP frontend port")
        int httpPort;

        @Option(names = {"--mgmt-port"}, defaultValue = "${env:KUBERDE_MGMT_PORT:-8090}", description = "Management API port")
        int mgmtPort;

        @Option(names = {"--tunnel-path"}, defaultValue = "/ws", description = "Upgrade path for agent tunnels")
        String tunnelPath;

        @Option(names = {"--agent-domain"}, defaultValue = "${env:KUBERDE_AGENT_DOMAIN}",
                description = "Parent domain for derived HTTP routing (<agent>.<domain>)")
        String agentDomain;

        @Option(names = {"--tcp-port-min"}, defaultValue = "30000", description = "Lowest relay TCP port")
        int tcpPortMin;

        @Option(names = {"--tcp-port-max"}, defaultValue = "32767", description = "Highest relay TCP port")
        int tcpPortMax;

        @Option(names = {"--keep-alive"}, defaultValue = "30s", description = "Keep-alive interval")
        String keepAlive;

        @Option(names = {"--heartbeat-window"}, defaultValue = "90s", description = "Session is dead after this much silence")
        String heartbeatWindow;

        @Option(names = {"--controller-url"}, defaultValue = "${env:KUBERDE_CONTROLLER_URL}",
                description = "Controller base URL for scale-up signals")
        String controllerUrl;

        @Option(names = {"--open-probes"}, defaultValue = "false", description = "Serve /healthz and /readyz without a token")
        boolean openProbes;

        @Option(names = {"--require-browser-session"}, defaultValue = "false",
                description = "Require a browser session cookie on HTTP routes")
        boolean requireBrowserSession;

        @Option(names = {"--login-url"}, description = "Redirect target for HTTP requests without a session")
        String loginUrl;

        @Option(names = {"--jwks-file"}, defaultValue = "${env:KUBERDE_JWKS_FILE}", description = "Local signing key set (JSON)")
        String jwksFile;

        @Option(names = {"--issuer"}, defaultValue = DEFAULT_ISSUER, description = "Issuer for locally minted tokens")
        String issuer;

        @Option(names = {"--clients-file"}, defaultValue = "${env:KUBERDE_CLIENTS_FILE}", description = "Client registry (JSON)")
        String clientsFile;

        @Option(names = {"--oidc-issuer"}, description = "Trusted identity provider issuer")
        String oidcIssuer;

        @Option(names = {"--oidc-jwks-url"}, description = "Identity provider key set URL")
        String oidcJwksUrl;

        @Option(names = {"--oidc-authorize-url"}, description = "Identity provider authorization endpoint")
        String oidcAuthorizeUrl;

        @Option(names = {"--oidc-token-url"}, description = "Identity provider token endpoint")
        String oidcTokenUrl;

        @Option(names = {"--oidc-client-id"}, description = "Relay client id at the identity provider")
        String oidcClientId;

        @Option(names = {"--oidc-client-secret"}, defaultValue = "${env:KUBERDE_OIDC_CLIENT_SECRET}",
                description = "Relay client secret at the identity provider")
        String oidcClientSecret;

        @Option(names = {"--oidc-redirect-uri"}, description = "Callback URL registered at the identity provider")
        String oidcRedirectUri;

        @Option(names = {"--tls-keystore"}, defaultValue = "${env:KUBERDE_TLS_KEYSTORE}", description = "Keystore for TLS listeners")
        String keystore;

        @Option(names = {"--tls-keystore-pass"}, defaultValue = "${env:KUBERDE_TLS_KEYSTORE_PASS}", description = "Keystore password")
        String keystorePass;

        @Option(names = {"--tls-keystore-type"}, defaultValue = "PKCS12", description = "Keystore type")
        String keystoreType;

        @Override
        public Integer call() throws Exception {
            RelayConfig config = RelayConfig.builder()
                    .bindHost(bind)
                    .tunnelPort(tunnelPort)
                    .httpPort(httpPort)
                    .mgmtPort(mgmtPort)
                    .tunnelPath(tunnelPath)
                    .agentDomain(agentDomain)
                    .tcpPortRange(tcpPortMin, tcpPortMax)
                    .keepAliveInterval(Durations.parse(keepAlive))
                    .heartbeatWindow(Durations.parse(heartbeatWindow))
                    .controllerUrl(controllerUrl)
                    .openProbes(openProbes)
                    .requireBrowserSession(requireBrowserSession)
                    .loginUrl(loginUrl)
                    .dataRoot(Paths.get(parent.dataRoot))
                    .auditSigningSecret(parent.auditSigningSecret)
                    .keystore(keystore, keystorePass, keystoreType)
                    .build();
            Clock clock = Clock.systemUTC();
            JsonWebKeySet localKeys = loadKeys(jwksFile);
            TokenIssuer tokenIssuer = new TokenIssuer(localKeys, issuer, clock);
            ClientRegistry clients = clientsFile == null || clientsFile.isBlank()
                    ? ClientRegistry.empty()
                    : ClientRegistry.load(Paths.get(clientsFile));
            SessionStore browserSessions = new SessionStore(clock);

            JsonWebKeySet trusted = localKeys;
            Set<String> issuers = new LinkedHashSet<>();
            issuers.add(tokenIssuer.issuer());
            OidcLoginFlow oidc = null;
            if (oidcIssuer != null && !oidcIssuer.isBlank()) {
                if (oidcJwksUrl == null || oidcJwksUrl.isBlank()) {
                    throw new IllegalArgumentException("--oidc-jwks-url is required with --oidc-issuer");
                }
                HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
                JsonWebKeySet providerKeys = JsonWebKeySet.fetch(http, URI.create(oidcJwksUrl));
                trusted = JsonWebKeySet.merge(localKeys, providerKeys);
                issuers.add(oidcIssuer.trim());
                if (oidcAuthorizeUrl != null && oidcTokenUrl != null && oidcClientId != null && oidcRedirectUri != null) {
                    TokenVerifier idTokens = new TokenVerifier(providerKeys, Set.of(oidcIssuer.trim()), null, clock, null);
                    oidc = new OidcLoginFlow(
                            http,
                            new OidcLoginFlow.ProviderSettings(
                                    URI.create(oidcAuthorizeUrl),
                                    URI.create(oidcTokenUrl),
                                    oidcClientId,
                                    oidcClientSecret,
                                    URI.create(oidcRedirectUri)
                            ),
                            idTokens,
                            config.agentDomain(),
                            clock
                    );
                }
            }
            TokenVerifier verifier = new TokenVerifier(trusted, issuers, null, clock, browserSessions);
            RelayServer server = new RelayServer(config, verifier, tokenIssuer, clients, browserSessions, oidc, clock);
            try {
                server.start();
            } catch (Exception e) {
                server.close();
                throw e;
            }
            System.out.println("Relay trusts issuers=" + issuers + ", keys=" + trusted.size()
                    + ", clients=" + clients.size() + ", login=" + (oidc != null));
            awaitShutdown("relay", server);
            return 0;
        }
    }

    @Command(name = "agent", description = "Run the in-pod agent; bootstrap comes from the environment")
    static final class AgentCommand implements Callable<Integer> {
        @ParentCommand
        KubeRdeCommand parent;

        @Override
        public Integer call() throws Exception {
            AgentConfig config;
            try {
                config = AgentConfig.fromEnvironment(System.getenv());
            } catch (IllegalArgumentException e) {
                System.err.println("ERROR invalid agent environment: " + e.getMessage());
                return 2;
            }
            AgentRuntime runtime = AgentRuntime.fromConfig(config, error -> { });
            Runtime.getRuntime().addShutdownHook(new Thread(runtime::close, "kuberde-agent-shutdown"));
            System.out.println("Agent " + config.agentId() + " starting: server=" + config.serverUrl()
                    + ", services=" + config.services().names());
            try {
                runtime.start();
            } catch (Exception e) {
                System.err.println("ERROR agent could not obtain a credential: " + e.getMessage());
                runtime.close();
                return EXIT_CREDENTIALS;
            }
            runtime.run();
            runtime.close();
            return runtime.fatalError() == null ? 0 : EXIT_CREDENTIALS;
        }
    }

    @Command(name = "controller", description = "Run the RDEAgent controller")
    static final class ControllerCommand implements Callable<Integer> {
        @ParentCommand
        KubeRdeCommand parent;

        @Option(names = {"--namespace"}, defaultValue = "${env:KUBERDE_NAMESPACE:-kuberde}", description = "Watched namespace")
        String namespace;

        @Option(names = {"--relay-mgmt-url"}, defaultValue = "${env:KUBERDE_RELAY_MGMT_URL}",
                description = "Relay management API base URL")
        String relayMgmtUrl;

        @Option(names = {"--bind"}, defaultValue = "0.0.0.0", description = "Bind address")
        String bind;

        @Option(names = {"--port"}, defaultValue = "8082", description = "Probe and hook port")
        int port;

        @Option(names = {"--resync-interval"}, defaultValue = "30s", description = "Reconcile period")
        String resyncInterval;

        @Option(names = {"--workers"}, defaultValue = "4", description = "Concurrent reconciles")
        int workers;

        @Option(names = {"--tcp-port-base"}, defaultValue = "30000", description = "First port handed out to TCP services")
        int tcpPortBase;

        @Option(names = {"--tcp-port-range"}, defaultValue = "2768", description = "Number of ports handed out to TCP services")
        int tcpPortRange;

        @Option(names = {"--agent-image"}, defaultValue = "${env:KUBERDE_AGENT_IMAGE:-kuberde/agent:latest}",
                description = "Image for the agent container")
        String agentImage;

        @Option(names = {"--default-ttl"}, defaultValue = "8h", description = "Idle TTL when a resource sets none")
        String defaultTtl;

        @Option(names = {"--jwks-file"}, defaultValue = "${env:KUBERDE_JWKS_FILE}",
                description = "Key set shared with the relay (verifies hook callers, mints the controller credential)")
        String jwksFile;

        @Option(names = {"--issuer"}, defaultValue = DEFAULT_ISSUER, description = "Issuer of relay tokens")
        String issuer;

        @Option(names = {"--client-id"}, defaultValue = "${env:AUTH_CLIENT_ID}",
                description = "Use client credentials instead of a locally minted token")
        String clientId;

        @Option(names = {"--client-secret"}, defaultValue = "${env:AUTH_CLIENT_SECRET}", description = "Client secret")
        String clientSecret;

        @Option(names = {"--token-url"}, defaultValue = "${env:AUTH_TOKEN_URL}", description = "Token endpoint")
        String tokenUrl;

        @Override
        public Integer call() throws Exception {
            ControllerConfig config = new ControllerConfig(
                    namespace,
                    relayMgmtUrl,
                    bind,
                    port,
                    Durations.parse(resyncInterval),
                    workers,
                    tcpPortBase,
                    tcpPortRange,
                    agentImage,
                    Durations.parse(defaultTtl),
                    Paths.get(parent.dataRoot),
                    parent.auditSigningSecret
            );
            Clock clock = Clock.systemUTC();
            JsonWebKeySet keys = loadKeys(jwksFile);
            TokenVerifier verifier = new TokenVerifier(keys, Set.of(issuer), null, clock, null);
            HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
            TokenSource credentials;
            if (clientId != null && !clientId.isBlank()) {
                if (tokenUrl == null || tokenUrl.isBlank()) {
                    throw new IllegalArgumentException("--token-url is required with --client-id");
                }
                credentials = new ClientCredentialsTokenSource(http, URI.create(tokenUrl), clientId, clientSecret, clock);
            } else {
                TokenIssuer local = new TokenIssuer(keys, issuer, clock);
                credentials = () -> local.issue(TokenIssuer.TokenRequest.system("kuberde-controller", CONTROLLER_TOKEN_TTL));
            }
            CachingTokenSource tokens = new CachingTokenSource(credentials, AgentConfig.DEFAULT_REFRESH_FRACTION, clock);
            HttpRelayApi relay = new HttpRelayApi(http, config.relayMgmtUrl(), tokens);
            ControllerServer server = new ControllerServer(config, KubernetesClusterClient.inCluster(), relay, verifier, clock);
            try {
                server.start();
            } catch (Exception e) {
                server.close();
                throw e;
            }
            awaitShutdown("controller", server);
            return 0;
        }
    }

    @Command(name = "issue-token", description = "Mint a token from a local key set")
    static final class IssueTokenCommand implements Callable<Integer> {
        @Option(names = {"--jwks-file"}, required = true, description = "Key set (JSON) holding the signing key")
        String jwksFile;

        @Option(names = {"--subject"}, required = true, description = "Token subject")
        String subject;

        @Option(names = {"--kind"}, defaultValue = "system", description = "Actor kind: user|agent|system")
        String kind;

        @Option(names = {"--agent-id"}, description = "Bound agent identity (agent tokens)")
        String agentId;

        @Option(names = {"--role"}, description = "Role claim; repeatable")
        List<String> roles;

        @Option(names = {"--ttl"}, defaultValue = "1h", description = "Token lifetime")
        String ttl;

        @Option(names = {"--issuer"}, defaultValue = DEFAULT_ISSUER, description = "Issuer claim")
        String issuer;

        @Override
        public Integer call() throws Exception {
            ActorKind actorKind = ActorKind.fromString(kind);
            if (actorKind == ActorKind.AGENT && (agentId == null || agentId.isBlank())) {
                System.err.println("ERROR --agent-id is required for agent tokens");
                return 2;
            }
            List<String> claimedRoles = roles == null ? List.of() : roles;
            TokenIssuer tokenIssuer = new TokenIssuer(loadKeys(jwksFile), issuer, Clock.systemUTC());
            AccessToken token = tokenIssuer.issue(new TokenIssuer.TokenRequest(
                    subject,
                    subject,
                    actorKind,
                    actorKind == ActorKind.SYSTEM && claimedRoles.isEmpty() ? List.of(VerifiedToken.ADMIN_ROLE) : claimedRoles,
                    agentId,
                    null,
                    Durations.parse(ttl)
            ));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("access_token", token.value());
            out.put("token_type", "Bearer");
            out.put("issued_at", token.issuedAt().toString());
            out.put("expires_at", token.expiresAt().toString());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "keygen", description = "Write a fresh HS256 key set")
    static final class KeygenCommand implements Callable<Integer> {
        @Option(names = {"--out"}, required = true, description = "Output file")
        String out;

        @Option(names = {"--kid"}, defaultValue = "kuberde-1", description = "Key id")
        String kid;

        @Option(names = {"--force"}, defaultValue = "false", description = "Overwrite an existing file")
        boolean force;

        @Override
        public Integer call() throws Exception {
            Path target = Paths.get(out).toAbsolutePath().normalize();
            if (Files.exists(target) && !force) {
                System.err.println("ERROR " + target + " exists; pass --force to overwrite");
                return 1;
            }
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, JsonWebKeySet.generateHs256(kid).toJson(), StandardCharsets.UTF_8);
            System.out.println("Wrote key set " + kid + " to " + target);
            return 0;
        }
    }

    @Command(name = "login", description = "Sign in through the identity provider and store the token for connect")
    static final class LoginCommand implements Callable<Integer> {
        @Option(names = {"--authorize-url"}, defaultValue = "${env:AUTH_AUTHORIZE_URL}", description = "Authorization endpoint")
        String authorizeUrl;

        @Option(names = {"--token-url"}, defaultValue = "${env:AUTH_TOKEN_URL}", description = "Token endpoint")
        String tokenUrl;

        @Option(names = {"--client-id"}, defaultValue = "kuberde-cli", description = "Public client id")
        String clientId;

        @Option(names = {"--client-secret"}, defaultValue = "${env:AUTH_CLIENT_SECRET}", description = "Client secret, if the client has one")
        String clientSecret;

        @Option(names = {"--token-file"}, description = "Where to store the token (default ~/" + StoredToken.DEFAULT_FILE + ")")
        Path tokenFile;

        @Option(names = {"--timeout"}, defaultValue = "5m", description = "How long to wait for the browser")
        String timeout;

        @Option(names = {"--access-token"}, description = "Store this bearer token instead of opening a browser")
        String accessToken;

        @Override
        public Integer call() throws Exception {
            Path target = tokenFile == null ? StoredToken.defaultPath() : tokenFile;
            StoredToken token;
            if (accessToken != null && !accessToken.isBlank()) {
                token = StoredToken.fromBearer(accessToken);
            } else {
                if (authorizeUrl == null || authorizeUrl.isBlank() || tokenUrl == null || tokenUrl.isBlank()) {
                    System.err.println("ERROR --authorize-url and --token-url are required");
                    return 2;
                }
                HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
                try (LoopbackLogin login = new LoopbackLogin(http, URI.create(authorizeUrl), URI.create(tokenUrl),
                        clientId, clientSecret, Clock.systemUTC())) {
                    System.out.println("Open this URL in your browser to sign in:");
                    System.out.println(login.start());
                    try {
                        token = login.await(Durations.parse(timeout));
                    } catch (TimeoutException e) {
                        System.err.println("ERROR no login callback within " + timeout);
                        return 1;
                    }
                }
            }
            token.save(target);
            System.out.println("Saved token to " + target
                    + (token.expiresAt() == null ? "" : " (expires " + token.expiresAt() + ")"));
            return 0;
        }
    }

    @Command(name = "connect", description = "Open a tunnel to an agent service over stdin/stdout (SSH ProxyCommand)")
    static final class ConnectCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "Connect URL, e.g. wss://relay:8081/connect/user-alice-dev-ssh")
        URI url;

        @Option(names = {"--token-file"}, description = "Token stored by login (default ~/" + StoredToken.DEFAULT_FILE + ")")
        Path tokenFile;

        @Option(names = {"--truststore"}, defaultValue = "${env:KUBERDE_TRUSTSTORE}", description = "PKCS12 truststore for wss")
        String truststore;

        @Option(names = {"--truststore-pass"}, defaultValue = "${env:KUBERDE_TRUSTSTORE_PASS}", description = "Truststore password")
        String truststorePass;

        @Option(names = {"--connect-timeout"}, defaultValue = "10s", description = "Dial and handshake timeout")
        String connectTimeout;

        InputStream stdin = System.in;
        OutputStream stdout = System.out;

        @Override
        public Integer call() throws Exception {
            Optional<StoredToken> stored = StoredToken.load(tokenFile == null ? StoredToken.defaultPath() : tokenFile);
            if (stored.isEmpty() || stored.get().expired(Clock.systemUTC().instant())) {
                System.err.println("ERROR no valid token; run 'kuberde login'");
                return 1;
            }
            SocketFactory factory = TunnelSockets.secure(url)
                    ? TunnelTls.clientContext(truststore, truststorePass, null).getSocketFactory()
                    : null;
            Socket socket;
            try {
                socket = UserTunnel.open(url, stored.get().accessToken(), factory, Durations.parse(connectTimeout));
            } catch (HandshakeRejectedException e) {
                System.err.println("ERROR relay refused the connection (HTTP " + e.status() + "): " + e.getMessage());
                return 1;
            }
            UserTunnel.pipe(socket, stdin, stdout);
            return 0;
        }
    }
}

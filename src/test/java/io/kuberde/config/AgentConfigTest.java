package io.kuberde.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

final class AgentConfigTest {

    @Test
    void readsPodEnvironment() {
        AgentConfig config = AgentConfig.fromEnvironment(env());
        Assertions.assertEquals("user-alice-dev", config.agentId());
        Assertions.assertEquals(2, config.services().size());
        Assertions.assertEquals("127.0.0.1", config.localHost());
        Assertions.assertEquals(Duration.ofSeconds(15), config.keepAliveInterval());
        Assertions.assertTrue(config.tlsEnabled());
        Assertions.assertNull(config.truststorePath());
        Assertions.assertEquals(AgentConfig.DEFAULT_REFRESH_FRACTION, config.refreshFraction());
    }

    @Test
    void plainSchemeDisablesTlsAndKeepAliveFallsBack() {
        Map<String, String> env = env();
        env.put(AgentConfig.ENV_SERVER_URL, "ws://relay.kuberde.svc:8081/ws");
        env.remove(AgentConfig.ENV_KEEP_ALIVE);
        env.put(AgentConfig.ENV_LOCAL_HOST, " 10.0.0.5 ");
        AgentConfig config = AgentConfig.fromEnvironment(env);
        Assertions.assertFalse(config.tlsEnabled());
        Assertions.assertEquals(RelayConfig.DEFAULT_KEEP_ALIVE_INTERVAL, config.keepAliveInterval());
        Assertions.assertEquals("10.0.0.5", config.localHost());
    }

    @Test
    void missingRequiredVariableNamesIt() {
        for (String key : new String[] {
                AgentConfig.ENV_SERVER_URL,
                AgentConfig.ENV_AGENT_ID,
                AgentConfig.ENV_SERVICES,
                AgentConfig.ENV_CLIENT_SECRET,
                AgentConfig.ENV_TOKEN_URL
        }) {
            Map<String, String> env = env();
            env.put(key, " ");
            IllegalArgumentException error = Assertions.assertThrows(IllegalArgumentException.class,
                    () -> AgentConfig.fromEnvironment(env));
            Assertions.assertTrue(error.getMessage().contains(key), error.getMessage());
        }
    }

    @Test
    void malformedServiceTableIsRejected() {
        Map<String, String> env = env();
        env.put(AgentConfig.ENV_SERVICES, "[{\"name\":\"ssh\",\"port\":70000}]");
        Assertions.assertThrows(IllegalArgumentException.class, () -> AgentConfig.fromEnvironment(env));
    }

    private static Map<String, String> env() {
        Map<String, String> env = new HashMap<>();
        env.put(AgentConfig.ENV_SERVER_URL, "wss://relay.example.com/ws");
        env.put(AgentConfig.ENV_AGENT_ID, "user-alice-dev");
        env.put(AgentConfig.ENV_SERVICES, """
                [{"name":"ssh","port":22},{"name":"ide","port":3000,"protocol":"http"}]
                """);
        env.put(AgentConfig.ENV_CLIENT_ID, "kuberde-agent");
        env.put(AgentConfig.ENV_CLIENT_SECRET, "s3cret");
        env.put(AgentConfig.ENV_TOKEN_URL, "https://sso.example.com/token");
        env.put(AgentConfig.ENV_KEEP_ALIVE, "15s");
        return env;
    }
}

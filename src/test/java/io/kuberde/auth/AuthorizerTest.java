package io.kuberde.auth;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

final class AuthorizerTest {
    private final Authorizer authorizer = new Authorizer();

    @Test
    void usersActOnlyOnTheirOwnIdentities() {
        VerifiedToken alice = token("sub-a", "alice", List.of(), ActorKind.USER, null);
        Assertions.assertTrue(authorizer.canActOn(alice, "user-alice-dev"));
        Assertions.assertTrue(authorizer.canActOn(alice, "user-alice-dev-ssh"));
        Assertions.assertFalse(authorizer.canActOn(alice, "user-bob-dev"));
        Assertions.assertFalse(authorizer.canActOn(alice, "user-alicex-dev"));
        Assertions.assertFalse(authorizer.canActOn(alice, "not-an-identity"));
        Assertions.assertFalse(authorizer.canActOn(null, "user-alice-dev"));

        VerifiedToken admin = token("root", "root", List.of(VerifiedToken.ADMIN_ROLE), ActorKind.USER, null);
        Assertions.assertTrue(authorizer.canActOn(admin, "user-bob-dev"));
    }

    @Test
    void onlyAgentAndSystemCredentialsOpenSessions() {
        VerifiedToken user = token("sub-a", "alice", List.of(), ActorKind.USER, null);
        Assertions.assertFalse(authorizer.canOpenSession(user, "user-alice-dev"));

        VerifiedToken bound = token("agent-1", "agent-1", List.of(), ActorKind.AGENT, "user-alice-dev");
        Assertions.assertTrue(authorizer.canOpenSession(bound, "user-alice-dev"));
        Assertions.assertFalse(authorizer.canOpenSession(bound, "user-alice-other"));

        VerifiedToken shared = token("sa", "service-account-kuberde-agent", List.of(Authorizer.AGENT_ROLE), ActorKind.AGENT, null);
        Assertions.assertTrue(authorizer.canOpenSession(shared, "user-bob-dev"));

        VerifiedToken system = token("controller", "controller", List.of(VerifiedToken.ADMIN_ROLE), ActorKind.SYSTEM, null);
        Assertions.assertTrue(authorizer.canOpenSession(system, "user-bob-dev"));
        Assertions.assertTrue(authorizer.isSystem(system));
        Assertions.assertFalse(authorizer.isSystem(shared));
    }

    private static VerifiedToken token(String sub, String username, List<String> roles, ActorKind kind, String agentId) {
        return new VerifiedToken(sub, username, roles, Instant.now().plusSeconds(60), kind, null, agentId);
    }
}

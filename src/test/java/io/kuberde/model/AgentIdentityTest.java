package io.kuberde.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class AgentIdentityTest {

    @Test
    void buildsWorkloadAndServiceIdentities() {
        AgentIdentity workload = AgentIdentity.of("Alice", "Dev");
        Assertions.assertEquals("user-alice-dev", workload.value());
        AgentIdentity ssh = workload.forService("ssh");
        Assertions.assertEquals("user-alice-dev-ssh", ssh.value());
        Assertions.assertEquals(workload, ssh.workloadIdentity());
    }

    @Test
    void ownerIsRecoveredEvenWhenWorkloadHasDashes() {
        Assertions.assertEquals("alice", AgentIdentity.ownerOf("user-alice-my-dev-box"));
        Assertions.assertEquals("bob", AgentIdentity.ownerOf("user-bob-x"));
        Assertions.assertNull(AgentIdentity.ownerOf("svc-alice-dev"));
        Assertions.assertNull(AgentIdentity.ownerOf("user-alice"));
        Assertions.assertNull(AgentIdentity.ownerOf(null));
    }

    @Test
    void rejectsOwnersWithDashesAndBadLabels() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> AgentIdentity.of("al-ice", "dev"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> AgentIdentity.of("alice", "-dev"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> AgentIdentity.of("alice", "dev_box"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> AgentIdentity.of("alice", "dev").forService("Web!"));
        Assertions.assertTrue(AgentIdentity.isValidLabel("my-dev-1"));
        Assertions.assertFalse(AgentIdentity.isValidLabel("ends-"));
    }
}

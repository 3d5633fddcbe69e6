package io.kuberde.relay;

import io.kuberde.MutableClock;
import io.kuberde.model.RouteEntry;
import io.kuberde.model.RouteKind;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

final class RoutingTableTest {
    private final RoutingTable table = new RoutingTable(port -> port >= 30000 && port <= 32767,
            new MutableClock(Instant.parse("2025-03-01T10:00:00Z")));

    @Test
    void registerIsIdempotentForSameTarget() throws Exception {
        RoutingTable.Registration first = table.register(RouteKind.TCP, "30022", "user-alice-dev", "ssh", "controller");
        RoutingTable.Registration again = table.register(RouteKind.TCP, " 30022 ", "user-alice-dev", "ssh", "controller");
        Assertions.assertEquals(RoutingTable.Outcome.CREATED, first.outcome());
        Assertions.assertEquals(RoutingTable.Outcome.UNCHANGED, again.outcome());
        Assertions.assertEquals(1, table.size());
        Assertions.assertEquals("ssh", table.resolvePort(30022).orElseThrow().entry().service());
    }

    @Test
    void sameAgentCanRebindKeyToAnotherService() throws Exception {
        table.register(RouteKind.HTTP, "ide.user-alice-dev", "user-alice-dev", "ide", "controller");
        RouteConflictException conflict = Assertions.assertThrows(RouteConflictException.class,
                () -> table.register(RouteKind.HTTP, "IDE.user-alice-dev", "user-bob-dev", "ide", "someone"));
        Assertions.assertEquals("user-alice-dev", conflict.existing().agentId());

        RoutingTable.Registration rebound = table.register(RouteKind.HTTP, "ide.user-alice-dev", "user-alice-dev", "web", "someone");
        Assertions.assertEquals(RoutingTable.Outcome.REPLACED, rebound.outcome());
        Assertions.assertEquals("ide", rebound.previous().service());
    }

    @Test
    void keyOfAnotherWorkloadConflictsEvenForTheSameRegistrant() throws Exception {
        table.register(RouteKind.TCP, "30022", "user-alice-dev-ssh", "ssh", "kuberde-controller");

        RouteConflictException conflict = Assertions.assertThrows(RouteConflictException.class,
                () -> table.register(RouteKind.TCP, "30022", "user-bob-box-ssh", "ssh", "kuberde-controller"));
        Assertions.assertEquals("user-alice-dev-ssh", conflict.existing().agentId());
        Assertions.assertThrows(RouteConflictException.class,
                () -> table.register(RouteKind.TCP, "30022", "user-alice-other-ssh", "ssh", "kuberde-controller"));
        Assertions.assertEquals("user-alice-dev-ssh", table.resolvePort(30022).orElseThrow().entry().agentId());
    }

    @Test
    void keyMovesBetweenServicesOfOneWorkload() throws Exception {
        table.register(RouteKind.TCP, "30022", "user-alice-dev-ssh", "ssh", "kuberde-controller");

        RoutingTable.Registration moved = table.register(RouteKind.TCP, "30022", "user-alice-dev-shell", "shell", "kuberde-controller");
        Assertions.assertEquals(RoutingTable.Outcome.REPLACED, moved.outcome());
        Assertions.assertEquals("user-alice-dev-ssh", moved.previous().agentId());
        Assertions.assertEquals("user-alice-dev", RoutingTable.workloadOf(moved.entry()));
    }

    @Test
    void parkedKeyStaysWithItsIdleWorkload() throws Exception {
        table.register(RouteKind.TCP, "30022", "user-alice-dev-ssh", "ssh", "kuberde-controller");
        table.park(RouteKind.TCP, "30022");

        RouteConflictException conflict = Assertions.assertThrows(RouteConflictException.class,
                () -> table.register(RouteKind.TCP, "30022", "user-bob-box-ssh", "ssh", "someone-else"));
        Assertions.assertEquals("user-alice-dev-ssh", conflict.existing().agentId());
        Assertions.assertEquals(1, table.parkedCount());
        Assertions.assertTrue(table.resolvePort(30022).orElseThrow().parked());

        RoutingTable.Registration woken = table.register(RouteKind.TCP, "30022", "user-alice-dev-ssh", "ssh", "kuberde-controller");
        Assertions.assertEquals(RoutingTable.Outcome.CREATED, woken.outcome());
        Assertions.assertEquals(0, table.parkedCount());
    }

    @Test
    void invalidKeysAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> table.register(RouteKind.TCP, "22", "user-alice-dev", "ssh", "c"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> table.register(RouteKind.TCP, "ssh", "user-alice-dev", "ssh", "c"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> table.register(RouteKind.HTTP, "bad_host", "user-alice-dev", "web", "c"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> table.register(RouteKind.HTTP, "web.user-alice-dev", "", "web", "c"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> table.register(RouteKind.HTTP, "web.user-alice-dev", "user-alice-dev", "Web!", "c"));
        Assertions.assertEquals(0, table.size());
    }

    @Test
    void parkedRouteResolvesAsParkedUntilRegisteredAgain() throws Exception {
        table.register(RouteKind.TCP, "30022", "user-alice-dev", "ssh", "controller");
        Assertions.assertTrue(table.park(RouteKind.TCP, "30022").isPresent());
        Assertions.assertTrue(table.park(RouteKind.TCP, "30022").isPresent());

        RoutingTable.Resolution parked = table.resolvePort(30022).orElseThrow();
        Assertions.assertTrue(parked.parked());
        Assertions.assertEquals(0, table.size());
        Assertions.assertEquals(1, table.parkedCount());
        Assertions.assertEquals(1, table.parkedByPrefix("user-alice").size());

        table.register(RouteKind.TCP, "30022", "user-alice-dev", "ssh", "controller");
        Assertions.assertFalse(table.resolvePort(30022).orElseThrow().parked());
        Assertions.assertEquals(0, table.parkedCount());
    }

    @Test
    void deregisterRemovesLiveAndParkedEntries() throws Exception {
        table.register(RouteKind.TCP, "30022", "user-alice-dev", "ssh", "controller");
        table.park(RouteKind.TCP, "30022");
        Assertions.assertTrue(table.deregister(RouteKind.TCP, "30022").isPresent());
        Assertions.assertTrue(table.deregister(RouteKind.TCP, "30022").isEmpty());
        Assertions.assertTrue(table.resolvePort(30022).isEmpty());
    }

    @Test
    void explicitHostWinsOverDerivedRouting() throws Exception {
        Set<String> live = Set.of("user-alice-dev-web");
        Assertions.assertTrue(table.resolveHost("web.user-alice-dev.rde.example.com", "rde.example.com", live::contains).get().derived());

        table.register(RouteKind.HTTP, "web.user-alice-dev", "user-alice-dev", "ide", "controller");
        RoutingTable.Resolution explicit = table.resolveHost("WEB.user-alice-dev.rde.example.com:8080", "rde.example.com", live::contains)
                .orElseThrow();
        Assertions.assertFalse(explicit.derived());
        Assertions.assertEquals("ide", explicit.entry().service());
    }

    @Test
    void derivedRoutingNeedsLiveSessionAndMatchingDomain() {
        Assertions.assertTrue(table.resolveHost("web.user-alice-dev.rde.example.com", "rde.example.com", id -> false).isEmpty());
        Assertions.assertTrue(table.resolveHost("web.user-alice-dev.other.com", "rde.example.com", id -> true).isEmpty());
        Assertions.assertTrue(table.resolveHost("", "rde.example.com", id -> true).isEmpty());

        RouteEntry derived = table.resolveHost("ssh.user-alice-dev", "", "user-alice-dev-ssh"::equals).orElseThrow().entry();
        Assertions.assertEquals("user-alice-dev-ssh", derived.agentId());
        Assertions.assertEquals("ssh", derived.service());
    }

    @Test
    void hostPrefixStripsPortDomainAndTrailingDot() {
        Assertions.assertEquals("web.user-alice-dev", RoutingTable.hostPrefix("Web.User-Alice-Dev.rde.example.com.:443", "rde.example.com"));
        Assertions.assertNull(RoutingTable.hostPrefix("rde.example.com", "rde.example.com"));
        Assertions.assertEquals("a.b", RoutingTable.hostPrefix("a.b", ""));
    }

    @Test
    void listsByIdentityPrefix() throws Exception {
        table.register(RouteKind.TCP, "30022", "user-alice-dev", "ssh", "c");
        table.register(RouteKind.TCP, "30023", "user-bob-dev", "ssh", "c");
        table.register(RouteKind.HTTP, "ide.user-alice-dev", "user-alice-dev", "ide", "c");
        List<RouteEntry> alice = table.listByPrefix("user-alice-");
        Assertions.assertEquals(2, alice.size());
        Assertions.assertEquals(3, table.listByPrefix("").size());
        Assertions.assertEquals(2L, table.countByKind().get("tcp"));
        Assertions.assertEquals(1L, table.countByKind().get("http"));
    }
}

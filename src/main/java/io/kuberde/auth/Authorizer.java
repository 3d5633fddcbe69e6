package io.kuberde.auth;

import io.kuberde.model.AgentIdentity;

/**
 * Access rule shared by every surface: admins act on any identity, everybody else only on
 * identities they own.
 */
public final class Authorizer {
    /**
     * Role carried by the shared agent client; its holders may open any identity.
     */
    public static final String AGENT_ROLE = "kuberde-agent";

    public boolean canActOn(VerifiedToken token, String identity) {
        if (token == null) {
            return false;
        }
        if (token.isAdmin()) {
            return true;
        }
        String owner = AgentIdentity.ownerOf(identity);
        if (owner == null) {
            return false;
        }
        return owner.equals(token.username()) || owner.equals(token.subjectId());
    }

    /**
     * Only agent and system credentials may hold a tunnel. An agent token bound to an identity may
     * only open that identity; an unbound one needs the shared agent role or ownership.
     */
    public boolean canOpenSession(VerifiedToken token, String identity) {
        if (token == null || identity == null) {
            return false;
        }
        if (token.kind() != ActorKind.AGENT && token.kind() != ActorKind.SYSTEM) {
            return false;
        }
        if (token.agentId() != null) {
            return token.agentId().equals(identity);
        }
        if (token.hasRole(AGENT_ROLE)) {
            return true;
        }
        return canActOn(token, identity);
    }

    public boolean isSystem(VerifiedToken token) {
        return token != null && token.kind() == ActorKind.SYSTEM;
    }
}

package io.kuberde.relay;

import io.kuberde.mux.MuxException;
import io.kuberde.mux.MuxSession;
import io.kuberde.mux.MuxStream;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Live tunnel of one agent: the mux session plus who authenticated it and until when.
 */
public final class AgentSession {
    private final String identity;
    private final List<String> aliases;
    private final MuxSession mux;
    private final String subject;
    private final Instant connectedAt;
    private volatile Instant credentialExpiry;

    public AgentSession(String identity, List<String> services, MuxSession mux, String subject, Instant credentialExpiry, Instant connectedAt) {
        this.identity = identity;
        List<String> keys = new ArrayList<>();
        for (String service : services) {
            keys.add(identity + "-" + service);
        }
        this.aliases = List.copyOf(keys);
        this.mux = mux;
        this.subject = subject;
        this.credentialExpiry = credentialExpiry;
        this.connectedAt = connectedAt;
    }

    public String identity() {
        return identity;
    }

    /**
     * Per-service identities ({@code identity-service}) routed to this session.
     */
    public List<String> aliases() {
        return aliases;
    }

    public List<String> keys() {
        List<String> out = new ArrayList<>(aliases.size() + 1);
        out.add(identity);
        out.addAll(aliases);
        return out;
    }

    public String subject() {
        return subject;
    }

    public Instant connectedAt() {
        return connectedAt;
    }

    public Instant credentialExpiry() {
        return credentialExpiry;
    }

    void extendCredential(Instant expiry) {
        if (expiry != null && (credentialExpiry == null || expiry.isAfter(credentialExpiry))) {
            credentialExpiry = expiry;
        }
    }

    public boolean credentialExpired(Instant now) {
        return credentialExpiry != null && !now.isBefore(credentialExpiry);
    }

    public boolean isOpen() {
        return !mux.isClosed();
    }

    public MuxSession mux() {
        return mux;
    }

    public MuxStream openStream() throws IOException {
        if (mux.isClosed()) {
            throw new MuxException("session for " + identity + " is closed");
        }
        return mux.openStream();
    }

    public void close(String reason) {
        mux.close(new MuxException(reason));
    }
}

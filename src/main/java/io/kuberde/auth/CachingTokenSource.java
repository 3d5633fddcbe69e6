package io.kuberde.auth;

import java.io.IOException;
import java.time.Clock;

/**
 * Reuses one token until {@code refreshFraction} of its lifetime has passed.
 */
public final class CachingTokenSource implements TokenSource {
    private final TokenSource delegate;
    private final double refreshFraction;
    private final Clock clock;
    private AccessToken current;

    public CachingTokenSource(TokenSource delegate, double refreshFraction, Clock clock) {
        if (refreshFraction <= 0.0d || refreshFraction > 1.0d) {
            throw new IllegalArgumentException("refresh fraction must be in (0, 1]");
        }
        this.delegate = delegate;
        this.refreshFraction = refreshFraction;
        this.clock = clock;
    }

    @Override
    public synchronized AccessToken fetch() throws IOException, AuthException {
        if (current == null || !clock.instant().isBefore(current.refreshAt(refreshFraction))) {
            current = delegate.fetch();
        }
        return current;
    }

    public synchronized void invalidate() {
        current = null;
    }
}

package io.kuberde.auth;

import java.io.IOException;

/**
 * Supplier of bearer credentials for outbound calls.
 */
@FunctionalInterface
public interface TokenSource {
    AccessToken fetch() throws IOException, AuthException;
}

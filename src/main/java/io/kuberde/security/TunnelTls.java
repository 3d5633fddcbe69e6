package io.kuberde.security;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.MessageDigest;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * TLS material for the relay listeners and the agent's outbound tunnel. The relay side loads a
 * keystore; the agent side loads an optional truststore and an optional list of relay certificates
 * that must no longer be accepted.
 */
public final class TunnelTls {
    private TunnelTls() {
    }

    public static SSLContext serverContext(String keystorePath, String keystorePass, String keystoreType)
            throws IOException, GeneralSecurityException {
        if (keystorePath == null || keystorePath.isBlank()) {
            throw new IllegalArgumentException("keystore path is required");
        }
        if (keystorePass == null) {
            throw new IllegalArgumentException("keystore password is required");
        }
        KeyStore keyStore = loadKeyStore(Path.of(keystorePath), keystorePass, blankToDefault(keystoreType, "PKCS12"));
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(keyStore, keystorePass.toCharArray());
        SSLContext ssl = SSLContext.getInstance("TLS");
        ssl.init(kmf.getKeyManagers(), null, null);
        return ssl;
    }

    /**
     * Client context for dialing the relay. Without a truststore the platform defaults apply.
     */
    public static SSLContext clientContext(String truststorePath, String truststorePass, String revocationFilePath)
            throws IOException, GeneralSecurityException {
        RevocationPolicy policy = loadRevocationPolicy(revocationFilePath);
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        if (truststorePath == null || truststorePath.isBlank()) {
            tmf.init((KeyStore) null);
        } else {
            tmf.init(loadKeyStore(Path.of(truststorePath), truststorePass == null ? "" : truststorePass, "PKCS12"));
        }
        TrustManager[] base = tmf.getTrustManagers();
        TrustManager[] wrapped = new TrustManager[base.length];
        for (int i = 0; i < base.length; i++) {
            if (base[i] instanceof X509ExtendedTrustManager ext) {
                wrapped[i] = new RevocationTrustManager(ext, policy);
            } else if (base[i] instanceof X509TrustManager x509) {
                wrapped[i] = new RevocationTrustManager(new ExtendedAdapter(x509), policy);
            } else {
                wrapped[i] = base[i];
            }
        }
        SSLContext ssl = SSLContext.getInstance("TLS");
        ssl.init(null, wrapped, null);
        return ssl;
    }

    /**
     * Reads {@code serial:<hex>} and {@code sha256:<hex>} lines; {@code #} starts a comment.
     */
    public static RevocationPolicy loadRevocationPolicy(String path) throws IOException {
        if (path == null || path.isBlank()) {
            return RevocationPolicy.EMPTY;
        }
        Path file = Path.of(path);
        if (!Files.exists(file)) {
            return RevocationPolicy.EMPTY;
        }
        LinkedHashSet<String> serials = new LinkedHashSet<>();
        LinkedHashSet<String> fingerprints = new LinkedHashSet<>();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            String raw = line.replace("\uFEFF", "").trim();
            if (raw.isEmpty() || raw.startsWith("#")) {
                continue;
            }
            int sep = raw.indexOf(':');
            if (sep <= 0) {
                throw new IllegalArgumentException("revocation entry needs a serial: or sha256: prefix: " + raw);
            }
            String type = raw.substring(0, sep).trim().toLowerCase(Locale.ROOT);
            String value = raw.substring(sep + 1).trim();
            switch (type) {
                case "serial" -> serials.add(normalizeHex(value, "serial"));
                case "sha256" -> {
                    String fp = normalizeHex(value, "sha256");
                    if (fp.length() != 64) {
                        throw new IllegalArgumentException("sha256 fingerprint must be 64 hex chars: " + value);
                    }
                    fingerprints.add(fp);
                }
                default -> throw new IllegalArgumentException("unsupported revocation prefix: " + type);
            }
        }
        return new RevocationPolicy(Collections.unmodifiableSet(serials), Collections.unmodifiableSet(fingerprints));
    }

    public static boolean isCertificateRevoked(X509Certificate certificate, RevocationPolicy policy) {
        if (certificate == null || policy == null) {
            return false;
        }
        if (policy.serials().contains(normalizeHex(certificate.getSerialNumber().toString(16), "serial"))) {
            return true;
        }
        return policy.fingerprints().contains(fingerprintSha256(certificate));
    }

    public static String fingerprintSha256(X509Certificate certificate) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(certificate.getEncoded());
            return HexFormat.of().withUpperCase().formatHex(digest);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to compute certificate fingerprint", e);
        }
    }

    static String normalizeHex(String raw, String field) {
        String token = raw == null ? "" : raw.trim();
        if (token.toLowerCase(Locale.ROOT).startsWith("0x")) {
            token = token.substring(2);
        }
        token = token.replace(":", "").replace(" ", "").toUpperCase(Locale.ROOT);
        if (token.isEmpty()) {
            throw new IllegalArgumentException(field + " is empty");
        }
        for (int i = 0; i < token.length(); i++) {
            char c = token.charAt(i);
            if (!((c >= '0' && c <= '9') || (c >= 'A' && c <= 'F'))) {
                throw new IllegalArgumentException(field + " must be hex: " + raw);
            }
        }
        return token;
    }

    private static KeyStore loadKeyStore(Path path, String password, String type)
            throws IOException, GeneralSecurityException {
        KeyStore keyStore = KeyStore.getInstance(type);
        try (InputStream in = Files.newInputStream(path)) {
            keyStore.load(in, password.toCharArray());
        }
        return keyStore;
    }

    private static String blankToDefault(String raw, String fallback) {
        return raw == null || raw.isBlank() ? fallback : raw.trim();
    }

    public record RevocationPolicy(Set<String> serials, Set<String> fingerprints) {
        public static final RevocationPolicy EMPTY = new RevocationPolicy(Set.of(), Set.of());

        public int size() {
            return serials.size() + fingerprints.size();
        }
    }

    private static final class RevocationTrustManager extends X509ExtendedTrustManager {
        private final X509ExtendedTrustManager delegate;
        private final RevocationPolicy policy;

        private RevocationTrustManager(X509ExtendedTrustManager delegate, RevocationPolicy policy) {
            this.delegate = Objects.requireNonNull(delegate);
            this.policy = policy == null ? RevocationPolicy.EMPTY : policy;
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            delegate.checkClientTrusted(chain, authType);
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
            delegate.checkClientTrusted(chain, authType, socket);
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
            delegate.checkClientTrusted(chain, authType, engine);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            delegate.checkServerTrusted(chain, authType);
            enforce(chain);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
            delegate.checkServerTrusted(chain, authType, socket);
            enforce(chain);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
            delegate.checkServerTrusted(chain, authType, engine);
            enforce(chain);
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return delegate.getAcceptedIssuers();
        }

        private void enforce(X509Certificate[] chain) throws CertificateException {
            if (chain == null || chain.length == 0 || chain[0] == null) {
                return;
            }
            if (isCertificateRevoked(chain[0], policy)) {
                throw new CertificateException("relay certificate revoked: sha256=" + fingerprintSha256(chain[0]));
            }
        }
    }

    private static final class ExtendedAdapter extends X509ExtendedTrustManager {
        private final X509TrustManager delegate;

        private ExtendedAdapter(X509TrustManager delegate) {
            this.delegate = Objects.requireNonNull(delegate);
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            delegate.checkClientTrusted(chain, authType);
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
            delegate.checkClientTrusted(chain, authType);
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
            delegate.checkClientTrusted(chain, authType);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
            delegate.checkServerTrusted(chain, authType);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
            delegate.checkServerTrusted(chain, authType);
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
            delegate.checkServerTrusted(chain, authType);
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return delegate.getAcceptedIssuers();
        }
    }
}

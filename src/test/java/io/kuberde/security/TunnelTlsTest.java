package io.kuberde.security;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.Principal;
import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.util.Date;
import java.util.Set;
import java.util.stream.Stream;

final class TunnelTlsTest {

    @Test
    void revocationFileAcceptsSerialsAndFingerprints() throws Exception {
        Path root = Files.createTempDirectory("kuberde-tunnel-tls-test-");
        try {
            Path file = root.resolve("revoked-relays.txt");
            Files.writeString(file, """
                    # rotated 2025-02
                    serial:0x1a2b
                    serial: 00:ff
                    sha256:aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa
                    """, StandardCharsets.UTF_8);
            TunnelTls.RevocationPolicy policy = TunnelTls.loadRevocationPolicy(file.toString());
            Assertions.assertEquals(Set.of("1A2B", "00FF"), policy.serials());
            Assertions.assertEquals(Set.of("A".repeat(64)), policy.fingerprints());
            Assertions.assertEquals(3, policy.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingOrBlankRevocationFileMeansNothingRevoked() throws Exception {
        Assertions.assertSame(TunnelTls.RevocationPolicy.EMPTY, TunnelTls.loadRevocationPolicy(""));
        Assertions.assertSame(TunnelTls.RevocationPolicy.EMPTY, TunnelTls.loadRevocationPolicy("/nonexistent/kuberde/revoked.txt"));
    }

    @Test
    void malformedEntriesAreRejected() throws Exception {
        Path root = Files.createTempDirectory("kuberde-tunnel-tls-test-");
        try {
            Path file = root.resolve("revoked.txt");
            Files.writeString(file, "sha256:ABCDEF\n", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> TunnelTls.loadRevocationPolicy(file.toString()));
            Files.writeString(file, "md5:ABCDEF\n", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> TunnelTls.loadRevocationPolicy(file.toString()));
            Files.writeString(file, "1A2B\n", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> TunnelTls.loadRevocationPolicy(file.toString()));
        } finally {
            deleteRecursively(root);
        }
        Assertions.assertThrows(IllegalArgumentException.class, () -> TunnelTls.normalizeHex("xyz", "serial"));
        Assertions.assertEquals("ABCD", TunnelTls.normalizeHex("0xab:cd", "serial"));
    }

    @Test
    void relayCertificateMatchesBySerialOrFingerprint() {
        StubCertificate cert = new StubCertificate(new BigInteger("1A2B", 16), new byte[]{1, 2, 3, 4});
        String fingerprint = TunnelTls.fingerprintSha256(cert);
        Assertions.assertEquals(64, fingerprint.length());

        Assertions.assertTrue(TunnelTls.isCertificateRevoked(cert, new TunnelTls.RevocationPolicy(Set.of("1A2B"), Set.of())));
        Assertions.assertTrue(TunnelTls.isCertificateRevoked(cert, new TunnelTls.RevocationPolicy(Set.of(), Set.of(fingerprint))));
        Assertions.assertFalse(TunnelTls.isCertificateRevoked(cert, TunnelTls.RevocationPolicy.EMPTY));
        Assertions.assertFalse(TunnelTls.isCertificateRevoked(null, TunnelTls.RevocationPolicy.EMPTY));
    }

    @Test
    void serverContextNeedsAKeystore() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> TunnelTls.serverContext("", "changeit", null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> TunnelTls.serverContext("relay.p12", null, null));
    }

    @Test
    void clientContextWithoutTruststoreUsesPlatformDefaults() throws Exception {
        Assertions.assertEquals("TLS", TunnelTls.clientContext(null, null, null).getProtocol());
    }

    private static void deleteRecursively(Path root) throws Exception {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    /**
     * Only the serial number and encoding are read by the revocation check.
     */
    private static final class StubCertificate extends X509Certificate {
        private final BigInteger serial;
        private final byte[] encoded;

        private StubCertificate(BigInteger serial, byte[] encoded) {
            this.serial = serial;
            this.encoded = encoded.clone();
        }

        @Override
        public BigInteger getSerialNumber() {
            return serial;
        }

        @Override
        public byte[] getEncoded() {
            return encoded.clone();
        }

        @Override
        public void checkValidity() {
        }

        @Override
        public void checkValidity(Date date) {
        }

        @Override
        public int getVersion() {
            return 3;
        }

        @Override
        public Principal getIssuerDN() {
            throw new UnsupportedOperationException();
        }

        @Override
        public Principal getSubjectDN() {
            throw new UnsupportedOperationException();
        }

        @Override
        public Date getNotBefore() {
            return new Date(0L);
        }

        @Override
        public Date getNotAfter() {
            return new Date(Long.MAX_VALUE);
        }

        @Override
        public byte[] getTBSCertificate() {
            throw new UnsupportedOperationException();
        }

        @Override
        public byte[] getSignature() {
            throw new UnsupportedOperationException();
        }

        @Override
        public String getSigAlgName() {
            return "none";
        }

        @Override
        public String getSigAlgOID() {
            return "0.0";
        }

        @Override
        public byte[] getSigAlgParams() {
            return null;
        }

        @Override
        public boolean[] getIssuerUniqueID() {
            return null;
        }

        @Override
        public boolean[] getSubjectUniqueID() {
            return null;
        }

        @Override
        public boolean[] getKeyUsage() {
            return null;
        }

        @Override
        public int getBasicConstraints() {
            return -1;
        }

        @Override
        public void verify(PublicKey key) {
            throw new UnsupportedOperationException();
        }

        @Override
        public void verify(PublicKey key, String sigProvider) {
            throw new UnsupportedOperationException();
        }

        @Override
        public String toString() {
            return "StubCertificate(" + serial.toString(16) + ")";
        }

        @Override
        public PublicKey getPublicKey() {
            throw new UnsupportedOperationException();
        }

        @Override
        public boolean hasUnsupportedCriticalExtension() {
            return false;
        }

        @Override
        public Set<String> getCriticalExtensionOIDs() {
            return null;
        }

        @Override
        public Set<String> getNonCriticalExtensionOIDs() {
            return null;
        }

        @Override
        public byte[] getExtensionValue(String oid) {
            return null;
        }
    }
}

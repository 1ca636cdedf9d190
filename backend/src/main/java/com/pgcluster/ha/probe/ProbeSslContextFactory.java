package com.pgcluster.ha.probe;

import com.pgcluster.ha.config.ClusterProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.NoSuchAlgorithmException;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Collection;

/**
 * Builds the SSL context used to verify Patroni and etcd endpoints.
 * <p>
 * Database nodes trust the etcd CA: it is signed by the same authority and its directory is
 * readable by the service user, unlike the PostgreSQL certificate directory. Client nodes use the
 * PostgreSQL CA distributed to them at install time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProbeSslContextFactory {

    private final ClusterProperties properties;

    public String trustAnchorPath() {
        if (properties.isDatabaseNode()) {
            return properties.getEtcd().getCaPath();
        }
        return properties.getPostgres().getCaPath();
    }

    /**
     * Create an SSL context trusting the CA for this host's role.
     * Falls back to the JVM default trust store when the CA file cannot be loaded.
     */
    public SSLContext create() {
        String caPath = trustAnchorPath();
        try {
            return fromPem(Path.of(caPath));
        } catch (Exception e) {
            log.warn("Could not load CA certificate from {}, using default trust store: {}", caPath, e.getMessage());
            try {
                return SSLContext.getDefault();
            } catch (NoSuchAlgorithmException ex) {
                throw new IllegalStateException("No default SSL context available", ex);
            }
        }
    }

    static SSLContext fromPem(Path caPath) throws Exception {
        Collection<? extends Certificate> certificates;
        try (InputStream in = Files.newInputStream(caPath)) {
            certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
        }
        if (certificates.isEmpty()) {
            throw new GeneralSecurityException("No certificates found in " + caPath);
        }

        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        int index = 0;
        for (Certificate certificate : certificates) {
            trustStore.setCertificateEntry("ca-" + index++, certificate);
        }

        TrustManagerFactory trustManagerFactory =
                TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagerFactory.init(trustStore);

        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, trustManagerFactory.getTrustManagers(), null);
        return context;
    }
}

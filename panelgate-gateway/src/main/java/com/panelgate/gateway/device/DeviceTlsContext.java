package com.panelgate.gateway.device;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;

/**
 * TLS material for one outbound device connection.
 * <p>
 * A pinned context trusts exactly the certificates of one device PEM and verifies the
 * host name. A permissive context trusts any certificate and skips host name checks;
 * it exists only as a fallback when the device certificate cannot be fetched.
 */
public final class DeviceTlsContext {

    private final SSLSocketFactory socketFactory;
    private final X509TrustManager trustManager;
    private final HostnameVerifier hostnameVerifier;
    private final boolean pinned;

    private DeviceTlsContext(SSLSocketFactory socketFactory, X509TrustManager trustManager,
            HostnameVerifier hostnameVerifier, boolean pinned) {
        this.socketFactory = socketFactory;
        this.trustManager = trustManager;
        this.hostnameVerifier = hostnameVerifier;
        this.pinned = pinned;
    }

    /**
     * Build a context that trusts only the certificate(s) in {@code pem}.
     *
     * @throws GeneralSecurityException when the PEM holds no parsable certificate
     */
    public static DeviceTlsContext pinned(String pem) throws GeneralSecurityException {
        CertificateFactory cf = CertificateFactory.getInstance("X.509");
        Collection<? extends Certificate> certs;
        try {
            certs = cf.generateCertificates(new ByteArrayInputStream(pem.getBytes(StandardCharsets.US_ASCII)));
        } catch (CertificateException e) {
            throw new CertificateException("unparsable device certificate: " + e.getMessage(), e);
        }
        if (certs.isEmpty()) {
            throw new CertificateException("no certificate in PEM");
        }

        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        try {
            trustStore.load(null, null);
        } catch (IOException e) {
            throw new GeneralSecurityException("could not initialize empty key store", e);
        }
        int i = 0;
        for (Certificate cert : certs) {
            trustStore.setCertificateEntry("device-" + i++, cert);
        }

        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(trustStore);
        X509TrustManager trustManager = firstX509(tmf.getTrustManagers());

        SSLContext ssl = SSLContext.getInstance("TLS");
        ssl.init(null, new TrustManager[]{trustManager}, null);
        return new DeviceTlsContext(ssl.getSocketFactory(), trustManager,
                HttpsURLConnection.getDefaultHostnameVerifier(), true);
    }

    /**
     * Build a context that accepts any server certificate and any host name.
     */
    public static DeviceTlsContext permissive() {
        X509TrustManager trustAll = new TrustAllManager();
        try {
            SSLContext ssl = SSLContext.getInstance("TLS");
            ssl.init(null, new TrustManager[]{trustAll}, new SecureRandom());
            return new DeviceTlsContext(ssl.getSocketFactory(), trustAll, (host, session) -> true, false);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("TLS is unavailable in this JVM", e);
        }
    }

    private static X509TrustManager firstX509(TrustManager[] managers) throws GeneralSecurityException {
        for (TrustManager tm : managers) {
            if (tm instanceof X509TrustManager x509) {
                return x509;
            }
        }
        throw new GeneralSecurityException("no X509TrustManager available");
    }

    public SSLSocketFactory socketFactory() {
        return socketFactory;
    }

    public X509TrustManager trustManager() {
        return trustManager;
    }

    public HostnameVerifier hostnameVerifier() {
        return hostnameVerifier;
    }

    public boolean isPinned() {
        return pinned;
    }

    private static final class TrustAllManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}

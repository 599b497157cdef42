package com.proxy.link.agent.connection;

import lombok.extern.slf4j.Slf4j;

import javax.net.ssl.X509TrustManager;
import java.security.cert.X509Certificate;

/**
 * Accepts any relay certificate. The relay is usually deployed with a self-signed certificate, so the
 * link is encrypted but the relay's identity is not verified.
 */
@Slf4j
class TrustAllManager implements X509TrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
        // the agent never authenticates clients
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
        if (log.isDebugEnabled() && chain != null) {
            for (X509Certificate cert : chain) {
                log.debug("Trusting relay certificate s:{} i:{}", cert.getSubjectX500Principal().getName(), cert.getIssuerX500Principal().getName());
            }
        }
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return new X509Certificate[0];
    }
}

package com.proxy.link.relay.connection;

import com.proxy.link.config.RelayConfig;
import com.proxy.link.relay.processor.HttpProcessor;
import com.proxy.link.relay.processor.TunnelProcessor;
import com.proxy.link.utils.ByteStreamUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Listens for the agent and keeps exactly one accepted connection. While a session is active every further
 * connection attempt is closed immediately; the original session stays authoritative.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "proxy", name = "mode", havingValue = "relay")
public class RelayConnectionManager {

    private final RelayConfig relayConfig;
    private final HttpProcessor httpProcessor;
    private final TunnelProcessor tunnelProcessor;
    // only consulted when TLS is enabled
    private final SslBundles sslBundles;

    private ServerSocket serverSocket;
    private volatile boolean running = false;
    private ExecutorService connectionAcceptorExecutor;
    private RelaySession activeSession;

    @PostConstruct
    public void start() throws IOException {
        serverSocket = createServerSocket();
        running = true;
        connectionAcceptorExecutor = Executors.newSingleThreadExecutor();
        connectionAcceptorExecutor.submit(this::acceptLoop);
        log.info("Relay listening on port {} using {}", getLocalPort(), relayConfig.isTlsEnabled() ? "TLS" : "TCP");
    }

    private ServerSocket createServerSocket() throws IOException {
        if (relayConfig.isTlsEnabled()) {
            return sslBundles.getBundle(relayConfig.getSslBundle())
                    .createSslContext()
                    .getServerSocketFactory()
                    .createServerSocket(relayConfig.getListenPort());
        }
        return new ServerSocket(relayConfig.getListenPort());
    }

    private void acceptLoop() {
        Thread.currentThread().setName("relay-connection-acceptor");
        while (running) {
            Socket agentSocket;
            try {
                agentSocket = serverSocket.accept();
            } catch (IOException e) {
                if (running) {
                    log.error("Error accepting agent connection: {}", e.getMessage());
                    try {
                        Thread.sleep(100); // Prevent busy-wait
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        running = false;
                    }
                }
                continue;
            }
            handleAccepted(agentSocket);
        }
        log.info("Relay connection acceptor stopped.");
    }

    private synchronized void handleAccepted(Socket agentSocket) {
        String remote = String.valueOf(agentSocket.getRemoteSocketAddress());
        if (activeSession != null && activeSession.isOpen()) {
            log.warn("Rejecting extra agent connection from {}: a session is already active", remote);
            ByteStreamUtils.close(agentSocket, "rejected agent socket");
            return;
        }
        try {
            agentSocket.setTcpNoDelay(true);
            RelaySession session = new RelaySession(relayConfig, httpProcessor, tunnelProcessor, this::onSessionClosed);
            activeSession = session;
            session.start(agentSocket);
            log.info("Accepted agent connection from {}", remote);
        } catch (IOException e) {
            log.error("Could not start session for {}: {}", remote, e.getMessage());
            activeSession = null;
            ByteStreamUtils.close(agentSocket, "agent socket");
        }
    }

    private synchronized void onSessionClosed(RelaySession session) {
        if (activeSession == session) {
            activeSession = null;
            log.info("Agent session ended; ready for a new connection");
        }
    }

    public synchronized boolean hasActiveSession() {
        return activeSession != null && activeSession.isOpen();
    }

    public int getLocalPort() {
        return serverSocket.getLocalPort();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down RelayConnectionManager.");
        running = false;
        ByteStreamUtils.close(serverSocket, "relay server socket");
        RelaySession session;
        synchronized (this) {
            session = activeSession;
        }
        if (session != null) {
            session.close();
        }
        if (connectionAcceptorExecutor != null) {
            connectionAcceptorExecutor.shutdownNow();
            try {
                if (!connectionAcceptorExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Connection acceptor executor did not terminate in time.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Connection acceptor executor shutdown interrupted.");
            }
        }
        log.info("RelayConnectionManager shutdown complete.");
    }
}

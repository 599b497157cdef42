package com.proxy.link.agent.connection;

import com.proxy.link.communicator.FrameCommunicator;
import com.proxy.link.communicator.FrameListener;
import com.proxy.link.config.AgentConfig;
import com.proxy.link.protocol.Frame;
import com.proxy.link.utils.ByteStreamUtils;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.TrustManager;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sole owner of the agent's connection to the relay. At most one connection exists at any time, and at
 * most one reconnect is ever pending; reconnects retry forever at the fixed configured interval.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "proxy", name = "mode", havingValue = "agent", matchIfMissing = true)
public class RelayLinkManager implements FrameListener {

    private final AgentConfig agentConfig;
    private final ScheduledExecutorService reconnectScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "relay-reconnect");
        thread.setDaemon(true);
        return thread;
    });
    private final AtomicInteger connectionsOpened = new AtomicInteger();

    private FrameListener listener;
    private volatile FrameCommunicator link;
    private ScheduledFuture<?> reconnectTask;
    private volatile boolean running = false;

    /**
     * Makes the first connection attempt; a failure only schedules a reconnect.
     *
     * @param listener receives every frame from the relay and every loss of the link
     */
    public synchronized void start(FrameListener listener) {
        this.listener = listener;
        running = true;
        try {
            connect();
        } catch (IOException e) {
            log.error("Relay connection error: {}", e.getMessage());
            scheduleReconnect();
        }
    }

    /**
     * No-op when a live connection exists; otherwise connects now, waiting at most the connect timeout.
     *
     * @return the live link
     * @throws IOException if the relay cannot be reached; a reconnect is then pending
     */
    public synchronized FrameCommunicator ensureConnected() throws IOException {
        if (!running) {
            throw new IOException("Relay link manager is stopped");
        }
        if (link != null && link.isConnected()) {
            return link;
        }
        try {
            return connect();
        } catch (IOException e) {
            log.error("Relay connection error: {}", e.getMessage());
            scheduleReconnect();
            throw e;
        }
    }

    public synchronized boolean isConnected() {
        return link != null && link.isConnected();
    }

    /**
     * Number of connections opened over this manager's lifetime.
     */
    public int getConnectionsOpened() {
        return connectionsOpened.get();
    }

    private FrameCommunicator connect() throws IOException {
        if (link != null) {
            link.close();
            link = null;
        }
        Socket socket = createSocket();
        FrameCommunicator communicator;
        try {
            socket.connect(new InetSocketAddress(agentConfig.getRelayHost(), agentConfig.getRelayPort()),
                    (int) agentConfig.getConnectTimeout().toMillis());
            socket.setTcpNoDelay(true);
            socket.setKeepAlive(true);
            if (socket instanceof SSLSocket) {
                ((SSLSocket) socket).startHandshake();
            }
            communicator = new FrameCommunicator("agent-link-" + (connectionsOpened.get() + 1), socket, this);
            // assigned before start so an immediate loss is attributed to this link
            link = communicator;
            communicator.start();
        } catch (IOException e) {
            link = null;
            ByteStreamUtils.close(socket, "relay socket");
            throw e;
        }
        connectionsOpened.incrementAndGet();
        cancelReconnect();
        log.info("Connected to relay at {}:{} using {}", agentConfig.getRelayHost(), agentConfig.getRelayPort(),
                agentConfig.isTlsEnabled() ? "TLS" : "TCP");
        return communicator;
    }

    private Socket createSocket() throws IOException {
        if (!agentConfig.isTlsEnabled()) {
            return new Socket();
        }
        try {
            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, new TrustManager[]{new TrustAllManager()}, null);
            return sslContext.getSocketFactory().createSocket();
        } catch (GeneralSecurityException e) {
            throw new IOException("Cannot initialise TLS for the relay link: " + e.getMessage(), e);
        }
    }

    private void scheduleReconnect() {
        if (!running || reconnectTask != null) {
            return;
        }
        long delay = agentConfig.getReconnectInterval().toMillis();
        log.info("Reconnecting to relay in {} ms", delay);
        reconnectTask = reconnectScheduler.schedule(this::reconnect, delay, TimeUnit.MILLISECONDS);
    }

    private void cancelReconnect() {
        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }
    }

    private synchronized void reconnect() {
        reconnectTask = null;
        if (!running || (link != null && link.isConnected())) {
            return;
        }
        try {
            connect();
        } catch (IOException e) {
            log.error("Relay connection error: {}", e.getMessage());
            scheduleReconnect();
        }
    }

    @Override
    public void onFrame(FrameCommunicator communicator, Frame frame) {
        if (communicator != link) {
            log.debug("Ignoring {} from a replaced link", frame);
            return;
        }
        listener.onFrame(communicator, frame);
    }

    @Override
    public void onConnectionLost(FrameCommunicator communicator, Throwable cause) {
        synchronized (this) {
            if (link != communicator) {
                return;
            }
            link = null;
            log.warn("Connection to relay closed");
            scheduleReconnect();
        }
        listener.onConnectionLost(communicator, cause);
    }

    @PreDestroy
    public void shutdown() {
        FrameCommunicator current;
        synchronized (this) {
            running = false;
            cancelReconnect();
            current = link;
            link = null;
        }
        if (current != null) {
            current.close();
        }
        reconnectScheduler.shutdownNow();
        log.info("RelayLinkManager shutdown complete.");
    }
}

package com.proxy.link.relay.processor;

import com.proxy.link.communicator.FrameCommunicator;
import com.proxy.link.config.RelayConfig;
import com.proxy.link.protocol.Frame;
import com.proxy.link.protocol.FrameType;
import com.proxy.link.protocol.TunnelTarget;
import com.proxy.link.utils.ByteStreamUtils;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.Socket;
import java.util.Arrays;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Opens CONNECT targets on the relay and pumps target bytes back over the link as tunnel frames.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "proxy", name = "mode", havingValue = "relay")
public class TunnelProcessor {

    private static final int READ_CHUNK_SIZE = 16 * 1024;

    private final RelayConfig relayConfig;
    // Executor for the target-to-agent read loop of each tunnel
    private final ExecutorService tunnelExecutor = Executors.newCachedThreadPool();

    public RelayTunnel prepare(TunnelTarget target) {
        return new RelayTunnel(target);
    }

    /**
     * Connects to the tunnel's target, bounded by the relay's connect timeout.
     *
     * @throws IOException if the target cannot be reached
     */
    public void connect(RelayTunnel tunnel) throws IOException {
        TunnelTarget target = tunnel.getTarget();
        Socket targetSocket = new Socket();
        try {
            targetSocket.connect(target.toSocketAddress(), (int) relayConfig.getConnectTimeout().toMillis());
            targetSocket.setTcpNoDelay(true);
        } catch (IOException e) {
            ByteStreamUtils.close(targetSocket, "tunnel target socket");
            throw e;
        }
        log.info("Connected to tunnel target {}", target);
        if (!tunnel.attach(targetSocket)) {
            log.debug("Tunnel to {} was closed by the agent while connecting", target);
            ByteStreamUtils.close(targetSocket, "tunnel target socket");
        }
    }

    /**
     * Starts relaying target bytes to the agent. When the target side ends, a tunnel close frame is sent
     * and the tunnel's {@code closed} future completes.
     */
    public void startPump(RelayTunnel tunnel, FrameCommunicator link) {
        tunnelExecutor.submit(() -> {
            Thread.currentThread().setName("relay-tunnel-" + tunnel.getTarget());
            Socket targetSocket = tunnel.socket();
            byte[] buffer = new byte[READ_CHUNK_SIZE];
            long total = 0;
            try (InputStream targetIn = targetSocket.getInputStream()) {
                int read;
                while ((read = targetIn.read(buffer)) != -1) {
                    link.send(new Frame(FrameType.TUNNEL_DATA, Arrays.copyOf(buffer, read)));
                    total += read;
                }
                log.debug("Tunnel target {} closed the connection", tunnel.getTarget());
            } catch (IOException e) {
                if (targetSocket.isClosed()) {
                    log.debug("Tunnel target socket for {} closed locally", tunnel.getTarget());
                } else {
                    log.warn("I/O error on tunnel to {}: {}", tunnel.getTarget(), e.getMessage());
                }
            } finally {
                ByteStreamUtils.close(targetSocket, "tunnel target socket");
                sendTunnelClose(link, tunnel);
                log.info("Tunnel to {} ended after {} bytes from target", tunnel.getTarget(), total);
                tunnel.getClosed().complete(null);
            }
        });
    }

    private void sendTunnelClose(FrameCommunicator link, RelayTunnel tunnel) {
        try {
            link.send(Frame.empty(FrameType.TUNNEL_CLOSE));
        } catch (IOException e) {
            log.debug("Link gone, tunnel close for {} not sent: {}", tunnel.getTarget(), e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        tunnelExecutor.shutdownNow();
        try {
            if (!tunnelExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("TunnelProcessor: tunnel executor did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("TunnelProcessor: shutdown interrupted.");
        }
    }
}

package com.proxy.link.agent.tunnel;

import com.proxy.link.agent.dispatcher.ProxyRequestTask;
import com.proxy.link.config.AgentConfig;
import com.proxy.link.http.HttpResponseWriter;
import com.proxy.link.protocol.TunnelTarget;
import com.proxy.link.utils.ByteStreamUtils;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ProtocolException;
import java.net.Socket;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * CONNECT handling that bypasses the relay: the agent connects to the target itself and splices bytes in
 * both directions until either side closes, then tears both connections down.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "proxy", name = "mode", havingValue = "agent", matchIfMissing = true)
public class DirectTunnelBridge {

    private final AgentConfig agentConfig;
    // Executor for the two copy directions of each tunnel
    private final ExecutorService tunnelExecutor = Executors.newCachedThreadPool();

    /**
     * Runs the whole tunnel; returns once both directions have stopped.
     */
    public void bridge(ProxyRequestTask task) throws InterruptedException {
        TunnelTarget target;
        try {
            target = TunnelTarget.parse(task.getRequest().getUri());
        } catch (ProtocolException e) {
            log.error("Rejecting CONNECT: {}", e.getMessage());
            refuse(task, 400);
            return;
        }

        Socket targetSocket = new Socket();
        try {
            targetSocket.connect(target.toSocketAddress(), (int) agentConfig.getConnectTimeout().toMillis());
            targetSocket.setTcpNoDelay(true);
            HttpResponseWriter.writeTunnelEstablished(task.getClientOut());
        } catch (IOException e) {
            log.error("Direct CONNECT to {} failed: {}", target, e.getMessage());
            ByteStreamUtils.close(targetSocket, "tunnel target socket");
            refuse(task, 502);
            return;
        }
        log.debug("Direct tunnel to {} established", target);

        try {
            InputStream targetIn = targetSocket.getInputStream();
            OutputStream targetOut = targetSocket.getOutputStream();
            Future<?> upstream = tunnelExecutor.submit(() -> splice(task.getClientIn(), targetOut, task, targetSocket, "client->" + target));
            Future<?> downstream = tunnelExecutor.submit(() -> splice(targetIn, task.getClientOut(), task, targetSocket, target + "->client"));
            upstream.get();
            downstream.get();
        } catch (IOException e) {
            log.error("Direct tunnel to {} could not start: {}", target, e.getMessage());
        } catch (ExecutionException e) {
            log.warn("Direct tunnel to {} failed: {}", target, e.getCause().getMessage());
        } finally {
            ByteStreamUtils.close(targetSocket, "tunnel target socket");
            ByteStreamUtils.close(task.getClientSocket(), "tunnel client socket");
            log.debug("Direct tunnel to {} closed", target);
        }
    }

    private void splice(InputStream in, OutputStream out, ProxyRequestTask task, Socket targetSocket, String direction) {
        try {
            long bytes = ByteStreamUtils.pipe(in, out);
            log.trace("Tunnel {} finished after {} bytes", direction, bytes);
        } catch (IOException e) {
            log.debug("Tunnel {} ended: {}", direction, e.getMessage());
        } finally {
            // either side closing ends the whole tunnel
            ByteStreamUtils.close(targetSocket, "tunnel target socket");
            ByteStreamUtils.close(task.getClientSocket(), "tunnel client socket");
        }
    }

    private void refuse(ProxyRequestTask task, int statusCode) {
        try {
            HttpResponseWriter.writeTunnelRefused(task.getClientOut(), statusCode);
        } catch (IOException e) {
            log.debug("Could not refuse CONNECT, client gone: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        tunnelExecutor.shutdownNow();
        try {
            if (!tunnelExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("DirectTunnelBridge: tunnel executor did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("DirectTunnelBridge: shutdown interrupted.");
        }
    }
}

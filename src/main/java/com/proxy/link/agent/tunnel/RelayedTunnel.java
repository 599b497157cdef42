package com.proxy.link.agent.tunnel;

import com.proxy.link.agent.dispatcher.ProxyRequestTask;
import com.proxy.link.communicator.FrameCommunicator;
import com.proxy.link.http.HttpResponseWriter;
import com.proxy.link.protocol.Frame;
import com.proxy.link.protocol.FrameType;
import com.proxy.link.utils.ByteStreamUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Agent end of a CONNECT tunnel carried over the relay link. Client bytes leave as tunnel data frames;
 * tunnel data frames from the relay are written to the client. Data that arrives before the client has
 * been told the tunnel is established is held back until then.
 * <p>
 * A tunnel close frame is sent at most once, and never after the relay has closed its side, so it can
 * not reach the relay once the relay has moved on to the next request.
 */
@Slf4j
public class RelayedTunnel {

    private static final int READ_CHUNK_SIZE = 16 * 1024;

    private final ProxyRequestTask task;
    private final FrameCommunicator link;
    @Getter
    private final String target;
    private final CompletableFuture<Void> relayClosed = new CompletableFuture<>();
    private final CompletableFuture<Void> clientClosed = new CompletableFuture<>();
    private final ByteArrayOutputStream heldBack = new ByteArrayOutputStream();

    private boolean established;
    private boolean closeSent;

    public RelayedTunnel(ProxyRequestTask task, FrameCommunicator link) {
        this.task = task;
        this.link = link;
        this.target = task.getRequest().getUri();
    }

    /**
     * Tells the client the tunnel is up and flushes anything the relay already sent.
     */
    public synchronized void establish() throws IOException {
        HttpResponseWriter.writeTunnelEstablished(task.getClientOut());
        if (heldBack.size() > 0) {
            task.getClientOut().write(heldBack.toByteArray());
            task.getClientOut().flush();
            heldBack.reset();
        }
        established = true;
    }

    /**
     * Tunnel data frame from the relay.
     */
    public synchronized void deliver(byte[] data) {
        if (relayClosed.isDone()) {
            return;
        }
        if (!established) {
            heldBack.write(data, 0, data.length);
            return;
        }
        try {
            task.getClientOut().write(data);
            task.getClientOut().flush();
        } catch (IOException e) {
            log.debug("Tunnel {}: client write failed: {}", target, e.getMessage());
            ByteStreamUtils.close(task.getClientSocket(), "tunnel client socket");
        }
    }

    /**
     * The relay's target connection is gone; the relay has already released its slot.
     */
    public synchronized void onRelayClosed() {
        closeSent = true;
        log.debug("Tunnel {}: closed by relay", target);
        ByteStreamUtils.close(task.getClientSocket(), "tunnel client socket");
        relayClosed.complete(null);
    }

    public synchronized void onLinkLost() {
        closeSent = true;
        log.warn("Tunnel {}: relay connection lost", target);
        ByteStreamUtils.close(task.getClientSocket(), "tunnel client socket");
        relayClosed.complete(null);
    }

    /**
     * Starts forwarding client bytes to the relay until the client closes its side.
     */
    public void startClientPump(ExecutorService executor) {
        executor.submit(() -> {
            Thread.currentThread().setName("agent-tunnel-" + target);
            byte[] buffer = new byte[READ_CHUNK_SIZE];
            InputStream clientIn = task.getClientIn();
            try {
                int read;
                while ((read = clientIn.read(buffer)) != -1) {
                    link.send(new Frame(FrameType.TUNNEL_DATA, Arrays.copyOf(buffer, read)));
                }
                log.debug("Tunnel {}: client closed", target);
            } catch (IOException e) {
                log.debug("Tunnel {}: client side ended: {}", target, e.getMessage());
            } finally {
                sendClose();
                clientClosed.complete(null);
            }
        });
    }

    /**
     * Asks the relay to close the target connection, unless it already has.
     */
    public synchronized void sendClose() {
        if (closeSent) {
            return;
        }
        closeSent = true;
        try {
            link.send(Frame.empty(FrameType.TUNNEL_CLOSE));
        } catch (IOException e) {
            log.debug("Tunnel {}: close not sent, link gone: {}", target, e.getMessage());
        }
    }

    /**
     * Blocks until the relay reports the tunnel closed. Once the client has closed its side the relay gets
     * {@code closeTimeout} to confirm.
     *
     * @return true if the relay confirmed the close
     */
    public boolean awaitEnd(Duration closeTimeout) throws InterruptedException {
        try {
            CompletableFuture.anyOf(relayClosed, clientClosed).get();
            if (relayClosed.isDone()) {
                return true;
            }
            relayClosed.get(closeTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            log.warn("Tunnel {}: relay did not confirm close within {} ms", target, closeTimeout.toMillis());
            return false;
        } catch (ExecutionException e) {
            log.warn("Tunnel {}: ended abnormally: {}", target, e.getCause().getMessage());
            return false;
        } finally {
            ByteStreamUtils.close(task.getClientSocket(), "tunnel client socket");
        }
    }
}

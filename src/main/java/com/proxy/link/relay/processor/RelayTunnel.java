package com.proxy.link.relay.processor;

import com.proxy.link.protocol.TunnelTarget;
import com.proxy.link.utils.ByteStreamUtils;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.CompletableFuture;

/**
 * Relay end of one CONNECT session: the socket to the target plus the signal that releases the
 * relay's processing slot once the target connection is gone.
 */
@Slf4j
public class RelayTunnel {

    @Getter
    private final TunnelTarget target;
    @Getter
    private final CompletableFuture<Void> closed = new CompletableFuture<>();

    private Socket socket;
    private OutputStream targetOut;
    private boolean closeRequested;

    RelayTunnel(TunnelTarget target) {
        this.target = target;
    }

    /**
     * @return false if the agent asked for the tunnel to be closed while the connect was in progress
     */
    synchronized boolean attach(Socket socket) throws IOException {
        this.socket = socket;
        this.targetOut = socket.getOutputStream();
        return !closeRequested;
    }

    /**
     * Writes bytes received from the agent to the target.
     */
    public synchronized void write(byte[] data) {
        if (targetOut == null || socket.isClosed()) {
            log.debug("Dropping {} tunnel bytes for {}: target not open", data.length, target);
            return;
        }
        try {
            targetOut.write(data);
            targetOut.flush();
        } catch (IOException e) {
            log.warn("Failed to write tunnel data to {}: {}", target, e.getMessage());
            ByteStreamUtils.close(socket, "tunnel target socket");
        }
    }

    /**
     * The agent's side has ended; closing the target socket ends the read pump, which then reports back.
     */
    public synchronized void requestClose() {
        closeRequested = true;
        if (socket != null) {
            ByteStreamUtils.close(socket, "tunnel target socket");
        }
    }

    synchronized Socket socket() {
        return socket;
    }
}

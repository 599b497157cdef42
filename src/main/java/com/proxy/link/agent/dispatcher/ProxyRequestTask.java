package com.proxy.link.agent.dispatcher;

import com.proxy.link.http.ProxyHttpRequest;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.concurrent.CompletableFuture;

/**
 * Represents a single request received from a local client, to be processed sequentially.
 * This task holds the parsed request, the client's connection, and a future
 * that tells the originating ClientConnectionHandler when the answer has been written.
 */
@Getter
@RequiredArgsConstructor
@ToString(exclude = {"clientSocket", "clientIn", "clientOut", "completion"})
public class ProxyRequestTask {

    private final long sequence;
    @NonNull private final ProxyHttpRequest request;
    @NonNull private final Socket clientSocket;
    // Buffered streams owned by the client handler; a tunnel continues on the same ones
    @NonNull private final InputStream clientIn;
    @NonNull private final OutputStream clientOut;
    // Completes with true when the client connection may carry another request
    private final CompletableFuture<Boolean> completion = new CompletableFuture<>();

    public boolean isTunnel() {
        return request.isConnect();
    }

    /**
     * Peeks at the client connection. Bytes a pipelining client already sent stay unread.
     *
     * @return true if the client has closed the connection
     */
    public boolean isClientGone() {
        if (clientSocket.isClosed() || clientSocket.isInputShutdown()) {
            return true;
        }
        if (!clientIn.markSupported()) {
            return false;
        }
        try {
            int previousTimeout = clientSocket.getSoTimeout();
            clientSocket.setSoTimeout(1);
            try {
                clientIn.mark(1);
                if (clientIn.read() == -1) {
                    return true;
                }
                clientIn.reset();
                return false;
            } finally {
                clientSocket.setSoTimeout(previousTimeout);
            }
        } catch (SocketTimeoutException e) {
            // nothing to read, still connected
            return false;
        } catch (IOException e) {
            return true;
        }
    }

    public void finish(boolean keepOpen) {
        completion.complete(keepOpen);
    }
}

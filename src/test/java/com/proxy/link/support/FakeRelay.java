package com.proxy.link.support;

import com.proxy.link.utils.ByteStreamUtils;

import java.io.Closeable;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Plain TCP endpoint standing in for the relay. Tests read the agent's frames and script the answers.
 */
public class FakeRelay implements Closeable {

    private final ServerSocket serverSocket;
    private final BlockingQueue<Socket> accepted = new LinkedBlockingQueue<>();
    private final AtomicInteger acceptCount = new AtomicInteger();

    public FakeRelay() throws IOException {
        this(0);
    }

    public FakeRelay(int port) throws IOException {
        serverSocket = new ServerSocket(port);
        Thread acceptor = new Thread(this::acceptLoop, "fake-relay");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();
                acceptCount.incrementAndGet();
                accepted.add(socket);
            } catch (IOException e) {
                return;
            }
        }
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    public int getAcceptCount() {
        return acceptCount.get();
    }

    /**
     * @return the next agent connection, or {@code null} if none arrives in time
     */
    public FrameConnection awaitConnection(Duration timeout) throws IOException, InterruptedException {
        Socket socket = accepted.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return socket == null ? null : new FrameConnection(socket);
    }

    @Override
    public void close() {
        ByteStreamUtils.close(serverSocket, "fake relay socket");
        Socket socket;
        while ((socket = accepted.poll()) != null) {
            ByteStreamUtils.close(socket, "fake relay connection");
        }
    }

    /**
     * Reserves a port that nothing listens on when this returns.
     */
    public static int unusedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }
}

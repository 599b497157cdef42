package com.proxy.link.support;

import com.proxy.link.utils.ByteStreamUtils;

import java.io.Closeable;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Echoes every byte back on each accepted connection; the CONNECT target in tunnel tests.
 */
public class EchoServer implements Closeable {

    private final ServerSocket serverSocket = new ServerSocket(0);

    public EchoServer() throws IOException {
        Thread acceptor = new Thread(this::acceptLoop, "echo-server");
        acceptor.setDaemon(true);
        acceptor.start();
    }

    private void acceptLoop() {
        while (!serverSocket.isClosed()) {
            try {
                Socket socket = serverSocket.accept();
                Thread echo = new Thread(() -> {
                    try {
                        ByteStreamUtils.pipe(socket.getInputStream(), socket.getOutputStream());
                    } catch (IOException e) {
                        // peer went away
                    } finally {
                        ByteStreamUtils.close(socket, "echo socket");
                    }
                }, "echo-connection");
                echo.setDaemon(true);
                echo.start();
            } catch (IOException e) {
                return;
            }
        }
    }

    public int getPort() {
        return serverSocket.getLocalPort();
    }

    @Override
    public void close() {
        ByteStreamUtils.close(serverSocket, "echo server socket");
    }
}

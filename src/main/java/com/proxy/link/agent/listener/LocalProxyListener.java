package com.proxy.link.agent.listener;

import com.proxy.link.agent.dispatcher.ProxyRequestTask;
import com.proxy.link.agent.dispatcher.SequentialDispatcher;
import com.proxy.link.config.AgentConfig;
import com.proxy.link.http.HttpRequestReader;
import com.proxy.link.http.HttpResponseWriter;
import com.proxy.link.http.ProxyHttpRequest;
import com.proxy.link.utils.ByteStreamUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ProtocolException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Accepts local HTTP proxy clients. Each client connection gets its own handler thread that parses
 * requests and hands them to the {@link SequentialDispatcher}; the handler waits for each answer before
 * reading the next request on the same connection.
 */
@Slf4j
@RequiredArgsConstructor
@Service
@ConditionalOnProperty(prefix = "proxy", name = "mode", havingValue = "agent", matchIfMissing = true)
public class LocalProxyListener {

    private final AgentConfig agentConfig;
    private final SequentialDispatcher dispatcher;

    private ServerSocket proxyServerSocket;
    private ExecutorService clientConnectionPool;
    private volatile boolean running = false;

    @PostConstruct
    public void init() throws IOException {
        clientConnectionPool = Executors.newCachedThreadPool();
        proxyServerSocket = new ServerSocket(agentConfig.getListenPort());
        // accept() wakes up regularly so shutdown is noticed
        proxyServerSocket.setSoTimeout(1000);
        running = true;
        new Thread(this::acceptClientConnections, "agent-listener").start();
        log.info("Proxy agent listening for clients on port {}", getLocalPort());
    }

    public int getLocalPort() {
        return proxyServerSocket.getLocalPort();
    }

    private void acceptClientConnections() {
        while (running && !proxyServerSocket.isClosed()) {
            try {
                Socket clientSocket = proxyServerSocket.accept();
                clientSocket.setTcpNoDelay(true);
                log.debug("Accepted client connection from {}:{}", clientSocket.getInetAddress().getHostAddress(), clientSocket.getPort());
                clientConnectionPool.submit(new ClientConnectionHandler(clientSocket));
            } catch (SocketTimeoutException e) {
                // no client within the accept timeout
            } catch (IOException e) {
                if (running) {
                    log.error("Error accepting client connection: {}", e.getMessage());
                }
                try {
                    Thread.sleep(100);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    running = false;
                }
            }
        }
        log.info("Agent listener thread stopped.");
    }

    @PreDestroy
    public void destroy() {
        log.info("LocalProxyListener shutting down...");
        running = false;
        ByteStreamUtils.close(proxyServerSocket, "agent listener socket");
        if (clientConnectionPool != null) {
            clientConnectionPool.shutdownNow();
            try {
                if (!clientConnectionPool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Client connection pool did not terminate in time.");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Client connection pool shutdown interrupted.");
            }
        }
    }

    /**
     * Reads requests from one client connection until the client closes it, asks for close, or opens a tunnel.
     */
    private class ClientConnectionHandler implements Runnable {

        private final Socket clientSocket;

        ClientConnectionHandler(Socket clientSocket) {
            this.clientSocket = clientSocket;
        }

        @Override
        public void run() {
            String clientInfo = clientSocket.getInetAddress().getHostAddress() + ":" + clientSocket.getPort();
            try {
                InputStream clientIn = new BufferedInputStream(clientSocket.getInputStream());
                OutputStream clientOut = new BufferedOutputStream(clientSocket.getOutputStream());
                HttpRequestReader reader = new HttpRequestReader(clientIn);
                boolean keepOpen = true;
                while (keepOpen && !clientSocket.isClosed()) {
                    ProxyHttpRequest request;
                    try {
                        request = reader.read();
                    } catch (ProtocolException e) {
                        log.warn("Bad request from {}: {}", clientInfo, e.getMessage());
                        HttpResponseWriter.writeError(clientOut, 400, "Bad Request: " + e.getMessage());
                        break;
                    }
                    if (request == null) {
                        log.debug("Client {} closed the connection", clientInfo);
                        break;
                    }
                    ProxyRequestTask task = dispatcher.enqueue(request, clientSocket, clientIn, clientOut);
                    keepOpen = task.getCompletion().get();
                }
            } catch (IOException e) {
                log.debug("Client {} I/O error: {}", clientInfo, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (ExecutionException e) {
                log.error("Request from {} failed: {}", clientInfo, e.getCause().getMessage());
            } finally {
                ByteStreamUtils.close(clientSocket, "client socket");
            }
        }
    }
}

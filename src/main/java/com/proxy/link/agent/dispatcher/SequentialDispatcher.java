package com.proxy.link.agent.dispatcher;

import com.proxy.link.agent.connection.RelayLinkManager;
import com.proxy.link.agent.tunnel.DirectTunnelBridge;
import com.proxy.link.agent.tunnel.RelayedTunnel;
import com.proxy.link.communicator.FrameCommunicator;
import com.proxy.link.communicator.FrameListener;
import com.proxy.link.config.AgentConfig;
import com.proxy.link.http.HttpResponseWriter;
import com.proxy.link.http.ProxyHttpRequest;
import com.proxy.link.protocol.EnvelopeCodec;
import com.proxy.link.protocol.Frame;
import com.proxy.link.protocol.FrameType;
import com.proxy.link.protocol.MalformedEnvelopeException;
import com.proxy.link.protocol.ProxyProtocolConstants;
import com.proxy.link.protocol.RequestEnvelope;
import com.proxy.link.protocol.ResponseEnvelope;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serializes all client requests onto the relay link: requests are taken in arrival order and the next one
 * is only sent once the previous one has been answered, timed out or failed. Response frames are matched
 * to the request in flight purely by position.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "proxy", name = "mode", havingValue = "agent", matchIfMissing = true)
public class SequentialDispatcher implements FrameListener {

    private final AgentConfig agentConfig;
    private final RelayLinkManager linkManager;
    private final DirectTunnelBridge directTunnelBridge;

    private final BlockingQueue<ProxyRequestTask> requestQueue = new LinkedBlockingQueue<>();
    private final InFlightState inFlight = new InFlightState();
    private final AtomicLong sequence = new AtomicLong();
    // Client-to-relay pumps of relayed tunnels
    private final ExecutorService tunnelExecutor = Executors.newCachedThreadPool();

    private ExecutorService requestProcessor;
    private volatile boolean running = false;
    // CONNECT waiting for its acknowledgement, and the tunnel currently open
    private volatile RelayedTunnel pendingTunnel;
    private volatile RelayedTunnel activeTunnel;

    @PostConstruct
    public void start() {
        running = true;
        requestProcessor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "agent-dispatcher"));
        requestProcessor.submit(this::processRequestsSequentially);
        linkManager.start(this);
        log.info("SequentialDispatcher started, forwarding to relay {}:{} (CONNECT mode {})",
                agentConfig.getRelayHost(), agentConfig.getRelayPort(), agentConfig.getConnectMode());
    }

    /**
     * Appends a request to the tail of the queue.
     *
     * @return the task; its completion tells the caller whether the client connection may be reused
     */
    public ProxyRequestTask enqueue(ProxyHttpRequest request, Socket clientSocket, InputStream clientIn, OutputStream clientOut) {
        ProxyRequestTask task = new ProxyRequestTask(sequence.incrementAndGet(), request, clientSocket, clientIn, clientOut);
        requestQueue.add(task);
        int size = requestQueue.size();
        if (size > agentConfig.getQueueWarnThreshold()) {
            log.warn("Request queue is backing up: {} requests waiting", size);
        }
        log.debug("Queued request #{} {} {}", task.getSequence(), request.getMethod(), request.getUri());
        return task;
    }

    private void processRequestsSequentially() {
        while (running) {
            ProxyRequestTask task;
            try {
                task = requestQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Request processor interrupted, stopping.");
                break;
            }
            boolean keepOpen = false;
            try {
                if (task.isClientGone()) {
                    log.debug("Skipping request #{}, client already disconnected", task.getSequence());
                    continue;
                }
                keepOpen = task.isTunnel() ? processTunnel(task) : processHttp(task);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("Request processor interrupted while handling #{}", task.getSequence());
                break;
            } catch (Exception e) {
                log.error("Unexpected error processing request #{}: {}", task.getSequence(), e.getMessage(), e);
            } finally {
                task.finish(keepOpen);
            }
        }
    }

    private boolean processHttp(ProxyRequestTask task) throws InterruptedException {
        ProxyHttpRequest request = task.getRequest();
        OutputStream clientOut = task.getClientOut();
        FrameCommunicator link;
        try {
            link = linkManager.ensureConnected();
        } catch (IOException e) {
            log.error("Request #{} {} {}: relay unavailable: {}", task.getSequence(), request.getMethod(), request.getUri(), e.getMessage());
            return answerError(task, 502, "Bad Gateway: relay unavailable");
        }

        byte[] answer;
        try {
            answer = awaitResponse(link, EnvelopeCodec.requestFrame(toEnvelope(request)), false);
        } catch (TimeoutException e) {
            log.error("Request #{} {} {}: no response from relay within {} ms", task.getSequence(),
                    request.getMethod(), request.getUri(), agentConfig.getResponseTimeout().toMillis());
            return answerError(task, 504, "Gateway Timeout");
        } catch (IOException e) {
            log.error("Request #{} {} {}: {}", task.getSequence(), request.getMethod(), request.getUri(), e.getMessage());
            return answerError(task, 502, "Bad Gateway: " + e.getMessage());
        }

        ResponseEnvelope response;
        try {
            response = EnvelopeCodec.readResponse(answer);
        } catch (MalformedEnvelopeException e) {
            log.error("Request #{}: unreadable response from relay: {}", task.getSequence(), e.getMessage());
            return answerError(task, 502, "Bad Gateway");
        }

        boolean keepAlive = request.isKeepAlive();
        try {
            HttpResponseWriter.writeResponse(clientOut, request.getMethod(), response.getStatusCode(), response.getHeaders(), response.getBodyBytes(), keepAlive);
        } catch (IOException e) {
            log.warn("Request #{}: client went away before the response was written: {}", task.getSequence(), e.getMessage());
            return false;
        }
        log.debug("Request #{} {} {} -> {}", task.getSequence(), request.getMethod(), request.getUri(), response.getStatusCode());
        return keepAlive;
    }

    private boolean processTunnel(ProxyRequestTask task) throws InterruptedException {
        if (agentConfig.getConnectMode() == AgentConfig.ConnectMode.DIRECT) {
            directTunnelBridge.bridge(task);
            return false;
        }
        ProxyHttpRequest request = task.getRequest();
        FrameCommunicator link;
        try {
            link = linkManager.ensureConnected();
        } catch (IOException e) {
            log.error("CONNECT #{} {}: relay unavailable: {}", task.getSequence(), request.getUri(), e.getMessage());
            refuseTunnel(task, 502);
            return false;
        }

        RelayedTunnel tunnel = new RelayedTunnel(task, link);
        pendingTunnel = tunnel;
        try {
            byte[] ack;
            try {
                ack = awaitResponse(link, EnvelopeCodec.requestFrame(toEnvelope(request)), true);
            } catch (TimeoutException e) {
                log.error("CONNECT #{} {}: no acknowledgement from relay within {} ms", task.getSequence(),
                        request.getUri(), agentConfig.getResponseTimeout().toMillis());
                refuseTunnel(task, 504);
                return false;
            } catch (IOException e) {
                log.error("CONNECT #{} {}: {}", task.getSequence(), request.getUri(), e.getMessage());
                refuseTunnel(task, 502);
                return false;
            }

            if (!isTunnelAccepted(ack)) {
                log.warn("CONNECT #{} {}: relay could not reach the target", task.getSequence(), request.getUri());
                refuseTunnel(task, 502);
                return false;
            }
            activeTunnel = tunnel;
            try {
                tunnel.establish();
            } catch (IOException e) {
                log.warn("CONNECT #{} {}: client went away before the tunnel was up: {}", task.getSequence(), request.getUri(), e.getMessage());
                tunnel.sendClose();
            }
            log.info("Tunnel #{} to {} established via relay", task.getSequence(), request.getUri());
            tunnel.startClientPump(tunnelExecutor);
            tunnel.awaitEnd(agentConfig.getResponseTimeout());
            log.info("Tunnel #{} to {} closed", task.getSequence(), request.getUri());
            return false;
        } finally {
            if (pendingTunnel == tunnel) {
                pendingTunnel = null;
            }
            if (activeTunnel == tunnel) {
                activeTunnel = null;
            }
        }
    }

    /**
     * Sends one request frame and waits for the frame that answers it.
     *
     * @throws TimeoutException if the relay did not answer in time; the request is then abandoned
     * @throws IOException if the frame could not be sent or the link dropped while waiting
     */
    private byte[] awaitResponse(FrameCommunicator link, Frame frame, boolean tunnel)
            throws IOException, TimeoutException, InterruptedException {
        CompletableFuture<byte[]> pending = inFlight.begin(tunnel);
        try {
            link.send(frame);
        } catch (IOException e) {
            inFlight.release(pending);
            throw e;
        }
        try {
            return pending.get(agentConfig.getResponseTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            byte[] late = inFlight.expire(pending);
            if (late != null) {
                return late;
            }
            throw e;
        } catch (ExecutionException e) {
            throw new IOException(e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            inFlight.expire(pending);
            throw e;
        }
    }

    static RequestEnvelope toEnvelope(ProxyHttpRequest request) {
        return RequestEnvelope.builder()
                .method(request.getMethod())
                .url(request.getUri())
                .headers(new LinkedHashMap<>(request.getHeaders()))
                .body(RequestEnvelope.encodeBody(request.getBody()))
                .build();
    }

    private static boolean isTunnelAccepted(byte[] ack) {
        return ProxyProtocolConstants.TUNNEL_ACK_OK.equals(new String(ack, StandardCharsets.UTF_8).trim());
    }

    private boolean answerError(ProxyRequestTask task, int statusCode, String message) {
        try {
            HttpResponseWriter.writeError(task.getClientOut(), statusCode, message);
        } catch (IOException e) {
            log.debug("Could not send {} to client, it is gone: {}", statusCode, e.getMessage());
        }
        return false;
    }

    private void refuseTunnel(ProxyRequestTask task, int statusCode) {
        try {
            HttpResponseWriter.writeTunnelRefused(task.getClientOut(), statusCode);
        } catch (IOException e) {
            log.debug("Could not refuse CONNECT, client gone: {}", e.getMessage());
        }
    }

    @Override
    public void onFrame(FrameCommunicator communicator, Frame frame) {
        switch (frame.getType()) {
            case RESPONSE -> onResponseFrame(communicator, frame.getPayload());
            case TUNNEL_DATA -> {
                RelayedTunnel tunnel = activeTunnel;
                if (tunnel == null) {
                    log.debug("Dropping {} bytes of tunnel data, no tunnel open", frame.getPayload().length);
                } else {
                    tunnel.deliver(frame.getPayload());
                }
            }
            case TUNNEL_CLOSE -> {
                RelayedTunnel tunnel = activeTunnel;
                if (tunnel == null) {
                    log.debug("Ignoring tunnel close, no tunnel open");
                } else {
                    tunnel.onRelayClosed();
                }
            }
            default -> log.warn("Unexpected {} frame from relay, ignoring", frame.getType());
        }
    }

    private void onResponseFrame(FrameCommunicator communicator, byte[] payload) {
        // read before matching: the dispatcher clears it only after the answer has been matched or abandoned
        RelayedTunnel candidate = pendingTunnel;
        switch (inFlight.onResponse(payload)) {
            case MATCHED_TUNNEL -> {
                // tunnel data may follow the acknowledgement before the dispatcher thread wakes up
                if (candidate != null && isTunnelAccepted(payload)) {
                    activeTunnel = candidate;
                }
            }
            case ABANDONED_TUNNEL -> {
                if (isTunnelAccepted(payload)) {
                    closeAbandonedTunnel(communicator);
                }
            }
            default -> {
                // MATCHED wakes the dispatcher; the rest were logged when discarded
            }
        }
    }

    private void closeAbandonedTunnel(FrameCommunicator communicator) {
        try {
            if (inFlight.runUnlessTunnelQueued(() -> communicator.send(Frame.empty(FrameType.TUNNEL_CLOSE)))) {
                log.warn("Closing tunnel the relay opened after its CONNECT was abandoned");
            } else {
                // the relay ends it when its target closes
                log.warn("Tunnel opened for an abandoned CONNECT left to the relay, another CONNECT is queued behind it");
            }
        } catch (IOException e) {
            log.debug("Could not close abandoned tunnel: {}", e.getMessage());
        }
    }

    @Override
    public void onConnectionLost(FrameCommunicator communicator, Throwable cause) {
        log.warn("Relay connection lost: {}", cause == null ? "closed" : cause.getMessage());
        inFlight.onLinkLost();
        pendingTunnel = null;
        RelayedTunnel tunnel = activeTunnel;
        if (tunnel != null) {
            tunnel.onLinkLost();
        }
    }

    int getAbandonedAnswers() {
        return inFlight.getAbandonedAnswers();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down SequentialDispatcher.");
        running = false;
        if (requestProcessor != null) {
            requestProcessor.shutdownNow();
        }
        tunnelExecutor.shutdownNow();
        ProxyRequestTask task;
        while ((task = requestQueue.poll()) != null) {
            task.finish(false);
        }
        try {
            if (requestProcessor != null && !requestProcessor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Request processor did not terminate in time.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("SequentialDispatcher shutdown interrupted.");
        }
    }
}

package com.proxy.link.relay.connection;

import com.proxy.link.communicator.FrameCommunicator;
import com.proxy.link.communicator.FrameListener;
import com.proxy.link.config.RelayConfig;
import com.proxy.link.protocol.EnvelopeCodec;
import com.proxy.link.protocol.Frame;
import com.proxy.link.protocol.FrameType;
import com.proxy.link.protocol.MalformedEnvelopeException;
import com.proxy.link.protocol.RequestEnvelope;
import com.proxy.link.protocol.ResponseEnvelope;
import com.proxy.link.protocol.TunnelTarget;
import com.proxy.link.relay.processor.HttpProcessor;
import com.proxy.link.relay.processor.RelayTunnel;
import com.proxy.link.relay.processor.TunnelProcessor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ProtocolException;
import java.net.Socket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static com.proxy.link.protocol.ProxyProtocolConstants.TUNNEL_ACK_FAIL;
import static com.proxy.link.protocol.ProxyProtocolConstants.TUNNEL_ACK_OK;

/**
 * The relay's side of the single agent connection. Request frames are queued and handled strictly one at a
 * time by a single worker; each request frame is answered by exactly one response frame. A CONNECT holds
 * the worker until its target connection closes, so a tunnel occupies the link like one long HTTP call.
 */
@Slf4j
public class RelaySession implements FrameListener {

    private final RelayConfig relayConfig;
    private final HttpProcessor httpProcessor;
    private final TunnelProcessor tunnelProcessor;
    private final Consumer<RelaySession> onClosed;
    private final BlockingQueue<byte[]> requestQueue = new LinkedBlockingQueue<>();
    private final ExecutorService worker = Executors.newSingleThreadExecutor();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private FrameCommunicator link;
    private volatile RelayTunnel activeTunnel;

    public RelaySession(RelayConfig relayConfig, HttpProcessor httpProcessor, TunnelProcessor tunnelProcessor, Consumer<RelaySession> onClosed) {
        this.relayConfig = relayConfig;
        this.httpProcessor = httpProcessor;
        this.tunnelProcessor = tunnelProcessor;
        this.onClosed = onClosed;
    }

    public void start(Socket agentSocket) throws IOException {
        link = new FrameCommunicator("relay-link", agentSocket, this);
        worker.submit(this::processLoop);
        link.start();
    }

    @Override
    public void onFrame(FrameCommunicator communicator, Frame frame) {
        switch (frame.getType()) {
            case REQUEST -> enqueue(frame.getPayload());
            case TUNNEL_DATA -> {
                RelayTunnel tunnel = activeTunnel;
                if (tunnel != null) {
                    tunnel.write(frame.getPayload());
                } else {
                    log.debug("Dropping {} tunnel bytes: no tunnel open", frame.getPayload().length);
                }
            }
            case TUNNEL_CLOSE -> {
                RelayTunnel tunnel = activeTunnel;
                if (tunnel != null) {
                    log.debug("Agent closed tunnel to {}", tunnel.getTarget());
                    tunnel.requestClose();
                } else {
                    log.debug("Ignoring tunnel close: no tunnel open");
                }
            }
            default -> log.warn("Unexpected {} frame from agent, discarding", frame.getType());
        }
    }

    @Override
    public void onConnectionLost(FrameCommunicator communicator, Throwable cause) {
        log.warn("Agent connection lost, discarding {} queued requests", requestQueue.size());
        close();
    }

    private void enqueue(byte[] payload) {
        requestQueue.add(payload);
        int queued = requestQueue.size();
        log.debug("Request enqueued (queue={})", queued);
        if (queued > relayConfig.getQueueWarnThreshold()) {
            log.warn("Queue length is high: {}. Possible delay.", queued);
        }
    }

    private void processLoop() {
        Thread.currentThread().setName("relay-dispatcher");
        while (!closed.get()) {
            byte[] payload;
            try {
                payload = requestQueue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                process(payload);
            } catch (RuntimeException e) {
                log.error("Unexpected error processing request: {}", e.getMessage(), e);
                reply(EnvelopeCodec.responseFrame(ResponseEnvelope.error(500, "Relay error: " + e.getMessage())));
            }
        }
        log.debug("Relay dispatcher stopped");
    }

    private void process(byte[] payload) {
        RequestEnvelope envelope;
        try {
            envelope = EnvelopeCodec.readRequest(payload);
        } catch (MalformedEnvelopeException e) {
            log.error("Processing failed: {}", e.getMessage());
            reply(EnvelopeCodec.responseFrame(ResponseEnvelope.error(400, "Bad Request: " + e.getMessage())));
            return;
        }
        if (envelope.isConnect()) {
            handleConnect(envelope);
        } else {
            handleHttp(envelope);
        }
    }

    private void handleHttp(RequestEnvelope envelope) {
        log.debug("HTTP request: {} {}", envelope.getMethod(), envelope.getTarget());
        ResponseEnvelope response;
        try {
            response = httpProcessor.execute(envelope).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for {} {}", envelope.getMethod(), envelope.getTarget());
            return;
        } catch (ExecutionException e) {
            log.error("Outbound call failed for {}: {}", envelope.getTarget(), e.getCause().getMessage());
            response = ResponseEnvelope.error(502, "Bad Gateway: " + e.getCause().getMessage());
        }
        reply(EnvelopeCodec.responseFrame(response));
    }

    private void handleConnect(RequestEnvelope envelope) {
        TunnelTarget target;
        try {
            target = TunnelTarget.parse(envelope.getTarget());
        } catch (ProtocolException e) {
            log.error("CONNECT failed: {}", e.getMessage());
            reply(Frame.of(FrameType.RESPONSE, TUNNEL_ACK_FAIL));
            return;
        }
        log.debug("CONNECT request for {}", target);
        RelayTunnel tunnel = tunnelProcessor.prepare(target);
        activeTunnel = tunnel;
        try {
            try {
                tunnelProcessor.connect(tunnel);
            } catch (IOException e) {
                log.error("CONNECT to {} failed: {}", target, e.getMessage());
                reply(Frame.of(FrameType.RESPONSE, TUNNEL_ACK_FAIL));
                return;
            }
            reply(Frame.of(FrameType.RESPONSE, TUNNEL_ACK_OK));
            tunnelProcessor.startPump(tunnel, link);
            // the slot stays taken for the tunnel's whole lifetime
            tunnel.getClosed().get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while tunnel to {} was open", target);
        } catch (ExecutionException e) {
            log.warn("Tunnel to {} ended abnormally: {}", target, e.getCause().getMessage());
        } finally {
            activeTunnel = null;
        }
    }

    private void reply(Frame frame) {
        try {
            link.send(frame);
        } catch (IOException e) {
            log.warn("Could not send {} to agent: {}", frame.getType(), e.getMessage());
        }
    }

    public boolean isOpen() {
        return !closed.get();
    }

    /**
     * Ends the session: queued requests are discarded, an open tunnel is closed and the relay's single
     * connection slot is released.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        requestQueue.clear();
        RelayTunnel tunnel = activeTunnel;
        if (tunnel != null) {
            tunnel.requestClose();
        }
        if (link != null) {
            link.close();
        }
        worker.shutdownNow();
        onClosed.accept(this);
        log.info("Relay session closed");
    }
}

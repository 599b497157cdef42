package com.proxy.link.communicator;

import com.proxy.link.protocol.Frame;
import com.proxy.link.protocol.FrameDecoder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Framed, full-duplex view of the single relay link socket. Outgoing frames are queued and written by a
 * dedicated send thread, so callers never interleave partial frames; a receive thread decodes the stream
 * and hands each complete frame to the {@link FrameListener}.
 */
@Slf4j
public class FrameCommunicator {

    private static final int READ_CHUNK_SIZE = 16 * 1024;

    @Getter
    private final String name;
    private final Socket socket;
    private final FrameListener listener;
    private final BlockingQueue<Frame> outgoingQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean lost = new AtomicBoolean(false);
    private final ExecutorService executorService;

    private InputStream inputStream;
    private OutputStream outputStream;
    @Getter
    private volatile boolean running = false;

    public FrameCommunicator(String name, Socket socket, FrameListener listener) {
        this.name = name;
        this.socket = socket;
        this.listener = listener;
        // One for sending, one for receiving
        this.executorService = Executors.newFixedThreadPool(2);
    }

    /**
     * Starts the dedicated send and receive threads.
     */
    public void start() throws IOException {
        this.inputStream = socket.getInputStream();
        this.outputStream = new BufferedOutputStream(socket.getOutputStream());
        running = true;
        executorService.submit(this::sendLoop);
        executorService.submit(this::receiveLoop);
        log.info("{}: frame communicator started for {}", name, socket.getRemoteSocketAddress());
    }

    /**
     * Queues a frame for sending. Never blocks on the network.
     *
     * @throws IOException if the link is already lost or closed
     */
    public void send(Frame frame) throws IOException {
        if (!running) {
            throw new IOException(name + ": link not running, frame " + frame.getType() + " not sent");
        }
        outgoingQueue.add(frame);
        log.trace("{}: queued {}", name, frame);
    }

    public boolean isConnected() {
        return running && !socket.isClosed();
    }

    private void sendLoop() {
        Thread.currentThread().setName(name + "-send");
        while (running) {
            try {
                Frame frame = outgoingQueue.take();
                outputStream.write(frame.toBytes());
                outputStream.flush();
                log.trace("{}: sent {}", name, frame);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception | OutOfMemoryError e) {
                handleConnectionLoss(e);
            }
        }
        log.debug("{}: send loop stopped", name);
    }

    private void receiveLoop() {
        Thread.currentThread().setName(name + "-receive");
        FrameDecoder decoder = new FrameDecoder();
        byte[] chunk = new byte[READ_CHUNK_SIZE];
        Throwable cause = null;
        try {
            int read;
            while (running && (read = inputStream.read(chunk)) != -1) {
                decoder.feed(chunk, 0, read);
                Frame frame;
                while ((frame = decoder.poll()) != null) {
                    dispatch(frame);
                }
            }
        } catch (Exception | OutOfMemoryError e) {
            cause = e;
        } finally {
            // however the loop ended, nothing more can be read from this link
            handleConnectionLoss(cause);
        }
        log.debug("{}: receive loop stopped", name);
    }

    private void dispatch(Frame frame) {
        log.trace("{}: received {}", name, frame);
        try {
            listener.onFrame(this, frame);
        } catch (RuntimeException e) {
            log.error("{}: listener failed on {}: {}", name, frame, e.getMessage(), e);
        }
    }

    private void handleConnectionLoss(Throwable cause) {
        if (!lost.compareAndSet(false, true)) {
            return;
        }
        if (cause == null) {
            log.warn("{}: link closed by peer", name);
        } else if (running && cause instanceof IOException) {
            log.error("{}: link lost: {}", name, cause.getMessage());
        } else if (running) {
            log.error("{}: link lost to unexpected failure: {}", name, cause.toString(), cause);
        }
        boolean notify = running;
        closeSocket();
        if (notify) {
            listener.onConnectionLost(this, cause);
        }
        executorService.shutdownNow();
    }

    /**
     * Deliberate close: stops both loops and closes the socket without notifying the listener.
     */
    public void close() {
        if (lost.compareAndSet(false, true)) {
            log.info("{}: closing link", name);
            closeSocket();
            executorService.shutdownNow();
        }
    }

    private void closeSocket() {
        running = false;
        outgoingQueue.clear();
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("{}: error closing link socket: {}", name, e.getMessage());
        }
    }
}

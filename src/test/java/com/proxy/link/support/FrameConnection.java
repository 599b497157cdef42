package com.proxy.link.support;

import com.proxy.link.protocol.Frame;
import com.proxy.link.protocol.FrameDecoder;
import com.proxy.link.utils.ByteStreamUtils;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * Blocking, frame-level view of one end of a link, for driving the agent or the relay from a test.
 */
public class FrameConnection implements Closeable {

    private final Socket socket;
    private final InputStream in;
    private final OutputStream out;
    private final FrameDecoder decoder = new FrameDecoder();
    private final byte[] buffer = new byte[8192];

    public FrameConnection(Socket socket) throws IOException {
        this.socket = socket;
        this.in = socket.getInputStream();
        this.out = socket.getOutputStream();
    }

    public static FrameConnection connect(int port) throws IOException {
        return new FrameConnection(new Socket("127.0.0.1", port));
    }

    public void send(Frame frame) throws IOException {
        out.write(frame.toBytes());
        out.flush();
    }

    public void sendRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    /**
     * @throws SocketTimeoutException if no complete frame arrives in time
     * @throws EOFException if the peer closed the connection
     */
    public Frame readFrame(Duration timeout) throws IOException {
        socket.setSoTimeout((int) timeout.toMillis());
        Frame frame;
        while ((frame = decoder.poll()) == null) {
            int read = in.read(buffer);
            if (read == -1) {
                throw new EOFException("Peer closed the link");
            }
            decoder.feed(buffer, 0, read);
        }
        return frame;
    }

    /**
     * @return true if nothing at all arrives within {@code quietPeriod}
     */
    public boolean isSilentFor(Duration quietPeriod) throws IOException {
        if (decoder.readableBytes() > 0) {
            return false;
        }
        try {
            readFrame(quietPeriod);
            return false;
        } catch (SocketTimeoutException e) {
            return true;
        }
    }

    @Override
    public void close() {
        ByteStreamUtils.close(socket, "test link socket");
    }
}

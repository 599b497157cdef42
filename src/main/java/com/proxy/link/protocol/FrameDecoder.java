package com.proxy.link.protocol;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.ProtocolException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.proxy.link.protocol.ProxyProtocolConstants.HEADER_BYTES;
import static com.proxy.link.protocol.ProxyProtocolConstants.MAX_PAYLOAD_LENGTH;

/**
 * Accumulates bytes read from the link and yields complete frames. A frame is only handed out once
 * all of its {@code length + 5} bytes have arrived; the incomplete tail stays buffered until the next
 * {@link #feed}. Frames with an unknown type tag are dropped by their declared length so the stream
 * never loses alignment.
 * <p>
 * Not thread-safe: one decoder per receiving thread.
 */
@Slf4j
public class FrameDecoder {

    private static final int INITIAL_CAPACITY = 8192;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int readIndex;
    private int writeIndex;
    @Getter
    private long skippedFrames;

    public void feed(byte[] chunk) {
        feed(chunk, 0, chunk.length);
    }

    public void feed(byte[] chunk, int offset, int length) {
        ensureWritable(length);
        System.arraycopy(chunk, offset, buffer, writeIndex, length);
        writeIndex += length;
    }

    /**
     * @return the next complete frame, or {@code null} if the buffered bytes do not yet hold one
     * @throws ProtocolException if a frame declares a length no byte array can carry
     */
    public Frame poll() throws ProtocolException {
        while (readableBytes() >= HEADER_BYTES) {
            long length = readUnsignedInt(readIndex);
            if (length > MAX_PAYLOAD_LENGTH) {
                throw new ProtocolException("Frame payload length " + length + " exceeds " + MAX_PAYLOAD_LENGTH);
            }
            if (readableBytes() < HEADER_BYTES + length) {
                return null;
            }
            int tag = buffer[readIndex + 4] & 0xFF;
            int payloadStart = readIndex + HEADER_BYTES;
            readIndex = payloadStart + (int) length;

            FrameType type = FrameType.fromValue(tag);
            if (type == null) {
                skippedFrames++;
                log.warn("Skipping frame with unknown type {} ({} payload bytes)", tag, length);
                continue;
            }
            return new Frame(type, Arrays.copyOfRange(buffer, payloadStart, payloadStart + (int) length));
        }
        return null;
    }

    /**
     * Pulls every complete frame currently buffered.
     */
    public List<Frame> drain() throws ProtocolException {
        List<Frame> frames = new ArrayList<>();
        Frame frame;
        while ((frame = poll()) != null) {
            frames.add(frame);
        }
        return frames;
    }

    public int readableBytes() {
        return writeIndex - readIndex;
    }

    private long readUnsignedInt(int index) {
        return ((long) (buffer[index] & 0xFF) << 24)
                | ((buffer[index + 1] & 0xFF) << 16)
                | ((buffer[index + 2] & 0xFF) << 8)
                | (buffer[index + 3] & 0xFF);
    }

    private void ensureWritable(int length) {
        if (buffer.length - writeIndex >= length) {
            return;
        }
        int readable = readableBytes();
        // compact first, grow only when the pending bytes really do not fit
        if (buffer.length - readable >= length) {
            System.arraycopy(buffer, readIndex, buffer, 0, readable);
        } else {
            long required = (long) readable + length;
            if (required > Integer.MAX_VALUE - 8) {
                throw new IllegalStateException("Decoder buffer cannot grow to " + required + " bytes");
            }
            int capacity = (int) Math.min(Integer.MAX_VALUE - 8, Math.max(required, (long) buffer.length * 2));
            byte[] grown = new byte[capacity];
            System.arraycopy(buffer, readIndex, grown, 0, readable);
            buffer = grown;
        }
        readIndex = 0;
        writeIndex = readable;
    }
}

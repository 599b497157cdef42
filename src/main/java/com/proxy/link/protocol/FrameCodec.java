package com.proxy.link.protocol;

import java.nio.ByteBuffer;

import static com.proxy.link.protocol.ProxyProtocolConstants.HEADER_BYTES;

/**
 * Encoding side of the framing protocol. Decoding is stateful and lives in {@link FrameDecoder}.
 */
public final class FrameCodec {

    private FrameCodec() {}

    /**
     * Builds {@code [len:4][type:1][payload:len]}. Type values outside {@link FrameType} are allowed;
     * receivers skip them.
     *
     * @param type    tag in the range 0..255
     * @param payload frame payload, never null
     */
    public static byte[] encode(int type, byte[] payload) {
        if (type < 0 || type > 0xFF) {
            throw new IllegalArgumentException("Frame type out of range: " + type);
        }
        return ByteBuffer.allocate(HEADER_BYTES + payload.length)
                .putInt(payload.length)
                .put((byte) type)
                .put(payload)
                .array();
    }
}

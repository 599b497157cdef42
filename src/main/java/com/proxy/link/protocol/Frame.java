package com.proxy.link.protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.nio.charset.StandardCharsets;

/**
 * One unit of the relay link protocol: {@code | length: uint32 BE | type: uint8 | payload |}.
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
@ToString
public class Frame {

    private static final byte[] EMPTY = new byte[0];

    @NonNull private final FrameType type;
    @ToString.Exclude
    @NonNull private final byte[] payload;

    public static Frame of(FrameType type, String payload) {
        return new Frame(type, payload.getBytes(StandardCharsets.UTF_8));
    }

    public static Frame empty(FrameType type) {
        return new Frame(type, EMPTY);
    }

    public byte[] toBytes() {
        return FrameCodec.encode(type.getValue(), payload);
    }

    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }
}

package com.proxy.link.protocol;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Type tags understood on the relay link. Any other tag value is skipped by the decoder.
 */
@Getter
@RequiredArgsConstructor
public enum FrameType {
    REQUEST(0),
    RESPONSE(1),
    TUNNEL_DATA(2),
    TUNNEL_CLOSE(3);

    private final int value;

    /**
     * @return the matching type, or {@code null} when the tag is not one we know
     */
    public static FrameType fromValue(int value) {
        for (FrameType type : FrameType.values()) {
            if (type.value == value) {
                return type;
            }
        }
        return null;
    }
}

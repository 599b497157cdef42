package com.proxy.link.protocol;

public final class ProxyProtocolConstants {

    // Frame header: payload length (uint32, big-endian) followed by the type tag (uint8)
    public static final int LENGTH_FIELD_BYTES = 4;
    public static final int TYPE_FIELD_BYTES = 1;
    public static final int HEADER_BYTES = LENGTH_FIELD_BYTES + TYPE_FIELD_BYTES;

    // Largest payload a single byte[] can carry once the header is accounted for
    public static final long MAX_PAYLOAD_LENGTH = Integer.MAX_VALUE - HEADER_BYTES;

    // CONNECT acknowledgement bodies (payload of a RESPONSE frame answering a CONNECT envelope)
    public static final String TUNNEL_ACK_OK = "OK";
    public static final String TUNNEL_ACK_FAIL = "FAIL";

    // Joins the values of a response header that must be written as separate lines (Set-Cookie)
    public static final String HEADER_LINE_SEPARATOR = "\n";

    public static final String CONNECT_METHOD = "CONNECT";
    public static final int DEFAULT_TUNNEL_PORT = 443;

    // Private constructor to prevent instantiation
    private ProxyProtocolConstants() {}
}

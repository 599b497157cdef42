package com.proxy.link.protocol;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.net.InetSocketAddress;
import java.net.ProtocolException;

/**
 * {@code host:port} authority of a CONNECT request.
 */
@Getter
@RequiredArgsConstructor
@EqualsAndHashCode
public class TunnelTarget {

    private final String host;
    private final int port;

    /**
     * Accepts {@code host}, {@code host:port} and {@code [v6-address]:port}; the port defaults to 443.
     */
    public static TunnelTarget parse(String authority) throws ProtocolException {
        if (authority == null || authority.isBlank()) {
            throw new ProtocolException("Empty CONNECT target");
        }
        String value = authority.trim();
        String host;
        String port = null;
        if (value.startsWith("[")) {
            int end = value.indexOf(']');
            if (end < 0) {
                throw new ProtocolException("Unterminated IPv6 literal in CONNECT target: " + authority);
            }
            host = value.substring(1, end);
            if (value.length() > end + 1) {
                if (value.charAt(end + 1) != ':') {
                    throw new ProtocolException("Malformed CONNECT target: " + authority);
                }
                port = value.substring(end + 2);
            }
        } else {
            int colon = value.lastIndexOf(':');
            host = colon < 0 ? value : value.substring(0, colon);
            port = colon < 0 ? null : value.substring(colon + 1);
        }
        if (host.isEmpty()) {
            throw new ProtocolException("CONNECT target has no host: " + authority);
        }
        return new TunnelTarget(host, parsePort(port, authority));
    }

    private static int parsePort(String port, String authority) throws ProtocolException {
        if (port == null || port.isEmpty()) {
            return ProxyProtocolConstants.DEFAULT_TUNNEL_PORT;
        }
        try {
            int value = Integer.parseInt(port);
            if (value < 1 || value > 65535) {
                throw new ProtocolException("CONNECT port out of range: " + authority);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid CONNECT port: " + authority);
        }
    }

    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}

package com.proxy.link.http;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Map;

/**
 * A request read from a local proxy client. Header names keep the case they were received with.
 */
@Getter
@RequiredArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
public class ProxyHttpRequest {

    @ToString.Include
    @NonNull private final String method;
    @ToString.Include
    @NonNull private final String uri;
    @NonNull private final String version;
    @NonNull private final Map<String, String> headers;
    @NonNull private final byte[] body;

    public String header(String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    public boolean isConnect() {
        return "CONNECT".equalsIgnoreCase(method);
    }

    /**
     * HTTP/1.1 stays open unless told otherwise, HTTP/1.0 only when it asks for keep-alive.
     */
    public boolean isKeepAlive() {
        String connection = header("Proxy-Connection");
        if (connection == null) {
            connection = header("Connection");
        }
        if ("HTTP/1.0".equals(version)) {
            return connection != null && connection.equalsIgnoreCase("keep-alive");
        }
        return connection == null || !connection.equalsIgnoreCase("close");
    }
}

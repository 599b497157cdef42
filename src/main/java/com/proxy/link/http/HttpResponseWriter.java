package com.proxy.link.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

import static com.proxy.link.protocol.ProxyProtocolConstants.HEADER_LINE_SEPARATOR;

/**
 * Writes complete HTTP/1.1 responses back to local proxy clients.
 */
public final class HttpResponseWriter {

    public static final String TUNNEL_ESTABLISHED = "HTTP/1.1 200 Connection Established\r\n\r\n";

    // Framing is recomputed locally, so the origin's own framing headers are never forwarded
    private static final Set<String> SKIPPED_HEADERS = Set.of("transfer-encoding", "connection", "keep-alive", "content-length", "proxy-connection");

    private HttpResponseWriter() {}

    public static void writeResponse(OutputStream out, int statusCode, Map<String, String> headers, byte[] body, boolean keepAlive) throws IOException {
        writeResponse(out, null, statusCode, headers, body, keepAlive);
    }

    /**
     * Writes a response to a request made with {@code requestMethod}. Responses to HEAD and those with status
     * 1xx, 204 or 304 are written without a body; HEAD and 304 answers keep the origin's {@code Content-Length}.
     */
    public static void writeResponse(OutputStream out, String requestMethod, int statusCode, Map<String, String> headers,
                                     byte[] body, boolean keepAlive) throws IOException {
        boolean bodiless = isBodiless(requestMethod, statusCode);
        ByteArrayOutputStream head = new ByteArrayOutputStream();
        writeAscii(head, "HTTP/1.1 " + statusCode + " " + getReasonPhrase(statusCode) + "\r\n");
        String originContentLength = null;
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                String name = header.getKey().toLowerCase();
                if (name.equals("content-length")) {
                    originContentLength = header.getValue();
                }
                if (!SKIPPED_HEADERS.contains(name)) {
                    writeHeader(head, header.getKey(), header.getValue());
                }
            }
        }
        if (!bodiless) {
            writeAscii(head, "Content-Length: " + body.length + "\r\n");
        } else if (originContentLength != null && statusCode >= 200 && statusCode != 204) {
            writeAscii(head, "Content-Length: " + originContentLength.trim() + "\r\n");
        }
        writeAscii(head, "Connection: " + (keepAlive ? "keep-alive" : "close") + "\r\n");
        writeAscii(head, "\r\n");
        out.write(head.toByteArray());
        if (!bodiless) {
            out.write(body);
        }
        out.flush();
    }

    static boolean isBodiless(String requestMethod, int statusCode) {
        return "HEAD".equalsIgnoreCase(requestMethod) || (statusCode >= 100 && statusCode < 200)
                || statusCode == 204 || statusCode == 304;
    }

    // Set-Cookie values arrive joined by a line separator, one header line each
    private static void writeHeader(OutputStream out, String name, String value) throws IOException {
        for (String line : value.split(HEADER_LINE_SEPARATOR)) {
            writeAscii(out, name + ": " + line + "\r\n");
        }
    }

    /**
     * Short plain-text answer generated by the proxy itself. Always closes the connection.
     */
    public static void writeError(OutputStream out, int statusCode, String message) throws IOException {
        writeResponse(out, statusCode, Map.of("Content-Type", "text/plain; charset=utf-8"),
                message.getBytes(StandardCharsets.UTF_8), false);
    }

    public static void writeTunnelEstablished(OutputStream out) throws IOException {
        writeAscii(out, TUNNEL_ESTABLISHED);
        out.flush();
    }

    /**
     * Bare status line used to refuse a CONNECT; no body follows.
     */
    public static void writeTunnelRefused(OutputStream out, int statusCode) throws IOException {
        writeAscii(out, "HTTP/1.1 " + statusCode + " " + getReasonPhrase(statusCode) + "\r\nConnection: close\r\n\r\n");
        out.flush();
    }

    static String getReasonPhrase(int statusCode) {
        return switch (statusCode) {
            case 100 -> "Continue";
            case 200 -> "OK";
            case 201 -> "Created";
            case 202 -> "Accepted";
            case 204 -> "No Content";
            case 206 -> "Partial Content";
            case 301 -> "Moved Permanently";
            case 302 -> "Found";
            case 303 -> "See Other";
            case 304 -> "Not Modified";
            case 307 -> "Temporary Redirect";
            case 308 -> "Permanent Redirect";
            case 400 -> "Bad Request";
            case 401 -> "Unauthorized";
            case 403 -> "Forbidden";
            case 404 -> "Not Found";
            case 405 -> "Method Not Allowed";
            case 409 -> "Conflict";
            case 429 -> "Too Many Requests";
            case 500 -> "Internal Server Error";
            case 502 -> "Bad Gateway";
            case 503 -> "Service Unavailable";
            case 504 -> "Gateway Timeout";
            default -> "Unknown Status";
        };
    }

    private static void writeAscii(OutputStream out, String text) throws IOException {
        out.write(text.getBytes(StandardCharsets.ISO_8859_1));
    }
}

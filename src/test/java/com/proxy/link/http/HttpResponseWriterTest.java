package com.proxy.link.http;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HttpResponseWriterTest {

    @Test
    void recomputesFramingHeaders() throws Exception {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "text/plain");
        headers.put("Transfer-Encoding", "chunked");
        headers.put("content-length", "999");
        headers.put("Connection", "close");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        HttpResponseWriter.writeResponse(out, 200, headers, "hello".getBytes(StandardCharsets.UTF_8), true);

        assertThat(out.toString(StandardCharsets.ISO_8859_1)).isEqualTo("HTTP/1.1 200 OK\r\n"
                + "Content-Type: text/plain\r\n"
                + "Content-Length: 5\r\n"
                + "Connection: keep-alive\r\n"
                + "\r\n"
                + "hello");
    }

    @Test
    void writesEachCookieOnItsOwnLine() throws Exception {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("set-cookie", "a=1; Expires=Wed, 21 Oct 2026 07:28:00 GMT\nb=2");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        HttpResponseWriter.writeResponse(out, "GET", 200, headers, new byte[0], false);

        assertThat(out.toString(StandardCharsets.ISO_8859_1)).isEqualTo("HTTP/1.1 200 OK\r\n"
                + "set-cookie: a=1; Expires=Wed, 21 Oct 2026 07:28:00 GMT\r\n"
                + "set-cookie: b=2\r\n"
                + "Content-Length: 0\r\n"
                + "Connection: close\r\n"
                + "\r\n");
    }

    @Test
    void headResponseKeepsOriginContentLengthAndHasNoBody() throws Exception {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("content-type", "text/html");
        headers.put("content-length", "1234");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        HttpResponseWriter.writeResponse(out, "HEAD", 200, headers, new byte[0], true);

        assertThat(out.toString(StandardCharsets.ISO_8859_1)).isEqualTo("HTTP/1.1 200 OK\r\n"
                + "content-type: text/html\r\n"
                + "Content-Length: 1234\r\n"
                + "Connection: keep-alive\r\n"
                + "\r\n");
    }

    @Test
    void notModifiedAndNoContentCarryNoBody() throws Exception {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("ETag", "\"v1\"");
        ByteArrayOutputStream notModified = new ByteArrayOutputStream();
        ByteArrayOutputStream noContent = new ByteArrayOutputStream();

        HttpResponseWriter.writeResponse(notModified, "GET", 304, headers, new byte[0], true);
        HttpResponseWriter.writeResponse(noContent, "DELETE", 204, Map.of("Content-Length", "0"), new byte[0], true);

        assertThat(notModified.toString(StandardCharsets.ISO_8859_1)).isEqualTo("HTTP/1.1 304 Not Modified\r\n"
                + "ETag: \"v1\"\r\n"
                + "Connection: keep-alive\r\n"
                + "\r\n");
        assertThat(noContent.toString(StandardCharsets.ISO_8859_1)).isEqualTo("HTTP/1.1 204 No Content\r\n"
                + "Connection: keep-alive\r\n"
                + "\r\n");
    }

    @Test
    void errorIsPlainTextAndClosesConnection() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        HttpResponseWriter.writeError(out, 504, "Gateway Timeout");

        String response = out.toString(StandardCharsets.ISO_8859_1);
        assertThat(response).startsWith("HTTP/1.1 504 Gateway Timeout\r\n");
        assertThat(response).contains("Content-Type: text/plain; charset=utf-8\r\n", "Connection: close\r\n");
        assertThat(response).endsWith("\r\n\r\nGateway Timeout");
    }

    @Test
    void tunnelStatusLines() throws Exception {
        ByteArrayOutputStream established = new ByteArrayOutputStream();
        ByteArrayOutputStream refused = new ByteArrayOutputStream();

        HttpResponseWriter.writeTunnelEstablished(established);
        HttpResponseWriter.writeTunnelRefused(refused, 502);

        assertThat(established.toString(StandardCharsets.ISO_8859_1)).isEqualTo("HTTP/1.1 200 Connection Established\r\n\r\n");
        assertThat(refused.toString(StandardCharsets.ISO_8859_1)).isEqualTo("HTTP/1.1 502 Bad Gateway\r\nConnection: close\r\n\r\n");
    }

    @Test
    void unknownStatusStillGetsAReasonPhrase() {
        assertThat(HttpResponseWriter.getReasonPhrase(599)).isNotBlank();
    }
}

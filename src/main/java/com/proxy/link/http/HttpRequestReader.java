package com.proxy.link.http;

import com.proxy.link.utils.ByteStreamUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ProtocolException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads HTTP/1.x proxy requests (absolute-form, origin-form with a Host header, or CONNECT authority-form)
 * from a client stream. Bodies are read fully, by Content-Length or by de-chunking.
 */
@Slf4j
@RequiredArgsConstructor
public class HttpRequestReader {

    private static final Pattern REQUEST_LINE_PATTERN = Pattern.compile("(?<method>[A-Z]+)\\s+(?<uri>\\S+)\\s+(?<version>HTTP/1\\.[01])");
    private static final Pattern HEADER_PATTERN = Pattern.compile("(?<name>[^:\\s]+)\\s*:\\s*(?<value>.*)");
    private static final int MAX_LINE_LENGTH = 64 * 1024;
    private static final int MAX_HEADER_COUNT = 200;

    private final InputStream in;

    /**
     * @return the next request, or {@code null} if the client closed the connection between requests
     * @throws ProtocolException on a malformed request line, header block or body framing
     */
    public ProxyHttpRequest read() throws IOException {
        String requestLine = readLine();
        // tolerate stray CRLFs between pipelined requests
        while (requestLine != null && requestLine.isEmpty()) {
            requestLine = readLine();
        }
        if (requestLine == null) {
            return null;
        }
        Matcher requestMatcher = REQUEST_LINE_PATTERN.matcher(requestLine);
        if (!requestMatcher.matches()) {
            throw new ProtocolException("Malformed request line: " + requestLine);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        String line;
        while ((line = readLine()) != null && !line.isEmpty()) {
            Matcher headerMatcher = HEADER_PATTERN.matcher(line);
            if (!headerMatcher.matches()) {
                log.warn("Malformed header line: {}", line);
                continue;
            }
            if (headers.size() >= MAX_HEADER_COUNT) {
                throw new ProtocolException("Too many request headers");
            }
            String name = headerMatcher.group("name");
            String value = headerMatcher.group("value").trim();
            headers.merge(name, value, (existing, added) -> existing + ", " + added);
        }
        if (line == null) {
            throw new ProtocolException("Connection closed inside request headers");
        }

        String method = requestMatcher.group("method");
        byte[] body = "CONNECT".equals(method) ? new byte[0] : readBody(headers);
        return new ProxyHttpRequest(method, requestMatcher.group("uri"), requestMatcher.group("version"), headers, body);
    }

    private byte[] readBody(Map<String, String> headers) throws IOException {
        String transferEncoding = removeHeader(headers, "Transfer-Encoding");
        if (transferEncoding != null && transferEncoding.toLowerCase().contains("chunked")) {
            return readChunkedBody();
        }
        String contentLength = findHeader(headers, "Content-Length");
        if (contentLength == null) {
            return new byte[0];
        }
        int length;
        try {
            length = Integer.parseInt(contentLength.trim());
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length header: " + contentLength);
        }
        if (length < 0) {
            throw new ProtocolException("Negative Content-Length: " + length);
        }
        byte[] body = new byte[length];
        ByteStreamUtils.readFully(in, body, 0, length);
        return body;
    }

    private byte[] readChunkedBody() throws IOException {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        while (true) {
            String line = readLine();
            if (line == null) {
                throw new ProtocolException("Unexpected end of stream while reading chunk size");
            }
            int chunkSize;
            try {
                chunkSize = Integer.parseInt(line.trim().split(";")[0], 16);
            } catch (NumberFormatException e) {
                throw new ProtocolException("Invalid chunk size format: " + line);
            }
            if (chunkSize == 0) {
                // trailers are dropped
                while ((line = readLine()) != null && !line.isEmpty()) {
                    log.trace("Dropping chunk trailer: {}", line);
                }
                return body.toByteArray();
            }
            byte[] chunk = new byte[chunkSize];
            ByteStreamUtils.readFully(in, chunk, 0, chunkSize);
            body.write(chunk);
            line = readLine();
            if (line == null || !line.isEmpty()) {
                throw new ProtocolException("Expected CRLF after chunk data, but got: '" + line + "'");
            }
        }
    }

    private String readLine() throws IOException {
        ByteArrayOutputStream lineBuffer = new ByteArrayOutputStream();
        int currentChar;
        while ((currentChar = in.read()) != -1) {
            if (currentChar == '\n') {
                byte[] bytes = lineBuffer.toByteArray();
                int length = bytes.length > 0 && bytes[bytes.length - 1] == '\r' ? bytes.length - 1 : bytes.length;
                return new String(bytes, 0, length, StandardCharsets.ISO_8859_1);
            }
            if (lineBuffer.size() >= MAX_LINE_LENGTH) {
                throw new ProtocolException("Request line or header exceeds " + MAX_LINE_LENGTH + " bytes");
            }
            lineBuffer.write(currentChar);
        }
        return lineBuffer.size() == 0 ? null : lineBuffer.toString(StandardCharsets.ISO_8859_1);
    }

    private static String findHeader(Map<String, String> headers, String name) {
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String removeHeader(Map<String, String> headers, String name) {
        String value = findHeader(headers, name);
        headers.keySet().removeIf(key -> key.equalsIgnoreCase(name));
        return value;
    }
}

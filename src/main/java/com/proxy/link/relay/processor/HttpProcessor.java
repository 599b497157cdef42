package com.proxy.link.relay.processor;

import com.proxy.link.config.RelayConfig;
import com.proxy.link.protocol.MalformedEnvelopeException;
import com.proxy.link.protocol.RequestEnvelope;
import com.proxy.link.protocol.ResponseEnvelope;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.regex.Pattern;

import static com.proxy.link.protocol.ProxyProtocolConstants.HEADER_LINE_SEPARATOR;

/**
 * Executes the real outbound HTTP(S) call for a request envelope. Every outcome, including failures,
 * completes the returned future with a response envelope; nothing is propagated as a raw fault.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "proxy", name = "mode", havingValue = "relay")
public class HttpProcessor {

    private static final Pattern ABSOLUTE_URL_PATTERN = Pattern.compile("^https?://.*", Pattern.CASE_INSENSITIVE);

    // Managed by HttpClient itself, or hop-by-hop and meaningless past the proxy
    private static final Set<String> EXCLUDED_REQUEST_HEADERS = Set.of(
            "host", "connection", "content-length", "expect", "upgrade",
            "proxy-connection", "keep-alive", "proxy-authorization", "te", "trailer", "transfer-encoding");

    private static final String SET_COOKIE = "set-cookie";

    private final RelayConfig relayConfig;

    private HttpClient httpClient;

    @PostConstruct
    public void init() {
        this.httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(relayConfig.getConnectTimeout())
                // redirects belong to the original client
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
        log.info("HttpProcessor initialized with HttpClient.");
    }

    /**
     * @return a future that always completes normally, with the origin's answer or a synthetic 4xx/5xx envelope
     */
    public CompletableFuture<ResponseEnvelope> execute(RequestEnvelope envelope) {
        HttpRequest request;
        try {
            request = buildRequest(envelope);
        } catch (MalformedEnvelopeException | IllegalArgumentException e) {
            log.error("Rejecting request envelope {} {}: {}", envelope.getMethod(), envelope.getTarget(), e.getMessage());
            return CompletableFuture.completedFuture(ResponseEnvelope.error(400, "Bad Request: " + e.getMessage()));
        }

        log.debug("Making actual HTTP request: {} {}", request.method(), request.uri());
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray()).handle((httpResponse, throwable) -> {
            if (throwable != null) {
                return failureEnvelope(request.uri(), throwable);
            }
            log.debug("Received {} from {}", httpResponse.statusCode(), request.uri());
            return ResponseEnvelope.of(httpResponse.statusCode(), flattenHeaders(httpResponse.headers().map()), httpResponse.body());
        });
    }

    HttpRequest buildRequest(RequestEnvelope envelope) throws MalformedEnvelopeException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(resolveTargetUri(envelope))
                .timeout(relayConfig.getRequestTimeout());
        if (envelope.getHeaders() != null) {
            envelope.getHeaders().forEach((name, value) -> {
                if (EXCLUDED_REQUEST_HEADERS.contains(name.toLowerCase())) {
                    return;
                }
                try {
                    builder.header(name, value);
                } catch (IllegalArgumentException e) {
                    log.warn("Dropping header {} the HTTP client refuses: {}", name, e.getMessage());
                }
            });
        }
        byte[] body;
        try {
            body = envelope.getBodyBytes();
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException("Request body is not valid Base64", e);
        }
        builder.method(envelope.getMethod().toUpperCase(),
                body.length > 0 ? HttpRequest.BodyPublishers.ofByteArray(body) : HttpRequest.BodyPublishers.noBody());
        return builder.build();
    }

    /**
     * Absolute {@code http(s)://} targets are used as they are; anything else is taken as a path on the
     * envelope's {@code Host}, over plain http.
     */
    static URI resolveTargetUri(RequestEnvelope envelope) throws MalformedEnvelopeException {
        String target = envelope.getTarget();
        String url;
        if (ABSOLUTE_URL_PATTERN.matcher(target).matches()) {
            url = target;
        } else {
            String host = envelope.header("Host");
            if (host == null || host.isBlank()) {
                throw new MalformedEnvelopeException("Could not determine target URI (no absolute URL or Host header)");
            }
            url = "http://" + host.trim() + (target.startsWith("/") ? target : "/" + target);
        }
        try {
            URI uri = new URI(url);
            if (uri.getHost() == null) {
                throw new MalformedEnvelopeException("Target URL has no host: " + url);
            }
            return uri;
        } catch (URISyntaxException e) {
            throw new MalformedEnvelopeException("Invalid target URL: " + url, e);
        }
    }

    private static ResponseEnvelope failureEnvelope(URI uri, Throwable throwable) {
        Throwable cause = unwrap(throwable);
        String reason = describe(cause);
        if (cause instanceof HttpTimeoutException && !(cause instanceof HttpConnectTimeoutException)) {
            log.error("Outbound request to {} timed out: {}", uri, reason);
            return ResponseEnvelope.error(504, "Gateway Timeout: " + reason);
        }
        log.error("Error making actual HTTP request to {}: {}", uri, reason);
        return ResponseEnvelope.error(502, "Bad Gateway: " + reason);
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    static String describe(Throwable cause) {
        StringBuilder reason = new StringBuilder(cause.getClass().getSimpleName());
        if (cause.getMessage() != null) {
            reason.append(": ").append(cause.getMessage());
        }
        // ConnectException often carries its real reason one level down, e.g. UnresolvedAddressException
        Throwable inner = cause.getCause();
        if (inner != null && inner != cause) {
            reason.append(" (").append(inner.getClass().getSimpleName());
            if (inner.getMessage() != null) {
                reason.append(": ").append(inner.getMessage());
            }
            reason.append(')');
        }
        return reason.toString();
    }

    static Map<String, String> flattenHeaders(Map<String, List<String>> headers) {
        Map<String, String> flattened = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            // HTTP/2 pseudo headers never reach an HTTP/1.1 client
            if (!name.startsWith(":")) {
                // cookie values may contain commas and must stay separate lines
                String separator = SET_COOKIE.equalsIgnoreCase(name) ? HEADER_LINE_SEPARATOR : ", ";
                flattened.put(name, String.join(separator, values));
            }
        });
        return flattened;
    }
}

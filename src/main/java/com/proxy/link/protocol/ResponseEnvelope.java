package com.proxy.link.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of a {@link FrameType#RESPONSE} frame answering an HTTP request envelope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResponseEnvelope {

    private int statusCode;
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();
    // Base64
    @Builder.Default
    private String body = "";

    public static ResponseEnvelope of(int statusCode, Map<String, String> headers, byte[] body) {
        return new ResponseEnvelope(statusCode, headers, Base64.getEncoder().encodeToString(body));
    }

    /**
     * Synthetic answer produced by the relay itself, with a plain-text reason as body.
     */
    public static ResponseEnvelope error(int statusCode, String reason) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("content-type", "text/plain; charset=utf-8");
        return of(statusCode, headers, reason.getBytes(StandardCharsets.UTF_8));
    }

    @JsonIgnore
    public byte[] getBodyBytes() {
        return body == null || body.isEmpty() ? new byte[0] : Base64.getDecoder().decode(body);
    }
}

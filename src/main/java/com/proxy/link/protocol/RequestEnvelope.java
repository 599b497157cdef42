package com.proxy.link.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload of a {@link FrameType#REQUEST} frame. {@code url} carries the absolute-form URL, a
 * host-relative path, or {@code host:port} for CONNECT; {@code path} is accepted as an alternative.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class RequestEnvelope {

    private String method;
    private String url;
    private String path;
    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();
    // Base64
    private String body;

    @JsonIgnore
    public boolean isConnect() {
        return ProxyProtocolConstants.CONNECT_METHOD.equalsIgnoreCase(method);
    }

    /**
     * @return {@code url} if present, otherwise {@code path}, otherwise {@code "/"}
     */
    @JsonIgnore
    public String getTarget() {
        if (url != null && !url.isEmpty()) {
            return url;
        }
        return path != null && !path.isEmpty() ? path : "/";
    }

    /**
     * Case-insensitive header lookup; headers keep the case they were received with.
     */
    public String header(String name) {
        if (headers == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(name)) {
                return entry.getValue();
            }
        }
        return null;
    }

    @JsonIgnore
    public byte[] getBodyBytes() {
        return body == null || body.isEmpty() ? new byte[0] : Base64.getDecoder().decode(body);
    }

    public static String encodeBody(byte[] bytes) {
        return bytes == null || bytes.length == 0 ? null : Base64.getEncoder().encodeToString(bytes);
    }
}

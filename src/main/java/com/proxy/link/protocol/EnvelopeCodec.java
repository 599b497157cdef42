package com.proxy.link.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON mapping between envelopes and frame payloads.
 */
public final class EnvelopeCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private EnvelopeCodec() {}

    public static byte[] serialize(Object envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            // envelopes are plain beans; failing here is a programming error
            throw new UncheckedIOException(e);
        }
    }

    public static Frame requestFrame(RequestEnvelope envelope) {
        return new Frame(FrameType.REQUEST, serialize(envelope));
    }

    public static Frame responseFrame(ResponseEnvelope envelope) {
        return new Frame(FrameType.RESPONSE, serialize(envelope));
    }

    public static RequestEnvelope readRequest(byte[] payload) throws MalformedEnvelopeException {
        RequestEnvelope envelope = deserialize(payload, RequestEnvelope.class);
        if (envelope.getMethod() == null || envelope.getMethod().isEmpty()) {
            throw new MalformedEnvelopeException("Request envelope has no method");
        }
        return envelope;
    }

    public static ResponseEnvelope readResponse(byte[] payload) throws MalformedEnvelopeException {
        ResponseEnvelope envelope = deserialize(payload, ResponseEnvelope.class);
        if (envelope.getStatusCode() < 100 || envelope.getStatusCode() > 999) {
            throw new MalformedEnvelopeException("Response envelope has invalid status " + envelope.getStatusCode());
        }
        try {
            envelope.getBodyBytes();
        } catch (IllegalArgumentException e) {
            throw new MalformedEnvelopeException("Response body is not valid Base64", e);
        }
        return envelope;
    }

    private static <T> T deserialize(byte[] payload, Class<T> type) throws MalformedEnvelopeException {
        try {
            T value = objectMapper.readValue(payload, type);
            if (value == null) {
                throw new MalformedEnvelopeException("Empty " + type.getSimpleName());
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new MalformedEnvelopeException("Unparseable " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        } catch (MalformedEnvelopeException e) {
            throw e;
        } catch (IOException e) {
            throw new MalformedEnvelopeException("Unreadable " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}

package com.proxy.link.protocol;

import java.io.IOException;

public class MalformedEnvelopeException extends IOException {

    public MalformedEnvelopeException(String message, Throwable cause) {
        super(message, cause);
    }

    public MalformedEnvelopeException(String message) {
        super(message);
    }
}

package com.example.i18n.web;

import com.example.i18n.response.Payload;

/**
 * Thrown from a handler to answer with the envelope for {@code code}
 * instead of returning one. The message, when present, is the trace
 * description shown in debug mode.
 */
public class ResponseCodeException extends RuntimeException {

    private final int code;
    private final transient Payload payload;

    public ResponseCodeException(int code) {
        this(code, Payload.empty(), null, null);
    }

    public ResponseCodeException(int code, String message) {
        this(code, Payload.empty(), message, null);
    }

    public ResponseCodeException(int code, String message, Throwable cause) {
        this(code, Payload.empty(), message, cause);
    }

    public ResponseCodeException(int code, Payload payload, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.payload = payload == null ? Payload.empty() : payload;
    }

    public int getCode() {
        return code;
    }

    public Payload getPayload() {
        return payload;
    }
}

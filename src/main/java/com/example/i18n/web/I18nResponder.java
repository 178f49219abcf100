package com.example.i18n.web;

import com.example.i18n.config.I18nProperties;
import com.example.i18n.resolve.RequestSignals;
import com.example.i18n.response.Envelope;
import com.example.i18n.response.EnvelopeAssembler;
import com.example.i18n.response.Payload;
import com.fasterxml.jackson.core.JsonProcessingException;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Writes localized envelopes from controller methods.
 *
 * <pre>
 * &#64;GetMapping("/users/{id}")
 * public ResponseEntity&lt;byte[]&gt; user(@PathVariable String id, HttpServletRequest request) {
 *     return responder.json(request, 1000, Payload.withParams(userService.find(id), "Seakee", id), null);
 * }
 * </pre>
 *
 * <p>The HTTP status is always 200; the outcome travels in the envelope code.
 */
public class I18nResponder {

    /** Request attribute receiving the envelope code, for filters running after the handler. */
    public static final String RESPONSE_CODE_ATTRIBUTE = "response_code";

    private final EnvelopeAssembler assembler;
    private final EnvelopeWriter writer;
    private final I18nProperties properties;

    public I18nResponder(EnvelopeAssembler assembler, EnvelopeWriter writer, I18nProperties properties) {
        this.assembler = assembler;
        this.writer = writer;
        this.properties = properties;
    }

    public ResponseEntity<byte[]> json(HttpServletRequest request, int code, Payload payload, Throwable err) {
        return respond(ResponseFormat.JSON, request, code, payload, err);
    }

    public ResponseEntity<byte[]> jsonp(HttpServletRequest request, int code, Payload payload, Throwable err) {
        return respond(ResponseFormat.JSONP, request, code, payload, err);
    }

    public ResponseEntity<byte[]> asciiJson(HttpServletRequest request, int code, Payload payload, Throwable err) {
        return respond(ResponseFormat.ASCII_JSON, request, code, payload, err);
    }

    public ResponseEntity<byte[]> pureJson(HttpServletRequest request, int code, Payload payload, Throwable err) {
        return respond(ResponseFormat.PURE_JSON, request, code, payload, err);
    }

    public ResponseEntity<byte[]> xml(HttpServletRequest request, int code, Payload payload, Throwable err) {
        return respond(ResponseFormat.XML, request, code, payload, err);
    }

    public ResponseEntity<byte[]> yaml(HttpServletRequest request, int code, Payload payload, Throwable err) {
        return respond(ResponseFormat.YAML, request, code, payload, err);
    }

    public ResponseEntity<byte[]> respond(ResponseFormat format, HttpServletRequest request,
                                          int code, Payload payload, Throwable err) {
        request.setAttribute(RESPONSE_CODE_ATTRIBUTE, code);
        Envelope envelope = envelope(request, code, payload, err);
        String callback = format == ResponseFormat.JSONP
                ? request.getParameter(properties.getCallbackParam())
                : null;

        byte[] body;
        try {
            body = writer.write(format, envelope, callback);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to write " + format + " envelope for code " + code, ex);
        }
        return ResponseEntity.status(HttpStatus.OK)
                .contentType(format.getMediaType())
                .body(body);
    }

    /** Builds the envelope without writing it, for handlers that return it through Spring's converters. */
    public Envelope envelope(HttpServletRequest request, int code, Payload payload, Throwable err) {
        return assembler.assemble(code, payload, err, signals(request));
    }

    RequestSignals signals(HttpServletRequest request) {
        Object traceId = request.getAttribute(properties.getTraceIdAttribute());
        return new RequestSignals(
                request.getHeader(properties.getLangHeader()),
                request.getHeader(HttpHeaders.USER_AGENT),
                request.getHeader(properties.getDebugHeader()),
                traceId != null ? traceId.toString() : null);
    }
}

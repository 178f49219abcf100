package com.example.i18n.web;

import com.example.i18n.response.Payload;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Answers exceptions escaping a handler with a JSON envelope. Ordered last
 * so application advice takes precedence.
 */
@RestControllerAdvice
@Order(Ordered.LOWEST_PRECEDENCE)
public class EnvelopeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(EnvelopeExceptionHandler.class);

    static final int VALIDATION_ERROR_CODE = 400;

    private final I18nResponder responder;
    private final int errorCode;

    public EnvelopeExceptionHandler(I18nResponder responder, int errorCode) {
        this.responder = responder;
        this.errorCode = errorCode;
    }

    @ExceptionHandler(ResponseCodeException.class)
    public ResponseEntity<byte[]> handleResponseCode(ResponseCodeException ex, HttpServletRequest request) {
        log.debug("Handler for {} answered with code {}: {}", request.getRequestURI(), ex.getCode(), ex.getMessage());
        Throwable err = ex.getMessage() != null ? ex : ex.getCause();
        return responder.json(request, ex.getCode(), ex.getPayload(), err);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<byte[]> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String msg = ex.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .orElse("Validation error");
        log.debug("Validation failed for {}: {}", request.getRequestURI(), msg);
        return responder.json(request, VALIDATION_ERROR_CODE, Payload.empty(), new IllegalArgumentException(msg, ex));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<byte[]> handleOther(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse) {
            int status = errorResponse.getStatusCode().value();
            log.warn("Request {} {} failed with status {}: {}",
                    request.getMethod(), request.getRequestURI(), status, ex.getMessage());
            return responder.json(request, status, Payload.empty(), ex);
        }
        log.error("Unexpected exception for path {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return responder.json(request, errorCode, Payload.empty(), ex);
    }
}

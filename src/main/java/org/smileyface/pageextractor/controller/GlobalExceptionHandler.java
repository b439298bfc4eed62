package org.smileyface.pageextractor.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.pageextractor.service.DispatcherUnavailableException;
import org.smileyface.pageextractor.service.ExtractionTimeoutException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps failures to the {@code {"error": "..."}} envelope used by every endpoint.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ExtractionTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleTimeout(ExtractionTimeoutException ex) {
        log.warn("Extraction of {} timed out after {} ms", ex.getUrl(),
                ex.getWaited() != null ? ex.getWaited().toMillis() : -1);
        return build(HttpStatus.GATEWAY_TIMEOUT, ex.getMessage());
    }

    @ExceptionHandler(DispatcherUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUnavailable(DispatcherUnavailableException ex) {
        return build(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
    }

    /**
     * Missing body and malformed JSON both surface as unreadable messages; only the wording differs.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        String msg = ex.getMessage();
        if (msg != null && msg.startsWith("Required request body is missing")) {
            return build(HttpStatus.BAD_REQUEST, "empty body");
        }
        return build(HttpStatus.BAD_REQUEST, "invalid JSON");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return build(HttpStatus.BAD_REQUEST, "invalid JSON");
    }

    @ExceptionHandler({NoHandlerFoundException.class, NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(Exception ex) {
        return build(HttpStatus.NOT_FOUND, "not found");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
        log.error("Unhandled error while serving request", ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "extraction failed");
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error) {
        return ResponseEntity.status(status).body(ErrorResponse.of(error));
    }
}

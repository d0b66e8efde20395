package org.learningjava.macrohub.infrastructure.adapter.in.web;

import org.learningjava.macrohub.domain.error.KeyCommandsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

import java.util.Map;

/**
 * Turns pipeline failures into {@code {"error": kind, "message": user message}} responses.
 */
@RestControllerAdvice
public class KeyCommandsExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(KeyCommandsExceptionHandler.class);

    @ExceptionHandler(KeyCommandsException.class)
    public ResponseEntity<Map<String, String>> onKeyCommandsFailure(KeyCommandsException e) {
        HttpStatus status = statusOf(e.kind());
        log.warn("{} -> {}: {}", e.kind(), status.value(), e.getMessage());
        return ResponseEntity.status(status)
                .body(Map.of("error", e.kind().name(), "message", e.userMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, String>> onUploadTooLarge(MaxUploadSizeExceededException e) {
        log.warn("Upload rejected by the servlet container: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(Map.of("error", KeyCommandsException.Kind.INPUT_TOO_LARGE.name(),
                        "message", "File is too large."));
    }

    static HttpStatus statusOf(KeyCommandsException.Kind kind) {
        return switch (kind) {
            case MALFORMED_XML -> HttpStatus.BAD_REQUEST;
            case SCHEMA, NO_MACRO_DATA -> HttpStatus.UNPROCESSABLE_ENTITY;
            case SNIPPET_REPARSE -> HttpStatus.CONFLICT;
            case INPUT_TOO_LARGE -> HttpStatus.PAYLOAD_TOO_LARGE;
        };
    }
}

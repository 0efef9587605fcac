package com.clubcricket.scorebook.controller;

import com.clubcricket.scorebook.exception.IllegalStateTransitionException;
import com.clubcricket.scorebook.exception.InvalidDeliveryException;
import com.clubcricket.scorebook.exception.NotFoundException;
import com.clubcricket.scorebook.exception.NothingToUndoException;
import com.clubcricket.scorebook.exception.ScoringException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps business-rule rejections to status codes with a {@code {"error", "message"}} body.
 * Anything unexpected is logged and answered with an opaque 500.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(InvalidDeliveryException.class)
    public ResponseEntity<Map<String, String>> invalidDelivery(InvalidDeliveryException e) {
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(IllegalStateTransitionException.class)
    public ResponseEntity<Map<String, String>> illegalTransition(IllegalStateTransitionException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(NothingToUndoException.class)
    public ResponseEntity<Map<String, String>> nothingToUndo(NothingToUndoException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badArgument(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, String>> malformed(Exception e) {
        log.debug("[Api] malformed request: {}", e.getMessage());
        return body(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Malformed request");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> unexpected(Exception e) {
        log.error("[Api] unexpected failure", e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", "Internal error");
    }

    private ResponseEntity<Map<String, String>> respond(HttpStatus status, ScoringException e) {
        log.debug("[Api] {} {}: {}", status.value(), e.getCode(), e.getMessage());
        return body(status, e.getCode(), e.getMessage());
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatus status, String code, String message) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("error", code);
        out.put("message", message);
        return ResponseEntity.status(status).body(out);
    }
}

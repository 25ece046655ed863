package com.rabs.backend.global.error;

import java.util.stream.Collectors;

import jakarta.servlet.http.HttpServletRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Problem responses for the CRUD endpoints. Loom operations do not reach this
 * handler for business failures; they answer with a {@code LoomResult} envelope.
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<ProblemResponse> handleProblemException(ProblemException ex, HttpServletRequest request) {
        log.debug("{} {} -> {} {}", request.getMethod(), request.getRequestURI(), ex.getHttpStatus().value(), ex.getCode());
        return respond(ProblemResponse.from(ex, request.getRequestURI()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ProblemResponse> handleResponseStatusException(ResponseStatusException ex,
                                                                         HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return respond(ProblemResponse.of(status, status.name(), ex.getReason(), request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemResponse> handleValidationException(MethodArgumentNotValidException ex,
                                                                     HttpServletRequest request) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return respond(ProblemResponse.of(HttpStatus.UNPROCESSABLE_ENTITY, "VALIDATION_ERROR",
                detail.isEmpty() ? "Validation failed" : detail, request.getRequestURI()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                              HttpServletRequest request) {
        String detail = ex.getName() + ": invalid value '" + ex.getValue() + "'";
        return respond(ProblemResponse.of(HttpStatus.BAD_REQUEST, "INVALID_PARAMETER", detail, request.getRequestURI()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemResponse> handleUnreadableBody(HttpMessageNotReadableException ex,
                                                                HttpServletRequest request) {
        return respond(ProblemResponse.of(HttpStatus.BAD_REQUEST, "MALFORMED_REQUEST",
                "Request body could not be read", request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemResponse> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), ex);
        return respond(ProblemResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                null, request.getRequestURI()));
    }

    private static ResponseEntity<ProblemResponse> respond(ProblemResponse body) {
        return ResponseEntity.status(body.status()).body(body);
    }
}

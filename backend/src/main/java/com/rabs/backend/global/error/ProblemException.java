package com.rabs.backend.global.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Business rule violation carrying a stable upper-case code. Services throw it;
 * the loom facade and {@link RestExceptionHandler} translate it for callers.
 */
public class ProblemException extends ResponseStatusException {

    private final String code;
    private final String detail;

    public ProblemException(HttpStatus status, String code, String detail) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
    }

    public static ProblemException notFound(String code, String detail) {
        return new ProblemException(HttpStatus.NOT_FOUND, code, detail);
    }

    public static ProblemException badRequest(String code, String detail) {
        return new ProblemException(HttpStatus.BAD_REQUEST, code, detail);
    }

    public static ProblemException conflict(String code, String detail) {
        return new ProblemException(HttpStatus.CONFLICT, code, detail);
    }

    public HttpStatus getHttpStatus() {
        return HttpStatus.valueOf(getStatusCode().value());
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }
}

package com.rabs.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * RFC 7807 style body. {@code code} repeats the machine-readable error code so
 * clients need not parse {@code type}.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    static final String TYPE_PREFIX = "urn:problem:rabs:";

    public static ProblemResponse from(ProblemException ex, String instance) {
        return of(ex.getHttpStatus(), ex.getCode(), ex.getDetailMessage(), instance);
    }

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(typeOf(safeCode), httpStatus.getReasonPhrase(), httpStatus.value(),
                safeDetail, instance, safeCode);
    }

    static String typeOf(String code) {
        return TYPE_PREFIX + code.toLowerCase(Locale.ROOT).replace('_', '-');
    }
}

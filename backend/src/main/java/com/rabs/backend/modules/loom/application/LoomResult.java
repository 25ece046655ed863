package com.rabs.backend.modules.loom.application;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Uniform outcome of every loom engine operation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoomResult<T>(boolean success, String message, T data, Error error) {

    public static <T> LoomResult<T> ok(String message, T data) {
        return new LoomResult<>(true, message, data, null);
    }

    public static <T> LoomResult<T> insufficient(String code, String message, T data) {
        return new LoomResult<>(false, message, data, new Error(LoomFailureKind.INSUFFICIENT_RESOURCES, code, message));
    }

    public static <T> LoomResult<T> failure(LoomFailureKind kind, String code, String detail) {
        return new LoomResult<>(false, detail, null, new Error(kind, code, detail));
    }

    public record Error(LoomFailureKind kind, String code, String detail) {
    }
}

package com.contact.resolution.rest.dto;

import com.contact.resolution.core.exception.ErrorKind;

import java.time.Instant;

/**
 * Standardized error response DTO. {@code code} names the {@link ErrorKind} where one applies.
 */
public record ErrorResponse(
        int status,
        String error,
        String code,
        String message,
        String path,
        Instant timestamp
) {
    public ErrorResponse(int status, String error, String code, String message, String path) {
        this(status, error, code, message, path, Instant.now());
    }

    public static ErrorResponse of(ErrorKind kind, String message, String path) {
        return switch (kind) {
            case VALIDATION_ERROR, INVALID_MERGE -> new ErrorResponse(400, "Bad Request", kind.name(), message, path);
            case NOT_FOUND -> new ErrorResponse(404, "Not Found", kind.name(), message, path);
            case CONFLICT -> new ErrorResponse(409, "Conflict", kind.name(), message, path);
            case MIGRATION_FAILURE -> new ErrorResponse(500, "Internal Server Error", kind.name(), message, path);
        };
    }

    public static ErrorResponse badRequest(String message, String path) {
        return of(ErrorKind.VALIDATION_ERROR, message, path);
    }

    public static ErrorResponse notFound(String message, String path) {
        return of(ErrorKind.NOT_FOUND, message, path);
    }

    public static ErrorResponse internalError(String message, String path) {
        return new ErrorResponse(500, "Internal Server Error", "INTERNAL_ERROR", message, path);
    }
}

package com.contact.resolution.core.exception;

/**
 * Machine readable failure categories reported to callers.
 */
public enum ErrorKind {
    VALIDATION_ERROR,
    INVALID_MERGE,
    NOT_FOUND,
    CONFLICT,
    MIGRATION_FAILURE
}

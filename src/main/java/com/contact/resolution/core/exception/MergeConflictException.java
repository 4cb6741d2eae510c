package com.contact.resolution.core.exception;

import com.contact.resolution.merge.MergeState;

/**
 * A concurrent merge changed one of the contacts first.
 * Callers should re-run duplicate discovery before trying again.
 */
public class MergeConflictException extends ContactResolutionException {

    public MergeConflictException(String message, MergeState failedState) {
        super(ErrorKind.CONFLICT, message, failedState, null);
    }

    public MergeConflictException(String message, MergeState failedState, Throwable cause) {
        super(ErrorKind.CONFLICT, message, failedState, cause);
    }
}

package com.contact.resolution.core.exception;

import com.contact.resolution.merge.MergeState;

/**
 * Malformed input: blank ids, identity tuples with nothing to match on.
 */
public class ValidationException extends ContactResolutionException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message, null, null);
    }

    public ValidationException(String message, MergeState failedState) {
        super(ErrorKind.VALIDATION_ERROR, message, failedState, null);
    }
}

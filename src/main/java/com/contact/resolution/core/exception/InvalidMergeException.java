package com.contact.resolution.core.exception;

import com.contact.resolution.merge.MergeState;

/**
 * A merge request that can never succeed, such as merging a contact into itself.
 */
public class InvalidMergeException extends ContactResolutionException {

    public InvalidMergeException(String message) {
        super(ErrorKind.INVALID_MERGE, message, MergeState.REQUESTED, null);
    }
}

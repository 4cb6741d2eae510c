package com.contact.resolution.core.exception;

import com.contact.resolution.merge.MergeState;

/**
 * Storage failed while re-pointing records or writing the merge result.
 * Nothing from the failed merge is visible afterwards.
 */
public class MigrationFailureException extends ContactResolutionException {

    public MigrationFailureException(String message, MergeState failedState, Throwable cause) {
        super(ErrorKind.MIGRATION_FAILURE, message, failedState, cause);
    }
}

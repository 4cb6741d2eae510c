package com.contact.resolution.core.exception;

import com.contact.resolution.merge.MergeState;

import java.util.Optional;

/**
 * Base class for every failure the resolution library reports.
 * Merge failures also carry the state the merge was in when it failed.
 */
public abstract class ContactResolutionException extends RuntimeException {

    private final ErrorKind kind;
    private final MergeState failedState;

    protected ContactResolutionException(ErrorKind kind, String message, MergeState failedState, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.failedState = failedState;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Optional<MergeState> getFailedState() {
        return Optional.ofNullable(failedState);
    }
}

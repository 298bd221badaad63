package com.xksgroup.playlistsync.exception;

/**
 * Raised when a sync was cancelled explicitly or superseded by a newer sync.
 * Not a failure: the resource ends up CANCELLED, committed data is kept.
 */
public class SyncCancelledException extends RuntimeException {

    public SyncCancelledException(String message) {
        super(message);
    }

    public SyncCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}

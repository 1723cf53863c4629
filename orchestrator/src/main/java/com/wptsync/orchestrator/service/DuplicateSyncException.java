package com.wptsync.orchestrator.service;

import com.wptsync.orchestrator.model.FailureKind;

/**
 * A downstream sync already exists for the pull request.
 */
public class DuplicateSyncException extends SyncException {

    public DuplicateSyncException(int prId) {
        super(FailureKind.STATE_STORE_FAILURE, "A downstream sync already exists for PR " + prId);
    }

    public DuplicateSyncException(int prId, Throwable cause) {
        super(FailureKind.STATE_STORE_FAILURE, "A downstream sync already exists for PR " + prId, cause);
    }
}

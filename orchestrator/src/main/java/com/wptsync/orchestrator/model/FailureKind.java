package com.wptsync.orchestrator.model;

/**
 * Why a sync invocation stopped.
 *
 * CLASSIFICATION_FAILURE never aborts a sync: the routing classifier falls
 * back to the default component and only logs it.
 */
public enum FailureKind {
    FETCH_FAILURE,
    WORKSPACE_FAILURE,
    PATCH_RENDER_FAILURE,
    PATCH_APPLY_FAILURE,
    METADATA_REGEN_FAILURE,
    CLASSIFICATION_FAILURE,
    STATE_STORE_FAILURE,
    // Bugzilla rejected or did not answer a request other than a comment.
    TRACKER_FAILURE,
    TIMEOUT
}

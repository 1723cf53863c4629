package com.wptsync.orchestrator.service;

import com.wptsync.orchestrator.model.FailureKind;
import com.wptsync.orchestrator.model.SyncState;
import com.wptsync.orchestrator.routing.RoutingDecision;

/**
 * Result of one orchestrator invocation.
 *
 * @param state       state the sync ended in (REPORTED or ERROR)
 * @param failureKind why it failed, or null on success
 * @param message     diagnostic posted to the bug, or null on success
 * @param routing     component the bug was moved to, or null on failure
 */
public record SyncOutcome(
        SyncState       state,
        FailureKind     failureKind,
        String          message,
        RoutingDecision routing
) {
    public static SyncOutcome reported(RoutingDecision routing) {
        return new SyncOutcome(SyncState.REPORTED, null, null, routing);
    }

    public static SyncOutcome failed(FailureKind kind, String message) {
        return new SyncOutcome(SyncState.ERROR, kind, message, null);
    }

    public boolean success() {
        return failureKind == null;
    }
}

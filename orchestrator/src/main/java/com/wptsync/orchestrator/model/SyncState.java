package com.wptsync.orchestrator.model;

/**
 * States of one downstream sync invocation.
 *
 * Transitions (happy path):
 *   PENDING_INTAKE → FETCHING_SOURCE → TRANSLATING → UPDATING_METADATA
 *                  → CLASSIFYING → REPORTED
 *
 * Any non-terminal state can move to ERROR. A later CI event starts a new
 * invocation, which re-enters FETCHING_SOURCE from REPORTED or ERROR.
 */
public enum SyncState {
    PENDING_INTAKE,
    FETCHING_SOURCE,
    TRANSLATING,
    UPDATING_METADATA,
    CLASSIFYING,
    REPORTED,
    ERROR;

    public boolean isTerminal() {
        return this == REPORTED || this == ERROR;
    }
}

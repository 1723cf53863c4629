package com.wptsync.orchestrator.service;

import com.wptsync.orchestrator.model.FailureKind;

/**
 * A failure that ends a sync invocation, tagged with its {@link FailureKind}.
 *
 * Raised inside the engine and turned into a {@link SyncOutcome} by the
 * orchestrator; intake lets it reach the HTTP layer.
 */
public class SyncException extends RuntimeException {

    private final FailureKind kind;

    public SyncException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SyncException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() { return kind; }
}

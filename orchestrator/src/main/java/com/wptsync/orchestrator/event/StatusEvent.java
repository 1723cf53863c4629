package com.wptsync.orchestrator.event;

/**
 * A CI status change for a pull request's head commit.
 *
 * Unknown contexts and states are valid events; the reactor ignores them.
 */
public record StatusEvent(String context, String state, String sha) {

    public static final String PENDING = "pending";
    public static final String PASSED  = "passed";

    public StatusEvent {
        if (context == null || context.isBlank()) {
            throw new IllegalArgumentException("context is required");
        }
        if (state == null || state.isBlank()) {
            throw new IllegalArgumentException("state is required");
        }
        if (sha == null || sha.isBlank()) {
            throw new IllegalArgumentException("sha is required");
        }
    }

    public boolean isPending() { return PENDING.equals(state); }
    public boolean isPassed()  { return PASSED.equals(state); }
}

package com.wptsync.orchestrator.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Centralizes all valid sync state transitions.
 *
 * <p>Valid transitions:</p>
 * <pre>
 *   PENDING_INTAKE    → FETCHING_SOURCE, ERROR
 *   FETCHING_SOURCE   → TRANSLATING, ERROR
 *   TRANSLATING       → UPDATING_METADATA, ERROR
 *   UPDATING_METADATA → CLASSIFYING, ERROR
 *   CLASSIFYING       → REPORTED, ERROR
 *   REPORTED          → FETCHING_SOURCE
 *   ERROR             → FETCHING_SOURCE
 * </pre>
 */
public final class SyncStateMachine {

    private static final Map<SyncState, Set<SyncState>> TRANSITIONS;

    static {
        TRANSITIONS = new EnumMap<>(SyncState.class);
        TRANSITIONS.put(SyncState.PENDING_INTAKE,    EnumSet.of(SyncState.FETCHING_SOURCE, SyncState.ERROR));
        TRANSITIONS.put(SyncState.FETCHING_SOURCE,   EnumSet.of(SyncState.TRANSLATING, SyncState.ERROR));
        TRANSITIONS.put(SyncState.TRANSLATING,       EnumSet.of(SyncState.UPDATING_METADATA, SyncState.ERROR));
        TRANSITIONS.put(SyncState.UPDATING_METADATA, EnumSet.of(SyncState.CLASSIFYING, SyncState.ERROR));
        TRANSITIONS.put(SyncState.CLASSIFYING,       EnumSet.of(SyncState.REPORTED, SyncState.ERROR));
        TRANSITIONS.put(SyncState.REPORTED,          EnumSet.of(SyncState.FETCHING_SOURCE));
        TRANSITIONS.put(SyncState.ERROR,             EnumSet.of(SyncState.FETCHING_SOURCE));
    }

    private SyncStateMachine() {
    }

    /**
     * Validates a transition and returns the target state if it is permitted.
     *
     * @param from the current state
     * @param to   the desired state
     * @return {@code to} when the transition is valid
     * @throws IllegalStateException when the edge is not in the graph
     * @throws NullPointerException  if either argument is null
     */
    public static SyncState transition(SyncState from, SyncState to) {
        if (from == null || to == null) {
            throw new NullPointerException("from and to must not be null");
        }
        Set<SyncState> allowed = TRANSITIONS.getOrDefault(from, EnumSet.noneOf(SyncState.class));
        if (!allowed.contains(to)) {
            throw new IllegalStateException("Invalid sync transition: " + from + " → " + to);
        }
        return to;
    }

    public static boolean canTransition(SyncState from, SyncState to) {
        return TRANSITIONS.getOrDefault(from, EnumSet.noneOf(SyncState.class)).contains(to);
    }
}

package com.wptsync.orchestrator.api.dto;

import com.wptsync.orchestrator.model.FailureKind;
import com.wptsync.orchestrator.model.SyncState;
import com.wptsync.orchestrator.service.CiStatusReactor.Reaction;
import com.wptsync.orchestrator.service.CiStatusReactor.StatusReaction;
import com.wptsync.orchestrator.service.SyncOutcome;

/**
 * Response body for POST /syncs/{prId}/status and POST /syncs/{prId}/update.
 *
 * reaction is null for a direct update; state, failureKind, message and the
 * routing fields are null when no sync run happened.
 */
public record OutcomeResponse(
        Reaction    reaction,
        SyncState   state,
        FailureKind failureKind,
        String      message,
        String      product,
        String      component
) {
    public static OutcomeResponse from(StatusReaction reaction) {
        return from(reaction.reaction(), reaction.outcome());
    }

    public static OutcomeResponse from(SyncOutcome outcome) {
        return from(null, outcome);
    }

    private static OutcomeResponse from(Reaction reaction, SyncOutcome outcome) {
        if (outcome == null) {
            return new OutcomeResponse(reaction, null, null, null, null, null);
        }
        return new OutcomeResponse(
                reaction,
                outcome.state(),
                outcome.failureKind(),
                outcome.message(),
                outcome.routing() == null ? null : outcome.routing().product(),
                outcome.routing() == null ? null : outcome.routing().component());
    }
}

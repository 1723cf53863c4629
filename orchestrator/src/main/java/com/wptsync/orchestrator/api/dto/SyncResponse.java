package com.wptsync.orchestrator.api.dto;

import com.wptsync.orchestrator.model.FailureKind;
import com.wptsync.orchestrator.model.Sync;
import com.wptsync.orchestrator.model.SyncState;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /syncs, GET /syncs/{prId} and the operator actions.
 */
public record SyncResponse(
        UUID        id,
        int         prId,
        String      direction,
        Long        bugId,
        SyncState   state,
        FailureKind failureKind,
        String      lastError,
        String      upstreamWorktree,
        String      downstreamWorktree,
        Instant     createdAt,
        Instant     updatedAt
) {
    public static SyncResponse from(Sync sync) {
        return new SyncResponse(
                sync.getId(),
                sync.getPrId(),
                sync.getDirection().name(),
                sync.getBugId(),
                sync.getState(),
                sync.getFailureKind(),
                sync.getLastError(),
                sync.getUpstreamWorktree(),
                sync.getDownstreamWorktree(),
                sync.getCreatedAt(),
                sync.getUpdatedAt()
        );
    }
}

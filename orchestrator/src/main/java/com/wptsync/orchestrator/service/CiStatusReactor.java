package com.wptsync.orchestrator.service;

import com.wptsync.orchestrator.config.SyncProperties;
import com.wptsync.orchestrator.event.StatusEvent;
import com.wptsync.orchestrator.model.RepositoryKind;
import com.wptsync.orchestrator.model.Sync;
import com.wptsync.orchestrator.model.SyncDirection;
import com.wptsync.orchestrator.repository.SyncRepository;
import com.wptsync.orchestrator.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides what a CI status notification means for a sync.
 *
 * A {@code pending} status for a commit the sync's wpt worktree is already
 * at is a no-op; any other {@code pending} status re-runs the orchestrator.
 * That check is what makes repeated deliveries of the same status safe.
 * {@code passed} is accepted and does nothing yet.
 */
@Service
public class CiStatusReactor {

    private static final Logger log = LoggerFactory.getLogger(CiStatusReactor.class);

    public enum Reaction {
        IGNORED,     // unknown context or state
        UP_TO_DATE,  // worktree already at the reported commit
        SYNCED,      // orchestrator ran; see the outcome
        PASSED       // CI passed; nothing to do yet
    }

    /**
     * @param outcome the orchestrator result when {@code reaction == SYNCED}, else null
     */
    public record StatusReaction(Reaction reaction, SyncOutcome outcome) {
        static StatusReaction of(Reaction reaction) {
            return new StatusReaction(reaction, null);
        }
    }

    private final SyncRepository   syncRepo;
    private final WorkspaceManager workspaces;
    private final SyncOrchestrator orchestrator;
    private final String           ciContext;

    public CiStatusReactor(SyncRepository syncRepo,
                           WorkspaceManager workspaces,
                           SyncOrchestrator orchestrator,
                           SyncProperties properties) {
        this.syncRepo     = syncRepo;
        this.workspaces   = workspaces;
        this.orchestrator = orchestrator;
        this.ciContext    = properties.ciContext();
    }

    /**
     * React to a status event for PR {@code prId}.
     *
     * Runs in one transaction holding the sync's row lock, so a second
     * delivery of the same event waits for the first and then finds the
     * worktree up to date.
     *
     * @throws SyncNotFoundException if the PR has no downstream sync
     */
    @Transactional
    public StatusReaction onStatus(int prId, StatusEvent event) {
        if (!ciContext.equals(event.context())) {
            log.info("Ignoring status for context {}", event.context());
            return StatusReaction.of(Reaction.IGNORED);
        }

        Sync sync = syncRepo.lockByPr(RepositoryKind.UPSTREAM.repositoryName(), prId, SyncDirection.DOWNSTREAM)
                .orElseThrow(() -> new SyncNotFoundException(prId));

        if (event.isPending()) {
            if (workspaces.isAt(sync, RepositoryKind.UPSTREAM, event.sha())) {
                log.info("PR {} worktree already at {}, nothing to do", prId, event.sha());
                return StatusReaction.of(Reaction.UP_TO_DATE);
            }
            log.info("PR {} has new commits ({}), updating sync", prId, event.sha());
            return new StatusReaction(Reaction.SYNCED, orchestrator.run(sync));
        }
        if (event.isPassed()) {
            // TODO call TryPushService here once try pushes are started automatically
            log.info("CI passed for PR {} at {}", prId, event.sha());
            return StatusReaction.of(Reaction.PASSED);
        }

        log.info("Ignoring status state {} for PR {}", event.state(), prId);
        return StatusReaction.of(Reaction.IGNORED);
    }
}

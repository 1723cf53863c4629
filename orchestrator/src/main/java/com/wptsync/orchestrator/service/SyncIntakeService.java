package com.wptsync.orchestrator.service;

import com.wptsync.orchestrator.bugzilla.BugTracker;
import com.wptsync.orchestrator.event.ChangeRequestEvent;
import com.wptsync.orchestrator.model.FailureKind;
import com.wptsync.orchestrator.model.GitRepository;
import com.wptsync.orchestrator.model.RepositoryKind;
import com.wptsync.orchestrator.model.Sync;
import com.wptsync.orchestrator.model.SyncDirection;
import com.wptsync.orchestrator.repository.GitRepositoryRepository;
import com.wptsync.orchestrator.repository.SyncRepository;
import com.wptsync.orchestrator.routing.RoutingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Turns a newly opened web-platform-tests PR into a Sync and its bug.
 *
 * The Sync row and the bug are created in one transaction. The row is
 * flushed before Bugzilla is called, so a storage failure means no bug is
 * ever requested; a Bugzilla failure rolls the row back. Either way no bug
 * exists without a Sync and no Sync without a bug.
 */
@Service
public class SyncIntakeService {

    private static final Logger log = LoggerFactory.getLogger(SyncIntakeService.class);

    private final GitRepositoryRepository repositoryRepo;
    private final SyncRepository          syncRepo;
    private final BugTracker              bugTracker;

    public SyncIntakeService(GitRepositoryRepository repositoryRepo,
                             SyncRepository syncRepo,
                             BugTracker bugTracker) {
        this.repositoryRepo = repositoryRepo;
        this.syncRepo       = syncRepo;
        this.bugTracker     = bugTracker;
    }

    /**
     * Create the downstream sync and bug for a new PR.
     *
     * @throws DuplicateSyncException if the PR already has a downstream sync
     * @throws SyncException          with STATE_STORE_FAILURE if the row cannot be stored
     * @throws com.wptsync.orchestrator.bugzilla.BugzillaException if the bug cannot be filed
     */
    @Transactional
    public Sync newPullRequest(ChangeRequestEvent event) {
        int prId = event.changeRequestId();
        GitRepository wpt = repositoryRepo.findByName(RepositoryKind.UPSTREAM.repositoryName())
                .orElseThrow(() -> new SyncException(FailureKind.STATE_STORE_FAILURE,
                        "Repository '" + RepositoryKind.UPSTREAM.repositoryName() + "' is not registered"));

        if (syncRepo.existsByRepositoryAndPrIdAndDirection(wpt, prId, SyncDirection.DOWNSTREAM)) {
            throw new DuplicateSyncException(prId);
        }

        Sync sync;
        try {
            sync = syncRepo.saveAndFlush(new Sync(prId, SyncDirection.DOWNSTREAM, wpt));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateSyncException(prId, e);
        } catch (DataAccessException e) {
            throw new SyncException(FailureKind.STATE_STORE_FAILURE,
                    "Could not store sync for PR " + prId + ": " + e.getMessage(), e);
        }

        long bugId = bugTracker.create(
                "[wpt-sync] PR " + prId + " - " + event.title(),
                event.body(),
                RoutingDecision.DEFAULT.product(),
                RoutingDecision.DEFAULT.component());
        sync.setBugId(bugId);

        log.info("Created downstream sync {} for PR {} with bug {}", sync.getId(), prId, bugId);
        return sync;
    }
}

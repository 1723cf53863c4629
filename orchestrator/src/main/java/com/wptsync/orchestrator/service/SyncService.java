package com.wptsync.orchestrator.service;

import com.wptsync.orchestrator.model.RepositoryKind;
import com.wptsync.orchestrator.model.Sync;
import com.wptsync.orchestrator.model.SyncDirection;
import com.wptsync.orchestrator.repository.SyncRepository;
import com.wptsync.orchestrator.workspace.WorkspaceManager;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Lookups and operator actions on existing downstream syncs.
 */
@Service
public class SyncService {

    private final SyncRepository   syncRepo;
    private final WorkspaceManager workspaces;

    public SyncService(SyncRepository syncRepo, WorkspaceManager workspaces) {
        this.syncRepo   = syncRepo;
        this.workspaces = workspaces;
    }

    @Transactional(readOnly = true)
    public Optional<Sync> find(int prId) {
        return syncRepo.findByPr(RepositoryKind.UPSTREAM.repositoryName(), prId, SyncDirection.DOWNSTREAM);
    }

    /**
     * Remove the sync's worktrees, e.g. once the PR has landed or been abandoned.
     *
     * @throws SyncNotFoundException if the PR has no downstream sync
     */
    @Transactional
    public Sync removeWorkspaces(int prId) {
        Sync sync = syncRepo.lockByPr(RepositoryKind.UPSTREAM.repositoryName(), prId, SyncDirection.DOWNSTREAM)
                .orElseThrow(() -> new SyncNotFoundException(prId));
        workspaces.remove(sync);
        return sync;
    }
}

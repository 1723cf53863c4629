package com.wptsync.orchestrator.workspace;

import com.wptsync.orchestrator.command.CommandTimeoutException;
import com.wptsync.orchestrator.config.SyncProperties;
import com.wptsync.orchestrator.model.FailureKind;
import com.wptsync.orchestrator.model.RepositoryKind;
import com.wptsync.orchestrator.model.Sync;
import com.wptsync.orchestrator.service.SyncException;
import com.wptsync.orchestrator.vcs.GitWorkTree;
import com.wptsync.orchestrator.vcs.GitWorkTreeFactory;
import com.wptsync.orchestrator.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates, finds and tears down the per-sync git worktrees.
 *
 * Worktrees live at {@code <worktree-root>/<repository>/PR_<id>} on a branch
 * of the same name, and their paths are recorded on the Sync so a restarted
 * process finds them again. Worktrees are only removed through
 * {@link #remove}; a failed sync keeps them for diagnosis and resumption.
 *
 * Callers must hold the sync's row lock: two invocations mutating the same
 * worktree at once would corrupt its history.
 */
@Component
public class WorkspaceManager {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceManager.class);

    private final GitWorkTreeFactory gitFactory;
    private final Path               worktreeRoot;

    public WorkspaceManager(GitWorkTreeFactory gitFactory, SyncProperties properties) {
        this.gitFactory   = gitFactory;
        this.worktreeRoot = properties.worktreeRoot();
    }

    /**
     * Return the sync's worktree for {@code kind}, creating it from
     * {@code baselineRef} if it does not exist yet.
     *
     * Idempotent: an existing worktree is returned unchanged, whatever
     * commit it is on. A worktree left on disk without a recorded path (the
     * process died, or the transaction that recorded it rolled back) is
     * adopted when it is checked out on the sync's branch.
     *
     * @throws SyncException with {@link FailureKind#WORKSPACE_FAILURE} (or
     *                       {@link FailureKind#TIMEOUT}) if the worktree cannot be created
     */
    public Workspace ensure(Sync sync, RepositoryKind kind, String baselineRef) {
        String branch = sync.worktreeName();
        String recorded = sync.worktreeFor(kind);
        if (recorded != null) {
            Path existing = Path.of(recorded);
            if (Files.isDirectory(existing)) {
                log.debug("Reusing {} worktree {} for PR {}", kind, existing, sync.getPrId());
                return new Workspace(kind, existing, branch, gitFactory.open(existing));
            }
            log.warn("Recorded {} worktree {} for PR {} is missing, recreating it",
                    kind, existing, sync.getPrId());
        }

        Path path = worktreeRoot.resolve(kind.repositoryName()).resolve(branch);
        if (isWorktreeOn(path, branch)) {
            log.info("Adopting existing {} worktree {} for PR {}", kind, path, sync.getPrId());
            sync.setWorktree(kind, path.toString());
            return new Workspace(kind, path, branch, gitFactory.open(path));
        }
        log.info("Creating {} worktree {} from {} for PR {}", kind, path, baselineRef, sync.getPrId());
        try {
            Files.createDirectories(path.getParent());
            gitFactory.openClone(kind).addWorktree(path, branch, baselineRef);
        } catch (IOException e) {
            throw new SyncException(FailureKind.WORKSPACE_FAILURE,
                    "Could not create worktree directory " + path + ": " + e.getMessage(), e);
        } catch (VcsException | UncheckedIOException e) {
            throw new SyncException(FailureKind.WORKSPACE_FAILURE,
                    "Could not create " + kind.repositoryName() + " worktree " + path + ":\n" + e.getMessage(), e);
        } catch (CommandTimeoutException e) {
            throw new SyncException(FailureKind.TIMEOUT, e.getMessage(), e);
        }
        sync.setWorktree(kind, path.toString());
        return new Workspace(kind, path, branch, gitFactory.open(path));
    }

    private boolean isWorktreeOn(Path path, String branch) {
        if (!Files.exists(path.resolve(".git"))) {
            return false;
        }
        try {
            return branch.equals(gitFactory.open(path).activeBranch());
        } catch (VcsException | UncheckedIOException e) {
            log.warn("{} exists but is not a usable worktree: {}", path, e.getMessage());
            return false;
        } catch (CommandTimeoutException e) {
            throw new SyncException(FailureKind.TIMEOUT, e.getMessage(), e);
        }
    }

    /**
     * True if the sync already has a worktree for {@code kind} and its branch
     * points at {@code revision}. A sync without a worktree is never up to date.
     */
    public boolean isAt(Sync sync, RepositoryKind kind, String revision) {
        if (sync.worktreeFor(kind) == null) {
            return false;
        }
        return gitFactory.openClone(kind)
                .branchTip(sync.worktreeName())
                .map(revision::equals)
                .orElse(false);
    }

    /**
     * Remove every worktree owned by the sync and forget their paths.
     * The PR branches stay in the main clones.
     */
    public void remove(Sync sync) {
        for (RepositoryKind kind : RepositoryKind.values()) {
            String recorded = sync.worktreeFor(kind);
            if (recorded == null) {
                continue;
            }
            Path path = Path.of(recorded);
            if (Files.isDirectory(path)) {
                log.info("Removing {} worktree {} for PR {}", kind, path, sync.getPrId());
                gitFactory.openClone(kind).removeWorktree(path);
            } else {
                log.info("{} worktree {} for PR {} already gone", kind, path, sync.getPrId());
            }
            sync.setWorktree(kind, null);
        }
    }
}

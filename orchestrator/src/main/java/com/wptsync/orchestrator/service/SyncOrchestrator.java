package com.wptsync.orchestrator.service;

import com.wptsync.orchestrator.bugzilla.BugTracker;
import com.wptsync.orchestrator.bugzilla.BugzillaException;
import com.wptsync.orchestrator.buildtool.BuildTool;
import com.wptsync.orchestrator.buildtool.BuildToolException;
import com.wptsync.orchestrator.command.CommandTimeoutException;
import com.wptsync.orchestrator.config.SyncProperties;
import com.wptsync.orchestrator.model.FailureKind;
import com.wptsync.orchestrator.model.RepositoryKind;
import com.wptsync.orchestrator.model.Sync;
import com.wptsync.orchestrator.model.SyncDirection;
import com.wptsync.orchestrator.model.SyncState;
import com.wptsync.orchestrator.repository.SyncRepository;
import com.wptsync.orchestrator.routing.RoutingClassifier;
import com.wptsync.orchestrator.routing.RoutingDecision;
import com.wptsync.orchestrator.translate.CommitTranslator;
import com.wptsync.orchestrator.translate.TranslationResult;
import com.wptsync.orchestrator.vcs.GitWorkTree;
import com.wptsync.orchestrator.vcs.GitWorkTreeFactory;
import com.wptsync.orchestrator.vcs.VcsException;
import com.wptsync.orchestrator.workspace.Workspace;
import com.wptsync.orchestrator.workspace.WorkspaceManager;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.UncheckedIOException;
import java.util.Set;

/**
 * Drives one downstream sync invocation.
 *
 * Pipeline:
 *   FETCHING_SOURCE   : fetch wpt, merge the PR into its worktree, record the
 *                       files it changes, fetch gecko and reset its worktree
 *   TRANSLATING       : port the PR's commits onto gecko
 *   UPDATING_METADATA : regenerate the wpt manifest as a separate commit
 *   CLASSIFYING       : pick the bug component from the changed files
 *   REPORTED          : move the bug to that component
 *
 * Any failure moves the sync to ERROR, is commented on the bug and comes
 * back as a failed {@link SyncOutcome}; nothing is thrown to the caller.
 * An unexpected runtime exception is charged to the stage the sync was in.
 * Worktrees and any commits already applied are left as they are.
 *
 * Each invocation runs in one transaction with the sync row locked, which
 * is what keeps two invocations for the same PR from touching its
 * worktrees at the same time.
 */
@Service
public class SyncOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

    private static final String FAILED_BECAUSE = "Downstreaming from web-platform-tests failed because ";

    private final SyncRepository     syncRepo;
    private final WorkspaceManager   workspaces;
    private final CommitTranslator   translator;
    private final RoutingClassifier  classifier;
    private final BuildTool          buildTool;
    private final BugTracker         bugTracker;
    private final GitWorkTreeFactory gitFactory;
    private final SyncProperties     properties;
    private final MeterRegistry      meterRegistry;

    public SyncOrchestrator(SyncRepository syncRepo,
                            WorkspaceManager workspaces,
                            CommitTranslator translator,
                            RoutingClassifier classifier,
                            BuildTool buildTool,
                            BugTracker bugTracker,
                            GitWorkTreeFactory gitFactory,
                            SyncProperties properties,
                            MeterRegistry meterRegistry) {
        this.syncRepo      = syncRepo;
        this.workspaces    = workspaces;
        this.translator    = translator;
        this.classifier    = classifier;
        this.buildTool     = buildTool;
        this.bugTracker    = bugTracker;
        this.gitFactory    = gitFactory;
        this.properties    = properties;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Lock the PR's sync and run the pipeline.
     *
     * @throws SyncNotFoundException if the PR has no downstream sync
     */
    @Transactional
    public SyncOutcome run(int prId) {
        Sync sync = syncRepo.lockByPr(RepositoryKind.UPSTREAM.repositoryName(), prId, SyncDirection.DOWNSTREAM)
                .orElseThrow(() -> new SyncNotFoundException(prId));
        return run(sync);
    }

    /**
     * Run the pipeline for a sync the caller has already locked in the
     * current transaction.
     */
    @Transactional
    public SyncOutcome run(Sync sync) {
        MDC.put("prId",   String.valueOf(sync.getPrId()));
        MDC.put("syncId", String.valueOf(sync.getId()));
        Timer.Sample sample = Timer.start(meterRegistry);
        SyncOutcome outcome;
        try {
            log.info("Starting downstream sync for PR {} (state={})", sync.getPrId(), sync.getState());
            outcome = process(sync);
        } finally {
            sample.stop(meterRegistry.timer("wptsync.sync.duration"));
            MDC.remove("prId");
            MDC.remove("syncId");
        }
        meterRegistry.counter("wptsync.sync.outcomes",
                "result", outcome.state().name().toLowerCase(),
                "kind",   outcome.failureKind() == null ? "none" : outcome.failureKind().name().toLowerCase())
                .increment();
        return outcome;
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    private SyncOutcome process(Sync sync) {
        sync.clearFailure();
        sync.advanceTo(SyncState.FETCHING_SOURCE);
        try {
            Workspace wpt = fetchPullRequest(sync);
            Set<String> filesChanged = filesChanged(wpt);
            Workspace gecko = prepareTarget(sync);

            sync.advanceTo(SyncState.TRANSLATING);
            TranslationResult translation =
                    translator.translate(wpt, properties.upstream().baselineRef(), gecko);
            if (!translation.success()) {
                return fail(sync, translation.failureKind(), translationFailure(translation));
            }

            sync.advanceTo(SyncState.UPDATING_METADATA);
            commitManifestUpdate(gecko);

            sync.advanceTo(SyncState.CLASSIFYING);
            RoutingDecision routing = classifier.classify(filesChanged, RoutingDecision.DEFAULT, gecko);
            setComponent(sync, routing);

            sync.advanceTo(SyncState.REPORTED);
            log.info("PR {} synced downstream ({} applied, {} skipped), bug {} in {}",
                    sync.getPrId(), translation.applied(), translation.skipped(), sync.getBugId(), routing);
            return SyncOutcome.reported(routing);
        } catch (SyncException e) {
            return fail(sync, e.getKind(), e.getMessage());
        } catch (CommandTimeoutException e) {
            return fail(sync, FailureKind.TIMEOUT, FAILED_BECAUSE + "a command timed out:\n" + e.getMessage());
        } catch (RuntimeException e) {
            SyncState stage = sync.getState();
            log.error("Unexpected error in {} for PR {}", stage, sync.getPrId(), e);
            return fail(sync, failureKindFor(stage),
                    FAILED_BECAUSE + describe(stage) + " failed:\n" + e.getMessage());
        }
    }

    /**
     * Bring the wpt worktree to origin/master with the PR merged on top.
     */
    private Workspace fetchPullRequest(Sync sync) {
        SyncProperties.Upstream upstream = properties.upstream();
        int prId = sync.getPrId();
        try {
            log.info("Fetching web-platform-tests {}", upstream.baselineRef());
            gitFactory.openClone(RepositoryKind.UPSTREAM).fetch(upstream.remote(), upstream.branch(), false);
            log.info("Fetch done");

            Workspace wpt = workspaces.ensure(sync, RepositoryKind.UPSTREAM, upstream.baselineRef());
            wpt.git().resetHard(upstream.baselineRef());
            wpt.git().fetch(upstream.remote(),
                    "+pull/" + prId + "/head:heads/pull_" + prId, false);
            wpt.git().merge("heads/pull_" + prId);
            return wpt;
        } catch (VcsException e) {
            log.error("Failed to obtain web-platform-tests PR {}:\n{}", prId, e.getMessage());
            throw new SyncException(FailureKind.FETCH_FAILURE,
                    FAILED_BECAUSE + "obtaining PR " + prId + " failed:\n" + e.getMessage(), e);
        }
    }

    /**
     * Files the PR touches, relative to the wpt root. Read from the wpt
     * worktree before gecko is modified. Only used for routing, so a
     * failure here falls back to the default component.
     */
    private Set<String> filesChanged(Workspace wpt) {
        try {
            return buildTool.filesChanged(wpt.path());
        } catch (BuildToolException | UncheckedIOException e) {
            log.warn("Could not list files changed by {}, bug component will use the default: {}",
                    wpt.branch(), e.getMessage());
            return Set.of();
        }
    }

    /**
     * Fetch gecko and reset the sync's gecko worktree to the central ref.
     */
    private Workspace prepareTarget(Sync sync) {
        SyncProperties.Downstream downstream = properties.downstream();
        try {
            log.info("Fetching {}", downstream.remote());
            gitFactory.openClone(RepositoryKind.DOWNSTREAM).fetch(downstream.remote(), null, false);
            log.info("Fetch done");
        } catch (VcsException e) {
            log.error("Failed to fetch {}:\n{}", downstream.remote(), e.getMessage());
            throw new SyncException(FailureKind.FETCH_FAILURE,
                    FAILED_BECAUSE + "fetching " + downstream.remote() + " failed:\n" + e.getMessage(), e);
        }

        Workspace gecko = workspaces.ensure(sync, RepositoryKind.DOWNSTREAM, downstream.centralRef());
        try {
            gecko.git().abortApply();
            gecko.git().resetHard(downstream.centralRef());
        } catch (VcsException e) {
            throw new SyncException(FailureKind.WORKSPACE_FAILURE,
                    FAILED_BECAUSE + "resetting " + gecko.path() + " to "
                    + downstream.centralRef() + " failed:\n" + e.getMessage(), e);
        }
        return gecko;
    }

    /**
     * Regenerate the wpt manifest and commit it on its own, so the ported
     * commits stay a 1:1 copy of upstream.
     */
    private void commitManifestUpdate(Workspace gecko) {
        try {
            GitWorkTree git = gecko.git();
            git.resetHard("HEAD");
            buildTool.regenerateMetadata(gecko.path());
            if (git.isDirty()) {
                git.add(properties.downstream().metaPath());
                git.commit("[wpt-sync] downstream " + gecko.branch() + ": update manifest");
            }
        } catch (BuildToolException | VcsException | UncheckedIOException e) {
            log.error("Failed to update the wpt manifest in {}:\n{}", gecko.path(), e.getMessage());
            throw new SyncException(FailureKind.METADATA_REGEN_FAILURE,
                    FAILED_BECAUSE + "updating the wpt manifest failed:\n" + e.getMessage(), e);
        }
    }

    private void setComponent(Sync sync, RoutingDecision routing) {
        try {
            bugTracker.setComponent(sync.getBugId(), routing.product(), routing.component());
        } catch (BugzillaException e) {
            throw new SyncException(FailureKind.TRACKER_FAILURE,
                    "Moving bug " + sync.getBugId() + " to " + routing + " failed: " + e.getMessage(), e);
        }
    }

    // ------------------------------------------------------------------
    // Failure reporting
    // ------------------------------------------------------------------

    private static String translationFailure(TranslationResult result) {
        String commit = result.failedCommit() == null ? "the PR's commit list" : result.failedCommit();
        String action = switch (result.failureKind()) {
            case PATCH_APPLY_FAILURE -> "applying patch from " + commit;
            case TIMEOUT             -> "porting " + commit + " timed out";
            default                  -> "creating patch from " + commit;
        };
        if (result.failureKind() == FailureKind.TIMEOUT) {
            return FAILED_BECAUSE + action + ":\n" + result.diagnostic();
        }
        return FAILED_BECAUSE + action + " failed:\n" + result.diagnostic();
    }

    private static FailureKind failureKindFor(SyncState stage) {
        return switch (stage) {
            case TRANSLATING       -> FailureKind.PATCH_APPLY_FAILURE;
            case UPDATING_METADATA -> FailureKind.METADATA_REGEN_FAILURE;
            case CLASSIFYING       -> FailureKind.TRACKER_FAILURE;
            default                -> FailureKind.FETCH_FAILURE;
        };
    }

    private static String describe(SyncState stage) {
        return switch (stage) {
            case TRANSLATING       -> "porting the PR's commits";
            case UPDATING_METADATA -> "updating the wpt manifest";
            case CLASSIFYING       -> "setting the bug component";
            default                -> "obtaining the PR";
        };
    }

    /**
     * Move the sync to ERROR, comment on its bug, and build the failed outcome.
     * The comment is skipped when Bugzilla itself is what failed.
     */
    private SyncOutcome fail(Sync sync, FailureKind kind, String message) {
        log.error("Downstream sync for PR {} failed ({}): {}", sync.getPrId(), kind, message);
        sync.fail(kind, message);
        if (kind != FailureKind.TRACKER_FAILURE && sync.getBugId() != null) {
            try {
                bugTracker.comment(sync.getBugId(), message);
            } catch (BugzillaException e) {
                log.error("Could not comment on bug {} for PR {}: {}",
                        sync.getBugId(), sync.getPrId(), e.getMessage(), e);
            }
        }
        return SyncOutcome.failed(kind, message);
    }
}

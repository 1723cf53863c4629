package com.wptsync.orchestrator.service;

import com.wptsync.orchestrator.TestProperties;
import com.wptsync.orchestrator.bugzilla.BugTracker;
import com.wptsync.orchestrator.bugzilla.BugzillaException;
import com.wptsync.orchestrator.buildtool.BuildTool;
import com.wptsync.orchestrator.buildtool.BuildToolException;
import com.wptsync.orchestrator.command.CommandResult;
import com.wptsync.orchestrator.command.CommandTimeoutException;
import com.wptsync.orchestrator.model.*;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SyncOrchestrator.
 *
 * git, mach, wpt and Bugzilla are all mocked; the tests check the order of
 * pipeline stages, the state the sync ends in and what is reported on the bug.
 */
@ExtendWith(MockitoExtension.class)
class SyncOrchestratorTest {

    private static final long BUG = 1234L;
    private static final Path WPT_PATH   = Path.of("/wt/web-platform-tests/PR_9");
    private static final Path GECKO_PATH = Path.of("/wt/gecko/PR_9");

    @Mock SyncRepository     syncRepo;
    @Mock WorkspaceManager   workspaces;
    @Mock CommitTranslator   translator;
    @Mock RoutingClassifier  classifier;
    @Mock BuildTool          buildTool;
    @Mock BugTracker         bugTracker;
    @Mock GitWorkTreeFactory gitFactory;
    @Mock GitWorkTree        wptClone;
    @Mock GitWorkTree        geckoClone;
    @Mock GitWorkTree        wptGit;
    @Mock GitWorkTree        geckoGit;

    SimpleMeterRegistry meters;
    SyncOrchestrator orchestrator;
    Sync sync;
    Workspace wpt;
    Workspace gecko;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        orchestrator = new SyncOrchestrator(syncRepo, workspaces, translator, classifier, buildTool,
                bugTracker, gitFactory, TestProperties.create(), meters);
        sync = new Sync(9, SyncDirection.DOWNSTREAM, new GitRepository("web-platform-tests"));
        sync.setBugId(BUG);
        wpt   = new Workspace(RepositoryKind.UPSTREAM,   WPT_PATH,   "PR_9", wptGit);
        gecko = new Workspace(RepositoryKind.DOWNSTREAM, GECKO_PATH, "PR_9", geckoGit);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void run_happyPath_portsCommitsUpdatesManifestAndMovesBug() {
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH)).thenReturn(Set.of("dom/a.html"));
        when(translator.translate(wpt, "origin/master", gecko)).thenReturn(TranslationResult.success(2, 0));
        when(geckoGit.isDirty()).thenReturn(true);
        RoutingDecision dom = new RoutingDecision("Core", "DOM");
        when(classifier.classify(Set.of("dom/a.html"), RoutingDecision.DEFAULT, gecko)).thenReturn(dom);

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.success()).isTrue();
        assertThat(outcome.routing()).isEqualTo(dom);
        assertThat(sync.getState()).isEqualTo(SyncState.REPORTED);

        InOrder wptOrder = inOrder(wptClone, wptGit);
        wptOrder.verify(wptClone).fetch("origin", "master", false);
        wptOrder.verify(wptGit).resetHard("origin/master");
        wptOrder.verify(wptGit).fetch("origin", "+pull/9/head:heads/pull_9", false);
        wptOrder.verify(wptGit).merge("heads/pull_9");

        InOrder geckoOrder = inOrder(geckoClone, geckoGit, buildTool);
        geckoOrder.verify(geckoClone).fetch("mozilla", null, false);
        geckoOrder.verify(geckoGit).resetHard("mozilla/central");
        geckoOrder.verify(geckoGit).resetHard("HEAD");
        geckoOrder.verify(buildTool).regenerateMetadata(GECKO_PATH);
        geckoOrder.verify(geckoGit).add("testing/web-platform/meta");
        geckoOrder.verify(geckoGit).commit("[wpt-sync] downstream PR_9: update manifest");

        verify(bugTracker).setComponent(BUG, "Core", "DOM");
        verify(bugTracker, never()).comment(anyLong(), anyString());
    }

    @Test
    void run_cleanManifest_makesNoMetadataCommit() {
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH)).thenReturn(Set.of());
        when(translator.translate(wpt, "origin/master", gecko)).thenReturn(TranslationResult.success(1, 0));
        when(geckoGit.isDirty()).thenReturn(false);
        when(classifier.classify(Set.of(), RoutingDecision.DEFAULT, gecko)).thenReturn(RoutingDecision.DEFAULT);

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.success()).isTrue();
        verify(geckoGit, never()).commit(anyString());
        verify(bugTracker).setComponent(BUG, "Testing", "web-platform-tests");
    }

    @Test
    void run_filesChangedFails_stillSyncsWithDefaultRouting() {
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH))
                .thenThrow(new BuildToolException("./wpt files-changed", new CommandResult(1, "", "no wpt")));
        when(translator.translate(wpt, "origin/master", gecko)).thenReturn(TranslationResult.success(1, 0));
        when(classifier.classify(Set.of(), RoutingDecision.DEFAULT, gecko)).thenReturn(RoutingDecision.DEFAULT);

        assertThat(orchestrator.run(sync).success()).isTrue();
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    @Test
    void run_prFetchFails_commentsOnBugAndStops() {
        when(gitFactory.openClone(RepositoryKind.UPSTREAM)).thenReturn(wptClone);
        when(workspaces.ensure(sync, RepositoryKind.UPSTREAM, "origin/master")).thenReturn(wpt);
        doThrow(new VcsException("fetch", new CommandResult(128, "", "fatal: couldn't find remote ref pull/9/head")))
                .when(wptGit).fetch("origin", "+pull/9/head:heads/pull_9", false);

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.FETCH_FAILURE);
        assertThat(sync.getState()).isEqualTo(SyncState.ERROR);
        assertThat(sync.getFailureKind()).isEqualTo(FailureKind.FETCH_FAILURE);
        verify(bugTracker).comment(eq(BUG), argThat(text ->
                text.startsWith("Downstreaming from web-platform-tests failed because obtaining PR 9 failed:\n")
                && text.contains("couldn't find remote ref")));
        verifyNoInteractions(translator);
        verify(bugTracker, never()).setComponent(anyLong(), any(), any());
    }

    @Test
    void run_patchApplyFails_commentsCommitAndSkipsManifest() {
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH)).thenReturn(Set.of("dom/a.html"));
        when(translator.translate(wpt, "origin/master", gecko)).thenReturn(TranslationResult.failure(
                1, 0, "c2c2c2", FailureKind.PATCH_APPLY_FAILURE, "error: patch failed: dom/a.html:3"));

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.PATCH_APPLY_FAILURE);
        assertThat(sync.getState()).isEqualTo(SyncState.ERROR);
        verify(bugTracker).comment(BUG, "Downstreaming from web-platform-tests failed because applying patch "
                + "from c2c2c2 failed:\nerror: patch failed: dom/a.html:3");
        verify(buildTool, never()).regenerateMetadata(any());
        verify(bugTracker, never()).setComponent(anyLong(), any(), any());
    }

    @Test
    void run_patchRenderFails_commentsCreatingPatch() {
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH)).thenReturn(Set.of());
        when(translator.translate(wpt, "origin/master", gecko)).thenReturn(TranslationResult.failure(
                0, 0, "c1c1c1", FailureKind.PATCH_RENDER_FAILURE, "fatal: bad object"));

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.message()).startsWith(
                "Downstreaming from web-platform-tests failed because creating patch from c1c1c1 failed:");
    }

    @Test
    void run_manifestUpdateFails_isMetadataFailure() {
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH)).thenReturn(Set.of());
        when(translator.translate(wpt, "origin/master", gecko)).thenReturn(TranslationResult.success(1, 0));
        doThrow(new BuildToolException("./mach wpt-manifest-update", new CommandResult(2, "", "mach broke")))
                .when(buildTool).regenerateMetadata(GECKO_PATH);

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.METADATA_REGEN_FAILURE);
        verify(bugTracker).comment(eq(BUG), argThat(text -> text.contains("mach broke")));
        verifyNoInteractions(classifier);
    }

    @Test
    void run_setComponentFails_isTrackerFailureWithoutComment() {
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH)).thenReturn(Set.of());
        when(translator.translate(wpt, "origin/master", gecko)).thenReturn(TranslationResult.success(1, 0));
        when(classifier.classify(Set.of(), RoutingDecision.DEFAULT, gecko)).thenReturn(RoutingDecision.DEFAULT);
        doThrow(new BugzillaException("HTTP 503")).when(bugTracker).setComponent(BUG, "Testing", "web-platform-tests");

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.TRACKER_FAILURE);
        verify(bugTracker, never()).comment(anyLong(), anyString());
    }

    @Test
    void run_commandTimeout_isTimeout() {
        when(gitFactory.openClone(RepositoryKind.UPSTREAM)).thenReturn(wptClone);
        doThrow(new CommandTimeoutException("git fetch origin master", Duration.ofMinutes(5)))
                .when(wptClone).fetch("origin", "master", false);

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(sync.getState()).isEqualTo(SyncState.ERROR);
    }

    @Test
    void run_manifestToolCannotStart_isMetadataFailure() {
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH)).thenReturn(Set.of());
        when(translator.translate(wpt, "origin/master", gecko)).thenReturn(TranslationResult.success(1, 0));
        doThrow(new UncheckedIOException("Could not start: ./mach wpt-manifest-update",
                        new IOException("error=2, No such file or directory")))
                .when(buildTool).regenerateMetadata(GECKO_PATH);

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.failureKind()).isEqualTo(FailureKind.METADATA_REGEN_FAILURE);
        assertThat(sync.getState()).isEqualTo(SyncState.ERROR);
        assertThat(sync.getFailureKind()).isEqualTo(FailureKind.METADATA_REGEN_FAILURE);
        verify(bugTracker).comment(eq(BUG), argThat(text ->
                text.contains("Could not start: ./mach wpt-manifest-update")));
        verifyNoInteractions(classifier);
    }

    @Test
    void run_unexpectedErrorWhileTranslating_failsTheSyncAndComments() {
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH)).thenReturn(Set.of());
        when(translator.translate(wpt, "origin/master", gecko))
                .thenThrow(new IllegalStateException("Interrupted while running: git am"));

        SyncOutcome outcome = orchestrator.run(sync);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.failureKind()).isEqualTo(FailureKind.PATCH_APPLY_FAILURE);
        assertThat(sync.getState()).isEqualTo(SyncState.ERROR);
        verify(bugTracker).comment(BUG, "Downstreaming from web-platform-tests failed because porting the "
                + "PR's commits failed:\nInterrupted while running: git am");
        assertThat(meters.counter("wptsync.sync.outcomes", "result", "error", "kind", "patch_apply_failure").count())
                .isEqualTo(1.0);
    }

    @Test
    void run_afterError_clearsFailureAndSucceeds() {
        sync.advanceTo(SyncState.FETCHING_SOURCE);
        sync.fail(FailureKind.FETCH_FAILURE, "earlier");
        stubFetch();
        stubTarget();
        when(buildTool.filesChanged(WPT_PATH)).thenReturn(Set.of());
        when(translator.translate(wpt, "origin/master", gecko)).thenReturn(TranslationResult.success(1, 0));
        when(classifier.classify(Set.of(), RoutingDecision.DEFAULT, gecko)).thenReturn(RoutingDecision.DEFAULT);

        orchestrator.run(sync);

        assertThat(sync.getState()).isEqualTo(SyncState.REPORTED);
        assertThat(sync.getFailureKind()).isNull();
        assertThat(sync.getLastError()).isNull();
    }

    // ------------------------------------------------------------------
    // Lookup and metrics
    // ------------------------------------------------------------------

    @Test
    void runByPr_unknownPr_throwsNotFound() {
        when(syncRepo.lockByPr("web-platform-tests", 42, SyncDirection.DOWNSTREAM)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> orchestrator.run(42)).isInstanceOf(SyncNotFoundException.class);
    }

    @Test
    void run_recordsOutcomeCounterAndDuration() {
        when(gitFactory.openClone(RepositoryKind.UPSTREAM)).thenReturn(wptClone);
        doThrow(new VcsException("fetch", new CommandResult(1, "", "offline")))
                .when(wptClone).fetch("origin", "master", false);

        orchestrator.run(sync);

        assertThat(meters.counter("wptsync.sync.outcomes", "result", "error", "kind", "fetch_failure").count())
                .isEqualTo(1.0);
        assertThat(meters.timer("wptsync.sync.duration").count()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void stubFetch() {
        when(gitFactory.openClone(RepositoryKind.UPSTREAM)).thenReturn(wptClone);
        when(workspaces.ensure(sync, RepositoryKind.UPSTREAM, "origin/master")).thenReturn(wpt);
    }

    private void stubTarget() {
        when(gitFactory.openClone(RepositoryKind.DOWNSTREAM)).thenReturn(geckoClone);
        when(workspaces.ensure(sync, RepositoryKind.DOWNSTREAM, "mozilla/central")).thenReturn(gecko);
    }
}

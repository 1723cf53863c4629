package com.wptsync.orchestrator.trypush;

import com.wptsync.orchestrator.buildtool.BuildTool;
import com.wptsync.orchestrator.command.CommandResult;
import com.wptsync.orchestrator.config.SyncProperties;
import com.wptsync.orchestrator.model.FailureKind;
import com.wptsync.orchestrator.model.RepositoryKind;
import com.wptsync.orchestrator.model.Sync;
import com.wptsync.orchestrator.model.SyncDirection;
import com.wptsync.orchestrator.repository.SyncRepository;
import com.wptsync.orchestrator.service.SyncException;
import com.wptsync.orchestrator.service.SyncNotFoundException;
import com.wptsync.orchestrator.vcs.GitWorkTree;
import com.wptsync.orchestrator.vcs.VcsException;
import com.wptsync.orchestrator.workspace.Workspace;
import com.wptsync.orchestrator.workspace.WorkspaceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.SortedSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pushes a synced PR's gecko branch to try with the affected wpt tests
 * selected.
 *
 * The try syntax travels in an empty commit on top of the branch; that
 * commit is always dropped again after the push, whether it succeeded or not.
 */
@Service
public class TryPushService {

    private static final Logger log = LoggerFactory.getLogger(TryPushService.class);

    private static final Pattern REVISION = Pattern.compile("revision=(?<rev>[0-9a-f]{40})");

    static final String RESULTS_URL = "https://treeherder.mozilla.org/#/jobs?repo=try&revision=";

    private final SyncRepository   syncRepo;
    private final WorkspaceManager workspaces;
    private final BuildTool        buildTool;
    private final SyncProperties   properties;

    public TryPushService(SyncRepository syncRepo,
                          WorkspaceManager workspaces,
                          BuildTool buildTool,
                          SyncProperties properties) {
        this.syncRepo   = syncRepo;
        this.workspaces = workspaces;
        this.buildTool  = buildTool;
        this.properties = properties;
    }

    /**
     * Push PR {@code prId}'s gecko branch to try.
     *
     * @throws SyncNotFoundException if the PR has no downstream sync
     * @throws SyncException         if the PR has not been synced yet
     * @throws VcsException          if the push fails or try reports no revision
     * @throws com.wptsync.orchestrator.buildtool.BuildToolException if affected tests cannot be listed
     */
    @Transactional
    public TryPush push(int prId) {
        Sync sync = syncRepo.lockByPr(RepositoryKind.UPSTREAM.repositoryName(), prId, SyncDirection.DOWNSTREAM)
                .orElseThrow(() -> new SyncNotFoundException(prId));
        if (sync.getUpstreamWorktree() == null || sync.getDownstreamWorktree() == null) {
            throw new SyncException(FailureKind.WORKSPACE_FAILURE, "PR " + prId + " has not been synced yet");
        }

        String baseline = properties.upstream().baselineRef();
        Workspace wpt   = workspaces.ensure(sync, RepositoryKind.UPSTREAM, baseline);
        Workspace gecko = workspaces.ensure(sync, RepositoryKind.DOWNSTREAM, properties.downstream().centralRef());

        Map<String, SortedSet<String>> testsByType =
                AffectedTests.parse(buildTool.testsAffected(wpt.path(), baseline));
        String message = TryMessageBuilder.build(testsByType);
        log.info("Pushing PR {} to try: {}", prId, message);

        GitWorkTree git = gecko.git();
        git.checkout(gecko.branch());
        git.commitAllowEmpty(message);
        try {
            CommandResult result = git.push(properties.downstream().tryRemote());
            String revision = findRevision(result);
            log.info("PR {} pushed to try as {}", prId, revision);
            return new TryPush(revision, RESULTS_URL + revision, message);
        } finally {
            git.resetTo("HEAD~");
        }
    }

    /** The try server prints the pushed revision on stdout or stderr depending on the transport. */
    static String findRevision(CommandResult result) {
        for (String stream : new String[] {result.stdout(), result.stderr()}) {
            if (stream == null) {
                continue;
            }
            Matcher m = REVISION.matcher(stream);
            if (m.find()) {
                return m.group("rev");
            }
        }
        throw new VcsException("push to try did not report a revision:\n" + result.diagnostic());
    }
}

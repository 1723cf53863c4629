package com.wptsync.orchestrator.translate;

import com.wptsync.orchestrator.command.CommandResult;
import com.wptsync.orchestrator.command.CommandTimeoutException;
import com.wptsync.orchestrator.config.SyncProperties;
import com.wptsync.orchestrator.model.FailureKind;
import com.wptsync.orchestrator.vcs.VcsException;
import com.wptsync.orchestrator.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Ports upstream commits onto the gecko worktree, one patch per commit.
 *
 * Commits are applied oldest first because later ones may depend on earlier
 * ones. The first commit that cannot be rendered or applied ends the run:
 * later commits are never attempted, and what was already applied stays in
 * place for whoever investigates the failure.
 */
@Component
public class CommitTranslator {

    private static final Logger log = LoggerFactory.getLogger(CommitTranslator.class);

    private static final Pattern DIFF_HEADER = Pattern.compile("(?m)^diff --git ");

    private final String wptPath;

    public CommitTranslator(SyncProperties properties) {
        this.wptPath = properties.downstream().wptPath();
    }

    /**
     * Apply every commit in {@code upstreamBaseline..HEAD} of the upstream
     * worktree to the target worktree, under the wpt directory.
     */
    public TranslationResult translate(Workspace upstream, String upstreamBaseline, Workspace target) {
        List<String> commits;
        try {
            commits = upstream.git().commitsBetween(upstreamBaseline, "HEAD");
        } catch (VcsException e) {
            log.error("Failed to list commits {}..HEAD:\n{}", upstreamBaseline, e.getMessage());
            return TranslationResult.failure(0, 0, null, FailureKind.PATCH_RENDER_FAILURE, e.getMessage());
        } catch (CommandTimeoutException e) {
            return TranslationResult.failure(0, 0, null, FailureKind.TIMEOUT, e.getMessage());
        }
        log.info("Translating {} commit(s) from {} onto {}", commits.size(), upstream.branch(), target.branch());

        int applied = 0;
        int skipped = 0;
        for (String commit : commits) {
            String patch;
            try {
                patch = upstream.git().renderPatch(commit);
            } catch (VcsException e) {
                log.error("Failed to create patch from {}:\n{}", commit, e.getMessage());
                return TranslationResult.failure(applied, skipped, commit,
                        FailureKind.PATCH_RENDER_FAILURE, e.getMessage());
            } catch (CommandTimeoutException e) {
                return TranslationResult.failure(applied, skipped, commit, FailureKind.TIMEOUT, e.getMessage());
            }

            if (isEmptyPatch(patch)) {
                log.info("Skipping empty patch {}", commit);
                skipped++;
                continue;
            }

            CommandResult result;
            try {
                result = target.git().applyPatch(patch, wptPath);
            } catch (CommandTimeoutException e) {
                return TranslationResult.failure(applied, skipped, commit, FailureKind.TIMEOUT, e.getMessage());
            }
            if (!result.success()) {
                log.error("Failed to import patch downstream {}\n\n{}\n\n{}", commit, patch, result.diagnostic());
                return TranslationResult.failure(applied, skipped, commit,
                        FailureKind.PATCH_APPLY_FAILURE, result.diagnostic());
            }
            applied++;
        }
        log.info("Translation done: {} applied, {} skipped", applied, skipped);
        return TranslationResult.success(applied, skipped);
    }

    /** A patch with only commit metadata and no file changes. */
    static boolean isEmptyPatch(String patch) {
        return !DIFF_HEADER.matcher(patch).find();
    }
}

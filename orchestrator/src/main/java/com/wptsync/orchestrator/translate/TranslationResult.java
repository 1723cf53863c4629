package com.wptsync.orchestrator.translate;

import com.wptsync.orchestrator.model.FailureKind;

/**
 * Outcome of porting a PR's commits onto the gecko worktree.
 *
 * @param applied      commits applied before the run ended
 * @param skipped      commits skipped because their patch was empty
 * @param failedCommit the commit that stopped the run, or null on success
 * @param failureKind  PATCH_RENDER_FAILURE / PATCH_APPLY_FAILURE / TIMEOUT, or null on success
 * @param diagnostic   git's output for the failing command, or null on success
 */
public record TranslationResult(
        int         applied,
        int         skipped,
        String      failedCommit,
        FailureKind failureKind,
        String      diagnostic
) {
    public static TranslationResult success(int applied, int skipped) {
        return new TranslationResult(applied, skipped, null, null, null);
    }

    public static TranslationResult failure(int applied, int skipped, String commit,
                                            FailureKind kind, String diagnostic) {
        return new TranslationResult(applied, skipped, commit, kind, diagnostic);
    }

    public boolean success() {
        return failureKind == null;
    }
}

package com.wptsync.orchestrator.vcs;

import com.wptsync.orchestrator.command.CommandResult;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Version-control operations on one checkout (a main clone or a worktree).
 *
 * Every method blocks until git finishes. Unless documented otherwise a
 * non-zero exit raises {@link VcsException} and an overrun deadline raises
 * {@link com.wptsync.orchestrator.command.CommandTimeoutException}.
 */
public interface GitWorkTree {

    /** Directory this checkout lives in. */
    Path path();

    /**
     * Fetch from {@code remote}.
     *
     * @param refspec what to fetch, or null for the remote's default refspecs
     * @param tags    whether tags are fetched as well
     */
    void fetch(String remote, String refspec, boolean tags);

    void merge(String ref);

    void resetHard(String ref);

    /** Move the branch to {@code ref}, keeping the working tree. */
    void resetTo(String ref);

    /** Abort a {@code git am} session left behind by an earlier failed apply, if any. */
    void abortApply();

    /** Render one commit as an email-format patch (metadata plus diff). */
    String renderPatch(String commitId);

    /**
     * Apply an email-format patch as a new commit, with every path rebased
     * under {@code directoryPrefix}.
     *
     * Does not throw on a rejected patch; the caller inspects the result.
     */
    CommandResult applyPatch(String patch, String directoryPrefix);

    void add(String path);

    /** True if the index or working tree has uncommitted changes. */
    boolean isDirty();

    void commit(String message);

    void commitAllowEmpty(String message);

    /** Push the current branch; the result holds git's stdout/stderr for parsing. */
    CommandResult push(String remote);

    void checkout(String branch);

    /** Commit id of HEAD. */
    String currentTip();

    String activeBranch();

    /** Commits reachable from {@code headRef} but not {@code baseRef}, oldest first. */
    List<String> commitsBetween(String baseRef, String headRef);

    /** Commit id a local branch points at, or empty when the branch does not exist. */
    Optional<String> branchTip(String branch);

    /**
     * Add a worktree at {@code worktreePath} on {@code branch}; the branch is
     * created from {@code startRef} unless it already exists.
     */
    void addWorktree(Path worktreePath, String branch, String startRef);

    void removeWorktree(Path worktreePath);
}

package com.wptsync.orchestrator.workspace;

import com.wptsync.orchestrator.model.RepositoryKind;
import com.wptsync.orchestrator.vcs.GitWorkTree;

import java.nio.file.Path;

/**
 * A sync's worktree in one repository.
 *
 * @param kind   which repository the worktree belongs to
 * @param path   worktree directory
 * @param branch branch checked out in it ("PR_&lt;id&gt;")
 * @param git    operations on the worktree
 */
public record Workspace(RepositoryKind kind, Path path, String branch, GitWorkTree git) {}

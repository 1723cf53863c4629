package com.wptsync.orchestrator.vcs;

import com.wptsync.orchestrator.command.CommandRunner;
import com.wptsync.orchestrator.config.SyncProperties;
import com.wptsync.orchestrator.model.RepositoryKind;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Opens {@link GitWorkTree} handles for the main clones and for worktrees.
 */
@Component
public class GitWorkTreeFactory {

    private final CommandRunner  runner;
    private final SyncProperties properties;

    public GitWorkTreeFactory(CommandRunner runner, SyncProperties properties) {
        this.runner     = runner;
        this.properties = properties;
    }

    /** The main clone of a repository (the one worktrees are added to). */
    public GitWorkTree openClone(RepositoryKind kind) {
        Path clone = kind == RepositoryKind.UPSTREAM
                ? properties.upstream().clonePath()
                : properties.downstream().clonePath();
        return open(clone);
    }

    public GitWorkTree open(Path path) {
        return new CliGitWorkTree(path, runner);
    }
}

package com.wptsync.orchestrator.model;

/**
 * The two repositories a downstream sync owns a worktree in.
 */
public enum RepositoryKind {
    UPSTREAM("web-platform-tests"),
    DOWNSTREAM("gecko");

    private final String repositoryName;

    RepositoryKind(String repositoryName) {
        this.repositoryName = repositoryName;
    }

    /** Name of the matching row in the repositories table. */
    public String repositoryName() {
        return repositoryName;
    }
}

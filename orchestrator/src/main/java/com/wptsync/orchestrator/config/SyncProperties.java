package com.wptsync.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Engine settings bound from the {@code wptsync.*} keys in application.yml.
 *
 * Built once at startup and handed to each component through its
 * constructor; nothing reads configuration from static state.
 *
 * @param upstream       the web-platform-tests clone and the branch PRs target
 * @param downstream     the gecko clone, the ref syncs start from, and where
 *                       wpt lives inside it
 * @param worktreeRoot   directory under which per-sync worktrees are created
 * @param ciContext      the only CI status context the reactor acts on
 * @param commandTimeout wall-clock limit for each git / mach / wpt invocation
 */
@ConfigurationProperties("wptsync")
public record SyncProperties(
        Upstream  upstream,
        Downstream downstream,
        Path      worktreeRoot,
        String    ciContext,
        Duration  commandTimeout) {

    /**
     * @param clonePath path of the main web-platform-tests clone
     * @param remote    remote PRs are fetched from (e.g. "origin")
     * @param branch    integration branch (e.g. "master")
     */
    public record Upstream(Path clonePath, String remote, String branch) {

        /** The baseline ref every translation is computed against, e.g. "origin/master". */
        public String baselineRef() {
            return remote + "/" + branch;
        }
    }

    /**
     * @param clonePath  path of the main gecko clone
     * @param remote     remote fetched before each sync (e.g. "mozilla")
     * @param centralRef ref the gecko worktree is reset to (e.g. "mozilla/central")
     * @param wptPath    where web-platform-tests lives in gecko
     * @param metaPath   where generated wpt metadata lives in gecko
     * @param tryRemote  remote try pushes go to
     */
    public record Downstream(Path   clonePath,
                             String remote,
                             String centralRef,
                             String wptPath,
                             String metaPath,
                             String tryRemote) {}
}

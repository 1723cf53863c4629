package com.wptsync.orchestrator.buildtool;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * The gecko ({@code mach}) and web-platform-tests ({@code wpt}) tooling the
 * sync drives.
 *
 * All methods throw {@link BuildToolException} when the tool fails.
 */
public interface BuildTool {

    /** Regenerate the wpt manifest inside a gecko checkout. */
    void regenerateMetadata(Path geckoRoot);

    /** Paths, relative to the wpt root, changed on the checkout's branch. */
    Set<String> filesChanged(Path wptRoot);

    /**
     * Bugzilla component report for {@code paths} (relative to the gecko root):
     * a component header line followed by one indented line per file.
     */
    String classifyPaths(Path geckoRoot, List<String> paths);

    /** Tab separated {@code path<TAB>type} lines for tests affected since {@code revish}. */
    String testsAffected(Path wptRoot, String revish);
}

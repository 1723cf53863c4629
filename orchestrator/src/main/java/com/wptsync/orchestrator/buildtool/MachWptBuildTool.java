package com.wptsync.orchestrator.buildtool;

import com.wptsync.orchestrator.command.CommandResult;
import com.wptsync.orchestrator.command.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link BuildTool} that shells out to {@code ./mach} in gecko and
 * {@code ./wpt} in web-platform-tests.
 */
@Component
public class MachWptBuildTool implements BuildTool {

    private static final Logger log = LoggerFactory.getLogger(MachWptBuildTool.class);

    private final CommandRunner runner;

    public MachWptBuildTool(CommandRunner runner) {
        this.runner = runner;
    }

    @Override
    public void regenerateMetadata(Path geckoRoot) {
        log.info("Updating wpt manifest in {}", geckoRoot);
        run(geckoRoot, List.of("./mach", "wpt-manifest-update"));
    }

    @Override
    public Set<String> filesChanged(Path wptRoot) {
        return run(wptRoot, List.of("./wpt", "files-changed")).lines()
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @Override
    public String classifyPaths(Path geckoRoot, List<String> paths) {
        List<String> command = new ArrayList<>(List.of("./mach", "file-info", "bugzilla-component"));
        command.addAll(paths);
        return run(geckoRoot, command);
    }

    @Override
    public String testsAffected(Path wptRoot, String revish) {
        run(wptRoot, List.of("./wpt", "manifest"));
        List<String> command = new ArrayList<>(List.of("./wpt", "tests-affected", "--show-type", "--new"));
        if (revish != null) {
            command.add(revish);
        }
        return run(wptRoot, command);
    }

    private String run(Path workDir, List<String> command) {
        CommandResult result = runner.run(workDir, command);
        if (!result.success()) {
            throw new BuildToolException(String.join(" ", command), result);
        }
        return result.stdout();
    }
}

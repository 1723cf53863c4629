package com.wptsync.orchestrator.routing;

import com.wptsync.orchestrator.buildtool.BuildTool;
import com.wptsync.orchestrator.buildtool.BuildToolException;
import com.wptsync.orchestrator.command.CommandTimeoutException;
import com.wptsync.orchestrator.config.SyncProperties;
import com.wptsync.orchestrator.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks the Bugzilla component for a sync from the files it touches.
 *
 * Asks mach which component owns each changed file and takes the most
 * frequent one. "UNKNOWN" is only chosen when nothing else is on offer, in
 * which case the default is returned instead. The result is advisory: any
 * problem running or reading the classification falls back to the default.
 */
@Component
public class RoutingClassifier {

    private static final Logger log = LoggerFactory.getLogger(RoutingClassifier.class);

    static final String UNKNOWN = "UNKNOWN";

    private final BuildTool buildTool;
    private final String    wptPath;

    public RoutingClassifier(BuildTool buildTool, SyncProperties properties) {
        this.buildTool = buildTool;
        this.wptPath   = properties.downstream().wptPath();
    }

    /**
     * @param changedPaths paths relative to the wpt root; may be empty
     * @param fallback     returned when no usable component is found
     * @param target       gecko worktree the classification runs in
     */
    public RoutingDecision classify(Collection<String> changedPaths, RoutingDecision fallback, Workspace target) {
        if (changedPaths.isEmpty()) {
            return fallback;
        }

        List<String> paths = new ArrayList<>(changedPaths.size());
        for (String path : changedPaths) {
            paths.add(wptPath + "/" + path);
        }

        Map<String, Integer> counts;
        try {
            counts = tally(buildTool.classifyPaths(target.path(), paths));
        } catch (BuildToolException | CommandTimeoutException | IllegalArgumentException | UncheckedIOException e) {
            log.warn("Bug component classification failed, using {}: {}", fallback, e.getMessage());
            return fallback;
        }
        return choose(counts, fallback);
    }

    /**
     * Count indented file lines per component header, keeping headers in
     * the order they were first seen.
     *
     * @throws IllegalArgumentException if a file line precedes every header
     */
    static Map<String, Integer> tally(String output) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        String current = null;
        for (String line : output.split("\n")) {
            if (line.startsWith(" ")) {
                if (current == null) {
                    throw new IllegalArgumentException("File line without component: " + line.strip());
                }
                counts.merge(current, 1, Integer::sum);
            } else {
                current = line.strip();
            }
        }
        return counts;
    }

    /**
     * Most frequent component, ties going to the first seen, with UNKNOWN
     * passed over when a runner-up exists.
     */
    static RoutingDecision choose(Map<String, Integer> counts, RoutingDecision fallback) {
        if (counts.isEmpty()) {
            return fallback;
        }

        // List.sort is stable, so equal counts keep their encounter order.
        List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
        ranked.sort(Comparator.comparing(Map.Entry<String, Integer>::getValue).reversed());

        String component = ranked.get(0).getKey();
        if (UNKNOWN.equals(component) && ranked.size() > 1) {
            component = ranked.get(1).getKey();
        }
        if (UNKNOWN.equals(component)) {
            return fallback;
        }

        RoutingDecision decision = RoutingDecision.parse(component);
        if (decision == null) {
            log.warn("Component '{}' is not of the form 'Product :: Component', using {}", component, fallback);
            return fallback;
        }
        return decision;
    }
}

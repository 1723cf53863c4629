package com.wptsync.orchestrator.trypush;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the try syntax commit message that selects the wpt jobs and test
 * paths for a try push.
 *
 * Example:
 * <pre>
 * try: -b do -p win32,win64,linux64,linux -u web-platform-tests[linux64-stylo,...],web-platform-tests-e10s[...]
 *      -t none --artifact --try-test-paths web-platform-tests:dom/a.html
 * </pre>
 */
public final class TryMessageBuilder {

    private static final Logger log = LoggerFactory.getLogger(TryMessageBuilder.class);

    private static final String TEMPLATE =
            "try: -b do -p win32,win64,linux64,linux -u %s -t none --artifact --try-test-paths %s";

    static final String PLATFORM_SUFFIX = "[linux64-stylo,Ubuntu,10.10,Windows 7,Windows 8,Windows 10]";

    // Test type → suite, in the order suites appear in the message.
    private static final Map<String, String> SUITES = new LinkedHashMap<>();
    static {
        SUITES.put("testharness", "web-platform-tests");
        SUITES.put("reftest",     "web-platform-tests-reftests");
        SUITES.put("wdspec",      "web-platform-tests-wdspec");
    }

    private TryMessageBuilder() {}

    public static String build(Map<String, ? extends Collection<String>> testsByType) {
        List<String> jobs = new ArrayList<>();
        List<String> prefixedPaths = new ArrayList<>();

        for (String type : testsByType.keySet()) {
            if (!SUITES.containsKey(type)) {
                log.debug("No try suite for test type '{}', skipping", type);
            }
        }

        for (Map.Entry<String, String> suiteEntry : SUITES.entrySet()) {
            Collection<String> paths = testsByType.get(suiteEntry.getKey());
            if (paths == null || paths.isEmpty()) {
                continue;
            }
            String suite = suiteEntry.getValue();
            String machines = suite.equals("web-platform-tests") ? PLATFORM_SUFFIX : "";
            jobs.add(suite + machines);
            jobs.add(suite + "-e10s" + machines);
            for (String path : paths) {
                prefixedPaths.add(suite + ":" + path);
            }
        }
        return String.format(TEMPLATE, String.join(",", jobs), String.join(",", prefixedPaths));
    }
}

package com.wptsync.orchestrator.routing;

/**
 * The Bugzilla product and component a sync's bug is filed under.
 */
public record RoutingDecision(String product, String component) {

    /** Where every sync bug starts and where unclassifiable ones stay. */
    public static final RoutingDecision DEFAULT = new RoutingDecision("Testing", "web-platform-tests");

    private static final String SEPARATOR = " :: ";

    /**
     * Parse a "Product :: Component" header.
     *
     * @return null if the header has no separator
     */
    static RoutingDecision parse(String header) {
        int idx = header.indexOf(SEPARATOR);
        if (idx < 0) {
            return null;
        }
        return new RoutingDecision(header.substring(0, idx).strip(),
                header.substring(idx + SEPARATOR.length()).strip());
    }

    @Override
    public String toString() {
        return product + SEPARATOR + component;
    }
}

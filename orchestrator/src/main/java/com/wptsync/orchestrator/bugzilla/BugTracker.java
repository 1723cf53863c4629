package com.wptsync.orchestrator.bugzilla;

/**
 * The bug operations a sync needs. Implementations throw
 * {@link BugzillaException} on failure.
 */
public interface BugTracker {

    /**
     * File a new bug.
     *
     * @return the new bug's id
     */
    long create(String summary, String body, String product, String component);

    void comment(long bugId, String text);

    /** Move a bug to another product/component. */
    void setComponent(long bugId, String product, String component);
}

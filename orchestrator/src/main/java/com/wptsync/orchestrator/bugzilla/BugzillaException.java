package com.wptsync.orchestrator.bugzilla;

/**
 * Thrown when Bugzilla returns an error or is unreachable.
 */
public class BugzillaException extends RuntimeException {

    public BugzillaException(String message) {
        super(message);
    }

    public BugzillaException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.wptsync.orchestrator.vcs;

import com.wptsync.orchestrator.command.CommandResult;

/**
 * Thrown when a git command exits non-zero.
 *
 * The message carries the command and git's own output, which is what gets
 * attached to the bug when a sync fails.
 */
public class VcsException extends RuntimeException {

    public VcsException(String command, CommandResult result) {
        super("git " + command + " failed:\n" + result.diagnostic());
    }

    public VcsException(String message) {
        super(message);
    }
}

package com.wptsync.orchestrator.command;

import java.time.Duration;

/**
 * Thrown when an external command does not finish within its deadline.
 * The process has already been killed when this is raised.
 */
public class CommandTimeoutException extends RuntimeException {

    public CommandTimeoutException(String command, Duration timeout) {
        super("Command timed out after " + timeout.toSeconds() + "s: " + command);
    }
}

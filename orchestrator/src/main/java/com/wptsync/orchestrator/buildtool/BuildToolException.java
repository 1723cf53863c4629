package com.wptsync.orchestrator.buildtool;

import com.wptsync.orchestrator.command.CommandResult;

/**
 * Thrown when mach or wpt exits non-zero.
 */
public class BuildToolException extends RuntimeException {

    public BuildToolException(String command, CommandResult result) {
        super(command + " failed:\n" + result.diagnostic());
    }
}

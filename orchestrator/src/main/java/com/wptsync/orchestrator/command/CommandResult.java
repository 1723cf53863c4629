package com.wptsync.orchestrator.command;

/**
 * Outcome of one external command (git, mach, wpt).
 */
public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean success() {
        return exitCode == 0;
    }

    /**
     * Human-readable diagnostic for logs and bug comments.
     */
    public String diagnostic() {
        StringBuilder sb = new StringBuilder();
        if (stdout != null && !stdout.isBlank()) {
            sb.append("stdout:\n").append(stdout.stripTrailing());
        }
        if (stderr != null && !stderr.isBlank()) {
            if (!sb.isEmpty()) sb.append("\n\n");
            sb.append("stderr:\n").append(stderr.stripTrailing());
        }
        if (sb.isEmpty()) sb.append("(no output)");
        sb.append("\n\nexit_code: ").append(exitCode);
        return sb.toString();
    }
}

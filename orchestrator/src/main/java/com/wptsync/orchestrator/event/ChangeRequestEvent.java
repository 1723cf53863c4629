package com.wptsync.orchestrator.event;

/**
 * A web-platform-tests pull request was opened.
 *
 * Validated on construction, so a malformed webhook body is rejected
 * before it reaches the sync engine.
 */
public record ChangeRequestEvent(int changeRequestId, String title, String body) {

    public ChangeRequestEvent {
        if (changeRequestId <= 0) {
            throw new IllegalArgumentException("changeRequestId must be positive, got " + changeRequestId);
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title is required");
        }
        if (body == null) body = "";
    }
}

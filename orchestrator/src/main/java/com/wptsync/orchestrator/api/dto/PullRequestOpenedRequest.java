package com.wptsync.orchestrator.api.dto;

import com.wptsync.orchestrator.event.ChangeRequestEvent;

/**
 * Request body for POST /syncs: the opened PR's number, title and body.
 */
public record PullRequestOpenedRequest(int number, String title, String body) {

    public ChangeRequestEvent toEvent() {
        return new ChangeRequestEvent(number, title, body);
    }
}

package com.wptsync.orchestrator.api.dto;

import com.wptsync.orchestrator.event.StatusEvent;

/**
 * Request body for POST /syncs/{prId}/status, as reported by CI.
 */
public record StatusRequest(String context, String state, String sha) {

    public StatusEvent toEvent() {
        return new StatusEvent(context, state, sha);
    }
}

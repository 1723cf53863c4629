package com.wptsync.orchestrator.api.dto;

import com.wptsync.orchestrator.trypush.TryPush;

/**
 * Response body for POST /syncs/{prId}/try.
 */
public record TryPushResponse(String revision, String resultsUrl, String message) {

    public static TryPushResponse from(TryPush push) {
        return new TryPushResponse(push.revision(), push.resultsUrl(), push.message());
    }
}

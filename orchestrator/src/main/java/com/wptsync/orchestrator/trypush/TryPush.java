package com.wptsync.orchestrator.trypush;

/**
 * A completed try push.
 *
 * @param revision   revision try reported for the push
 * @param resultsUrl Treeherder page for that revision
 * @param message    try syntax the push was made with
 */
public record TryPush(String revision, String resultsUrl, String message) {}

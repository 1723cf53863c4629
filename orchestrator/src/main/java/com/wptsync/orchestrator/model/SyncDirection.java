package com.wptsync.orchestrator.model;

/**
 * Which way a sync moves changes.
 *
 * Only DOWNSTREAM (web-platform-tests → gecko) is processed by this service;
 * UPSTREAM exists so the uniqueness key on syncs matches the schema.
 */
public enum SyncDirection {
    DOWNSTREAM,
    UPSTREAM
}

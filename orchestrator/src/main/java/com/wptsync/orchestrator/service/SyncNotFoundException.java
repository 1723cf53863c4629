package com.wptsync.orchestrator.service;

public class SyncNotFoundException extends RuntimeException {
    public SyncNotFoundException(int prId) {
        super("No downstream sync for PR " + prId);
    }
}

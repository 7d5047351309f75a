package com.musicbackup.sync;

/**
 * States of a {@link SyncOrchestrator} run. INTERRUPTED, CANCELLED, FAILED and COMPLETED are terminal.
 */
public enum SyncState {
    IDLE,
    ENUMERATING,
    FETCHING_PLAYLIST,
    FETCHING_LIKED,
    COMPLETED,
    INTERRUPTED,
    CANCELLED,
    FAILED
}

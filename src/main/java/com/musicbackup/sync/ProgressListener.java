package com.musicbackup.sync;

/**
 * Receives human-readable progress updates from a running sync.
 */
@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (message, current, total) -> { };

    void onProgress(String message, int current, int total);
}

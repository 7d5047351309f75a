package com.musicbackup.sync;

/**
 * Why a full sync stopped before completing. Persisted in the resume cursor so a user cancellation
 * is never mistaken for a throttle.
 */
public enum InterruptionReason {
    RATE_LIMITED,
    FETCH_ERROR,
    AUTH_FAILED,
    CANCELLED
}

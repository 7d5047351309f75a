package com.musicbackup.sync;

/**
 * A local working file (snapshot, resume cursor, partial snapshot) could not be written.
 * Unlike read failures, which degrade to "no data", this is surfaced to the caller unchanged.
 */
public class LocalStateException extends RuntimeException {
    public LocalStateException(String message, Throwable cause) {
        super(message, cause);
    }
}

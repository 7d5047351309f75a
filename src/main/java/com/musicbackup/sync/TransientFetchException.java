package com.musicbackup.sync;

/**
 * Network, timeout or parse failure that is neither a throttle nor an authorization problem.
 */
public class TransientFetchException extends CatalogException {
    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}

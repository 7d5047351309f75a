package com.musicbackup.sync;

/**
 * The access credentials were rejected (HTTP 401). Recoverable through one refresh.
 */
public class AuthExpiredException extends CatalogException {
    public AuthExpiredException(String message) {
        super(message);
    }
}

package com.musicbackup.sync;

/**
 * Credentials expired and the refresh attempt failed too. Fatal until the caller re-authenticates.
 */
public class AuthFailedException extends CatalogException {
    public AuthFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}

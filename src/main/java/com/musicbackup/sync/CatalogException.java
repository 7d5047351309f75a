package com.musicbackup.sync;

/**
 * Base type for every failure reported by a {@link RemoteCatalog} call.
 * <p>
 * The orchestrator never lets one of these escape a page fetch; each subtype maps to a state transition:
 * <ul>
 *   <li>{@link RateLimitedException}: interrupt, resumable after a known time.</li>
 *   <li>{@link AuthExpiredException}: one transparent credential refresh, then {@link AuthFailedException}.</li>
 *   <li>{@link TransientFetchException}: interrupt without rate-limit metadata.</li>
 * </ul>
 */
public class CatalogException extends Exception {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}

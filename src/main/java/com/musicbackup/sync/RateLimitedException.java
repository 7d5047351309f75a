package com.musicbackup.sync;

/**
 * The remote service throttled the call (HTTP 429 or an equivalent error message).
 * The retry hint is either an explicit number of seconds or free text left for
 * {@link RateLimitTracker#parseRetryAfter(String)}.
 */
public class RateLimitedException extends CatalogException {
    private final Integer retryAfterSeconds;

    public RateLimitedException(Integer retryAfterSeconds, String message) {
        super(message);
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * @return Explicit retry-after in seconds, or null when only the message carries a hint
     */
    public Integer getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}

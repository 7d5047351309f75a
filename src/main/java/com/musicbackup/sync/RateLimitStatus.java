package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time copy of the throttle state, stored in the resume cursor when a run is interrupted.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RateLimitStatus(
    @JsonProperty("is_limited") boolean limited,
    @JsonProperty("retry_after_seconds") long retryAfterSeconds,
    @JsonProperty("available_at") Instant availableAt,
    @JsonProperty("message") String message
) {
    public static RateLimitStatus notLimited() {
        return new RateLimitStatus(false, 0, null, "");
    }
}

package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of the merge history kept in {@code update_log.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateLogEntry(@JsonProperty("timestamp") Instant timestamp, @JsonProperty("stats") MergeStats stats) {
}

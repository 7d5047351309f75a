package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a run's plan, captured once at enumeration time.
 */
public record PlannedPlaylist(@JsonProperty("id") String id, @JsonProperty("name") String name) {
}

package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of the account that owns a snapshot.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserProfile(
    @JsonProperty("id") String id,
    @JsonProperty("display_name") String displayName,
    @JsonProperty("email") String email
) {
    public String label() {
        return displayName == null || displayName.isBlank() ? id : displayName;
    }
}

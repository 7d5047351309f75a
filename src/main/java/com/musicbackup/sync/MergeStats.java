package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Change statistics produced by a merge.
 * <p>
 * {@code tracksUpdated} is only filled by selective merges, where it counts tracks present both
 * before and after the refresh (their identity is unchanged but their metadata was re-read).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MergeStats(
    @JsonProperty("type") Type type,
    @JsonProperty("playlists_added") int playlistsAdded,
    @JsonProperty("playlists_updated") int playlistsUpdated,
    @JsonProperty("playlists_removed") int playlistsRemoved,
    @JsonProperty("tracks_added") int tracksAdded,
    @JsonProperty("tracks_removed") int tracksRemoved,
    @JsonProperty("tracks_updated") int tracksUpdated
) {
    public enum Type { FULL, SELECTIVE }

    public static MergeStats empty(Type type) {
        return new MergeStats(type, 0, 0, 0, 0, 0, 0);
    }

    /**
     * Whether anything was added, removed or replaced because its version changed.
     */
    @JsonIgnore
    public boolean hasChanges() {
        return playlistsAdded + playlistsUpdated + playlistsRemoved + tracksAdded + tracksRemoved > 0;
    }

    @Override
    public String toString() {
        return String.format("%s merge: playlists +%d ~%d -%d, tracks +%d -%d ~%d", type, playlistsAdded,
            playlistsUpdated, playlistsRemoved, tracksAdded, tracksRemoved, tracksUpdated);
    }
}

package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The user's liked/saved tracks. Same shape as a {@link Playlist} minus ownership and visibility,
 * and without a version token: changes are detected by comparing track identity sets.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LikedSongs(
    @JsonProperty("tracks") List<Track> tracks,
    @JsonProperty("total_tracks") int totalTracks,
    @JsonProperty("last_synced") Instant lastSynced
) {
    public LikedSongs {
        tracks = Utils.nonNullList(tracks);
    }

    public static LikedSongs empty() {
        return new LikedSongs(List.of(), 0, null);
    }

    @JsonIgnore
    public int trackCount() {
        return tracks.size();
    }

    @JsonIgnore
    public Set<String> trackIdentityKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Track t : tracks) keys.add(t.identityKey());
        return keys;
    }
}

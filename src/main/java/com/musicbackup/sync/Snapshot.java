package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * The full persisted local state: owning user, playlists in order, the liked collection and
 * aggregate counts.
 * <p>
 * Always build through {@link #of(UserProfile, List, LikedSongs, Instant)} so the counts are
 * recomputed from the lists instead of carried over from a stale total.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Snapshot(
    @JsonProperty("version") String version,
    @JsonProperty("exported_at") Instant exportedAt,
    @JsonProperty("user") UserProfile user,
    @JsonProperty("playlists") List<Playlist> playlists,
    @JsonProperty("liked_songs") LikedSongs likedSongs,
    @JsonProperty("playlist_count") int playlistCount,
    @JsonProperty("total_tracks") int totalTracks,
    @JsonProperty("liked_count") int likedCount
) {
    public static final String FORMAT_VERSION = "1.0";

    public Snapshot {
        playlists = Utils.nonNullList(playlists);
    }

    public static Snapshot of(UserProfile user, List<Playlist> playlists, LikedSongs likedSongs, Instant exportedAt) {
        List<Playlist> list = Utils.nonNullList(playlists);
        int total = list.stream().mapToInt(Playlist::trackCount).sum();
        int liked = likedSongs == null ? 0 : likedSongs.trackCount();
        return new Snapshot(FORMAT_VERSION, exportedAt, user, list, likedSongs, list.size(), total, liked);
    }

    /**
     * Returns the playlist with the given ID, or null.
     */
    public Playlist findPlaylist(String playlistId) {
        for (Playlist p : playlists) {
            if (p.playlistId().equals(playlistId)) return p;
        }
        return null;
    }
}

package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable record representing a playlist and its tracks.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Built from playlist metadata during enumeration, without tracks.</li>
 *   <li>Tracks are attached page by page through {@link #withTracks(List)} as they are fetched.</li>
 *   <li>{@code snapshotId} is the remote version token; it changes whenever remote content changes.</li>
 *   <li>{@code folderPath} is local organizational metadata and is never sent upstream.</li>
 * </ul>
 * <p>
 * {@code totalTracks} is what the remote service declared. It can differ from the real list length
 * (local files, unavailable items), so {@link #trackCount()} is the only count consumers should trust.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Playlist(
    @JsonProperty("playlist_id") String playlistId,
    @JsonProperty("uri") String uri,
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("owner_id") String ownerId,
    @JsonProperty("owner_name") String ownerName,
    @JsonProperty("is_public") boolean publicPlaylist,
    @JsonProperty("is_collaborative") boolean collaborative,
    @JsonProperty("snapshot_id") String snapshotId,
    @JsonProperty("total_tracks") int totalTracks,
    @JsonProperty("folder_path") String folderPath,
    @JsonProperty("last_synced") Instant lastSynced,
    @JsonProperty("external_urls") Map<String, String> externalUrls,
    @JsonProperty("tracks") List<Track> tracks
) {
    public Playlist {
        playlistId = playlistId == null ? "" : playlistId;
        uri = uri == null ? "" : uri;
        name = name == null ? "Unknown Playlist" : name;
        ownerId = ownerId == null ? "" : ownerId;
        ownerName = ownerName == null ? "" : ownerName;
        snapshotId = snapshotId == null ? "" : snapshotId;
        externalUrls = externalUrls == null ? Map.of() : Map.copyOf(externalUrls);
        tracks = Utils.nonNullList(tracks);
    }

    /**
     * Metadata-only playlist, as returned by enumeration.
     */
    public static Playlist metadata(String playlistId, String name, String ownerId, String snapshotId, int totalTracks) {
        return new Playlist(playlistId, "spotify:playlist:" + playlistId, name, null, ownerId, ownerId, true, false,
            snapshotId, totalTracks, null, null, Map.of(), List.of());
    }

    @JsonIgnore
    public int trackCount() {
        return tracks.size();
    }

    /**
     * Returns the identity keys of all tracks, in list order.
     */
    @JsonIgnore
    public Set<String> trackIdentityKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (Track t : tracks) keys.add(t.identityKey());
        return keys;
    }

    public Playlist withTracks(List<Track> newTracks) {
        return new Playlist(playlistId, uri, name, description, ownerId, ownerName, publicPlaylist, collaborative, snapshotId,
            totalTracks, folderPath, lastSynced, externalUrls, newTracks);
    }

    public Playlist withLastSynced(Instant when) {
        return new Playlist(playlistId, uri, name, description, ownerId, ownerName, publicPlaylist, collaborative, snapshotId,
            totalTracks, folderPath, when, externalUrls, tracks);
    }

    public Playlist withFolderPath(String path) {
        return new Playlist(playlistId, uri, name, description, ownerId, ownerName, publicPlaylist, collaborative, snapshotId,
            totalTracks, path, lastSynced, externalUrls, tracks);
    }
}

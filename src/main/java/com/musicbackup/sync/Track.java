package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record representing a track inside a playlist or the liked collection.
 * <p>
 * Identity:
 * <ul>
 *   <li>Two tracks are equal when their catalog track ID and URI are equal.</li>
 *   <li>Mutable remote attributes such as popularity or genres never take part in equality.</li>
 *   <li>{@link #identityKey()} is what merge statistics compare; local files have no track ID, so their URI is used instead.</li>
 * </ul>
 * <p>
 * The only post-fetch change allowed is genre backfill through {@link #withGenres(List)}.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Track(
    @JsonProperty("track_id") String trackId,
    @JsonProperty("uri") String uri,
    @JsonProperty("name") String name,
    @JsonProperty("artists") List<String> artists,
    @JsonProperty("artist_ids") List<String> artistIds,
    @JsonProperty("album_name") String albumName,
    @JsonProperty("album_id") String albumId,
    @JsonProperty("duration_ms") long durationMs,
    @JsonProperty("added_at") String addedAt,
    @JsonProperty("track_number") int trackNumber,
    @JsonProperty("disc_number") int discNumber,
    @JsonProperty("explicit") boolean explicit,
    @JsonProperty("is_local") boolean local,
    @JsonProperty("popularity") int popularity,
    @JsonProperty("genres") List<String> genres,
    @JsonProperty("release_date") String releaseDate,
    @JsonProperty("external_urls") Map<String, String> externalUrls,
    @JsonProperty("preview_url") String previewUrl,
    @JsonProperty("added_by") String addedBy
) {
    public Track {
        trackId = trackId == null ? "" : trackId;
        uri = uri == null ? "" : uri;
        name = name == null ? "Unknown Track" : name;
        artists = Utils.nonNullList(artists);
        artistIds = Utils.nonNullList(artistIds);
        albumName = albumName == null ? "Unknown Album" : albumName;
        albumId = albumId == null ? "" : albumId;
        genres = Utils.nonNullList(genres);
        externalUrls = externalUrls == null ? Map.of() : Map.copyOf(externalUrls);
    }

    /**
     * Convenience factory for the handful of fields most callers care about.
     */
    public static Track of(String trackId, String name, String artist, long durationMs) {
        return new Track(trackId, "spotify:track:" + trackId, name, List.of(artist), List.of(), "Unknown Album", "",
            durationMs, null, 0, 1, false, false, 0, List.of(), null, Map.of(), null, null);
    }

    /**
     * Returns the key used for identity-set comparison during merges.
     */
    @JsonIgnore
    public String identityKey() {
        return trackId.isBlank() ? uri : trackId;
    }

    /**
     * Returns the artists joined with ", ", or "Unknown Artist" when none are known.
     */
    @JsonIgnore
    public String artistsString() {
        return artists.isEmpty() ? "Unknown Artist" : String.join(", ", artists);
    }

    public Track withGenres(List<String> newGenres) {
        return new Track(trackId, uri, name, artists, artistIds, albumName, albumId, durationMs, addedAt, trackNumber,
            discNumber, explicit, local, popularity, newGenres, releaseDate, externalUrls, previewUrl, addedBy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Track)) return false;
        Track other = (Track) o;
        return trackId.equals(other.trackId) && uri.equals(other.uri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(trackId, uri);
    }
}

package com.musicbackup.sync;

import java.time.Duration;

/**
 * Caller-supplied knobs for a sync run.
 * @param fetchGenres Backfill track genres from artist metadata
 * @param includeServicePlaylists Keep playlists owned by the service account (e.g. editorial playlists)
 * @param includeCollaborative Keep collaborative playlists
 * @param serviceAccountId Owner ID of the service account
 * @param enumerationPageSize Page size when listing playlists
 * @param playlistPageSize Page size when listing playlist tracks
 * @param likedPageSize Page size when listing liked tracks
 * @param pageDelay Courtesy pause between pages
 * @param playlistDelay Courtesy pause between playlists
 */
public record SyncOptions(
    boolean fetchGenres,
    boolean includeServicePlaylists,
    boolean includeCollaborative,
    String serviceAccountId,
    int enumerationPageSize,
    int playlistPageSize,
    int likedPageSize,
    Duration pageDelay,
    Duration playlistDelay
) {
    public static final String DEFAULT_SERVICE_ACCOUNT = "spotify";

    public SyncOptions {
        serviceAccountId = serviceAccountId == null ? DEFAULT_SERVICE_ACCOUNT : serviceAccountId;
        if (enumerationPageSize <= 0 || playlistPageSize <= 0 || likedPageSize <= 0) {
            throw new IllegalArgumentException("Page sizes must be positive");
        }
        pageDelay = pageDelay == null ? Duration.ZERO : pageDelay;
        playlistDelay = playlistDelay == null ? Duration.ZERO : playlistDelay;
    }

    public static SyncOptions defaults() {
        return new SyncOptions(false, true, true, DEFAULT_SERVICE_ACCOUNT, 50, 100, 50,
            Duration.ofMillis(100), Duration.ofMillis(200));
    }

    public SyncOptions withFetchGenres(boolean value) {
        return new SyncOptions(value, includeServicePlaylists, includeCollaborative, serviceAccountId,
            enumerationPageSize, playlistPageSize, likedPageSize, pageDelay, playlistDelay);
    }

    public SyncOptions withFilters(boolean servicePlaylists, boolean collaborative) {
        return new SyncOptions(fetchGenres, servicePlaylists, collaborative, serviceAccountId,
            enumerationPageSize, playlistPageSize, likedPageSize, pageDelay, playlistDelay);
    }

    public SyncOptions withPageSizes(int enumeration, int playlist, int liked) {
        return new SyncOptions(fetchGenres, includeServicePlaylists, includeCollaborative, serviceAccountId,
            enumeration, playlist, liked, pageDelay, playlistDelay);
    }

    public SyncOptions withDelays(Duration page, Duration playlist) {
        return new SyncOptions(fetchGenres, includeServicePlaylists, includeCollaborative, serviceAccountId,
            enumerationPageSize, playlistPageSize, likedPageSize, page, playlist);
    }

    /**
     * Applies the inclusion filters to an enumerated playlist.
     */
    public boolean accepts(Playlist playlist) {
        boolean serviceOwned = serviceAccountId.equalsIgnoreCase(playlist.ownerId());
        if (serviceOwned && !includeServicePlaylists) return false;
        return includeCollaborative || !playlist.collaborative();
    }
}

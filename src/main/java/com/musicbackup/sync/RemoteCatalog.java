package com.musicbackup.sync;

import java.util.List;

/**
 * Read-only view of the remote music catalog for one authenticated user.
 * <p>
 * Every call may throw {@link RateLimitedException}, {@link AuthExpiredException} or
 * {@link TransientFetchException}. Timeouts are the implementation's job and surface as
 * {@link TransientFetchException}. Page tokens are numeric offsets.
 */
public interface RemoteCatalog {
    /**
     * @return The authenticated user
     */
    UserProfile getCurrentUser() throws CatalogException;

    /**
     * Lists the user's playlists, metadata only (no tracks).
     * @param offset Page offset
     * @param limit Page size
     * @return One page of playlists
     */
    Page<Playlist> listPlaylists(int offset, int limit) throws CatalogException;

    /**
     * Lists the tracks of a playlist.
     * @param playlistId Playlist to read
     * @param offset Page offset
     * @param limit Page size
     * @return One page of tracks; unavailable items are already skipped
     */
    Page<Track> listPlaylistTracks(String playlistId, int offset, int limit) throws CatalogException;

    /**
     * Lists the user's liked tracks.
     */
    Page<Track> listLikedTracks(int offset, int limit) throws CatalogException;

    /**
     * Fetches current metadata (version token, visibility, owner) for one playlist, without tracks.
     */
    Playlist getPlaylist(String playlistId) throws CatalogException;

    /**
     * @return Genre tags of an artist, possibly empty
     */
    List<String> getArtistGenres(String artistId) throws CatalogException;

    /**
     * Attempts to obtain fresh credentials after an {@link AuthExpiredException}.
     * @return true if later calls may succeed
     */
    boolean refreshCredentials();
}

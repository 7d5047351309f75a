package com.musicbackup.sync;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Aggregate figures about a persisted snapshot, shown by the {@code stats} command.
 * @param playlistCount Number of playlists
 * @param likedCount Number of liked tracks
 * @param uniqueTracks Distinct tracks across playlists and liked songs
 * @param uniqueArtists Distinct artist names
 * @param uniqueAlbums Distinct album names
 * @param genresFound Distinct genres (only non-zero when genres were fetched)
 * @param totalDurationMs Summed duration of every track occurrence
 * @param totalDurationHours The same sum in hours, rounded to two decimals
 * @param lastBackup Export time of the snapshot
 */
public record LibraryStatistics(
    int playlistCount,
    int likedCount,
    int uniqueTracks,
    int uniqueArtists,
    int uniqueAlbums,
    int genresFound,
    long totalDurationMs,
    double totalDurationHours,
    Instant lastBackup
) {
    public static LibraryStatistics of(Snapshot snapshot) {
        Set<String> tracks = new HashSet<>();
        Set<String> artists = new HashSet<>();
        Set<String> albums = new HashSet<>();
        Set<String> genres = new HashSet<>();
        long durationMs = 0;

        List<Track> liked = snapshot.likedSongs() == null ? List.of() : snapshot.likedSongs().tracks();
        for (Playlist p : snapshot.playlists()) {
            durationMs += collect(p.tracks(), tracks, artists, albums, genres);
        }
        durationMs += collect(liked, tracks, artists, albums, genres);

        double hours = Math.round(durationMs / 36_000.0) / 100.0;
        return new LibraryStatistics(snapshot.playlists().size(), liked.size(), tracks.size(), artists.size(),
            albums.size(), genres.size(), durationMs, hours, snapshot.exportedAt());
    }

    private static long collect(List<Track> source, Set<String> tracks, Set<String> artists, Set<String> albums,
                                Set<String> genres) {
        long durationMs = 0;
        for (Track t : source) {
            tracks.add(t.identityKey());
            artists.addAll(t.artists());
            albums.add(t.albumName());
            genres.addAll(t.genres());
            durationMs += t.durationMs();
        }
        return durationMs;
    }
}

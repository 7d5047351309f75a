package com.musicbackup.sync;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive substring search over a snapshot.
 * <p>
 * Tracks match on name, artists, album or genres; playlists match on name or description.
 * A blank query matches everything.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public final class LibrarySearch {
    public static final String LIKED_SOURCE = "Liked Songs";

    private LibrarySearch() {
    }

    /**
     * Finds tracks in the given part of the snapshot, in playlist order and then liked order.
     * A track present in several playlists is reported once per playlist.
     */
    public static List<TrackMatch> searchTracks(Snapshot snapshot, String query, SearchScope scope) {
        String needle = normalize(query);
        List<TrackMatch> out = new ArrayList<>();
        if (scope.includesPlaylists()) {
            for (Playlist playlist : snapshot.playlists()) {
                for (Track track : playlist.tracks()) {
                    if (matches(track, needle)) out.add(new TrackMatch(playlist.name(), track));
                }
            }
        }
        if (scope.includesLiked() && snapshot.likedSongs() != null) {
            for (Track track : snapshot.likedSongs().tracks()) {
                if (matches(track, needle)) out.add(new TrackMatch(LIKED_SOURCE, track));
            }
        }
        return out;
    }

    public static List<Playlist> searchPlaylists(Snapshot snapshot, String query) {
        String needle = normalize(query);
        List<Playlist> out = new ArrayList<>();
        for (Playlist playlist : snapshot.playlists()) {
            if (contains(playlist.name(), needle) || contains(playlist.description(), needle)) out.add(playlist);
        }
        return out;
    }

    static boolean matches(Track track, String needle) {
        if (contains(track.name(), needle) || contains(track.albumName(), needle)) return true;
        for (String artist : track.artists()) {
            if (contains(artist, needle)) return true;
        }
        for (String genre : track.genres()) {
            if (contains(genre, needle)) return true;
        }
        return false;
    }

    private static boolean contains(String haystack, String needle) {
        if (needle.isEmpty()) return true;
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static String normalize(String query) {
        return query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
    }
}

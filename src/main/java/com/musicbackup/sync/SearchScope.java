package com.musicbackup.sync;

import java.util.Locale;

/**
 * Which part of the library a track search looks at.
 */
public enum SearchScope {
    ALL,
    PLAYLISTS,
    LIKED;

    /**
     * Parses a scope name case-insensitively.
     * @throws IllegalArgumentException for unknown names
     */
    public static SearchScope parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    boolean includesPlaylists() {
        return this != LIKED;
    }

    boolean includesLiked() {
        return this != PLAYLISTS;
    }
}

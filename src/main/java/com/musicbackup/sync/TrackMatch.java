package com.musicbackup.sync;

/**
 * A track found by a search, with the name of the playlist it was found in
 * ({@link LibrarySearch#LIKED_SOURCE} for the liked collection).
 */
public record TrackMatch(String source, Track track) {
}

package com.musicbackup.sync;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-orchestrator cache of artist genre lookups, so each artist is asked for at most once per instance.
 */
public class GenreCache {
    static final int MAX_ARTISTS_PER_TRACK = 3;

    private final Map<String, List<String>> genresByArtist = new HashMap<>();

    @FunctionalInterface
    interface Lookup {
        List<String> genresOf(String artistId) throws CatalogException;
    }

    /**
     * Union of the genres of the first three artists, in discovery order.
     */
    List<String> genresFor(List<String> artistIds, Lookup lookup) throws CatalogException {
        Set<String> genres = new LinkedHashSet<>();
        int seen = 0;
        for (String artistId : artistIds) {
            if (seen++ >= MAX_ARTISTS_PER_TRACK) break;
            if (artistId == null || artistId.isBlank()) continue;
            List<String> cached = genresByArtist.get(artistId);
            if (cached == null) {
                cached = Utils.nonNullList(lookup.genresOf(artistId));
                genresByArtist.put(artistId, cached);
            }
            genres.addAll(cached);
        }
        return List.copyOf(genres);
    }
}

package com.musicbackup.sync;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Service for exporting a library snapshot to CSV using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Playlist tracks are written first, in playlist order, with source {@code Playlist}.</li>
 *   <li>Liked tracks follow with source {@code Liked Songs} and the playlist name {@code Liked Songs}.</li>
 *   <li>Text cells are flattened to one line so each row stays a single record for spreadsheet imports.</li>
 * </ul>
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] HEADER = {
        "Source", "Playlist Name", "Track Name", "Artists", "Album", "Duration (ms)", "Added At", "URI", "Is Local"
    };
    static final String LIKED_SOURCE = "Liked Songs";

    @Override
    public int writeSnapshotToCsv(Snapshot snapshot, Path target) throws IOException {
        if (snapshot == null) {
            logger.warn("Attempted to write null snapshot to CSV: {}", target);
            throw new IllegalArgumentException("Snapshot cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("Target file cannot be null");
        }
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);

        int rows = 0;
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (Playlist playlist : snapshot.playlists()) {
                rows += writeTracks(writer, "Playlist", playlist.name(), playlist.tracks());
            }
            if (snapshot.likedSongs() != null) {
                rows += writeTracks(writer, LIKED_SOURCE, LIKED_SOURCE, snapshot.likedSongs().tracks());
            }
        }
        logger.info("Wrote {} tracks to CSV file: {}", rows, target);
        return rows;
    }

    private static int writeTracks(CSVWriter writer, String source, String playlistName, List<Track> tracks) {
        for (Track track : tracks) {
            writer.writeNext(new String[]{
                source,
                safe(playlistName),
                safe(track.name()),
                safe(track.artistsString()),
                safe(track.albumName()),
                Long.toString(track.durationMs()),
                safe(track.addedAt()),
                safe(track.uri()),
                Boolean.toString(track.local())
            });
        }
        return tracks.size();
    }

    /**
     * Collapses CR/LF runs into a single space and trims. Quoting is left to the CSV writer.
     * @param s Input string
     * @return Single-line string, empty for null
     */
    static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}

package com.musicbackup.sync;

import com.opencsv.CSVReader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CsvServiceTest {
    @TempDir
    Path dir;

    @Test
    void testWritesPlaylistThenLikedRows() throws Exception {
        Track multiArtist = new Track("t1", "spotify:track:t1", "Song, with comma", List.of("A", "B"), List.of(), "Album\nTwo",
            "al", 215_000, "2024-05-01T10:00:00Z", 1, 1, false, false, 0, List.of(), null, Map.of(), null, null);
        Track local = new Track("", "spotify:local:x", "Local", List.of("Me"), List.of(), "Demo", "", 1000, null, 0, 1,
            false, true, 0, List.of(), null, Map.of(), null, null);
        Playlist playlist = FakeRemoteCatalog.playlist("P1", "user-1", false, "s", List.of(multiArtist, local));
        LikedSongs liked = new LikedSongs(List.of(Track.of("t9", "Liked", "C", 1000)), 1, null);
        Snapshot snapshot = Snapshot.of(null, List.of(playlist), liked, Instant.now());
        Path target = dir.resolve("exports/library.csv");

        int rows = new CsvService().writeSnapshotToCsv(snapshot, target);

        assertEquals(3, rows);
        try (Reader in = Files.newBufferedReader(target, StandardCharsets.UTF_8); CSVReader reader = new CSVReader(in)) {
            List<String[]> lines = reader.readAll();
            assertEquals(4, lines.size());
            assertArrayEquals(CsvService.HEADER, lines.get(0));
            assertArrayEquals(new String[]{"Playlist", "Playlist P1", "Song, with comma", "A, B", "Album Two", "215000",
                "2024-05-01T10:00:00Z", "spotify:track:t1", "false"}, lines.get(1));
            assertEquals("true", lines.get(2)[8]);
            assertEquals("Liked Songs", lines.get(3)[0]);
            assertEquals("Liked Songs", lines.get(3)[1]);
        }
    }

    @Test
    void testNullSnapshotRejected() {
        assertThrows(IllegalArgumentException.class, () -> new CsvService().writeSnapshotToCsv(null, dir.resolve("x.csv")));
    }

    @Test
    void testSafeFlattensLineBreaks() {
        assertEquals("a b", CsvService.safe(" a\r\nb "));
        assertEquals("", CsvService.safe(null));
    }
}

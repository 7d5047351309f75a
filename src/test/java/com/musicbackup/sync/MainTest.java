package com.musicbackup.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {
    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-14T12:00:00Z"));
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private final SyncOptions options = SyncOptions.defaults().withDelays(Duration.ZERO, Duration.ZERO);
    private FakeRemoteCatalog catalog;
    private BackupEngine engine;

    @BeforeEach
    void setUp() {
        catalog = new FakeRemoteCatalog()
            .add(FakeRemoteCatalog.playlist("P1", "user-1", false, "s1", FakeRemoteCatalog.tracks("a", 3)))
            .add(FakeRemoteCatalog.playlist("P2", "user-1", false, "s2", FakeRemoteCatalog.tracks("b", 2)));
        catalog.liked = FakeRemoteCatalog.tracks("l", 4);
        engine = new BackupEngine(catalog, dir, clock);
    }

    private int run(String... args) {
        buffer.reset();
        return Main.run(args, engine, options, out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testBackupThenStats() {
        assertEquals(Main.EXIT_OK, run("backup"));
        assertTrue(output().contains("Backup complete: 2 playlists, 5 playlist tracks, 4 liked songs."), output());

        assertEquals(Main.EXIT_OK, run("stats"));
        assertTrue(output().contains("Unique tracks:  9"), output());
        assertTrue(output().contains("Total duration: 27:00"), output());
    }

    @Test
    void testRateLimitedBackupCanBeResumed() {
        catalog.failOn("tracks:P2@0", new RateLimitedException(30, "HTTP 429"));

        assertEquals(Main.EXIT_INTERRUPTED, run("backup"));
        assertTrue(output().contains("Run 'resume' to continue."), output());

        assertEquals(Main.EXIT_OK, run("status"));
        assertTrue(output().contains("Interrupted backup (RATE_LIMITED): 1/2 playlists done"), output());

        clock.advance(Duration.ofSeconds(31));
        assertEquals(Main.EXIT_OK, run("resume"));
        assertTrue(output().contains("Backup complete: 2 playlists"), output());
        assertEquals(1, catalog.callsStartingWith("tracks:P1").size(), "completed playlist not fetched twice");
        assertFalse(engine.canResume());
    }

    @Test
    void testResumeWithNothingPending() {
        assertEquals(Main.EXIT_OK, run("resume"));
        assertTrue(output().contains("Nothing to resume."));
        assertTrue(catalog.calls.isEmpty());
    }

    @Test
    void testRefreshNeedsExistingBackupAndIds() {
        assertEquals(Main.EXIT_USAGE, run("refresh"));
        assertEquals(Main.EXIT_FAILED, run("refresh", "P1"));
        assertTrue(output().contains("run 'backup' first"));

        run("backup");
        catalog.add(FakeRemoteCatalog.playlist("P1", "user-1", false, "s1-new", FakeRemoteCatalog.tracks("a", 4)));
        assertEquals(Main.EXIT_OK, run("refresh", "P1"));
        assertEquals(4, engine.loadSnapshot().orElseThrow().findPlaylist("P1").trackCount());
    }

    @Test
    void testExportCsvToGivenFile() throws Exception {
        assertEquals(Main.EXIT_OK, run("export-csv"));
        assertTrue(output().contains("No backup saved yet."));

        run("backup");
        Path target = dir.resolve("out/library.csv");
        assertEquals(Main.EXIT_OK, run("export-csv", target.toString()));
        assertEquals(10, Files.readAllLines(target).size());
    }

    @Test
    void testSearchModes() {
        assertEquals(Main.EXIT_OK, run("search", "song"));
        assertTrue(output().contains("No backup saved yet."));

        run("backup");
        assertEquals(Main.EXIT_OK, run("search", "Song", "a1"));
        assertTrue(output().contains("[Playlist P1] Song a1 - Artist a (Unknown Album)"), output());
        assertTrue(output().contains("1 matching tracks."), output());

        assertEquals(Main.EXIT_OK, run("search", "artist", "l", "--in", "playlists"));
        assertTrue(output().contains("0 matching tracks."), output());
        assertEquals(Main.EXIT_OK, run("search", "artist", "l", "--in", "LIKED"));
        assertTrue(output().contains("4 matching tracks."), output());
        assertEquals(Main.EXIT_USAGE, run("search", "x", "--in", "nowhere"));
        assertEquals(Main.EXIT_USAGE, run("search", "x", "--in"));

        assertEquals(Main.EXIT_OK, run("search-playlists", "p2"));
        assertTrue(output().contains("P2  Playlist P2 (2 tracks)"), output());
        assertTrue(output().contains("1 matching playlists."), output());
    }

    @Test
    void testFolderModes() {
        assertEquals(Main.EXIT_OK, run("folders"));
        assertTrue(output().contains("No folders."));
        assertEquals(Main.EXIT_USAGE, run("assign-folder"));

        run("backup");
        assertEquals(Main.EXIT_OK, run("assign-folder", "P1", "Music/Rock"));
        assertTrue(output().contains("Moved P1 to Music/Rock."), output());
        assertEquals(Main.EXIT_FAILED, run("assign-folder", "missing", "Music"));

        assertEquals(Main.EXIT_OK, run("folders"));
        assertTrue(output().contains("Music/ (0 playlists)"), output());
        assertTrue(output().contains("  Rock/ (1 playlists)"), output());
        assertTrue(output().contains("    - P1"), output());

        assertEquals(Main.EXIT_OK, run("backup"));
        assertEquals("Music/Rock", engine.loadSnapshot().orElseThrow().findPlaylist("P1").folderPath());

        assertEquals(Main.EXIT_OK, run("assign-folder", "P1"));
        assertTrue(output().contains("Removed P1 from its folder."), output());
        assertNull(engine.loadSnapshot().orElseThrow().findPlaylist("P1").folderPath());
    }

    @Test
    void testUnknownModeIsUsageError() {
        assertEquals(Main.EXIT_USAGE, run("restore"));
        assertTrue(output().startsWith("Unknown mode 'restore'"));
    }

    @Test
    void testParseIds() {
        assertEquals(List.of("a", "b", "c"), Main.parseIds(new String[]{"refresh", "a, b", ",c"}));
        assertEquals(List.of(), Main.parseIds(new String[]{"refresh"}));
    }
}

package com.musicbackup.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SyncOrchestratorTest {
    private static final Instant START = Instant.parse("2026-01-01T00:00:00Z");

    @TempDir
    Path dir;

    private MutableClock clock;
    private RateLimitTracker tracker;
    private SnapshotStore store;
    private SyncOptions options;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        tracker = new RateLimitTracker(clock);
        store = new SnapshotStore(dir, clock);
        options = SyncOptions.defaults().withDelays(Duration.ZERO, Duration.ZERO).withPageSizes(50, 100, 50);
    }

    private SyncOrchestrator orchestrator(FakeRemoteCatalog catalog) {
        return new SyncOrchestrator(catalog, tracker, new ResumeCursor(dir, clock), store, clock);
    }

    private ResumeCursor cursorOnDisk() {
        ResumeCursor cursor = new ResumeCursor(dir, clock);
        assertTrue(cursor.load(), "expected a readable cursor file");
        return cursor;
    }

    private static FakeRemoteCatalog twoPlaylists() {
        FakeRemoteCatalog catalog = new FakeRemoteCatalog()
            .add(FakeRemoteCatalog.playlist("P1", "user-1", false, "s1", FakeRemoteCatalog.tracks("a", 3)))
            .add(FakeRemoteCatalog.playlist("P2", "user-1", false, "s2", FakeRemoteCatalog.tracks("b", 350)));
        catalog.liked = FakeRemoteCatalog.tracks("l", 120);
        return catalog;
    }

    @Test
    void testFullSyncFetchesEverythingInPlanOrder() {
        FakeRemoteCatalog catalog = twoPlaylists();
        SyncOrchestrator orchestrator = orchestrator(catalog);

        SyncResult result = orchestrator.runFullSync(options, false);

        assertEquals(SyncResult.Status.COMPLETED, result.status());
        Snapshot snapshot = ((SyncResult.Completed) result).snapshot();
        assertEquals(List.of("P1", "P2"), List.of(snapshot.playlists().get(0).playlistId(), snapshot.playlists().get(1).playlistId()));
        assertEquals(3, snapshot.playlists().get(0).trackCount());
        assertEquals(350, snapshot.playlists().get(1).trackCount());
        assertEquals(120, snapshot.likedCount());
        assertEquals(353, snapshot.totalTracks());
        assertEquals("user-1", snapshot.user().id());
        assertEquals(START, snapshot.playlists().get(1).lastSynced());
        assertEquals(SyncState.COMPLETED, orchestrator.getState());
        assertFalse(Files.exists(dir.resolve(ResumeCursor.FILE_NAME)));
        assertFalse(Files.exists(dir.resolve(SnapshotStore.PARTIAL_FILE)));
        assertFalse(Files.exists(dir.resolve(SnapshotStore.MAIN_FILE)), "a sync never writes the main snapshot");
    }

    @Test
    void testHasPendingWorkFalseAfterCompletedRun() {
        SyncOrchestrator orchestrator = orchestrator(twoPlaylists());
        orchestrator.runFullSync(options, false);
        assertFalse(orchestrator.canResume());
        assertFalse(orchestrator.resumeInfo().canResume());
    }

    @Test
    void testInterruptAtOffset200PersistsCursorAndResumesExactlyThere() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("tracks:P2@200", new RateLimitedException(60, "HTTP 429"));
        SyncOrchestrator orchestrator = orchestrator(catalog);

        SyncResult result = orchestrator.runFullSync(options, false);

        assertEquals(SyncResult.Status.INTERRUPTED, result.status());
        SyncResult.Interrupted interrupted = (SyncResult.Interrupted) result;
        assertEquals(InterruptionReason.RATE_LIMITED, interrupted.reason());
        assertEquals(START.plusSeconds(60), interrupted.availableAt());
        assertEquals(1, interrupted.completedCount());
        assertEquals(2, interrupted.plannedCount());
        assertTrue(interrupted.canResume());

        ResumeCursor cursor = cursorOnDisk();
        assertTrue(cursor.hasPendingWork());
        assertEquals("P2", cursor.getCurrentPlaylistId());
        assertEquals(200, cursor.getCurrentPlaylistOffset());
        assertEquals(Set.of("P1"), cursor.getCompletedPlaylistIds());
        assertEquals(InterruptionReason.RATE_LIMITED, cursor.getInterruptionReason());
        assertTrue(cursor.getRateLimit().limited());
        assertEquals(START.plusSeconds(60), cursor.getRateLimit().availableAt());

        Snapshot partial = store.loadPartial().orElseThrow();
        assertEquals(3, partial.findPlaylist("P1").trackCount());
        assertEquals(200, partial.findPlaylist("P2").trackCount());
        assertFalse(Files.exists(dir.resolve(SnapshotStore.MAIN_FILE)));

        catalog.calls.clear();
        clock.advance(Duration.ofSeconds(61));
        SyncResult resumed = orchestrator.runFullSync(options, true);

        assertEquals(SyncResult.Status.COMPLETED, resumed.status());
        assertEquals("tracks:P2@200", catalog.callsStartingWith("tracks:").get(0));
        assertTrue(catalog.callsStartingWith("tracks:P1").isEmpty(), "completed playlist must not be refetched");
        Playlist p2 = ((SyncResult.Completed) resumed).snapshot().findPlaylist("P2");
        assertEquals(350, p2.trackCount());
        assertEquals(350, new HashSet<>(p2.tracks()).size(), "no duplicated tracks after resume");
        assertFalse(orchestrator.canResume());
    }

    @Test
    void testNoRemoteCallsWhileStillThrottled() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("tracks:P2@100", new RateLimitedException(null, "Rate limit exceeded"));
        SyncOrchestrator orchestrator = orchestrator(catalog);
        SyncResult.Interrupted first = (SyncResult.Interrupted) orchestrator.runFullSync(options, false);
        assertEquals(START.plusSeconds(RateLimitTracker.DEFAULT_RETRY_AFTER_SECONDS), first.availableAt());

        int callsBefore = catalog.calls.size();
        clock.advance(Duration.ofMinutes(10));
        SyncResult again = orchestrator.runFullSync(options, true);

        assertEquals(SyncResult.Status.INTERRUPTED, again.status());
        assertTrue(((SyncResult.Interrupted) again).canResume());
        assertEquals(callsBefore, catalog.calls.size());
    }

    @Test
    void testPersistedThrottleIsHonouredByANewProcess() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("liked@50", new RateLimitedException(300, "HTTP 429"));
        orchestrator(catalog).runFullSync(options, false);

        tracker = new RateLimitTracker(clock);
        SyncOrchestrator restarted = orchestrator(catalog);
        int callsBefore = catalog.calls.size();
        clock.advance(Duration.ofSeconds(100));
        SyncResult result = restarted.runFullSync(options, true);

        assertEquals(SyncResult.Status.INTERRUPTED, result.status());
        assertEquals(START.plusSeconds(300), ((SyncResult.Interrupted) result).availableAt());
        assertEquals(callsBefore, catalog.calls.size());
    }

    @Test
    void testInterruptedLikedFetchResumesAtSavedOffset() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("liked@100", new TransientFetchException("connection reset"));
        SyncOrchestrator orchestrator = orchestrator(catalog);

        SyncResult result = orchestrator.runFullSync(options, false);

        SyncResult.Interrupted interrupted = (SyncResult.Interrupted) result;
        assertEquals(InterruptionReason.FETCH_ERROR, interrupted.reason());
        assertNull(interrupted.availableAt());
        assertTrue(interrupted.canResume());
        ResumeCursor cursor = cursorOnDisk();
        assertEquals(2, cursor.getCompletedPlaylistIds().size());
        assertEquals(100, cursor.getLikedOffset());
        assertNull(cursor.getRateLimit());

        catalog.calls.clear();
        SyncResult resumed = orchestrator.runFullSync(options, true);

        assertEquals(SyncResult.Status.COMPLETED, resumed.status());
        assertEquals(List.of("liked@100"), catalog.calls);
        assertEquals(120, ((SyncResult.Completed) resumed).snapshot().likedCount());
    }

    @Test
    void testCancellationPersistsCancelledWithoutRateLimitInfo() {
        FakeRemoteCatalog catalog = twoPlaylists();
        SyncOrchestrator orchestrator = orchestrator(catalog);
        orchestrator.setProgressListener((message, current, total) -> {
            if (message.startsWith("Fetching playlist 2/")) orchestrator.cancel();
        });

        SyncResult result = orchestrator.runFullSync(options, false);

        assertEquals(SyncResult.Status.CANCELLED, result.status());
        assertEquals(new SyncResult.Cancelled(1, 2), result);
        assertEquals(SyncState.CANCELLED, orchestrator.getState());
        ResumeCursor cursor = cursorOnDisk();
        assertTrue(cursor.wasInterrupted());
        assertEquals(InterruptionReason.CANCELLED, cursor.getInterruptionReason());
        assertNull(cursor.getRateLimit());
        assertTrue(orchestrator.canResume());
        assertEquals(InterruptionReason.CANCELLED, orchestrator.resumeInfo().reason());

        orchestrator.setProgressListener(ProgressListener.NONE);
        SyncResult resumed = orchestrator.runFullSync(options, true);
        assertEquals(SyncResult.Status.COMPLETED, resumed.status());
        assertEquals(350, ((SyncResult.Completed) resumed).snapshot().findPlaylist("P2").trackCount());
    }

    @Test
    void testExpiredCredentialsRefreshedExactlyOnce() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("tracks:P1@0", new AuthExpiredException("HTTP 401"));

        SyncResult result = orchestrator(catalog).runFullSync(options, false);

        assertEquals(SyncResult.Status.COMPLETED, result.status());
        assertEquals(1, catalog.refreshCount);
        assertEquals(2, catalog.callsStartingWith("tracks:P1@0").size());
    }

    @Test
    void testFailedRefreshReturnsFailedAndKeepsProgress() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("tracks:P2@100", new AuthExpiredException("HTTP 401"));
        catalog.refreshSucceeds = false;
        SyncOrchestrator orchestrator = orchestrator(catalog);

        SyncResult result = orchestrator.runFullSync(options, false);

        assertEquals(SyncResult.Status.FAILED, result.status());
        assertInstanceOf(AuthFailedException.class, ((SyncResult.Failed) result).cause());
        assertEquals(1, catalog.refreshCount);
        ResumeCursor cursor = cursorOnDisk();
        assertEquals(InterruptionReason.AUTH_FAILED, cursor.getInterruptionReason());
        assertEquals(100, cursor.getCurrentPlaylistOffset());
        assertTrue(orchestrator.canResume());
    }

    @Test
    void testRetryHintInUnclassifiedErrorIsTreatedAsThrottle() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("tracks:P1@0", new CatalogException("Rate limit exceeded. Retry will occur after: 120 s"));

        SyncResult result = orchestrator(catalog).runFullSync(options, false);

        SyncResult.Interrupted interrupted = (SyncResult.Interrupted) result;
        assertEquals(InterruptionReason.RATE_LIMITED, interrupted.reason());
        assertEquals(START.plusSeconds(120), interrupted.availableAt());
    }

    @Test
    void testServerErrorOnPlaylistWith429InIdIsNotAThrottle() {
        String id = "37i9dQZF1DX4290abcdEFG";
        FakeRemoteCatalog catalog = new FakeRemoteCatalog()
            .add(FakeRemoteCatalog.playlist(id, "user-1", false, "s", FakeRemoteCatalog.tracks("a", 3)))
            .failOn("tracks:" + id + "@0", new TransientFetchException("HTTP 502 from /v1/playlists/" + id + "/tracks: Bad gateway"));
        SyncOrchestrator orchestrator = orchestrator(catalog);

        SyncResult.Interrupted interrupted = (SyncResult.Interrupted) orchestrator.runFullSync(options, false);

        assertEquals(InterruptionReason.FETCH_ERROR, interrupted.reason());
        assertNull(interrupted.availableAt());
        assertFalse(tracker.isLimited());
        ResumeCursor cursor = cursorOnDisk();
        assertEquals(InterruptionReason.FETCH_ERROR, cursor.getInterruptionReason());
        assertNull(cursor.getRateLimit());

        catalog.calls.clear();
        assertEquals(SyncResult.Status.COMPLETED, orchestrator.runFullSync(options, true).status());
        assertEquals(List.of("tracks:" + id + "@0"), catalog.callsStartingWith("tracks:"));
    }

    @Test
    void testThrottleWhileReloadingMetadataIsPersistedForNextProcess() throws Exception {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("tracks:P2@200", new TransientFetchException("timeout"));
        orchestrator(catalog).runFullSync(options, false);
        Files.delete(dir.resolve(SnapshotStore.PARTIAL_FILE));
        catalog.failOn("playlist:P1", new RateLimitedException(600, "HTTP 429"));

        SyncResult.Interrupted interrupted = (SyncResult.Interrupted) orchestrator(catalog).runFullSync(options, true);

        assertEquals(InterruptionReason.RATE_LIMITED, interrupted.reason());
        assertTrue(interrupted.canResume());
        ResumeCursor cursor = cursorOnDisk();
        assertEquals(InterruptionReason.RATE_LIMITED, cursor.getInterruptionReason());
        assertEquals(START.plusSeconds(600), cursor.getRateLimit().availableAt());

        catalog.calls.clear();
        tracker = new RateLimitTracker(clock);
        SyncResult again = orchestrator(catalog).runFullSync(options, true);
        assertEquals(SyncResult.Status.INTERRUPTED, again.status());
        assertTrue(catalog.calls.isEmpty(), "no remote call while the saved throttle is active");

        clock.advance(Duration.ofSeconds(601));
        assertEquals(SyncResult.Status.COMPLETED, orchestrator(catalog).runFullSync(options, true).status());
    }

    @Test
    void testThrottleDuringEnumerationLeavesNothingToResume() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("playlists@0", new RateLimitedException(30, "HTTP 429"));
        SyncOrchestrator orchestrator = orchestrator(catalog);

        SyncResult result = orchestrator.runFullSync(options, false);

        SyncResult.Interrupted interrupted = (SyncResult.Interrupted) result;
        assertFalse(interrupted.canResume());
        assertEquals(0, interrupted.plannedCount());
        assertFalse(orchestrator.canResume());
    }

    @Test
    void testFreshRunDiscardsStaleCursor() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("tracks:P2@200", new TransientFetchException("timeout"));
        SyncOrchestrator orchestrator = orchestrator(catalog);
        orchestrator.runFullSync(options, false);
        assertTrue(orchestrator.canResume());

        catalog.calls.clear();
        SyncResult result = orchestrator.runFullSync(options, false);

        assertEquals(SyncResult.Status.COMPLETED, result.status());
        assertEquals("tracks:P1@0", catalog.callsStartingWith("tracks:").get(0));
        assertFalse(Files.exists(dir.resolve(SnapshotStore.PARTIAL_FILE)));
    }

    @Test
    void testResumeWithLostPartialRestartsInFlightPlaylist() throws Exception {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("tracks:P2@200", new TransientFetchException("timeout"));
        SyncOrchestrator orchestrator = orchestrator(catalog);
        orchestrator.runFullSync(options, false);
        Files.writeString(dir.resolve(SnapshotStore.PARTIAL_FILE), "{not json");

        catalog.calls.clear();
        SyncResult result = orchestrator.runFullSync(options, true);

        assertEquals(SyncResult.Status.COMPLETED, result.status());
        Snapshot snapshot = ((SyncResult.Completed) result).snapshot();
        assertEquals(3, snapshot.findPlaylist("P1").trackCount());
        assertEquals(350, snapshot.findPlaylist("P2").trackCount());
        assertTrue(catalog.calls.contains("user"));
        assertEquals("tracks:P2@0", catalog.callsStartingWith("tracks:P2").get(0));
    }

    @Test
    void testFiltersExcludeServiceAndCollaborativePlaylists() {
        FakeRemoteCatalog catalog = new FakeRemoteCatalog()
            .add(FakeRemoteCatalog.playlist("MINE", "user-1", false, "s", FakeRemoteCatalog.tracks("m", 2)))
            .add(FakeRemoteCatalog.playlist("EDITORIAL", "Spotify", false, "s", FakeRemoteCatalog.tracks("e", 2)))
            .add(FakeRemoteCatalog.playlist("SHARED", "friend", true, "s", FakeRemoteCatalog.tracks("c", 2)));

        SyncResult result = orchestrator(catalog).runFullSync(options.withFilters(false, false), false);

        Snapshot snapshot = ((SyncResult.Completed) result).snapshot();
        assertEquals(1, snapshot.playlistCount());
        assertNotNull(snapshot.findPlaylist("MINE"));
        assertTrue(catalog.callsStartingWith("tracks:EDITORIAL").isEmpty());
    }

    @Test
    void testEnumerationPagesAndDeduplicates() {
        FakeRemoteCatalog catalog = new FakeRemoteCatalog();
        for (int i = 0; i < 5; i++) {
            catalog.add(FakeRemoteCatalog.playlist("P" + i, "user-1", false, "s", FakeRemoteCatalog.tracks("t" + i, 1)));
        }

        SyncResult result = orchestrator(catalog).runFullSync(options.withPageSizes(2, 100, 50), false);

        assertEquals(5, ((SyncResult.Completed) result).snapshot().playlistCount());
        assertEquals(List.of("playlists@0", "playlists@2", "playlists@4"), catalog.callsStartingWith("playlists@"));
    }

    @Test
    void testGenreBackfillAsksEachArtistOnce() {
        Track first = new Track("t1", "spotify:track:t1", "One", List.of("A"), List.of("artist-a"), "Album", "al",
            1000, null, 1, 1, false, false, 0, List.of(), null, Map.of(), null, null);
        Track second = new Track("t2", "spotify:track:t2", "Two", List.of("A"), List.of("artist-a"), "Album", "al",
            1000, null, 2, 1, false, false, 0, List.of(), null, Map.of(), null, null);
        FakeRemoteCatalog catalog = new FakeRemoteCatalog()
            .add(FakeRemoteCatalog.playlist("P1", "user-1", false, "s", List.of(first, second)));
        catalog.genresByArtist.put("artist-a", List.of("shoegaze", "dream pop"));

        SyncResult result = orchestrator(catalog).runFullSync(options.withFetchGenres(true), false);

        Playlist playlist = ((SyncResult.Completed) result).snapshot().findPlaylist("P1");
        assertEquals(List.of("shoegaze", "dream pop"), playlist.tracks().get(0).genres());
        assertEquals(List.of("shoegaze", "dream pop"), playlist.tracks().get(1).genres());
        assertEquals(1, catalog.callsStartingWith("artist:").size());
    }

    @Test
    void testSelectiveSyncRefreshesOnlyRequestedPlaylists() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .add(FakeRemoteCatalog.playlist("P3", "user-1", false, "s3", FakeRemoteCatalog.tracks("c", 5)));

        SyncResult result = orchestrator(catalog).runSelectiveSync(List.of("P3", "P1"), options);

        Snapshot snapshot = ((SyncResult.Completed) result).snapshot();
        assertEquals(2, snapshot.playlistCount());
        assertEquals("P3", snapshot.playlists().get(0).playlistId());
        assertEquals(5, snapshot.findPlaylist("P3").trackCount());
        assertNull(snapshot.likedSongs());
        assertTrue(catalog.callsStartingWith("tracks:P2").isEmpty());
        assertTrue(catalog.callsStartingWith("liked").isEmpty());
        assertFalse(Files.exists(dir.resolve(ResumeCursor.FILE_NAME)));
    }

    @Test
    void testInterruptedSelectiveSyncCannotResume() {
        FakeRemoteCatalog catalog = twoPlaylists()
            .failOn("tracks:P2@100", new RateLimitedException(5, "HTTP 429"));

        SyncResult result = orchestrator(catalog).runSelectiveSync(List.of("P1", "P2"), options);

        SyncResult.Interrupted interrupted = (SyncResult.Interrupted) result;
        assertEquals(1, interrupted.completedCount());
        assertEquals(2, interrupted.plannedCount());
        assertFalse(interrupted.canResume());
        assertFalse(Files.exists(dir.resolve(ResumeCursor.FILE_NAME)));
    }
}

package com.musicbackup.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a full or selective sync against a {@link RemoteCatalog}.
 * <p>
 * Workflow of a full run:
 * <ul>
 *   <li>Fresh: fetch the user, enumerate and filter playlists, persist the plan in the {@link ResumeCursor}.</li>
 *   <li>Resume: reload the cursor and the partial snapshot, skip completed playlists, continue at the saved offset.</li>
 *   <li>Each playlist is paged through; the cursor is saved after every page.</li>
 *   <li>Liked tracks are fetched last, the same way.</li>
 *   <li>On a throttle, fetch error, auth failure or cancel, the partial snapshot and cursor are saved
 *       before control returns.</li>
 * </ul>
 * <p>
 * Every remote call goes through one wrapper that checks the {@link RateLimitTracker} first, records
 * throttles, and retries once after a credential refresh. A run never sleeps out a throttle.
 * <p>
 * One instance runs at most one sync at a time; {@link #cancel()} may be called from another thread.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class SyncOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(SyncOrchestrator.class);

    private final RemoteCatalog catalog;
    private final RateLimitTracker rateLimiter;
    private final ResumeCursor cursor;
    private final SnapshotStoreInterface store;
    private final Clock clock;
    private final GenreCache genreCache = new GenreCache();
    private final AtomicBoolean cancelRequested = new AtomicBoolean();

    private volatile SyncState state = SyncState.IDLE;
    private ProgressListener progress = ProgressListener.NONE;

    public SyncOrchestrator(RemoteCatalog catalog, RateLimitTracker rateLimiter, ResumeCursor cursor,
                            SnapshotStoreInterface store, Clock clock) {
        this.catalog = catalog;
        this.rateLimiter = rateLimiter;
        this.cursor = cursor;
        this.store = store;
        this.clock = clock;
    }

    public void setProgressListener(ProgressListener listener) {
        this.progress = listener == null ? ProgressListener.NONE : listener;
    }

    public SyncState getState() {
        return state;
    }

    /**
     * Asks the running sync to stop at the next page boundary. Progress so far is persisted and resumable.
     */
    public void cancel() {
        logger.info("Cancellation requested.");
        cancelRequested.set(true);
    }

    @FunctionalInterface
    private interface CatalogCall<T> {
        T execute() throws CatalogException;
    }

    @FunctionalInterface
    private interface TrackPageSource {
        Page<Track> fetch(int offset) throws CatalogException;
    }

    @FunctionalInterface
    private interface PageCommitted {
        void committed(int nextOffset, List<Track> fetchedSoFar);
    }

    private static final class Cancellation extends Exception {
        Cancellation() {
            super("Sync cancelled", null, false, false);
        }
    }

    /**
     * In-memory state of one full run.
     */
    private static final class Run {
        UserProfile user;
        List<PlannedPlaylist> plan = new ArrayList<>();
        // plan order; holds completed playlists plus the one in flight
        final Map<String, Playlist> playlists = new LinkedHashMap<>();
        final Set<String> restoredFromPartial = new HashSet<>();
        List<Track> likedTracks = new ArrayList<>();
        int likedTotal;
        boolean likedRestored;
    }

    // ---------------------------------------------------------------------------------------------
    // Full sync
    // ---------------------------------------------------------------------------------------------

    /**
     * Fetches the complete remote library.
     * @param options Filters, page sizes and delays
     * @param resume Continue an interrupted run if the cursor has pending work; otherwise start fresh
     * @return Completed with the fetched snapshot, or why the run stopped
     * @throws LocalStateException if the cursor or partial snapshot cannot be written
     */
    public SyncResult runFullSync(SyncOptions options, boolean resume) {
        cancelRequested.set(false);
        boolean pending = cursor.load() && cursor.hasPendingWork();
        boolean resuming = resume && pending;
        if (resuming) {
            rateLimiter.restore(cursor.getRateLimit());
        }
        if (rateLimiter.isLimited()) {
            logger.warn("Still rate limited until {}; not starting a sync.", rateLimiter.availableAt());
            state = SyncState.INTERRUPTED;
            return new SyncResult.Interrupted(rateLimiter.availableAt(), cursor.getCompletedPlaylistIds().size(),
                cursor.getPlannedPlaylists().size(), pending, InterruptionReason.RATE_LIMITED);
        }

        try {
            return doFullSync(options, resuming);
        } catch (LocalStateException e) {
            state = SyncState.FAILED;
            logger.error("Local state could not be persisted: {}", e.getMessage(), e);
            throw e;
        }
    }

    private SyncResult doFullSync(SyncOptions options, boolean resuming) {
        Run run = new Run();
        try {
            if (resuming) {
                prepareResume(run);
            } else {
                prepareFresh(run, options);
            }
        } catch (Cancellation c) {
            keepResumable(resuming, InterruptionReason.CANCELLED);
            state = SyncState.CANCELLED;
            logger.info("Sync cancelled before any playlist was fetched.");
            return new SyncResult.Cancelled(cursor.getCompletedPlaylistIds().size(), cursor.getPlannedPlaylists().size());
        } catch (AuthFailedException e) {
            keepResumable(resuming, InterruptionReason.AUTH_FAILED);
            state = SyncState.FAILED;
            return new SyncResult.Failed(e.getMessage(), e);
        } catch (RateLimitedException e) {
            keepResumable(resuming, InterruptionReason.RATE_LIMITED);
            state = SyncState.INTERRUPTED;
            return new SyncResult.Interrupted(rateLimiter.availableAt(), cursor.getCompletedPlaylistIds().size(),
                cursor.getPlannedPlaylists().size(), resuming, InterruptionReason.RATE_LIMITED);
        } catch (CatalogException e) {
            keepResumable(resuming, InterruptionReason.FETCH_ERROR);
            state = SyncState.INTERRUPTED;
            logger.warn("Sync could not start: {}", e.getMessage());
            return new SyncResult.Interrupted(null, cursor.getCompletedPlaylistIds().size(),
                cursor.getPlannedPlaylists().size(), resuming, InterruptionReason.FETCH_ERROR);
        }

        try {
            int total = run.plan.size();
            for (PlannedPlaylist planned : run.plan) {
                if (cursor.isCompleted(planned.id())) continue;
                int index = cursor.getCompletedPlaylistIds().size() + 1;
                progress.onProgress("Fetching playlist " + index + "/" + total + ": " + planned.name(), index, total);
                fetchPlaylist(run, planned, options);
                pause(options.playlistDelay());
            }
            if (!cursor.isLikedCompleted()) {
                fetchLiked(run, options);
            }
        } catch (Cancellation c) {
            persistInterruption(run, InterruptionReason.CANCELLED);
            state = SyncState.CANCELLED;
            logger.info("Sync cancelled after {}/{} playlists; progress saved.", cursor.getCompletedPlaylistIds().size(), run.plan.size());
            return new SyncResult.Cancelled(cursor.getCompletedPlaylistIds().size(), run.plan.size());
        } catch (AuthFailedException e) {
            persistInterruption(run, InterruptionReason.AUTH_FAILED);
            state = SyncState.FAILED;
            return new SyncResult.Failed(e.getMessage(), e);
        } catch (RateLimitedException e) {
            persistInterruption(run, InterruptionReason.RATE_LIMITED);
            state = SyncState.INTERRUPTED;
            progress.onProgress("Rate limited; resume after " + rateLimiter.availableAt(), cursor.getCompletedPlaylistIds().size(), run.plan.size());
            return new SyncResult.Interrupted(rateLimiter.availableAt(), cursor.getCompletedPlaylistIds().size(),
                run.plan.size(), true, InterruptionReason.RATE_LIMITED);
        } catch (CatalogException e) {
            logger.warn("Fetch error, stopping sync: {}", e.getMessage());
            persistInterruption(run, InterruptionReason.FETCH_ERROR);
            state = SyncState.INTERRUPTED;
            return new SyncResult.Interrupted(null, cursor.getCompletedPlaylistIds().size(), run.plan.size(), true,
                InterruptionReason.FETCH_ERROR);
        }

        List<Playlist> ordered = new ArrayList<>(run.playlists.values());
        LikedSongs liked = new LikedSongs(run.likedTracks, run.likedTotal, clock.instant());
        Snapshot snapshot = Snapshot.of(run.user, ordered, liked, clock.instant());
        cursor.clear();
        store.deletePartial();
        state = SyncState.COMPLETED;
        logger.info("Sync complete: {} playlists, {} playlist tracks, {} liked tracks.",
            snapshot.playlistCount(), snapshot.totalTracks(), snapshot.likedCount());
        progress.onProgress("Sync complete", run.plan.size(), run.plan.size());
        return new SyncResult.Completed(snapshot);
    }

    private void prepareFresh(Run run, SyncOptions options) throws CatalogException, Cancellation {
        cursor.clear();
        store.deletePartial();
        state = SyncState.ENUMERATING;
        progress.onProgress("Fetching user profile...", 0, 0);
        run.user = call(catalog::getCurrentUser, "fetching user profile");
        logger.info("Starting full sync for {}", run.user.label());

        for (Playlist p : enumeratePlaylists(options)) {
            run.plan.add(new PlannedPlaylist(p.playlistId(), p.name()));
            run.playlists.put(p.playlistId(), p);
        }
        cursor.startRun(run.plan);
        cursor.save();
        logger.info("Planned {} playlists.", run.plan.size());
    }

    private void prepareResume(Run run) throws CatalogException, Cancellation {
        state = SyncState.ENUMERATING;
        Optional<Snapshot> partial = store.loadPartial();
        run.plan = cursor.getPlannedPlaylists();
        logger.info("Resuming sync: {}/{} playlists done, liked songs {}.", cursor.getCompletedPlaylistIds().size(),
            run.plan.size(), cursor.isLikedCompleted() ? "done" : "pending");

        run.user = partial.map(Snapshot::user).orElse(null);
        if (run.user == null) {
            run.user = call(catalog::getCurrentUser, "fetching user profile");
        }

        Map<String, Playlist> saved = new HashMap<>();
        partial.ifPresent(s -> s.playlists().forEach(p -> saved.put(p.playlistId(), p)));

        for (PlannedPlaylist planned : run.plan) {
            checkCancelled();
            Playlist p = saved.get(planned.id());
            if (p != null) {
                run.playlists.put(planned.id(), p);
                run.restoredFromPartial.add(planned.id());
                continue;
            }
            if (cursor.isCompleted(planned.id())) {
                logger.warn("Playlist '{}' was completed but is missing from the partial snapshot; fetching it again.", planned.name());
                cursor.reopenPlaylist(planned.id());
            }
            if (cursor.offsetFor(planned.id()) > 0) {
                logger.warn("Tracks fetched so far for '{}' are missing; restarting it from the first page.", planned.name());
                cursor.advancePlaylist(planned.id(), 0);
            }
            Playlist meta = call(() -> catalog.getPlaylist(planned.id()), "fetching playlist " + planned.name());
            run.playlists.put(planned.id(), meta.withTracks(List.of()));
        }

        LikedSongs savedLiked = partial.map(Snapshot::likedSongs).orElse(null);
        if (cursor.getLikedOffset() > 0) {
            if (savedLiked != null) {
                run.likedTracks = new ArrayList<>(savedLiked.tracks());
                run.likedTotal = savedLiked.totalTracks();
                run.likedRestored = true;
            } else {
                logger.warn("Liked tracks fetched so far are missing; restarting liked songs from the first page.");
                cursor.advanceLiked(0);
            }
        }

        cursor.markRunning();
        cursor.save();
    }

    /**
     * Records why a resume stopped while reloading metadata, so the next process sees the current throttle.
     * A fresh run that fails before its plan is saved has nothing to keep.
     */
    private void keepResumable(boolean resuming, InterruptionReason reason) {
        if (!resuming) return;
        cursor.markInterrupted(reason, rateLimiter.status());
        cursor.save();
    }

    private List<Playlist> enumeratePlaylists(SyncOptions options) throws CatalogException, Cancellation {
        List<Playlist> accepted = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int offset = 0;
        while (true) {
            checkCancelled();
            final int pageOffset = offset;
            Page<Playlist> page = call(() -> catalog.listPlaylists(pageOffset, options.enumerationPageSize()), "fetching playlists");
            for (Playlist p : page.items()) {
                if (p.playlistId().isBlank() || !seen.add(p.playlistId())) continue;
                if (!options.accepts(p)) {
                    logger.info("Skipping playlist '{}' (owner: {}, collaborative: {})", p.name(), p.ownerId(), p.collaborative());
                    continue;
                }
                accepted.add(p);
            }
            progress.onProgress("Found " + accepted.size() + " playlists...", seen.size(), page.total());
            if (!page.hasNext() || page.nextOffset() <= offset) break;
            offset = page.nextOffset();
            pause(options.pageDelay());
        }
        return accepted;
    }

    private void fetchPlaylist(Run run, PlannedPlaylist planned, SyncOptions options) throws CatalogException, Cancellation {
        state = SyncState.FETCHING_PLAYLIST;
        String id = planned.id();
        Playlist playlist = run.playlists.get(id);
        int offset = cursor.offsetFor(id);
        List<Track> tracks = new ArrayList<>();
        if (offset > 0 && run.restoredFromPartial.contains(id)) {
            tracks.addAll(playlist.tracks());
            logger.info("Continuing '{}' at offset {} with {} tracks already fetched.", planned.name(), offset, tracks.size());
        } else {
            offset = 0;
        }
        cursor.advancePlaylist(id, offset);
        run.playlists.put(id, playlist.withTracks(tracks));

        drainPages(at -> catalog.listPlaylistTracks(id, at, options.playlistPageSize()), offset, tracks,
            "fetching tracks for '" + planned.name() + "'", options,
            (next, soFar) -> {
                run.playlists.put(id, playlist.withTracks(soFar));
                cursor.advancePlaylist(id, next);
                cursor.save();
            });

        run.playlists.put(id, playlist.withTracks(tracks).withLastSynced(clock.instant()));
        cursor.completePlaylist(id);
        cursor.save();
        logger.debug("Playlist '{}' complete with {} tracks.", planned.name(), tracks.size());
    }

    private void fetchLiked(Run run, SyncOptions options) throws CatalogException, Cancellation {
        state = SyncState.FETCHING_LIKED;
        progress.onProgress("Fetching liked songs...", cursor.getCompletedPlaylistIds().size(), run.plan.size());
        int offset = cursor.getLikedOffset();
        if (offset == 0 || !run.likedRestored) {
            run.likedTracks = new ArrayList<>();
            offset = 0;
        }
        List<Track> tracks = run.likedTracks;
        drainPages(at -> {
                Page<Track> p = catalog.listLikedTracks(at, options.likedPageSize());
                run.likedTotal = p.total();
                return p;
            }, offset, tracks, "fetching liked songs", options,
            (next, soFar) -> {
                cursor.advanceLiked(next);
                cursor.save();
            });
        cursor.completeLiked();
        cursor.save();
        logger.info("Liked songs complete with {} tracks.", tracks.size());
    }

    /**
     * Pages through a track listing into {@code into}, committing after every page that has a successor.
     * A page is only appended once it and its genre backfill both succeeded.
     */
    private void drainPages(TrackPageSource source, int startOffset, List<Track> into, String context,
                            SyncOptions options, PageCommitted onPage) throws CatalogException, Cancellation {
        int offset = startOffset;
        while (true) {
            checkCancelled();
            final int pageOffset = offset;
            Page<Track> page = call(() -> source.fetch(pageOffset), context);
            into.addAll(enrich(page.items(), options));
            progress.onProgress(context + ": " + into.size() + " tracks", into.size(), page.total());
            if (!page.hasNext() || page.nextOffset() <= offset) return;
            offset = page.nextOffset();
            onPage.committed(offset, into);
            pause(options.pageDelay());
        }
    }

    private List<Track> enrich(List<Track> tracks, SyncOptions options) throws CatalogException {
        if (!options.fetchGenres()) return tracks;
        List<Track> out = new ArrayList<>(tracks.size());
        for (Track t : tracks) {
            if (t.artistIds().isEmpty() || !t.genres().isEmpty()) {
                out.add(t);
                continue;
            }
            List<String> genres = genreCache.genresFor(t.artistIds(),
                artistId -> call(() -> catalog.getArtistGenres(artistId), "fetching artist genres"));
            out.add(t.withGenres(genres));
        }
        return out;
    }

    private void persistInterruption(Run run, InterruptionReason reason) {
        List<Playlist> fetched = new ArrayList<>();
        for (Playlist p : run.playlists.values()) {
            if (cursor.isCompleted(p.playlistId()) || p.playlistId().equals(cursor.getCurrentPlaylistId())) {
                fetched.add(p);
            }
        }
        LikedSongs liked = new LikedSongs(run.likedTracks, run.likedTotal, null);
        store.savePartial(Snapshot.of(run.user, fetched, liked, clock.instant()));
        cursor.markInterrupted(reason, rateLimiter.status());
        cursor.save();
        logger.info("Progress saved ({}): {}/{} playlists complete.", reason, cursor.getCompletedPlaylistIds().size(), run.plan.size());
    }

    // ---------------------------------------------------------------------------------------------
    // Selective sync
    // ---------------------------------------------------------------------------------------------

    /**
     * Re-fetches the given playlists from offset 0. Uses no cursor; an interruption loses the in-flight playlist.
     * @param playlistIds Playlists to refresh, in order
     * @param options Page sizes, delays and genre backfill
     * @return Completed with a snapshot holding only the refreshed playlists (liked songs absent)
     */
    public SyncResult runSelectiveSync(List<String> playlistIds, SyncOptions options) {
        cancelRequested.set(false);
        List<Playlist> refreshed = new ArrayList<>();
        int total = playlistIds.size();
        UserProfile user;
        try {
            user = call(catalog::getCurrentUser, "fetching user profile");
            for (String id : playlistIds) {
                checkCancelled();
                state = SyncState.FETCHING_PLAYLIST;
                Playlist meta = call(() -> catalog.getPlaylist(id), "fetching playlist " + id);
                progress.onProgress("Refreshing playlist " + (refreshed.size() + 1) + "/" + total + ": " + meta.name(),
                    refreshed.size() + 1, total);
                List<Track> tracks = new ArrayList<>();
                drainPages(at -> catalog.listPlaylistTracks(id, at, options.playlistPageSize()), 0, tracks,
                    "refreshing '" + meta.name() + "'", options, (next, soFar) -> { });
                refreshed.add(meta.withTracks(tracks).withLastSynced(clock.instant()));
                pause(options.playlistDelay());
            }
        } catch (Cancellation c) {
            state = SyncState.CANCELLED;
            return new SyncResult.Cancelled(refreshed.size(), total);
        } catch (AuthFailedException e) {
            state = SyncState.FAILED;
            return new SyncResult.Failed(e.getMessage(), e);
        } catch (RateLimitedException e) {
            state = SyncState.INTERRUPTED;
            return new SyncResult.Interrupted(rateLimiter.availableAt(), refreshed.size(), total, false,
                InterruptionReason.RATE_LIMITED);
        } catch (CatalogException e) {
            state = SyncState.INTERRUPTED;
            logger.warn("Selective refresh stopped: {}", e.getMessage());
            return new SyncResult.Interrupted(null, refreshed.size(), total, false, InterruptionReason.FETCH_ERROR);
        }
        state = SyncState.COMPLETED;
        logger.info("Refreshed {} playlists.", refreshed.size());
        return new SyncResult.Completed(Snapshot.of(user, refreshed, null, clock.instant()));
    }

    // ---------------------------------------------------------------------------------------------
    // Resume queries
    // ---------------------------------------------------------------------------------------------

    public boolean canResume() {
        return cursor.load() && cursor.hasPendingWork();
    }

    public ResumeInfo resumeInfo() {
        if (!canResume()) return ResumeInfo.none();
        return new ResumeInfo(true, cursor.getCompletedPlaylistIds().size(), cursor.getPlannedPlaylists().size(),
            cursor.isLikedCompleted(), cursor.getInterruptionReason(), cursor.getRateLimit());
    }

    // ---------------------------------------------------------------------------------------------
    // Remote-call wrapper
    // ---------------------------------------------------------------------------------------------

    private <T> T call(CatalogCall<T> remote, String context) throws CatalogException {
        boolean refreshed = false;
        while (true) {
            if (rateLimiter.isLimited()) {
                throw new RateLimitedException(null, "Rate limited until " + rateLimiter.availableAt());
            }
            try {
                return remote.execute();
            } catch (RateLimitedException e) {
                rateLimiter.recordLimit(e.getRetryAfterSeconds(), e.getMessage(), context);
                throw e;
            } catch (AuthExpiredException e) {
                if (refreshed || !catalog.refreshCredentials()) {
                    logger.error("Authentication failed during {}: {}", context, e.getMessage());
                    throw new AuthFailedException("Authentication failed during " + context + ", please reconnect", e);
                }
                refreshed = true;
                logger.info("Credentials refreshed during {}; retrying.", context);
            } catch (AuthFailedException | TransientFetchException e) {
                // already classified by the adapter; real 429s arrive as RateLimitedException
                throw e;
            } catch (CatalogException | RuntimeException e) {
                if (RateLimitTracker.looksLikeRateLimit(e.getMessage())) {
                    rateLimiter.recordLimit(null, e.getMessage(), context);
                    throw new RateLimitedException(null, e.getMessage());
                }
                throw new TransientFetchException("Error " + context + ": " + e.getMessage(), e);
            }
        }
    }

    private void checkCancelled() throws Cancellation {
        if (cancelRequested.get()) throw new Cancellation();
    }

    private void pause(Duration delay) {
        if (delay.isZero() || delay.isNegative()) return;
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelRequested.set(true);
        }
    }
}

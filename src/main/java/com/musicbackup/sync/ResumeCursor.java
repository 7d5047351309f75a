package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Persisted record of exactly where a full sync stopped.
 * <p>
 * Lifecycle:
 * <ul>
 *   <li>Created by {@link #startRun(List)} at the beginning of a fresh run.</li>
 *   <li>Saved after every successful page and before control returns on interruption.</li>
 *   <li>Removed by {@link #clear()} once the run completes.</li>
 * </ul>
 * <p>
 * Only one playlist is ever in flight, so a single {@code currentPlaylistId}/{@code currentPlaylistOffset}
 * pair is unambiguous. Offsets are remote pagination offsets, not track counts.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class ResumeCursor {
    private static final Logger logger = LoggerFactory.getLogger(ResumeCursor.class);
    static final String FILE_NAME = ".backup_progress.json";

    private final Path progressFile;
    private final ObjectMapper mapper;
    private final Clock clock;

    private List<PlannedPlaylist> plannedPlaylists = new ArrayList<>();
    private Set<String> completedPlaylistIds = new LinkedHashSet<>();
    private String currentPlaylistId;
    private int currentPlaylistOffset;
    private boolean likedCompleted;
    private int likedOffset;
    private boolean interrupted;
    private InterruptionReason interruptionReason;
    private RateLimitStatus rateLimit;

    public ResumeCursor(Path backupDir) {
        this(backupDir, Clock.systemUTC());
    }

    public ResumeCursor(Path backupDir, Clock clock) {
        this.progressFile = backupDir.resolve(FILE_NAME);
        this.mapper = Utils.newObjectMapper();
        this.clock = clock;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record State(
        @JsonProperty("playlists_to_process") List<PlannedPlaylist> plannedPlaylists,
        @JsonProperty("playlists_completed") List<String> completedPlaylistIds,
        @JsonProperty("current_playlist_id") String currentPlaylistId,
        @JsonProperty("current_playlist_offset") int currentPlaylistOffset,
        @JsonProperty("liked_songs_completed") boolean likedCompleted,
        @JsonProperty("liked_songs_offset") int likedOffset,
        @JsonProperty("was_interrupted") boolean interrupted,
        @JsonProperty("interruption_reason") InterruptionReason interruptionReason,
        @JsonProperty("rate_limit_info") RateLimitStatus rateLimit,
        @JsonProperty("saved_at") Instant savedAt
    ) {}

    /**
     * Persists the cursor atomically (temp file + rename).
     * @throws LocalStateException if the file cannot be written
     */
    public void save() {
        State state = new State(List.copyOf(plannedPlaylists), List.copyOf(completedPlaylistIds), currentPlaylistId,
            currentPlaylistOffset, likedCompleted, likedOffset, interrupted, interruptionReason, rateLimit, clock.instant());
        try {
            Utils.writeAtomically(progressFile, mapper.writeValueAsBytes(state));
        } catch (IOException e) {
            throw new LocalStateException("Failed to save resume cursor " + progressFile, e);
        }
    }

    /**
     * Loads the cursor from disk.
     * <p>
     * An unreadable or self-inconsistent file is treated as absent: state is reset and false returned.
     * @return true if a valid cursor was loaded
     */
    public boolean load() {
        reset();
        if (!Files.exists(progressFile)) return false;
        State state;
        try {
            state = mapper.readValue(progressFile.toFile(), State.class);
        } catch (IOException e) {
            logger.warn("Resume cursor {} is unreadable, ignoring it: {}", progressFile, e.getMessage());
            return false;
        }
        if (!isConsistent(state)) {
            logger.warn("Resume cursor {} is inconsistent, ignoring it.", progressFile);
            return false;
        }
        plannedPlaylists = new ArrayList<>(Utils.nonNullList(state.plannedPlaylists()));
        completedPlaylistIds = new LinkedHashSet<>(Utils.nonNullList(state.completedPlaylistIds()));
        currentPlaylistId = state.currentPlaylistId();
        currentPlaylistOffset = state.currentPlaylistOffset();
        likedCompleted = state.likedCompleted();
        likedOffset = state.likedOffset();
        interrupted = state.interrupted();
        interruptionReason = state.interruptionReason();
        rateLimit = state.rateLimit();
        return true;
    }

    private static boolean isConsistent(State state) {
        if (state == null || state.currentPlaylistOffset() < 0 || state.likedOffset() < 0) return false;
        Set<String> planned = new HashSet<>();
        for (PlannedPlaylist p : Utils.nonNullList(state.plannedPlaylists())) {
            if (p.id() == null) return false;
            planned.add(p.id());
        }
        return planned.containsAll(Utils.nonNullList(state.completedPlaylistIds()));
    }

    /**
     * Deletes the cursor file and resets in-memory state.
     * @throws LocalStateException if an existing file cannot be deleted
     */
    public void clear() {
        reset();
        try {
            Files.deleteIfExists(progressFile);
        } catch (IOException e) {
            throw new LocalStateException("Failed to delete resume cursor " + progressFile, e);
        }
    }

    private void reset() {
        plannedPlaylists = new ArrayList<>();
        completedPlaylistIds = new LinkedHashSet<>();
        currentPlaylistId = null;
        currentPlaylistOffset = 0;
        likedCompleted = false;
        likedOffset = 0;
        interrupted = false;
        interruptionReason = null;
        rateLimit = null;
    }

    /**
     * True iff the last run was interrupted and left playlists or the liked collection unfinished.
     */
    public boolean hasPendingWork() {
        return interrupted && (completedPlaylistIds.size() < plannedPlaylists.size() || !likedCompleted);
    }

    // --- Mutators used by the orchestrator ---

    void startRun(List<PlannedPlaylist> plan) {
        reset();
        plannedPlaylists = new ArrayList<>(plan);
    }

    /**
     * Marks the cursor as belonging to a run that is actively making progress.
     */
    void markRunning() {
        interrupted = false;
        interruptionReason = null;
        rateLimit = null;
    }

    void markInterrupted(InterruptionReason reason, RateLimitStatus status) {
        interrupted = true;
        interruptionReason = reason;
        rateLimit = reason == InterruptionReason.RATE_LIMITED ? status : null;
    }

    void advancePlaylist(String playlistId, int nextOffset) {
        currentPlaylistId = playlistId;
        currentPlaylistOffset = nextOffset;
    }

    void completePlaylist(String playlistId) {
        completedPlaylistIds.add(playlistId);
        currentPlaylistId = null;
        currentPlaylistOffset = 0;
    }

    /**
     * Forgets that a playlist was completed, for when its fetched tracks were lost with the partial snapshot.
     */
    void reopenPlaylist(String playlistId) {
        completedPlaylistIds.remove(playlistId);
    }

    void advanceLiked(int nextOffset) {
        likedOffset = nextOffset;
    }

    void completeLiked() {
        likedCompleted = true;
        likedOffset = 0;
    }

    /**
     * Offset to resume the given playlist from; 0 unless it is the one that was in flight.
     */
    public int offsetFor(String playlistId) {
        return playlistId != null && playlistId.equals(currentPlaylistId) ? currentPlaylistOffset : 0;
    }

    // --- Accessors ---

    public List<PlannedPlaylist> getPlannedPlaylists() {
        return List.copyOf(plannedPlaylists);
    }

    public Set<String> getCompletedPlaylistIds() {
        return Set.copyOf(completedPlaylistIds);
    }

    public boolean isCompleted(String playlistId) {
        return completedPlaylistIds.contains(playlistId);
    }

    public String getCurrentPlaylistId() {
        return currentPlaylistId;
    }

    public int getCurrentPlaylistOffset() {
        return currentPlaylistOffset;
    }

    public boolean isLikedCompleted() {
        return likedCompleted;
    }

    public int getLikedOffset() {
        return likedOffset;
    }

    public boolean wasInterrupted() {
        return interrupted;
    }

    public InterruptionReason getInterruptionReason() {
        return interruptionReason;
    }

    public RateLimitStatus getRateLimit() {
        return rateLimit;
    }

    public Path getProgressFile() {
        return progressFile;
    }
}

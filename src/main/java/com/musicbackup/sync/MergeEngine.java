package com.musicbackup.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles freshly fetched playlists against the previously persisted snapshot.
 * <p>
 * Change detection:
 * <ul>
 *   <li>Playlists are matched by ID.</li>
 *   <li>An unchanged version token means the stored playlist is kept as it is, fetched copy discarded.</li>
 *   <li>Track deltas are identity-set differences, so a pure reorder never counts as churn.</li>
 *   <li>The liked collection has no version token and is compared by identity sets only.</li>
 * </ul>
 * <p>
 * The engine is pure: it never reads or writes files. {@link BackupEngine} persists the result.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class MergeEngine {
    private static final Logger logger = LoggerFactory.getLogger(MergeEngine.class);

    private final Clock clock;

    public MergeEngine() {
        this(Clock.systemUTC());
    }

    public MergeEngine(Clock clock) {
        this.clock = clock;
    }

    /**
     * Merged snapshot plus the statistics that describe how it differs from the previous one.
     */
    public record Result(Snapshot snapshot, MergeStats stats) {}

    /**
     * Full reconciliation of a complete fetch against the previous snapshot.
     * @param fetched Completed fetch; its playlists are the full remote list
     * @param previous Previously persisted snapshot, or null for a first save
     * @return Merged snapshot and statistics
     */
    public Result mergeFull(Snapshot fetched, Snapshot previous) {
        Map<String, Playlist> existing = new LinkedHashMap<>();
        if (previous != null) {
            for (Playlist p : previous.playlists()) existing.put(p.playlistId(), p);
        } else {
            logger.info("No existing snapshot; treating this merge as the first full save.");
        }

        int added = 0, updated = 0, removed = 0, tracksAdded = 0, tracksRemoved = 0;
        List<Playlist> merged = new ArrayList<>();
        Set<String> fetchedIds = new HashSet<>();

        for (Playlist fresh : fetched.playlists()) {
            if (!fetchedIds.add(fresh.playlistId())) {
                logger.warn("Duplicate playlist {} in fetched data; keeping the first copy.", fresh.playlistId());
                continue;
            }
            Playlist old = existing.get(fresh.playlistId());
            if (old == null) {
                added++;
                tracksAdded += fresh.trackCount();
                merged.add(fresh);
            } else if (Utils.sameOrBothBlank(old.snapshotId(), fresh.snapshotId())) {
                merged.add(old);
            } else {
                updated++;
                Set<String> oldKeys = old.trackIdentityKeys();
                Set<String> newKeys = fresh.trackIdentityKeys();
                tracksAdded += difference(newKeys, oldKeys);
                tracksRemoved += difference(oldKeys, newKeys);
                merged.add(keepLocalMetadata(fresh, old));
            }
        }

        for (Playlist old : existing.values()) {
            if (!fetchedIds.contains(old.playlistId())) {
                removed++;
                tracksRemoved += old.trackCount();
                logger.info("Playlist '{}' ({}) no longer present remotely; removing {} tracks.", old.name(), old.playlistId(), old.trackCount());
            }
        }

        LikedSongs liked = previous == null ? null : previous.likedSongs();
        if (fetched.likedSongs() != null) {
            Set<String> oldKeys = liked == null ? Set.of() : liked.trackIdentityKeys();
            Set<String> newKeys = fetched.likedSongs().trackIdentityKeys();
            tracksAdded += difference(newKeys, oldKeys);
            tracksRemoved += difference(oldKeys, newKeys);
            liked = fetched.likedSongs();
        }

        UserProfile user = fetched.user() != null ? fetched.user() : previous == null ? null : previous.user();
        MergeStats stats = new MergeStats(MergeStats.Type.FULL, added, updated, removed, tracksAdded, tracksRemoved, 0);
        logger.info("{}", stats);
        return new Result(Snapshot.of(user, merged, liked, clock.instant()), stats);
    }

    /**
     * Replaces selected playlists in place with wholesale-refreshed copies.
     * <p>
     * IDs that are not in the previous snapshot are ignored; nothing is invented.
     * @param refreshed Playlists returned by a selective refresh
     * @param previous Previously persisted snapshot, or null
     * @return Merged snapshot (null when there was no previous snapshot) and statistics
     */
    public Result mergeSelective(List<Playlist> refreshed, Snapshot previous) {
        if (previous == null) {
            logger.warn("Selective merge requested without an existing snapshot; nothing to update.");
            return new Result(null, MergeStats.empty(MergeStats.Type.SELECTIVE));
        }
        Map<String, Playlist> replacements = new LinkedHashMap<>();
        int updated = 0, tracksAdded = 0, tracksRemoved = 0, tracksUpdated = 0;

        for (Playlist fresh : refreshed) {
            Playlist old = previous.findPlaylist(fresh.playlistId());
            if (old == null) {
                logger.warn("Refreshed playlist {} is not in the existing snapshot; ignoring it.", fresh.playlistId());
                continue;
            }
            if (replacements.containsKey(fresh.playlistId())) continue;
            Set<String> oldKeys = old.trackIdentityKeys();
            Set<String> newKeys = fresh.trackIdentityKeys();
            tracksAdded += difference(newKeys, oldKeys);
            tracksRemoved += difference(oldKeys, newKeys);
            tracksUpdated += intersection(oldKeys, newKeys);
            updated++;
            replacements.put(fresh.playlistId(), keepLocalMetadata(fresh, old));
        }

        List<Playlist> merged = new ArrayList<>(previous.playlists().size());
        for (Playlist p : previous.playlists()) {
            merged.add(replacements.getOrDefault(p.playlistId(), p));
        }
        MergeStats stats = new MergeStats(MergeStats.Type.SELECTIVE, 0, updated, 0, tracksAdded, tracksRemoved, tracksUpdated);
        logger.info("{}", stats);
        return new Result(Snapshot.of(previous.user(), merged, previous.likedSongs(), clock.instant()), stats);
    }

    // folderPath exists only locally; a fetched copy never carries one
    private static Playlist keepLocalMetadata(Playlist fresh, Playlist old) {
        if (fresh.folderPath() == null && old.folderPath() != null) {
            return fresh.withFolderPath(old.folderPath());
        }
        return fresh;
    }

    private static int difference(Set<String> a, Set<String> b) {
        int count = 0;
        for (String key : a) if (!b.contains(key)) count++;
        return count;
    }

    private static int intersection(Set<String> a, Set<String> b) {
        int count = 0;
        for (String key : a) if (b.contains(key)) count++;
        return count;
    }
}

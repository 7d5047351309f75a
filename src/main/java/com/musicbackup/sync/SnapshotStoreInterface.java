package com.musicbackup.sync;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Interface for the local files that hold the persisted library.
 * <p>
 * Read failures degrade to "no data" and are logged; write failures throw {@link LocalStateException}.
 */
public interface SnapshotStoreInterface {
    /**
     * Loads the main snapshot.
     * @return The snapshot, or empty if missing or unreadable
     */
    Optional<Snapshot> load();

    /**
     * Atomically replaces the main snapshot and keeps a timestamped history copy.
     * @param snapshot Snapshot to persist
     */
    void save(Snapshot snapshot);

    /**
     * Loads the partial snapshot written by an interrupted run.
     */
    Optional<Snapshot> loadPartial();

    /**
     * Atomically writes the partial snapshot. Never touches the main snapshot.
     */
    void savePartial(Snapshot partial);

    /**
     * Deletes the partial snapshot, if any.
     */
    void deletePartial();

    /**
     * Appends merge statistics to the update log, keeping the most recent entries.
     */
    void appendUpdateLog(MergeStats stats);

    /**
     * @return Update log entries, oldest first
     */
    List<UpdateLogEntry> readUpdateLog();

    /**
     * Loads the local playlist folder tree.
     * @return Top-level folders, or an empty list if missing or unreadable
     */
    List<PlaylistFolder> loadFolders();

    /**
     * Atomically replaces the playlist folder tree.
     */
    void saveFolders(List<PlaylistFolder> folders);

    /**
     * @return Directory holding all working files
     */
    Path getBackupDir();
}

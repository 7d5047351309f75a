package com.musicbackup.sync;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Interface for the operations a caller (CLI or UI) drives against the backup.
 * <p>
 * Fetching and persisting are separate steps: a sync returns data in memory, and only a merge replaces
 * the persisted snapshot. Remote failures come back as {@link SyncResult} values; local write failures
 * throw {@link LocalStateException}.
 */
public interface BackupEngineInterface {
    /**
     * Fetches the whole remote library, optionally continuing an interrupted run.
     * @param options Filters, page sizes and delays
     * @param resume Continue from the resume cursor when it has pending work
     * @return Outcome of the run
     */
    SyncResult runFullSync(SyncOptions options, boolean resume);

    /**
     * Re-fetches the given playlists from scratch.
     * @param playlistIds Playlists to refresh
     * @param options Page sizes, delays and genre backfill
     * @return Outcome of the refresh
     */
    SyncResult runSelectiveSync(List<String> playlistIds, SyncOptions options);

    /**
     * Reconciles a completed full fetch with the persisted snapshot and saves the result.
     * @param newData Snapshot from a {@link SyncResult.Completed} full sync
     * @return What changed
     */
    MergeStats mergeFull(Snapshot newData);

    /**
     * Replaces the refreshed playlists in the persisted snapshot and saves the result.
     * Does nothing when no snapshot exists yet.
     * @param newPlaylists Playlists from a selective sync
     * @return What changed
     */
    MergeStats mergeSelective(List<Playlist> newPlaylists);

    boolean canResume();

    ResumeInfo resumeInfo();

    /**
     * @return The persisted snapshot, or empty if none exists or it is unreadable
     */
    Optional<Snapshot> loadSnapshot();

    /**
     * @return Statistics of the persisted snapshot, or empty if none exists
     */
    Optional<LibraryStatistics> statistics();

    /**
     * Exports the persisted snapshot to CSV.
     * @param target Output file, or null for a dated file in the backup directory
     * @return The written file, or empty if there is no snapshot to export
     * @throws IOException if the file cannot be written
     */
    Optional<Path> exportCsv(Path target) throws IOException;

    /**
     * Searches tracks in the persisted snapshot by name, artist, album or genre.
     * @param query Case-insensitive substring; blank matches every track
     * @param scope Playlists, liked songs, or both
     * @return Matches with the playlist they were found in, or empty if there is no snapshot
     */
    List<TrackMatch> searchTracks(String query, SearchScope scope);

    /**
     * Searches playlists in the persisted snapshot by name or description.
     */
    List<Playlist> searchPlaylists(String query);

    /**
     * @return The local folder tree
     */
    List<PlaylistFolder> listFolders();

    /**
     * Moves a playlist into a local folder, creating the folder path as needed. The assignment is stored
     * in the folder file and on the playlist in the persisted snapshot, and survives later merges.
     * @param playlistId Playlist in the persisted snapshot
     * @param folderPath Slash-separated path; blank removes the playlist from its folder
     * @return false if there is no snapshot or it has no such playlist
     */
    boolean assignFolder(String playlistId, String folderPath);

    /**
     * Asks a running sync to stop at the next page boundary.
     */
    void cancel();
}

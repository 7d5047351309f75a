package com.musicbackup.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default {@link BackupEngineInterface}: wires the orchestrator, merge engine and file stores over one
 * backup directory.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class BackupEngine implements BackupEngineInterface {
    private static final Logger logger = LoggerFactory.getLogger(BackupEngine.class);
    private static final DateTimeFormatter EXPORT_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final SyncOrchestrator orchestrator;
    private final MergeEngine mergeEngine;
    private final SnapshotStoreInterface store;
    private final CsvServiceInterface csvService;
    private final Clock clock;

    public BackupEngine(RemoteCatalog catalog, Path backupDir) {
        this(catalog, backupDir, Clock.systemUTC());
    }

    public BackupEngine(RemoteCatalog catalog, Path backupDir, Clock clock) {
        this(catalog, new SnapshotStore(backupDir, clock), new ResumeCursor(backupDir, clock), clock);
    }

    private BackupEngine(RemoteCatalog catalog, SnapshotStore store, ResumeCursor cursor, Clock clock) {
        this(new SyncOrchestrator(catalog, new RateLimitTracker(clock), cursor, store, clock),
            new MergeEngine(clock), store, new CsvService(), clock);
    }

    public BackupEngine(SyncOrchestrator orchestrator, MergeEngine mergeEngine, SnapshotStoreInterface store,
                        CsvServiceInterface csvService, Clock clock) {
        this.orchestrator = orchestrator;
        this.mergeEngine = mergeEngine;
        this.store = store;
        this.csvService = csvService;
        this.clock = clock;
    }

    public void setProgressListener(ProgressListener listener) {
        orchestrator.setProgressListener(listener);
    }

    public SyncState getState() {
        return orchestrator.getState();
    }

    @Override
    public SyncResult runFullSync(SyncOptions options, boolean resume) {
        return orchestrator.runFullSync(options, resume);
    }

    @Override
    public SyncResult runSelectiveSync(List<String> playlistIds, SyncOptions options) {
        return orchestrator.runSelectiveSync(playlistIds, options);
    }

    @Override
    public MergeStats mergeFull(Snapshot newData) {
        MergeEngine.Result result = mergeEngine.mergeFull(newData, store.load().orElse(null));
        store.save(applyFolders(result.snapshot()));
        store.appendUpdateLog(result.stats());
        return result.stats();
    }

    @Override
    public MergeStats mergeSelective(List<Playlist> newPlaylists) {
        MergeEngine.Result result = mergeEngine.mergeSelective(newPlaylists, store.load().orElse(null));
        if (result.snapshot() == null) {
            return result.stats();
        }
        store.save(applyFolders(result.snapshot()));
        store.appendUpdateLog(result.stats());
        return result.stats();
    }

    @Override
    public boolean canResume() {
        return orchestrator.canResume();
    }

    @Override
    public ResumeInfo resumeInfo() {
        return orchestrator.resumeInfo();
    }

    @Override
    public Optional<Snapshot> loadSnapshot() {
        return store.load();
    }

    @Override
    public Optional<LibraryStatistics> statistics() {
        return store.load().map(LibraryStatistics::of);
    }

    @Override
    public Optional<Path> exportCsv(Path target) throws IOException {
        Optional<Snapshot> snapshot = store.load();
        if (snapshot.isEmpty()) {
            logger.warn("No snapshot to export.");
            return Optional.empty();
        }
        Path out = target != null ? target : store.getBackupDir().resolve(
            "library_export_" + EXPORT_STAMP.format(LocalDate.now(clock)) + ".csv");
        csvService.writeSnapshotToCsv(snapshot.get(), out);
        return Optional.of(out);
    }

    @Override
    public List<TrackMatch> searchTracks(String query, SearchScope scope) {
        return store.load().map(s -> LibrarySearch.searchTracks(s, query, scope)).orElse(List.of());
    }

    @Override
    public List<Playlist> searchPlaylists(String query) {
        return store.load().map(s -> LibrarySearch.searchPlaylists(s, query)).orElse(List.of());
    }

    @Override
    public List<PlaylistFolder> listFolders() {
        return store.loadFolders();
    }

    @Override
    public boolean assignFolder(String playlistId, String folderPath) {
        Optional<Snapshot> snapshot = store.load();
        if (snapshot.isEmpty() || snapshot.get().findPlaylist(playlistId) == null) {
            logger.warn("Playlist {} is not in the backup; folder unchanged.", playlistId);
            return false;
        }
        List<PlaylistFolder> folders = PlaylistFolder.assign(store.loadFolders(), playlistId, folderPath);
        String path = PlaylistFolder.assignments(folders).get(playlistId);
        store.saveFolders(folders);
        store.save(withFolderPath(snapshot.get(), playlistId, path));
        logger.info("Playlist {} moved to folder '{}'", playlistId, path == null ? "" : path);
        return true;
    }

    /**
     * Sets each playlist's folder path from the stored folder tree. Without a tree the paths already on
     * the snapshot are left alone.
     */
    private Snapshot applyFolders(Snapshot snapshot) {
        Map<String, String> paths = PlaylistFolder.assignments(store.loadFolders());
        if (paths.isEmpty()) return snapshot;
        List<Playlist> playlists = new ArrayList<>(snapshot.playlists().size());
        for (Playlist p : snapshot.playlists()) {
            playlists.add(p.withFolderPath(paths.get(p.playlistId())));
        }
        return Snapshot.of(snapshot.user(), playlists, snapshot.likedSongs(), snapshot.exportedAt());
    }

    private static Snapshot withFolderPath(Snapshot snapshot, String playlistId, String path) {
        List<Playlist> playlists = new ArrayList<>(snapshot.playlists().size());
        for (Playlist p : snapshot.playlists()) {
            playlists.add(p.playlistId().equals(playlistId) ? p.withFolderPath(path) : p);
        }
        return Snapshot.of(snapshot.user(), playlists, snapshot.likedSongs(), snapshot.exportedAt());
    }

    @Override
    public void cancel() {
        orchestrator.cancel();
    }
}

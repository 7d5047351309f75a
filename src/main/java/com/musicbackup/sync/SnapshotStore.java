package com.musicbackup.sync;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * JSON file store for the persisted library and the engine's private working files.
 * <p>
 * Layout under the backup directory:
 * <ul>
 *   <li>{@code library_backup.json}: the main snapshot, replaced only by merges.</li>
 *   <li>{@code .partial_backup.json}: data fetched by an interrupted run.</li>
 *   <li>{@code history/backup_<timestamp>.json}: copies of the main snapshot, last {@value #HISTORY_LIMIT} kept.</li>
 *   <li>{@code update_log.json}: merge statistics, last {@value #UPDATE_LOG_LIMIT} kept.</li>
 *   <li>{@code playlist_folders.json}: the local folder tree.</li>
 * </ul>
 * All writes go through {@link Utils#writeAtomically(Path, byte[])}.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class SnapshotStore implements SnapshotStoreInterface {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);

    static final String MAIN_FILE = "library_backup.json";
    static final String PARTIAL_FILE = ".partial_backup.json";
    static final String UPDATE_LOG_FILE = "update_log.json";
    static final String FOLDERS_FILE = "playlist_folders.json";
    static final String HISTORY_DIR = "history";
    static final int HISTORY_LIMIT = 10;
    static final int UPDATE_LOG_LIMIT = 100;

    private static final DateTimeFormatter HISTORY_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final Path backupDir;
    private final ObjectMapper mapper = Utils.newObjectMapper();
    private final Clock clock;

    public SnapshotStore(Path backupDir) {
        this(backupDir, Clock.systemUTC());
    }

    public SnapshotStore(Path backupDir, Clock clock) {
        this.backupDir = backupDir;
        this.clock = clock;
    }

    @Override
    public Optional<Snapshot> load() {
        return read(backupDir.resolve(MAIN_FILE), "snapshot");
    }

    @Override
    public void save(Snapshot snapshot) {
        Path target = backupDir.resolve(MAIN_FILE);
        write(target, snapshot, "snapshot");
        logger.info("Saved snapshot with {} playlists and {} tracks to {}", snapshot.playlistCount(), snapshot.totalTracks(), target);
        try {
            createHistoryCopy(target);
        } catch (IOException e) {
            // the main snapshot is already safe; history is a convenience copy
            logger.warn("Failed to write history copy of {}: {}", target, e.getMessage());
        }
    }

    @Override
    public Optional<Snapshot> loadPartial() {
        return read(backupDir.resolve(PARTIAL_FILE), "partial snapshot");
    }

    @Override
    public void savePartial(Snapshot partial) {
        write(backupDir.resolve(PARTIAL_FILE), partial, "partial snapshot");
        logger.info("Saved partial snapshot with {} playlists", partial.playlistCount());
    }

    @Override
    public void deletePartial() {
        Path partial = backupDir.resolve(PARTIAL_FILE);
        try {
            if (Files.deleteIfExists(partial)) logger.debug("Deleted partial snapshot {}", partial);
        } catch (IOException e) {
            throw new LocalStateException("Failed to delete partial snapshot " + partial, e);
        }
    }

    @Override
    public void appendUpdateLog(MergeStats stats) {
        List<UpdateLogEntry> entries = new ArrayList<>(readUpdateLog());
        entries.add(new UpdateLogEntry(clock.instant(), stats));
        if (entries.size() > UPDATE_LOG_LIMIT) {
            entries = new ArrayList<>(entries.subList(entries.size() - UPDATE_LOG_LIMIT, entries.size()));
        }
        write(backupDir.resolve(UPDATE_LOG_FILE), entries, "update log");
    }

    @Override
    public List<UpdateLogEntry> readUpdateLog() {
        Path logFile = backupDir.resolve(UPDATE_LOG_FILE);
        if (!Files.exists(logFile)) return List.of();
        try {
            return mapper.readValue(logFile.toFile(), new TypeReference<List<UpdateLogEntry>>() {});
        } catch (IOException e) {
            logger.warn("Update log {} is unreadable, starting a new one: {}", logFile, e.getMessage());
            return List.of();
        }
    }

    @Override
    public List<PlaylistFolder> loadFolders() {
        Path file = backupDir.resolve(FOLDERS_FILE);
        if (!Files.exists(file)) return List.of();
        try {
            FolderFile folderFile = mapper.readValue(file.toFile(), FolderFile.class);
            return folderFile == null ? List.of() : Utils.nonNullList(folderFile.folders());
        } catch (IOException e) {
            logger.warn("Folder file {} is unreadable, treating it as empty: {}", file, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void saveFolders(List<PlaylistFolder> folders) {
        write(backupDir.resolve(FOLDERS_FILE), new FolderFile(Snapshot.FORMAT_VERSION, clock.instant(), folders), "folders");
        logger.debug("Saved {} top-level folders", folders.size());
    }

    @Override
    public Path getBackupDir() {
        return backupDir;
    }

    /**
     * @return History copies, oldest first
     */
    public List<Path> listHistory() {
        Path historyDir = backupDir.resolve(HISTORY_DIR);
        if (!Files.isDirectory(historyDir)) return List.of();
        try (Stream<Path> files = Files.list(historyDir)) {
            return files.filter(p -> p.getFileName().toString().startsWith("backup_"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            logger.warn("Failed to list history directory {}: {}", historyDir, e.getMessage());
            return List.of();
        }
    }

    private Optional<Snapshot> read(Path file, String what) {
        if (!Files.exists(file)) return Optional.empty();
        try {
            return Optional.ofNullable(mapper.readValue(file.toFile(), Snapshot.class));
        } catch (IOException e) {
            logger.warn("The {} at {} is unreadable, treating it as absent: {}", what, file, e.getMessage());
            return Optional.empty();
        }
    }

    private void write(Path file, Object value, String what) {
        try {
            Utils.writeAtomically(file, mapper.writeValueAsBytes(value));
        } catch (IOException e) {
            throw new LocalStateException("Failed to write " + what + " " + file, e);
        }
    }

    private void createHistoryCopy(Path mainFile) throws IOException {
        Path historyDir = backupDir.resolve(HISTORY_DIR);
        Files.createDirectories(historyDir);
        String stamp = HISTORY_STAMP.format(clock.instant().atZone(clock.getZone()));
        Files.copy(mainFile, historyDir.resolve("backup_" + stamp + ".json"), StandardCopyOption.REPLACE_EXISTING);
        List<Path> history = listHistory();
        for (int i = 0; i < history.size() - HISTORY_LIMIT; i++) {
            Files.deleteIfExists(history.get(i));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FolderFile(
        @JsonProperty("version") String version,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("folders") List<PlaylistFolder> folders
    ) {
    }
}

package com.musicbackup.sync;

import com.musicbackup.spotify.SpotifyWebApiCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Main entry point for the music library backup.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code backup [--fresh]}: full sync, continuing an interrupted run unless {@code --fresh}, then merge.</li>
 *   <li>{@code resume}: continue an interrupted run only.</li>
 *   <li>{@code refresh <id,id,...>}: re-fetch selected playlists and merge them in place.</li>
 *   <li>{@code status}: show whether a run can be resumed and why it stopped.</li>
 *   <li>{@code stats}: print library statistics.</li>
 *   <li>{@code export-csv [file]}: export the snapshot to CSV.</li>
 *   <li>{@code search <query> [--in all|playlists|liked]}: find tracks by name, artist, album or genre.</li>
 *   <li>{@code search-playlists <query>}: find playlists by name or description.</li>
 *   <li>{@code folders}: print the local folder tree.</li>
 *   <li>{@code assign-folder <playlistId> [path]}: move a playlist into a folder, or out of it without a path.</li>
 * </ul>
 * Without arguments the mode is read from standard input.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INTERRUPTED = 2;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 64;

    private static final String MODES = "backup [--fresh], resume, refresh <ids>, status, stats, export-csv [file], "
        + "search <query> [--in all|playlists|liked], search-playlists <query>, folders, assign-folder <id> [path]";

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        String[] effective = args;
        if (args == null || args.length == 0) {
            effective = promptForMode();
        }
        BackupConfig config = BackupConfig.fromEnvironment();
        logger.info("Using backup directory {}", config.backupDir().toAbsolutePath());
        BackupEngine engine = new BackupEngine(SpotifyWebApiCatalog.fromConfig(config), config.backupDir(),
            Clock.systemDefaultZone());
        engine.setProgressListener((message, current, total) -> logger.info("{}", message));
        installCancelHook(engine);

        int code;
        try {
            code = run(effective, engine, config.syncOptions(), System.out);
        } catch (LocalStateException e) {
            logger.error("Local backup files could not be written: {}", e.getMessage(), e);
            code = EXIT_FAILED;
        }
        if (code != EXIT_OK) System.exit(code);
    }

    private static String[] promptForMode() {
        System.out.println("Choose mode:\n  1) backup - full backup (resumes an interrupted one)\n  2) resume\n"
            + "  3) status\n  4) stats\n  5) export-csv\nEnter choice or press Enter for 'backup': ");
        try {
            BufferedReader br = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String input = br.readLine();
            String mode = input == null ? "" : input.trim().toLowerCase(Locale.ROOT);
            switch (mode) {
                case "2": return new String[]{"resume"};
                case "3": return new String[]{"status"};
                case "4": return new String[]{"stats"};
                case "5": return new String[]{"export-csv"};
                case "":
                case "1": return new String[]{"backup"};
                default: return mode.split("\\s+");
            }
        } catch (IOException e) {
            logger.warn("Could not read mode from standard input, defaulting to backup: {}", e.getMessage());
            return new String[]{"backup"};
        }
    }

    // Ctrl-C stops the sync at the next page boundary so progress is saved for a later resume
    private static void installCancelHook(BackupEngine engine) {
        Thread mainThread = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            SyncState state = engine.getState();
            if (state == SyncState.ENUMERATING || state == SyncState.FETCHING_PLAYLIST || state == SyncState.FETCHING_LIKED) {
                engine.cancel();
                try {
                    mainThread.join(10_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
        }, "backup-cancel"));
    }

    /**
     * Runs one CLI command.
     * @param args Mode and its arguments
     * @param engine Engine to drive
     * @param options Sync options from configuration
     * @param out Where user-facing output goes
     * @return Process exit code
     */
    static int run(String[] args, BackupEngineInterface engine, SyncOptions options, PrintStream out) {
        String mode = args.length == 0 ? "backup" : args[0].trim().toLowerCase(Locale.ROOT);
        switch (mode) {
            case "backup":
                boolean fresh = args.length > 1 && "--fresh".equals(args[1]);
                return fullBackup(engine, options, !fresh, out);
            case "resume":
                if (!engine.canResume()) {
                    out.println("Nothing to resume.");
                    return EXIT_OK;
                }
                return fullBackup(engine, options, true, out);
            case "refresh":
                if (args.length < 2) {
                    out.println("Usage: refresh <playlistId>[,<playlistId>...]");
                    return EXIT_USAGE;
                }
                return refresh(engine, options, parseIds(args), out);
            case "status":
                return status(engine, out);
            case "stats":
                return stats(engine, out);
            case "export-csv":
                return exportCsv(engine, args.length > 1 ? Paths.get(args[1]) : null, out);
            case "search":
                return search(engine, args, out);
            case "search-playlists":
                return searchPlaylists(engine, joinArgs(args, 1, args.length), out);
            case "folders":
                return folders(engine, out);
            case "assign-folder":
                if (args.length < 2) {
                    out.println("Usage: assign-folder <playlistId> [folder/path]");
                    return EXIT_USAGE;
                }
                return assignFolder(engine, args[1].trim(), joinArgs(args, 2, args.length), out);
            default:
                out.println("Unknown mode '" + mode + "'. Modes: " + MODES);
                return EXIT_USAGE;
        }
    }

    private static int fullBackup(BackupEngineInterface engine, SyncOptions options, boolean resume, PrintStream out) {
        SyncResult result = engine.runFullSync(options, resume);
        if (result.status() != SyncResult.Status.COMPLETED) {
            return reportStopped(result, true, out);
        }
        Snapshot snapshot = ((SyncResult.Completed) result).snapshot();
        MergeStats stats = engine.mergeFull(snapshot);
        out.println("Backup complete: " + snapshot.playlistCount() + " playlists, " + snapshot.totalTracks()
            + " playlist tracks, " + snapshot.likedCount() + " liked songs.");
        out.println(stats);
        return EXIT_OK;
    }

    private static int refresh(BackupEngineInterface engine, SyncOptions options, List<String> ids, PrintStream out) {
        if (engine.loadSnapshot().isEmpty()) {
            out.println("No backup exists yet; run 'backup' first.");
            return EXIT_FAILED;
        }
        SyncResult result = engine.runSelectiveSync(ids, options);
        if (result instanceof SyncResult.Completed) {
            MergeStats stats = engine.mergeSelective(((SyncResult.Completed) result).snapshot().playlists());
            out.println(stats);
            return EXIT_OK;
        }
        return reportStopped(result, false, out);
    }

    private static int reportStopped(SyncResult result, boolean resumable, PrintStream out) {
        if (result instanceof SyncResult.Interrupted) {
            SyncResult.Interrupted interrupted = (SyncResult.Interrupted) result;
            out.println("Sync interrupted (" + interrupted.reason() + ") after " + interrupted.completedCount() + "/"
                + interrupted.plannedCount() + " playlists.");
            if (interrupted.availableAt() != null) {
                out.println("Rate limited; try again after " + interrupted.availableAt() + ".");
            }
            if (resumable && interrupted.canResume()) out.println("Progress saved. Run 'resume' to continue.");
            return EXIT_INTERRUPTED;
        }
        if (result instanceof SyncResult.Cancelled) {
            SyncResult.Cancelled cancelled = (SyncResult.Cancelled) result;
            out.println("Sync cancelled after " + cancelled.completedCount() + "/" + cancelled.plannedCount() + " playlists.");
            if (resumable) out.println("Progress saved. Run 'resume' to continue.");
            return EXIT_INTERRUPTED;
        }
        SyncResult.Failed failed = (SyncResult.Failed) result;
        out.println("Sync failed: " + failed.reason());
        return EXIT_FAILED;
    }

    private static int status(BackupEngineInterface engine, PrintStream out) {
        ResumeInfo info = engine.resumeInfo();
        if (!info.canResume()) {
            out.println("No interrupted backup.");
        } else {
            out.println("Interrupted backup (" + info.reason() + "): " + info.playlistsCompleted() + "/"
                + info.playlistsTotal() + " playlists done, liked songs " + (info.likedSongsCompleted() ? "done" : "pending") + ".");
            if (info.rateLimit() != null && info.rateLimit().limited()) {
                out.println("Rate limited until " + info.rateLimit().availableAt() + ".");
            }
        }
        Optional<Snapshot> snapshot = engine.loadSnapshot();
        out.println(snapshot.map(s -> "Last backup: " + s.exportedAt() + " (" + s.playlistCount() + " playlists)")
            .orElse("No backup saved yet."));
        return EXIT_OK;
    }

    private static int stats(BackupEngineInterface engine, PrintStream out) {
        Optional<LibraryStatistics> stats = engine.statistics();
        if (stats.isEmpty()) {
            out.println("No backup saved yet.");
            return EXIT_OK;
        }
        LibraryStatistics s = stats.get();
        out.println("Playlists:      " + s.playlistCount());
        out.println("Liked songs:    " + s.likedCount());
        out.println("Unique tracks:  " + s.uniqueTracks());
        out.println("Unique artists: " + s.uniqueArtists());
        out.println("Unique albums:  " + s.uniqueAlbums());
        out.println("Genres found:   " + s.genresFound());
        out.println("Total duration: " + Utils.formatDuration(s.totalDurationMs()) + " (" + s.totalDurationHours() + " h)");
        out.println("Last backup:    " + s.lastBackup());
        return EXIT_OK;
    }

    private static int exportCsv(BackupEngineInterface engine, Path target, PrintStream out) {
        try {
            Optional<Path> written = engine.exportCsv(target);
            out.println(written.map(p -> "Exported to " + p).orElse("No backup saved yet."));
            return EXIT_OK;
        } catch (IOException e) {
            logger.error("CSV export failed: {}", e.getMessage());
            out.println("CSV export failed: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    private static int search(BackupEngineInterface engine, String[] args, PrintStream out) {
        SearchScope scope = SearchScope.ALL;
        int end = args.length;
        for (int i = 1; i < args.length; i++) {
            if ("--in".equals(args[i])) {
                if (i + 1 >= args.length) {
                    out.println("Usage: search <query> [--in all|playlists|liked]");
                    return EXIT_USAGE;
                }
                try {
                    scope = SearchScope.parse(args[i + 1]);
                } catch (IllegalArgumentException e) {
                    out.println("Unknown search scope '" + args[i + 1] + "'. Use all, playlists or liked.");
                    return EXIT_USAGE;
                }
                end = i;
                break;
            }
        }
        if (engine.loadSnapshot().isEmpty()) {
            out.println("No backup saved yet.");
            return EXIT_OK;
        }
        List<TrackMatch> matches = engine.searchTracks(joinArgs(args, 1, end), scope);
        for (TrackMatch m : matches) {
            out.println("[" + m.source() + "] " + m.track().name() + " - " + m.track().artistsString()
                + " (" + m.track().albumName() + ")");
        }
        out.println(matches.size() + " matching tracks.");
        return EXIT_OK;
    }

    private static int searchPlaylists(BackupEngineInterface engine, String query, PrintStream out) {
        if (engine.loadSnapshot().isEmpty()) {
            out.println("No backup saved yet.");
            return EXIT_OK;
        }
        List<Playlist> matches = engine.searchPlaylists(query);
        for (Playlist p : matches) {
            out.println(p.playlistId() + "  " + p.name() + " (" + p.trackCount() + " tracks)");
        }
        out.println(matches.size() + " matching playlists.");
        return EXIT_OK;
    }

    private static int folders(BackupEngineInterface engine, PrintStream out) {
        List<PlaylistFolder> folders = engine.listFolders();
        if (folders.isEmpty()) {
            out.println("No folders.");
            return EXIT_OK;
        }
        printFolders(folders, "", out);
        return EXIT_OK;
    }

    private static void printFolders(List<PlaylistFolder> folders, String indent, PrintStream out) {
        for (PlaylistFolder f : folders) {
            out.println(indent + f.name() + "/ (" + f.playlists().size() + " playlists)");
            for (String id : f.playlists()) out.println(indent + "  - " + id);
            printFolders(f.subfolders(), indent + "  ", out);
        }
    }

    private static int assignFolder(BackupEngineInterface engine, String playlistId, String path, PrintStream out) {
        if (!engine.assignFolder(playlistId, path)) {
            out.println("Playlist " + playlistId + " is not in the backup.");
            return EXIT_FAILED;
        }
        out.println(path.isBlank() ? "Removed " + playlistId + " from its folder."
            : "Moved " + playlistId + " to " + String.join(PlaylistFolder.SEPARATOR, PlaylistFolder.segments(path)) + ".");
        return EXIT_OK;
    }

    private static String joinArgs(String[] args, int from, int to) {
        List<String> parts = new ArrayList<>();
        for (int i = from; i < to; i++) parts.add(args[i]);
        return String.join(" ", parts).trim();
    }

    static List<String> parseIds(String[] args) {
        List<String> ids = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            for (String id : args[i].split(",")) {
                if (!id.isBlank()) ids.add(id.trim());
            }
        }
        return ids;
    }
}

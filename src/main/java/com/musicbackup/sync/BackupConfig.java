package com.musicbackup.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Runtime configuration, read from environment variables with Java system properties as fallback.
 * <p>
 * Keys:
 * <ul>
 *   <li>{@code BACKUP_DIR}: directory for the snapshot and working files (default {@code backups}).</li>
 *   <li>{@code SPOTIFY_CLIENT_ID}, {@code SPOTIFY_CLIENT_SECRET}: application credentials for token refresh.</li>
 *   <li>{@code SPOTIFY_ACCESS_TOKEN}, {@code SPOTIFY_REFRESH_TOKEN}: user tokens.</li>
 *   <li>{@code SYNC_FETCH_GENRES}, {@code SYNC_INCLUDE_SERVICE_PLAYLISTS}, {@code SYNC_INCLUDE_COLLABORATIVE}: sync filters.</li>
 *   <li>{@code SYNC_PAGE_DELAY_MS}: courtesy pause between pages.</li>
 * </ul>
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public record BackupConfig(
    Path backupDir,
    String clientId,
    String clientSecret,
    String accessToken,
    String refreshToken,
    SyncOptions syncOptions
) {
    private static final Logger logger = LoggerFactory.getLogger(BackupConfig.class);

    static final String DEFAULT_BACKUP_DIR = "backups";

    public BackupConfig {
        backupDir = backupDir == null ? Paths.get(DEFAULT_BACKUP_DIR) : backupDir;
        clientId = clientId == null ? "" : clientId;
        clientSecret = clientSecret == null ? "" : clientSecret;
        accessToken = accessToken == null ? "" : accessToken;
        refreshToken = refreshToken == null ? "" : refreshToken;
        syncOptions = syncOptions == null ? SyncOptions.defaults() : syncOptions;
    }

    public static BackupConfig fromEnvironment() {
        SyncOptions defaults = SyncOptions.defaults();
        long pageDelayMs = parseLong("SYNC_PAGE_DELAY_MS", defaults.pageDelay().toMillis());
        SyncOptions options = defaults
            .withFetchGenres(parseBoolean("SYNC_FETCH_GENRES", defaults.fetchGenres()))
            .withFilters(parseBoolean("SYNC_INCLUDE_SERVICE_PLAYLISTS", defaults.includeServicePlaylists()),
                parseBoolean("SYNC_INCLUDE_COLLABORATIVE", defaults.includeCollaborative()))
            .withDelays(Duration.ofMillis(pageDelayMs), defaults.playlistDelay());
        return new BackupConfig(
            Paths.get(Utils.envOrProp("BACKUP_DIR", DEFAULT_BACKUP_DIR)),
            Utils.envOrProp("SPOTIFY_CLIENT_ID", ""),
            Utils.envOrProp("SPOTIFY_CLIENT_SECRET", ""),
            Utils.envOrProp("SPOTIFY_ACCESS_TOKEN", ""),
            Utils.envOrProp("SPOTIFY_REFRESH_TOKEN", ""),
            options);
    }

    /**
     * Whether an expired access token can be renewed without user interaction.
     */
    public boolean canRefreshToken() {
        return !clientId.isBlank() && !clientSecret.isBlank() && !refreshToken.isBlank();
    }

    static boolean parseBoolean(String key, boolean defaultVal) {
        String value = Utils.envOrProp(key, null);
        if (value == null || value.isBlank()) return defaultVal;
        return Boolean.parseBoolean(value.trim()) || value.trim().equals("1");
    }

    static long parseLong(String key, long defaultVal) {
        String value = Utils.envOrProp(key, null);
        if (value == null || value.isBlank()) return defaultVal;
        try {
            return Math.max(0, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}, using {}", value, key, defaultVal);
            return defaultVal;
        }
    }
}

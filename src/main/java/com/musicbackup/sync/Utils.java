package com.musicbackup.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Utility class for common helper methods used by the sync engine and its file stores.
 *
 * @author Music Library Backup Team
 * @since 1.0
 */
public class Utils {
    private static final Logger logger = LoggerFactory.getLogger(Utils.class);

    /**
     * Formats a duration in milliseconds as M:SS, or H:MM:SS once it reaches an hour.
     * @param durationMs Duration in milliseconds
     * @return Formatted duration
     */
    public static String formatDuration(long durationMs) {
        long totalSeconds = Math.max(0, durationMs) / 1000;
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;
        if (hours > 0) return String.format("%d:%02d:%02d", hours, minutes, seconds);
        return String.format("%d:%02d", minutes, seconds);
    }

    /**
     * Creates the ObjectMapper used for every persisted JSON file.
     * ISO-8601 timestamps, pretty printed.
     * @return Configured ObjectMapper
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Writes bytes to a sibling temp file and renames it over the target, so a crash mid-write
     * leaves either the old file or the new one, never a truncated mix.
     * @param target File to replace
     * @param content Bytes to write
     * @throws IOException if the temp file cannot be written or moved
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        if (dir != null) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, content);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                logger.debug("Atomic move not supported for {}, falling back to replace.", target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * Returns an unmodifiable copy of the list with null elements dropped; null becomes an empty list.
     */
    public static <T> List<T> nonNullList(List<T> list) {
        if (list == null) return List.of();
        List<T> out = new ArrayList<>(list.size());
        for (T item : list) {
            if (item != null) out.add(item);
        }
        return List.copyOf(out);
    }

    /**
     * Reads a string setting from the environment, then from system properties, then falls back to a default.
     */
    public static String envOrProp(String key, String defaultVal) {
        String ev = System.getenv(key);
        if (ev != null && !ev.isBlank()) return ev;
        String prop = System.getProperty(key);
        return prop != null ? prop : defaultVal;
    }

    static boolean sameOrBothBlank(String a, String b) {
        return Objects.equals(a == null ? "" : a, b == null ? "" : b);
    }
}

package com.musicbackup.sync;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Interface for CSV export of a persisted library.
 */
public interface CsvServiceInterface {
    /**
     * Writes every playlist track and liked track of the snapshot to one CSV file, one row per occurrence.
     * @param snapshot Snapshot to export
     * @param target Output CSV file; parent directories are created
     * @return Number of rows written, header excluded
     * @throws IOException if file writing fails
     */
    int writeSnapshotToCsv(Snapshot snapshot, Path target) throws IOException;
}

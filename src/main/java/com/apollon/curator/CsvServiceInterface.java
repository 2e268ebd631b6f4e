package com.apollon.curator;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of recommendation lists.
 */
public interface CsvServiceInterface {
    /**
     * Writes tracks to a CSV file with a header row.
     * @param tracks tracks to export, in order
     * @param file output file; parent directories are created
     * @throws IOException if file writing fails
     */
    void writeTracksToCSV(List<Track> tracks, Path file) throws IOException;
}

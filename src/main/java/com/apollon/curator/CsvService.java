package com.apollon.curator;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Service for exporting recommendation lists to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Writes one header row ({@link #CSV_FIELDS}) followed by one row per track, in recommendation order.</li>
 *   <li>Unknown tempos are written as an empty cell; genres are joined with "; ".</li>
 * </ul>
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final List<String> CSV_FIELDS = List.of("Title", "Artist", "BPM", "Camelot", "TimeSignature", "Genres");

    @Override
    public void writeTracksToCSV(List<Track> tracks, Path file) throws IOException {
        if (tracks == null) {
            logger.warn("Attempted to write null track list to CSV: {}", file);
            throw new IllegalArgumentException("Track list cannot be null");
        }
        if (file == null) {
            throw new IllegalArgumentException("Output file cannot be null");
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(CSV_FIELDS.toArray(String[]::new));
            for (Track track : tracks) {
                writer.writeNext(new String[]{
                    safe(track.title()),
                    safe(track.artist()),
                    track.hasTempo() ? String.format(Locale.ROOT, "%.0f", track.bpm()) : "",
                    safe(track.camelotPosition()),
                    safe(track.timeSignature()),
                    safe(String.join("; ", track.genres()))
                });
            }
        }
        logger.info("Wrote {} track(s) to CSV file: {}", tracks.size(), file);
    }

    /**
     * Collapses line breaks so each track stays on one CSV line.
     * @param s Input string
     * @return Sanitized string
     */
    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}

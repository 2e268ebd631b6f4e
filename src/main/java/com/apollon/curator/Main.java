package com.apollon.curator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Command-line entry point for Curator Apollon.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code recommend <seedTrackId> [entropy] [count] [csvFile]}: recommends tracks for a seed
 *   (entropy defaults to 0.25, count to 10) and optionally exports them to CSV. If {@code csvFile} is an
 *   existing directory, the file is named after the seed track.</li>
 *   <li>{@code stats}: prints library statistics as JSON.</li>
 *   <li>{@code enrich <contributionsFile>}: fills missing track metadata from a contributions file and saves the
 *   library.</li>
 *   <li>{@code probe}: checks whether the entropy source is reachable.</li>
 * </ul>
 * The library is read from {@link Utils#libraryPath()}; the entropy source from {@link EntropySourceConfig#fromEnvironment()}.
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final double DEFAULT_ENTROPY = 0.25;
    static final int DEFAULT_COUNT = 10;

    private final Path libraryPath;
    private final LibraryStore libraryStore;
    private final EntropySourceInterface entropySource;
    private final PrintStream out;

    Main(Path libraryPath, LibraryStore libraryStore, EntropySourceInterface entropySource, PrintStream out) {
        this.libraryPath = libraryPath;
        this.libraryStore = libraryStore;
        this.entropySource = entropySource;
        this.out = out;
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        String mode = args.length > 0 ? args[0].trim().toLowerCase(Locale.ROOT) : "";
        EntropySourceInterface entropySource = null;
        if (mode.equals("recommend") || mode.equals("probe")) {
            try {
                entropySource = new QuantumEntropySource(EntropySourceConfig.fromEnvironment());
            } catch (IllegalStateException | IllegalArgumentException e) {
                logger.error("Entropy source is not configured: {}", e.getMessage());
                System.exit(2);
                return;
            }
        }
        int exitCode = new Main(Utils.libraryPath(), new LibraryStore(), entropySource, System.out).run(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    int run(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 1;
        }
        String mode = args[0].trim().toLowerCase(Locale.ROOT);
        try {
            switch (mode) {
                case "recommend":
                    return recommend(args);
                case "stats":
                    return stats();
                case "enrich":
                    return enrich(args);
                case "probe":
                    return probe();
                default:
                    printUsage();
                    return 1;
            }
        } catch (IOException e) {
            logger.error("Library I/O failed for {}: {}", libraryPath, e.getMessage());
            return 3;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid arguments: {}", e.getMessage());
            return 1;
        }
    }

    private int recommend(String[] args) throws IOException {
        if (args.length < 2) {
            printUsage();
            return 1;
        }
        String seedId = args[1];
        double entropy = args.length > 2 ? Double.parseDouble(args[2]) : DEFAULT_ENTROPY;
        int count = args.length > 3 ? Integer.parseInt(args[3]) : DEFAULT_COUNT;

        TrackLibrary library = new TrackLibrary(libraryStore.load(libraryPath));
        Optional<Track> seed = library.findById(seedId);
        if (seed.isEmpty()) {
            logger.error("Seed track {} not found in library {}", seedId, libraryPath);
            return 1;
        }
        SelectionEngineInterface engine = new SelectionEngine(entropySource);
        RecommendationResult result = engine.recommend(library.getAllTracks(), seed.get(), entropy, count);

        out.println(result.status() + ": " + result.detail());
        for (Track track : result.tracks()) {
            String bpm = track.hasTempo() ? String.format(Locale.ROOT, "%.0f", track.bpm()) : "N/A";
            String genres = track.genres().isEmpty() ? "N/A" : String.join(", ", track.genres());
            out.println(String.format("  %s - %s (BPM: %s, Key: %s, Sig: %s, Genres: %s)",
                track.title(), track.artist(), bpm, track.camelotPosition(), track.timeSignature(), genres));
        }
        if (args.length > 4 && !result.tracks().isEmpty()) {
            new CsvService().writeTracksToCSV(result.tracks(), exportFile(Paths.get(args[4]), seed.get()));
        } else if (args.length > 4) {
            logger.warn("No recommendations to export; {} not written.", args[4]);
        }
        return result.isSuccess() ? 0 : 4;
    }

    /**
     * An existing directory gets a file named after the seed track; any other path is used as given.
     */
    static Path exportFile(Path target, Track seed) {
        if (!Files.isDirectory(target)) {
            return target;
        }
        String title = seed.title() == null || seed.title().isBlank() ? seed.id() : seed.title();
        return target.resolve(Utils.sanitizeFilename(title + " recommendations") + ".csv");
    }

    private int stats() throws IOException {
        List<Track> tracks = libraryStore.load(libraryPath);
        LibraryStatistics statistics = new LibraryAnalyzer().analyze(tracks);
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        out.println(mapper.writeValueAsString(statistics));
        return 0;
    }

    private int enrich(String[] args) throws IOException {
        if (args.length < 2) {
            printUsage();
            return 1;
        }
        ContributionLoader loader = new ContributionLoader();
        Map<String, TrackContribution> contributions = loader.load(Paths.get(args[1]));
        List<Track> enriched = loader.applyAll(libraryStore.load(libraryPath), contributions);
        libraryStore.save(libraryPath, enriched);
        out.println("Applied " + contributions.size() + " contribution(s) to " + enriched.size() + " track(s)");
        return 0;
    }

    private int probe() {
        boolean available = entropySource.isAvailable();
        out.println(available ? "Entropy source available" : "Entropy source unavailable");
        return available ? 0 : 4;
    }

    private void printUsage() {
        out.println("Usage:\n"
            + "  recommend <seedTrackId> [entropy 0.0-1.0] [count] [csvFile|directory]\n"
            + "  stats\n"
            + "  enrich <contributionsFile>\n"
            + "  probe");
    }
}

package com.apollon.curator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.apollon.curator.TrackFixtures.A;
import static com.apollon.curator.TrackFixtures.B;
import static com.apollon.curator.TrackFixtures.C;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Command-line modes run against a temporary library and a mocked entropy source.
 */
class MainTest {

    @TempDir
    Path tempDir;

    private Path libraryPath;
    private final LibraryStore store = new LibraryStore();
    private final EntropySourceInterface entropySource = mock(EntropySourceInterface.class);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private Main main;

    @BeforeEach
    void setUp() throws IOException {
        libraryPath = tempDir.resolve("library.json");
        store.save(libraryPath, List.of(A, B, C, TrackFixtures.track("E", 120, "8A", "4/4")));
        main = new Main(libraryPath, store, entropySource, new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testMissingOrUnknownModePrintsUsage() {
        assertEquals(1, main.run(new String[0]));
        assertEquals(1, main.run(new String[]{"shuffle"}));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void testRecommendShufflesAndExportsCsv() throws Exception {
        when(entropySource.fetchRandomBytes(1)).thenReturn(new byte[]{0});
        Path csv = tempDir.resolve("export/out.csv");

        assertEquals(0, main.run(new String[]{"recommend", "A", "0.0", "5", csv.toString()}));

        // Pool [B, E]; byte 0 swaps the two.
        String out = output();
        assertTrue(out.startsWith("OK"));
        assertTrue(out.indexOf("Song E") < out.indexOf("Song B"));
        assertFalse(out.contains("Song C"));
        List<String> lines = Files.readAllLines(csv, StandardCharsets.UTF_8);
        assertEquals(3, lines.size());
        verify(entropySource).fetchRandomBytes(1);
    }

    @Test
    void testRecommendExportsIntoDirectoryUsingSeedTitle() throws Exception {
        when(entropySource.fetchRandomBytes(1)).thenReturn(new byte[]{0});
        Path dir = Files.createDirectories(tempDir.resolve("exports"));

        assertEquals(0, main.run(new String[]{"recommend", "A", "0.0", "5", dir.toString()}));

        Path expected = dir.resolve("Song_A_recommendations.csv");
        assertTrue(Files.exists(expected));
        assertEquals(3, Files.readAllLines(expected, StandardCharsets.UTF_8).size());
    }

    @Test
    void testExportFileSanitizesSeedTitle() {
        Track seed = new Track("id1", "Intro: Part 1/2?", "X", 120, "8A", "8A", 0.5, "4/4", List.of());
        assertEquals(tempDir.resolve("Intro__Part_1_2__recommendations.csv"), Main.exportFile(tempDir, seed));
        Path file = tempDir.resolve("named.csv");
        assertEquals(file, Main.exportFile(file, seed));
    }

    @Test
    void testRecommendFallsBackWhenEntropyDownAndNearDeterministic() throws Exception {
        when(entropySource.fetchRandomBytes(anyInt()))
            .thenThrow(new EntropyUnavailableException(EntropyUnavailableException.Reason.CONNECTION, "refused"));

        assertEquals(0, main.run(new String[]{"recommend", "A", "0.05"}));
        assertTrue(output().startsWith("DETERMINISTIC_FALLBACK"));
    }

    @Test
    void testRecommendFailsWhenEntropyDown() throws Exception {
        when(entropySource.fetchRandomBytes(anyInt()))
            .thenThrow(new EntropyUnavailableException(EntropyUnavailableException.Reason.TIMEOUT, "timed out"));

        assertEquals(4, main.run(new String[]{"recommend", "A", "0.5"}));
        assertTrue(output().startsWith("ENTROPY_UNAVAILABLE"));
    }

    @Test
    void testRecommendRejectsBadArguments() {
        assertEquals(1, main.run(new String[]{"recommend"}));
        assertEquals(1, main.run(new String[]{"recommend", "missing"}));
        assertEquals(1, main.run(new String[]{"recommend", "A", "loud"}));
        assertEquals(1, main.run(new String[]{"recommend", "A", "1.5"}));
        verifyNoInteractions(entropySource);
    }

    @Test
    void testStatsPrintsJson() {
        assertEquals(0, main.run(new String[]{"stats"}));
        assertTrue(output().contains("\"trackCount\" : 4"));
    }

    @Test
    void testStatsFailsOnCorruptLibrary() throws IOException {
        Files.writeString(libraryPath, "{}");
        assertEquals(3, main.run(new String[]{"stats"}));
    }

    @Test
    void testEnrichFillsMissingMetadataAndSaves() throws IOException {
        store.save(libraryPath, List.of(TrackFixtures.track("X", 0, "Unknown", "4/4")));
        Path contributions = tempDir.resolve("contributions.json");
        Files.writeString(contributions, "[{\"track_id_spotify\":\"X\",\"bpm\":98.0,\"camelot_key\":\"11B\"}]");

        assertEquals(0, main.run(new String[]{"enrich", contributions.toString()}));

        Track enriched = store.load(libraryPath).get(0);
        assertEquals(98.0, enriched.bpm());
        assertEquals("11B", enriched.camelotPosition());
    }

    @Test
    void testAvailabilityModeReportsEntropySource() {
        when(entropySource.isAvailable()).thenReturn(true, false);
        assertEquals(0, main.run(new String[]{"probe"}));
        assertEquals(4, main.run(new String[]{"probe"}));
        assertTrue(output().contains("Entropy source unavailable"));
    }
}

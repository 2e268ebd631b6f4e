package com.apollon.curator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LibraryStoreTest {

    @TempDir
    Path tempDir;

    private final LibraryStore store = new LibraryStore();

    @Test
    void missingFileIsEmptyLibrary() throws IOException {
        assertTrue(store.load(tempDir.resolve("absent.json")).isEmpty());
    }

    @Test
    void saveThenLoadPreservesTracks() throws IOException {
        Track full = new Track("sp1", "Title", "Artist", 124.5, "A minor", "8A", 0.7,
            "https://open.spotify.com/track/sp1", "Album", "3/4", "https://img", List.of("house", "deep house"));
        Path file = tempDir.resolve("nested/dir/library.json");
        store.save(file, List.of(full, TrackFixtures.A));
        assertEquals(List.of(full, TrackFixtures.A), store.load(file));
    }

    @Test
    void readsSnakeCaseFieldsAndAppliesDefaults() throws IOException {
        Path file = tempDir.resolve("library.json");
        Files.writeString(file, "[{\"id\":\"t1\",\"title\":\"Song\",\"artist\":\"X\",\"bpm\":120.0,\"key\":\"C\","
            + "\"camelot_position\":\"8B\",\"energy_level\":0.4,\"genres\":null,\"extra\":1}]");
        List<Track> tracks = store.load(file);
        assertEquals(1, tracks.size());
        Track t = tracks.get(0);
        assertEquals("8B", t.camelotPosition());
        assertEquals(0.4, t.energyLevel());
        assertEquals("4/4", t.timeSignature());
        assertTrue(t.genres().isEmpty());
    }

    @Test
    void badEntriesAreSkipped() throws IOException {
        Path file = tempDir.resolve("library.json");
        Files.writeString(file, "[{\"title\":\"no id\"},{\"id\":\"ok\",\"bpm\":100},{\"id\":\"bad\",\"bpm\":\"fast\"}]");
        List<Track> tracks = store.load(file);
        assertEquals(1, tracks.size());
        assertEquals("ok", tracks.get(0).id());
    }

    @Test
    void nonArrayFileFails() throws IOException {
        Path file = tempDir.resolve("library.json");
        Files.writeString(file, "{\"tracks\":[]}");
        assertThrows(IOException.class, () -> store.load(file));
    }
}

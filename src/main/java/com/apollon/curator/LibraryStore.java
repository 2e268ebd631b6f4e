package com.apollon.curator;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the library as a JSON array of tracks using Jackson.
 * <p>
 * Error Handling:
 * <ul>
 *   <li>A missing file is an empty library.</li>
 *   <li>A file that is not a JSON array fails with {@link IOException}.</li>
 *   <li>Array entries that cannot be bound to a {@link Track} are skipped and logged.</li>
 * </ul>
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class LibraryStore {
    private static final Logger logger = LoggerFactory.getLogger(LibraryStore.class);

    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .enable(SerializationFeature.INDENT_OUTPUT);

    public List<Track> load(Path path) throws IOException {
        if (!Files.exists(path)) {
            logger.info("No library file found at {}. Starting fresh.", path);
            return List.of();
        }
        JsonNode root = mapper.readTree(path.toFile());
        if (root == null || !root.isArray()) {
            throw new IOException("Library file " + path + " does not contain a JSON array");
        }
        List<Track> tracks = new ArrayList<>();
        int index = 0;
        for (JsonNode node : root) {
            try {
                tracks.add(mapper.treeToValue(node, Track.class));
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Skipping library entry {}: {}", index, e.getMessage());
            }
            index++;
        }
        logger.info("Library loaded from {}: {} track(s).", path, tracks.size());
        return tracks;
    }

    public void save(Path path, List<Track> tracks) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        mapper.writeValue(path.toFile(), tracks);
        logger.info("Library saved to {}: {} track(s).", path, tracks.size());
    }
}

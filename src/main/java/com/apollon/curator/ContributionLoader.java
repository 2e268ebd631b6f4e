package com.apollon.curator;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link TrackContribution}s from a JSON file and merges them into library tracks.
 * <p>
 * The contributions file is optional. Entries that are not objects, lack {@code track_id_spotify}, or repeat an
 * id already seen are skipped with a warning; the first entry for an id wins.
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class ContributionLoader {
    private static final Logger logger = LoggerFactory.getLogger(ContributionLoader.class);

    private final ObjectMapper mapper = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * @param path contributions file
     * @return contributions keyed by Spotify track id, in file order; empty if the file does not exist
     * @throws IOException if the file exists but is not valid JSON
     */
    public Map<String, TrackContribution> load(Path path) throws IOException {
        Map<String, TrackContribution> contributions = new LinkedHashMap<>();
        if (!Files.exists(path)) {
            logger.info("Contributions file not found: {}. Proceeding without user-provided contributions.", path);
            return contributions;
        }
        JsonNode root = mapper.readTree(path.toFile());
        if (root == null || !root.isArray()) {
            logger.warn("Expected a list of contributions in {}. No contributions loaded.", path);
            return contributions;
        }
        int index = 0;
        for (JsonNode node : root) {
            if (!node.isObject()) {
                logger.warn("Contribution item at index {} is not an object, skipping.", index);
            } else {
                TrackContribution contribution;
                try {
                    contribution = mapper.treeToValue(node, TrackContribution.class);
                } catch (IOException | IllegalArgumentException e) {
                    logger.warn("Contribution item at index {} could not be read, skipping: {}", index, e.getMessage());
                    index++;
                    continue;
                }
                String id = contribution.trackIdSpotify();
                if (id == null || id.isBlank()) {
                    logger.warn("Contribution item at index {} missing 'track_id_spotify', skipping.", index);
                } else if (contributions.containsKey(id)) {
                    logger.warn("Duplicate track_id_spotify '{}' in contributions file. Using first entry.", id);
                } else {
                    contributions.put(id, contribution);
                }
            }
            index++;
        }
        logger.info("Loaded {} contribution(s) from {}", contributions.size(), path);
        return contributions;
    }

    /**
     * Applies matching contributions to each track.
     * @return tracks in the same order, enriched where a contribution matched
     */
    public List<Track> applyAll(List<Track> tracks, Map<String, TrackContribution> contributions) {
        List<Track> result = new ArrayList<>(tracks.size());
        int enriched = 0;
        for (Track track : tracks) {
            TrackContribution contribution = contributions.get(track.id());
            Track updated = contribution == null ? track : contribution.applyTo(track);
            if (updated != track) enriched++;
            result.add(updated);
        }
        logger.info("Enriched {} track(s) from contributions", enriched);
        return result;
    }
}

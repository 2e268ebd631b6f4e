package com.apollon.curator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link LibraryStatistics} for a set of tracks: tempo, energy, Camelot, time signature and genre
 * distributions.
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class LibraryAnalyzer {

    static final int TOP_N = 3;

    public LibraryStatistics analyze(List<Track> tracks) {
        double bpmSum = 0;
        int bpmCount = 0;
        Double minBpm = null;
        Double maxBpm = null;
        double energySum = 0;
        int energyCount = 0;
        Map<String, Integer> camelotCounts = new LinkedHashMap<>();
        Map<String, Integer> signatureCounts = new LinkedHashMap<>();
        Map<String, Integer> genreCounts = new LinkedHashMap<>();

        for (Track track : tracks) {
            if (track.hasTempo()) {
                bpmSum += track.bpm();
                bpmCount++;
                minBpm = minBpm == null ? track.bpm() : Math.min(minBpm, track.bpm());
                maxBpm = maxBpm == null ? track.bpm() : Math.max(maxBpm, track.bpm());
            }
            if (track.energyLevel() > 0) {
                energySum += track.energyLevel();
                energyCount++;
            }
            if (!Track.UNKNOWN.equalsIgnoreCase(track.camelotPosition())) {
                camelotCounts.merge(track.camelotPosition(), 1, Integer::sum);
            }
            if (!Track.UNKNOWN.equalsIgnoreCase(track.timeSignature())) {
                signatureCounts.merge(track.timeSignature(), 1, Integer::sum);
            }
            for (String genre : track.genres()) {
                genreCounts.merge(genre, 1, Integer::sum);
            }
        }

        Map<String, Double> signatureShares = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> entry : ranked(signatureCounts, Integer.MAX_VALUE)) {
            signatureShares.put(entry.getKey(), entry.getValue() * 100.0 / tracks.size());
        }

        return new LibraryStatistics(
            tracks.size(),
            bpmCount == 0 ? null : bpmSum / bpmCount,
            minBpm,
            maxBpm,
            energyCount == 0 ? null : energySum / energyCount,
            ranked(camelotCounts, TOP_N),
            signatureShares,
            ranked(genreCounts, TOP_N),
            genreCounts.size()
        );
    }

    // Descending by count; stable, so ties keep first-seen order.
    private static List<Map.Entry<String, Integer>> ranked(Map<String, Integer> counts, int limit) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>();
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            entries.add(Map.entry(e.getKey(), e.getValue()));
        }
        entries.sort((x, y) -> Integer.compare(y.getValue(), x.getValue()));
        return List.copyOf(entries.subList(0, Math.min(limit, entries.size())));
    }
}

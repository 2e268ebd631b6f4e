package com.apollon.curator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes the {@link CentroidProfile} of a set of tracks.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Mean tempo over tracks with a known (positive) tempo, 120 BPM if there are none.</li>
 *   <li>Modal Camelot key over parseable keys; ties go to the key seen first.</li>
 *   <li>Modal time signature ignoring "Unknown"; defaults to "4/4".</li>
 *   <li>Top three broad genre families, counted once per matching tag across all tracks.</li>
 * </ul>
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class CentroidAggregator {

    public static final double DEFAULT_BPM = 120.0;
    public static final int TOP_GENRE_KEYWORDS = 3;

    public CentroidProfile computeCentroid(List<? extends MusicalProfile> tracks) {
        double bpmSum = 0.0;
        int bpmCount = 0;
        Map<CamelotKey, Integer> keyCounts = new LinkedHashMap<>();
        Map<String, Integer> signatureCounts = new LinkedHashMap<>();
        Map<String, Integer> keywordCounts = new LinkedHashMap<>();

        if (tracks != null) {
            for (MusicalProfile track : tracks) {
                if (track == null) continue;
                if (track.bpm() > 0) {
                    bpmSum += track.bpm();
                    bpmCount++;
                }
                CamelotKeyParser.parse(track.camelotPosition()).ifPresent(k -> keyCounts.merge(k, 1, Integer::sum));
                String sig = track.timeSignature();
                if (sig != null && !sig.isBlank() && !Track.UNKNOWN.equalsIgnoreCase(sig)) {
                    signatureCounts.merge(sig.trim(), 1, Integer::sum);
                }
                for (String tag : track.genres()) {
                    for (String keyword : GenreVocabulary.keywordsOf(tag)) {
                        keywordCounts.merge(keyword, 1, Integer::sum);
                    }
                }
            }
        }

        double meanBpm = bpmCount == 0 ? DEFAULT_BPM : bpmSum / bpmCount;
        CamelotKey modalKey = mode(keyCounts).orElse(null);
        String modalSignature = mode(signatureCounts).orElse(Track.DEFAULT_TIME_SIGNATURE);
        return new CentroidProfile(meanBpm, modalKey, modalSignature, topKeywords(keywordCounts));
    }

    // Strict comparison keeps the first-seen entry on ties.
    private static <T> Optional<T> mode(Map<T, Integer> counts) {
        T best = null;
        int bestCount = 0;
        for (Map.Entry<T, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }

    private static List<String> topKeywords(Map<String, Integer> counts) {
        List<Map.Entry<String, Integer>> entries = new ArrayList<>(counts.entrySet());
        // List.sort is stable, so equal counts keep first-seen order
        entries.sort((x, y) -> Integer.compare(y.getValue(), x.getValue()));
        List<String> top = new ArrayList<>();
        for (int i = 0; i < entries.size() && i < TOP_GENRE_KEYWORDS; i++) {
            top.add(entries.get(i).getKey());
        }
        return top;
    }
}

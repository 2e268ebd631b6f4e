package com.apollon.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Selects and orders recommendations for a seed track.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Candidates are all library tracks except the seed, de-duplicated by id in library order.</li>
 *   <li>A candidate is kept if it is compatible with the seed at the requested entropy, or, above entropy 0.55,
 *   compatible with the library centroid at {@code min(1, entropy + 0.15)}.</li>
 *   <li>The compatible set is shuffled with bytes from the {@link EntropySourceInterface} and truncated to the
 *   requested count.</li>
 * </ul>
 * <p>
 * Error Handling:
 * <ul>
 *   <li>Entropy outside [0, 1] and counts below 1 throw {@link IllegalArgumentException}.</li>
 *   <li>If the entropy source is down, requests below entropy 0.1 keep the compatible order; any other request
 *   yields {@link RecommendationResult.Status#ENTROPY_UNAVAILABLE}. Pseudo-randomness is never substituted.</li>
 *   <li>If the first fetch returns too few bytes, one more fetch is attempted for the remainder; if that fails the
 *   partial shuffle stands.</li>
 * </ul>
 * The engine keeps no state between calls and can be shared between threads.
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class SelectionEngine implements SelectionEngineInterface {
    private static final Logger logger = LoggerFactory.getLogger(SelectionEngine.class);

    /** Above this entropy the library centroid becomes a second comparison target. */
    public static final double CENTROID_ENTROPY_THRESHOLD = 0.55;
    /** Extra leniency applied when comparing with the centroid. */
    public static final double CENTROID_ENTROPY_BIAS = 0.15;
    /** Below this entropy an unavailable source degrades to the unshuffled compatible order. */
    public static final double DETERMINISTIC_FALLBACK_CEILING = 0.1;

    private final EntropySourceInterface entropySource;
    private final CompatibilityEvaluator evaluator;
    private final CentroidAggregator centroidAggregator;

    public SelectionEngine(EntropySourceInterface entropySource) {
        this(entropySource, new CompatibilityEvaluator(), new CentroidAggregator());
    }

    public SelectionEngine(EntropySourceInterface entropySource, CompatibilityEvaluator evaluator,
                           CentroidAggregator centroidAggregator) {
        this.entropySource = Objects.requireNonNull(entropySource, "entropySource");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.centroidAggregator = Objects.requireNonNull(centroidAggregator, "centroidAggregator");
    }

    @Override
    public RecommendationResult recommend(List<Track> library, Track seedTrack, double entropy, int count) {
        Objects.requireNonNull(library, "library");
        Objects.requireNonNull(seedTrack, "seedTrack");
        CompatibilityEvaluator.requireValidEntropy(entropy);
        if (count < 1) {
            throw new IllegalArgumentException("Recommendation count must be at least 1, got " + count);
        }

        List<Track> compatible = findCompatible(library, seedTrack, entropy);
        if (compatible.isEmpty()) {
            logger.info("No compatible tracks for '{}' at entropy {}", seedTrack.title(), entropy);
            return RecommendationResult.noCompatibleTracks();
        }
        int numToSelect = Math.min(compatible.size(), count);
        if (compatible.size() == 1) {
            return RecommendationResult.ok(compatible);
        }

        byte[] randomBytes;
        try {
            randomBytes = fetchShuffleBytes(QuantumShuffler.bytesRequired(compatible.size()));
        } catch (EntropyUnavailableException e) {
            if (entropy < DETERMINISTIC_FALLBACK_CEILING) {
                logger.warn("Entropy source unavailable ({}); returning {} compatible track(s) unshuffled",
                    e.getReason(), numToSelect);
                return RecommendationResult.deterministicFallback(compatible.subList(0, numToSelect));
            }
            logger.warn("Entropy source unavailable ({}); refusing to order {} candidates at entropy {}",
                e.getReason(), compatible.size(), entropy);
            return RecommendationResult.entropyUnavailable("Entropy source unavailable: " + e.getReason());
        }

        List<Track> shuffled = QuantumShuffler.shuffle(compatible, randomBytes);
        List<Track> selected = shuffled.subList(0, numToSelect);
        logger.info("Recommended {} of {} compatible track(s) for '{}' at entropy {}",
            selected.size(), compatible.size(), seedTrack.title(), entropy);
        return RecommendationResult.ok(selected);
    }

    /**
     * Compatible candidates in library order, without the seed and without duplicate ids.
     */
    List<Track> findCompatible(List<Track> library, Track seedTrack, double entropy) {
        boolean useCentroid = entropy > CENTROID_ENTROPY_THRESHOLD;
        CentroidProfile centroid = useCentroid ? centroidAggregator.computeCentroid(library) : null;
        double centroidEntropy = Math.min(1.0, entropy + CENTROID_ENTROPY_BIAS);

        Map<String, Track> compatible = new LinkedHashMap<>();
        for (Track candidate : library) {
            if (candidate == null || candidate.id().equals(seedTrack.id()) || compatible.containsKey(candidate.id())) {
                continue;
            }
            if (evaluator.isCompatible(candidate, seedTrack, entropy)) {
                compatible.put(candidate.id(), candidate);
            } else if (useCentroid && evaluator.isCompatible(candidate, centroid, centroidEntropy)) {
                logger.debug("'{}' admitted through centroid affinity", candidate.title());
                compatible.put(candidate.id(), candidate);
            }
        }
        return new ArrayList<>(compatible.values());
    }

    private byte[] fetchShuffleBytes(int needed) throws EntropyUnavailableException {
        byte[] bytes = entropySource.fetchRandomBytes(needed);
        if (bytes.length >= needed) {
            return bytes;
        }
        try {
            byte[] more = entropySource.fetchRandomBytes(needed - bytes.length);
            byte[] combined = new byte[bytes.length + more.length];
            System.arraycopy(bytes, 0, combined, 0, bytes.length);
            System.arraycopy(more, 0, combined, bytes.length, more.length);
            return combined;
        } catch (EntropyUnavailableException e) {
            logger.warn("Re-fetch of {} byte(s) failed ({}); shuffle will be partial", needed - bytes.length, e.getReason());
            return bytes;
        }
    }
}

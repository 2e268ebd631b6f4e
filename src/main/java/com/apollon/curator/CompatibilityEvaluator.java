package com.apollon.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Entropy-tiered compatibility rules between two musical profiles.
 * <p>
 * Four independent sub-predicates are evaluated, each of which relaxes as entropy rises:
 * <ul>
 *   <li><b>Tempo</b>: BPM difference within {@link #tempoTolerance(double)}.</li>
 *   <li><b>Harmonic key</b>: Camelot wheel neighbourhood, widened by energy boosts (above 0.5) and two-step
 *   jumps (above 0.75).</li>
 *   <li><b>Time signature</b>: identical, or one of the related feels once entropy reaches 0.6.</li>
 *   <li><b>Genre</b>: shared tags, then shared broad genre families, then anything at 0.9.</li>
 * </ul>
 * The overall verdict requires all four below entropy 0.5, three of four below 0.8, and two of four above that.
 * <p>
 * Unparseable keys and "Unknown" time signatures never satisfy the key or time signature predicates. A missing
 * tempo only matches another missing tempo. Entropy outside [0, 1] is rejected rather than clamped.
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class CompatibilityEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(CompatibilityEvaluator.class);

    /** Tolerance at entropy 0, in BPM. */
    public static final int BASE_TEMPO_TOLERANCE = 5;
    /** Extra tolerance gained between entropy 0 and entropy 1, in BPM. */
    public static final int TEMPO_TOLERANCE_SPAN = 20;

    private static final Set<String> RELATED_FEELS = Set.of(
        "4/4|2/4", "2/4|4/4",
        "4/4|2/2", "2/2|4/4",
        "3/4|6/8", "6/8|3/4"
    );

    /**
     * Fails fast on entropy outside [0, 1] (NaN included).
     * @param entropy requested entropy
     * @return the same value
     * @throws IllegalArgumentException if out of range
     */
    public static double requireValidEntropy(double entropy) {
        if (!(entropy >= 0.0 && entropy <= 1.0)) {
            throw new IllegalArgumentException("Entropy must be between 0.0 and 1.0, got " + entropy);
        }
        return entropy;
    }

    /**
     * BPM tolerance for an entropy level: {@code 5 + floor(entropy * 20)}, i.e. 5 at entropy 0 and 25 at entropy 1.
     */
    public static int tempoTolerance(double entropy) {
        requireValidEntropy(entropy);
        return BASE_TEMPO_TOLERANCE + (int) Math.floor(entropy * TEMPO_TOLERANCE_SPAN);
    }

    /**
     * Overall compatibility of two profiles at an entropy level.
     * @param a first profile (typically the candidate)
     * @param b second profile (the seed track or the library centroid)
     * @param entropy entropy in [0, 1]
     * @return true if enough sub-predicates hold for the entropy band
     */
    public boolean isCompatible(MusicalProfile a, MusicalProfile b, double entropy) {
        requireValidEntropy(entropy);
        int matches = 0;
        if (isTempoCompatible(a, b, entropy)) matches++;
        if (isKeyCompatible(a.camelotPosition(), b.camelotPosition(), entropy)) matches++;
        if (isTimeSignatureCompatible(a.timeSignature(), b.timeSignature(), entropy)) matches++;
        if (isGenreCompatible(a, b, entropy)) matches++;
        boolean compatible = matches >= requiredMatches(entropy);
        logger.debug("Compatibility at entropy {}: {}/4 sub-predicates held, compatible={}", entropy, matches, compatible);
        return compatible;
    }

    /**
     * Number of sub-predicates (out of 4) that must hold at an entropy level.
     */
    public static int requiredMatches(double entropy) {
        if (entropy < 0.5) return 4;
        if (entropy < 0.8) return 3;
        return 2;
    }

    /**
     * Tempo compatibility. Two unknown tempos match; an unknown tempo never matches a known one.
     */
    public boolean isTempoCompatible(MusicalProfile a, MusicalProfile b, double entropy) {
        int tolerance = tempoTolerance(entropy);
        boolean knownA = a.bpm() > 0;
        boolean knownB = b.bpm() > 0;
        if (!knownA || !knownB) {
            return !knownA && !knownB;
        }
        return Math.abs(a.bpm() - b.bpm()) <= tolerance;
    }

    /**
     * Harmonic key compatibility. Each tier is a superset of the one below it.
     * @param labelA Camelot label of the first profile
     * @param labelB Camelot label of the second profile
     * @param entropy entropy in [0, 1]
     * @return false whenever either label is unparseable
     */
    public boolean isKeyCompatible(String labelA, String labelB, double entropy) {
        requireValidEntropy(entropy);
        Optional<CamelotKey> parsedA = CamelotKeyParser.parse(labelA);
        Optional<CamelotKey> parsedB = CamelotKeyParser.parse(labelB);
        if (parsedA.isEmpty() || parsedB.isEmpty()) {
            return false;
        }
        CamelotKey a = parsedA.get();
        CamelotKey b = parsedB.get();
        if (a.equals(b)) {
            return true;
        }
        int distance = a.wheelDistance(b);
        if (a.sameMode(b) && distance == 1) {
            return true;
        }
        // energy boost: 8A <-> 8B
        if (entropy > 0.5 && distance == 0) {
            return true;
        }
        // wide jump: 8A <-> 10A, 12A <-> 2A
        return entropy > 0.75 && a.sameMode(b) && distance == 2;
    }

    public boolean isTimeSignatureCompatible(String sigA, String sigB, double entropy) {
        requireValidEntropy(entropy);
        if (sigA == null || sigB == null || Track.UNKNOWN.equalsIgnoreCase(sigA) || Track.UNKNOWN.equalsIgnoreCase(sigB)) {
            return false;
        }
        String a = sigA.trim();
        String b = sigB.trim();
        if (a.equals(b)) {
            return true;
        }
        return entropy >= 0.6 && RELATED_FEELS.contains(a + "|" + b);
    }

    public boolean isGenreCompatible(MusicalProfile a, MusicalProfile b, double entropy) {
        requireValidEntropy(entropy);
        Set<String> tagsA = GenreVocabulary.normalize(a.genres());
        Set<String> tagsB = GenreVocabulary.normalize(b.genres());
        if (tagsA.isEmpty() && tagsB.isEmpty()) {
            return true;
        }
        if (tagsA.isEmpty() || tagsB.isEmpty()) {
            return entropy >= 0.75;
        }
        Set<String> shared = new HashSet<>(tagsA);
        shared.retainAll(tagsB);
        if (!shared.isEmpty()) {
            return true;
        }
        if (entropy < 0.3) {
            return false;
        }
        Set<String> families = new HashSet<>(GenreVocabulary.keywordsOf(tagsA));
        families.retainAll(GenreVocabulary.keywordsOf(tagsB));
        if (!families.isEmpty()) {
            return true;
        }
        return entropy >= 0.9;
    }
}

package com.apollon.curator;

import java.util.List;

/**
 * Interface for entropy-driven track recommendation.
 */
public interface SelectionEngineInterface {
    /**
     * Recommends tracks compatible with a seed track, ordered by external randomness.
     * @param library snapshot of all library tracks; treated as read-only for the duration of the call
     * @param seedTrack reference track, never part of the result
     * @param entropy 0.0 (conservative) to 1.0 (maximally chaotic)
     * @param count maximum number of tracks wanted; at least 1
     * @return tagged result distinguishing success, deterministic fallback, no match and source failure
     * @throws IllegalArgumentException if entropy is outside [0, 1] or count is below 1
     */
    RecommendationResult recommend(List<Track> library, Track seedTrack, double entropy, int count);

    /**
     * List-returning form of {@link #recommend}: an empty list means either nothing was compatible or the
     * entropy source was unavailable.
     */
    default List<Track> recommendTracks(List<Track> library, Track seedTrack, double entropy, int count) {
        return recommend(library, seedTrack, entropy, count).tracks();
    }
}

package com.apollon.curator;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a recommendation request.
 * <p>
 * The status separates an empty result caused by "nothing compatible" from one caused by the entropy source
 * being down, which a bare list cannot express.
 *
 * @param status how the tracks were produced
 * @param tracks recommended tracks in order, without duplicates; empty for the failure statuses
 * @param detail short human-readable explanation, never null
 */
public record RecommendationResult(Status status, List<Track> tracks, String detail) {

    public enum Status {
        /** Tracks were ordered by quantum randomness (or needed no ordering). */
        OK,
        /** The entropy source was down but the request was near-deterministic, so compatible order was kept. */
        DETERMINISTIC_FALLBACK,
        /** No track in the library is compatible with the seed. */
        NO_COMPATIBLE_TRACKS,
        /** The entropy source was down and the request asked for real randomness. */
        ENTROPY_UNAVAILABLE
    }

    public RecommendationResult {
        Objects.requireNonNull(status, "status");
        tracks = tracks == null ? List.of() : List.copyOf(tracks);
        detail = detail == null ? "" : detail;
    }

    public static RecommendationResult ok(List<Track> tracks) {
        return new RecommendationResult(Status.OK, tracks, "Recommended " + tracks.size() + " track(s)");
    }

    public static RecommendationResult deterministicFallback(List<Track> tracks) {
        return new RecommendationResult(Status.DETERMINISTIC_FALLBACK, tracks,
            "Entropy source unavailable; returned compatible tracks in library order");
    }

    public static RecommendationResult noCompatibleTracks() {
        return new RecommendationResult(Status.NO_COMPATIBLE_TRACKS, List.of(), "No compatible tracks found");
    }

    public static RecommendationResult entropyUnavailable(String detail) {
        return new RecommendationResult(Status.ENTROPY_UNAVAILABLE, List.of(), detail);
    }

    public boolean isSuccess() {
        return status == Status.OK || status == Status.DETERMINISTIC_FALLBACK;
    }
}

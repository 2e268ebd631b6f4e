package com.apollon.curator;

import java.util.List;
import java.util.Optional;

/**
 * The "average track" of a collection, computed by {@link CentroidAggregator}.
 * <p>
 * Recomputed on every recommendation request and never stored. It has no identity and is never part of the library;
 * it only implements {@link MusicalProfile} so it can be compared with candidates.
 *
 * @param meanBpm mean of the known tempos, or 120.0 if none are known
 * @param modalKey most frequent parseable Camelot key, or null if no track has one
 * @param modalTimeSignature most frequent known time signature, or "4/4"
 * @param genreKeywords up to three broad genre families, most frequent first
 */
public record CentroidProfile(
    double meanBpm,
    CamelotKey modalKey,
    String modalTimeSignature,
    List<String> genreKeywords
) implements MusicalProfile {

    public CentroidProfile {
        genreKeywords = genreKeywords == null ? List.of() : List.copyOf(genreKeywords);
    }

    public Optional<CamelotKey> key() {
        return Optional.ofNullable(modalKey);
    }

    @Override
    public double bpm() {
        return meanBpm;
    }

    @Override
    public String camelotPosition() {
        return modalKey == null ? Track.UNKNOWN : modalKey.label();
    }

    @Override
    public String timeSignature() {
        return modalTimeSignature;
    }

    @Override
    public List<String> genres() {
        return genreKeywords;
    }
}

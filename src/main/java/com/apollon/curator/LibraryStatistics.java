package com.apollon.curator;

import java.util.List;
import java.util.Map;

/**
 * Summary of a library's musical make-up, produced by {@link LibraryAnalyzer}.
 * Averages and ranges are null when no track has the corresponding value.
 *
 * @param trackCount number of tracks analysed
 * @param averageBpm mean of known tempos
 * @param minBpm lowest known tempo
 * @param maxBpm highest known tempo
 * @param averageEnergy mean of positive energy levels
 * @param commonCamelotPositions up to three Camelot positions with their counts, most frequent first
 * @param timeSignatureShares known time signatures with their share of all tracks, in percent, most frequent first
 * @param commonGenres up to three genre tags with their counts, most frequent first
 * @param distinctGenres number of distinct genre tags
 */
public record LibraryStatistics(
    int trackCount,
    Double averageBpm,
    Double minBpm,
    Double maxBpm,
    Double averageEnergy,
    List<Map.Entry<String, Integer>> commonCamelotPositions,
    Map<String, Double> timeSignatureShares,
    List<Map.Entry<String, Integer>> commonGenres,
    int distinctGenres
) {}

package com.apollon.curator;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.apollon.curator.TrackFixtures.track;
import static org.junit.jupiter.api.Assertions.*;

class CentroidAggregatorTest {

    private final CentroidAggregator aggregator = new CentroidAggregator();

    @Test
    void scenarioLibraryCentroid() {
        CentroidProfile centroid = aggregator.computeCentroid(List.of(TrackFixtures.A, TrackFixtures.B, TrackFixtures.C));
        assertEquals(133.67, centroid.bpm(), 0.01);
        assertEquals(new CamelotKey(8, 'A'), centroid.modalKey());
        assertEquals("8A", centroid.camelotPosition());
        assertEquals("4/4", centroid.timeSignature());
        assertTrue(centroid.genres().isEmpty());
    }

    @Test
    void defaultsWhenNothingIsKnown() {
        CentroidProfile centroid = aggregator.computeCentroid(List.of(
            track("x", 0, "Unknown", "Unknown"),
            track("y", -1, "??", "Unknown")));
        assertEquals(CentroidAggregator.DEFAULT_BPM, centroid.bpm());
        assertNull(centroid.modalKey());
        assertTrue(centroid.key().isEmpty());
        assertEquals("Unknown", centroid.camelotPosition());
        assertEquals("4/4", centroid.timeSignature());
    }

    @Test
    void emptyLibraryUsesDefaults() {
        CentroidProfile centroid = aggregator.computeCentroid(List.of());
        assertEquals(120.0, centroid.bpm());
        assertEquals("4/4", centroid.timeSignature());
    }

    @Test
    void unknownTemposAreExcludedFromMean() {
        CentroidProfile centroid = aggregator.computeCentroid(List.of(
            track("x", 100, "1A", "4/4"),
            track("y", 0, "1A", "4/4"),
            track("z", 140, "1A", "4/4")));
        assertEquals(120.0, centroid.bpm(), 1e-9);
    }

    @Test
    void keyTiesGoToFirstSeen() {
        CentroidProfile centroid = aggregator.computeCentroid(List.of(
            track("x", 120, "5B", "3/4"),
            track("y", 120, "9A", "6/8"),
            track("z", 120, "9A", "6/8"),
            track("w", 120, "5B", "3/4")));
        assertEquals("5B", centroid.camelotPosition());
        assertEquals("3/4", centroid.timeSignature());
    }

    @Test
    void unknownSignaturesDoNotWinTheMode() {
        CentroidProfile centroid = aggregator.computeCentroid(List.of(
            track("x", 120, "5B", "Unknown"),
            track("y", 120, "5B", "Unknown"),
            track("z", 120, "5B", "6/8")));
        assertEquals("6/8", centroid.timeSignature());
    }

    @Test
    void topThreeGenreFamiliesByFrequency() {
        CentroidProfile centroid = aggregator.computeCentroid(List.of(
            track("a", 120, "1A", "4/4", "Indie Rock", "jazz"),
            track("b", 120, "1A", "4/4", "Hard Rock", "Techno"),
            track("c", 120, "1A", "4/4", "minimal techno", "punk rock"),
            track("d", 120, "1A", "4/4", "acid jazz", "vaporwave")));
        assertEquals(List.of("rock", "jazz", "techno"), centroid.genres());
    }
}

package com.apollon.curator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * User-supplied metadata for a track, used to fill gaps left by the import (missing BPM, key, genres...).
 * <p>
 * Matched to library tracks by {@code trackIdSpotify}, which equals {@link Track#id()} for imported tracks.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TrackContribution(
    @JsonProperty("track_id_spotify") String trackIdSpotify,
    @JsonProperty("bpm") Double bpm,
    @JsonProperty("key") String key,
    @JsonProperty("time_signature") String timeSignature,
    @JsonProperty("camelot_key") String camelotKey,
    @JsonProperty("genre_keywords") List<String> genreKeywords,
    @JsonProperty("source_description") String sourceDescription,
    @JsonProperty("confidence") Double confidence
) {

    public TrackContribution {
        genreKeywords = genreKeywords == null ? List.of() : List.copyOf(genreKeywords);
    }

    /**
     * Fills the track's missing attributes from this contribution. Known values are never overwritten.
     * @param track library track with the same id
     * @return a new Track, or the same instance if nothing was missing
     */
    public Track applyTo(Track track) {
        boolean changed = false;
        double newBpm = track.bpm();
        if (!track.hasTempo() && bpm != null && bpm > 0) {
            newBpm = bpm;
            changed = true;
        }
        String newKey = track.key();
        if (isMissing(newKey) && !isMissing(key)) {
            newKey = key;
            changed = true;
        }
        String newCamelot = track.camelotPosition();
        if (CamelotKeyParser.parse(newCamelot).isEmpty() && CamelotKeyParser.parse(camelotKey).isPresent()) {
            newCamelot = camelotKey;
            changed = true;
        }
        String newSignature = track.timeSignature();
        if (isMissing(newSignature) && !isMissing(timeSignature)) {
            newSignature = timeSignature;
            changed = true;
        }
        List<String> newGenres = track.genres();
        if (newGenres.isEmpty() && !genreKeywords.isEmpty()) {
            newGenres = genreKeywords;
            changed = true;
        }
        if (!changed) return track;
        return new Track(track.id(), track.title(), track.artist(), newBpm, newKey, newCamelot, track.energyLevel(),
            track.spotifyUrl(), track.album(), newSignature, track.albumArtUrl(), newGenres);
    }

    private static boolean isMissing(String value) {
        return value == null || value.isBlank() || Track.UNKNOWN.equalsIgnoreCase(value);
    }
}

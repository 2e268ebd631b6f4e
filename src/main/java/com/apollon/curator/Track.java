package com.apollon.curator;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Immutable record representing a track in the user's music library.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Tracks are owned by {@link TrackLibrary} and persisted as JSON by {@link LibraryStore}.</li>
 *   <li>Musical attributes (tempo, Camelot position, time signature, genres) are read by the recommendation
 *   engine through {@link MusicalProfile}; the engine never mutates a track.</li>
 *   <li>Missing metadata can be filled from user contributions via {@link TrackContribution#applyTo(Track)},
 *   which returns a new Track.</li>
 * </ul>
 * <p>
 * A tempo of zero means "unknown". Camelot position and time signature use the literal "Unknown" when absent.
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Track(
    @JsonProperty("id") String id,
    @JsonProperty("title") String title,
    @JsonProperty("artist") String artist,
    @JsonProperty("bpm") double bpm,
    @JsonProperty("key") String key,
    @JsonProperty("camelot_position") String camelotPosition,
    @JsonProperty("energy_level") double energyLevel,
    @JsonProperty("spotify_url") String spotifyUrl,
    @JsonProperty("album") String album,
    @JsonProperty("time_signature") String timeSignature,
    @JsonProperty("album_art_url") String albumArtUrl,
    @JsonProperty("genres") List<String> genres
) implements MusicalProfile {

    public static final String UNKNOWN = "Unknown";
    public static final String DEFAULT_TIME_SIGNATURE = "4/4";

    public Track {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Track id cannot be blank");
        }
        camelotPosition = camelotPosition == null || camelotPosition.isBlank() ? UNKNOWN : camelotPosition;
        timeSignature = timeSignature == null || timeSignature.isBlank() ? DEFAULT_TIME_SIGNATURE : timeSignature;
        genres = genres == null ? List.of() : genres.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Convenience constructor for tracks without Spotify links or album metadata.
     */
    public Track(String id, String title, String artist, double bpm, String key, String camelotPosition,
                 double energyLevel, String timeSignature, List<String> genres) {
        this(id, title, artist, bpm, key, camelotPosition, energyLevel, null, null, timeSignature, null, genres);
    }

    /**
     * @return true if the tempo is known (strictly positive)
     */
    public boolean hasTempo() {
        return bpm > 0;
    }
}

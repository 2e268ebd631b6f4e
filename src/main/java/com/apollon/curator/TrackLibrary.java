package com.apollon.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory music library: the single source of Track data for the recommendation engine.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Tracks keep insertion order; ids are unique and duplicates are ignored with a warning.</li>
 *   <li>{@link #getAllTracks()} returns an immutable snapshot, so callers can hand it to the engine while the
 *   library keeps changing.</li>
 *   <li>Listeners are notified after each effective change, in registration order. A failing listener is logged
 *   and does not prevent the others from being notified.</li>
 * </ul>
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public class TrackLibrary {
    private static final Logger logger = LoggerFactory.getLogger(TrackLibrary.class);

    private final List<Track> tracks = new ArrayList<>();
    private final List<LibraryListener> listeners = new CopyOnWriteArrayList<>();

    public TrackLibrary() {}

    public TrackLibrary(List<Track> initialTracks) {
        if (initialTracks != null) {
            for (Track track : initialTracks) {
                if (track != null && !containsId(track.id())) tracks.add(track);
            }
        }
    }

    /**
     * Adds a track unless one with the same id exists.
     * @return true if the track was added
     */
    public boolean addTrack(Track track) {
        Objects.requireNonNull(track, "track");
        synchronized (this) {
            if (containsId(track.id())) {
                logger.warn("Track with ID {} already exists in library.", track.id());
                return false;
            }
            tracks.add(track);
        }
        notifyListeners();
        return true;
    }

    /**
     * Adds every track whose id is not already present.
     * @return number of tracks added
     */
    public int addTracks(List<Track> toAdd) {
        int added = 0;
        synchronized (this) {
            for (Track track : toAdd) {
                if (track != null && !containsId(track.id())) {
                    tracks.add(track);
                    added++;
                }
            }
        }
        if (added > 0) {
            logger.info("Added {} new track(s) to the library.", added);
            notifyListeners();
        }
        return added;
    }

    /**
     * Removes the track with the given id.
     * @return true if a track was removed
     */
    public boolean removeTrack(String trackId) {
        boolean removed;
        synchronized (this) {
            removed = tracks.removeIf(t -> t.id().equals(trackId));
        }
        if (removed) notifyListeners();
        return removed;
    }

    public void clear() {
        synchronized (this) {
            if (tracks.isEmpty()) return;
            tracks.clear();
        }
        notifyListeners();
    }

    public synchronized List<Track> getAllTracks() {
        return List.copyOf(tracks);
    }

    public synchronized Optional<Track> findById(String trackId) {
        return tracks.stream().filter(t -> t.id().equals(trackId)).findFirst();
    }

    public synchronized int size() {
        return tracks.size();
    }

    public void addListener(LibraryListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(LibraryListener listener) {
        listeners.remove(listener);
    }

    private boolean containsId(String id) {
        for (Track t : tracks) {
            if (t.id().equals(id)) return true;
        }
        return false;
    }

    private void notifyListeners() {
        List<Track> snapshot = getAllTracks();
        for (LibraryListener listener : listeners) {
            try {
                listener.libraryChanged(snapshot);
            } catch (RuntimeException e) {
                logger.error("Error notifying library listener {}: {}", listener, e.getMessage(), e);
            }
        }
    }
}

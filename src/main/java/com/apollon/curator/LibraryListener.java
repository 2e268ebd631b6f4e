package com.apollon.curator;

import java.util.List;

/**
 * Subscriber notified by {@link TrackLibrary} after every change to its contents.
 */
@FunctionalInterface
public interface LibraryListener {
    /**
     * @param snapshot the library contents after the change
     */
    void libraryChanged(List<Track> snapshot);
}

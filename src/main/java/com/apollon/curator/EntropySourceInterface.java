package com.apollon.curator;

/**
 * Interface for external randomness used to order recommendations.
 */
public interface EntropySourceInterface {
    /**
     * Fetches raw random bytes.
     * @param count number of bytes wanted; must be positive
     * @return between 1 and {@code count} bytes (a short response is returned as-is)
     * @throws IllegalArgumentException if {@code count <= 0}; no request is made
     * @throws EntropyUnavailableException if the source cannot deliver any bytes
     */
    byte[] fetchRandomBytes(int count) throws EntropyUnavailableException;

    /**
     * Probes the source by fetching a single byte.
     * @return true if the probe succeeded
     */
    boolean isAvailable();
}

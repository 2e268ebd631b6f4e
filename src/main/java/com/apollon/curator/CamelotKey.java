package com.apollon.curator;

/**
 * A parsed position on the Camelot wheel: a number from 1 to 12 and a mode letter,
 * {@code 'A'} for minor keys and {@code 'B'} for major keys.
 * <p>
 * Only {@link CamelotKeyParser} creates instances from labels; the constructor rejects anything outside the wheel.
 */
public record CamelotKey(int number, char mode) {

    public static final int WHEEL_SIZE = 12;

    public CamelotKey {
        if (number < 1 || number > WHEEL_SIZE) {
            throw new IllegalArgumentException("Camelot number must be between 1 and 12: " + number);
        }
        if (mode != 'A' && mode != 'B') {
            throw new IllegalArgumentException("Camelot mode must be 'A' or 'B': " + mode);
        }
    }

    /**
     * Distance around the wheel ignoring mode, in the range 0..6.
     */
    public int wheelDistance(CamelotKey other) {
        int diff = Math.abs(number - other.number);
        return Math.min(diff, WHEEL_SIZE - diff);
    }

    public boolean sameMode(CamelotKey other) {
        return mode == other.mode;
    }

    /**
     * @return the canonical label, e.g. "8A"
     */
    public String label() {
        return number + String.valueOf(mode);
    }

    @Override
    public String toString() {
        return label();
    }
}

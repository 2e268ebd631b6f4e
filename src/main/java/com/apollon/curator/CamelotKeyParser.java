package com.apollon.curator;

import java.util.Optional;

/**
 * Parses Camelot labels such as "8A" or "12B".
 * <p>
 * Unparseable labels (including "Unknown", which many tracks carry) are an expected outcome and yield
 * {@link Optional#empty()} rather than an exception.
 *
 * @author Curator Apollon Team
 * @since 1.0
 */
public final class CamelotKeyParser {
    private CamelotKeyParser() {}

    /**
     * Parses a Camelot label.
     * @param label label of length 2 or 3: a number 1-12 followed by 'A' or 'B'
     * @return the parsed key, or empty if the label is null or malformed
     */
    public static Optional<CamelotKey> parse(String label) {
        if (label == null || label.length() < 2 || label.length() > 3) {
            return Optional.empty();
        }
        String digits = label.substring(0, label.length() - 1);
        char mode = label.charAt(label.length() - 1);
        if (mode != 'A' && mode != 'B') {
            return Optional.empty();
        }
        // Integer.parseInt accepts a leading sign, which is not part of a Camelot label
        for (int i = 0; i < digits.length(); i++) {
            if (!Character.isDigit(digits.charAt(i))) {
                return Optional.empty();
            }
        }
        int number = Integer.parseInt(digits);
        if (number < 1 || number > CamelotKey.WHEEL_SIZE) {
            return Optional.empty();
        }
        return Optional.of(new CamelotKey(number, mode));
    }
}

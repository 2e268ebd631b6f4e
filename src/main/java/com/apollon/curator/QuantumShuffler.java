package com.apollon.curator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fisher-Yates shuffle driven by externally supplied random bytes.
 * <p>
 * For {@code i} from {@code n-1} down to 1, the next unused byte {@code b} (read unsigned) picks
 * {@code j = b mod (i + 1)} and positions {@code i} and {@code j} are swapped. When the bytes run out the pass stops,
 * leaving the remaining head of the list in its original order.
 * <p>
 * The modulo reduction slightly favours low indices whenever {@code i + 1} does not divide 256. This is accepted
 * behaviour: it keeps results reproducible for a given byte sequence, and the bias is at most 1/256 per draw.
 */
public final class QuantumShuffler {
    private QuantumShuffler() {}

    /**
     * Number of bytes that drive a complete pass over {@code size} items.
     */
    public static int bytesRequired(int size) {
        return Math.max(0, size - 1);
    }

    /**
     * Returns a shuffled copy of {@code items}; the input list is not modified.
     * @param items items to shuffle
     * @param randomBytes bytes consumed in order; may be shorter than {@link #bytesRequired(int)}
     * @param <T> element type
     * @return a permutation of {@code items}
     */
    public static <T> List<T> shuffle(List<T> items, byte[] randomBytes) {
        List<T> copy = new ArrayList<>(items);
        if (randomBytes == null || randomBytes.length == 0 || copy.size() < 2) {
            return copy;
        }
        int byteIdx = 0;
        for (int i = copy.size() - 1; i > 0; i--) {
            if (byteIdx >= randomBytes.length) {
                break;
            }
            int b = randomBytes[byteIdx++] & 0xFF;
            int j = b % (i + 1);
            Collections.swap(copy, i, j);
        }
        return copy;
    }
}

package io.github.cyfko.cohortql.core.utils;

/**
 * Ratcliff/Obershelp ("gestalt pattern matching") similarity between two strings.
 * <p>
 * The ratio is {@code 2 * M / T} where {@code T} is the total length of both strings and {@code M}
 * the number of characters in matching blocks. Blocks are found by taking the longest common
 * substring, then recursing on the unmatched text to its left and to its right. Among several
 * longest substrings the one starting earliest in {@code a}, then earliest in {@code b}, is taken,
 * which makes the ratio deterministic.
 * </p>
 *
 * <pre>{@code
 * SequenceSimilarity.ratio("etnicity", "ethnicity") // 16/17 = 0.941...
 * SequenceSimilarity.ratio("", "")                  // 1.0
 * }</pre>
 *
 * @since 1.0.0
 */
public final class SequenceSimilarity {

    private SequenceSimilarity() {
        // utility class
    }

    /**
     * Computes the similarity ratio of two strings.
     *
     * @param a first string, not {@code null}
     * @param b second string, not {@code null}
     * @return ratio in [0, 1]; 1.0 when both strings are empty
     */
    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) return 1.0;
        int matches = matchingCharacters(a, 0, a.length(), b, 0, b.length());
        return 2.0 * matches / total;
    }

    private static int matchingCharacters(String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
        if (aLow >= aHigh || bLow >= bHigh) return 0;

        int bestI = aLow;
        int bestJ = bLow;
        int bestSize = 0;
        // lengths[j + 1] is the length of the common suffix ending at a[i - 1] and b[j]
        int[] previous = new int[bHigh - bLow + 1];
        int[] current = new int[bHigh - bLow + 1];
        for (int i = aLow; i < aHigh; i++) {
            char ca = a.charAt(i);
            for (int j = bLow; j < bHigh; j++) {
                int k = j - bLow + 1;
                if (ca == b.charAt(j)) {
                    current[k] = previous[k - 1] + 1;
                    if (current[k] > bestSize) {
                        bestSize = current[k];
                        bestI = i - bestSize + 1;
                        bestJ = j - bestSize + 1;
                    }
                } else {
                    current[k] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        if (bestSize == 0) return 0;
        return bestSize
                + matchingCharacters(a, aLow, bestI, b, bLow, bestJ)
                + matchingCharacters(a, bestI + bestSize, aHigh, b, bestJ + bestSize, bHigh);
    }
}

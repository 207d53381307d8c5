package in.co.pricematch.services;

import java.util.Arrays;
import java.util.Locale;

/**
 * Token-order-insensitive string similarity.
 *
 * <p>Both strings are lowercased, split on non-alphanumerics, their tokens sorted and
 * re-joined; the score is the indel similarity {@code 2 * LCS / (len1 + len2)} of the two
 * sorted strings, rounded to a whole percent and returned in [0, 1].</p>
 */
public final class LexicalSimilarity {

    private LexicalSimilarity() {}

    public static double tokenSortRatio(String a, String b) {
        String sortedA = sortTokens(a);
        String sortedB = sortTokens(b);
        if (sortedA.isEmpty() || sortedB.isEmpty()) {
            return 0.0;
        }
        return Math.round(100.0 * ratio(sortedA, sortedB)) / 100.0;
    }

    static String sortTokens(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = text.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]+", " ").trim();
        if (cleaned.isEmpty()) {
            return "";
        }
        String[] tokens = cleaned.split(" ");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }

    static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        return 2.0 * longestCommonSubsequence(a, b) / total;
    }

    private static int longestCommonSubsequence(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}

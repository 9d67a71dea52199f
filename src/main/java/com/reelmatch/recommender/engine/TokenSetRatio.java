package com.reelmatch.recommender.engine;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Token-set fuzzy similarity on a 0-100 scale. Insensitive to token order and repeated
 * tokens; symmetric in its arguments. Non-ASCII characters are dropped before matching,
 * so "Amélie" is compared as "Amlie".
 */
public final class TokenSetRatio {

    private static final Pattern NON_ASCII = Pattern.compile("[^\\x00-\\x7F]");
    private static final Pattern NON_WORD = Pattern.compile("\\W");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TokenSetRatio() {
    }

    public static int score(String first, String second) {
        String left = normalize(first);
        String right = normalize(second);
        if (left.isEmpty() || right.isEmpty()) {
            return 0;
        }

        Set<String> leftTokens = tokens(left);
        Set<String> rightTokens = tokens(right);

        Set<String> intersection = new TreeSet<>(leftTokens);
        intersection.retainAll(rightTokens);
        Set<String> leftOnly = new TreeSet<>(leftTokens);
        leftOnly.removeAll(rightTokens);
        Set<String> rightOnly = new TreeSet<>(rightTokens);
        rightOnly.removeAll(leftTokens);

        String sect = String.join(" ", intersection);
        String combinedLeft = (sect + " " + String.join(" ", leftOnly)).trim();
        String combinedRight = (sect + " " + String.join(" ", rightOnly)).trim();

        return Math.max(ratio(sect, combinedLeft),
            Math.max(ratio(sect, combinedRight), ratio(combinedLeft, combinedRight)));
    }

    static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String ascii = NON_ASCII.matcher(value).replaceAll("");
        return NON_WORD.matcher(ascii).replaceAll(" ").toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Plain similarity ratio: 2 * LCS / total length, rounded half-even.
     */
    static int ratio(String first, String second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0;
        }
        int common = longestCommonSubsequence(first, second);
        return (int) Math.rint(100.0 * 2 * common / (first.length() + second.length()));
    }

    private static Set<String> tokens(String normalized) {
        return new TreeSet<>(Arrays.asList(WHITESPACE.split(normalized)));
    }

    private static int longestCommonSubsequence(String first, String second) {
        int[] previous = new int[second.length() + 1];
        int[] current = new int[second.length() + 1];
        for (int i = 1; i <= first.length(); i++) {
            char c = first.charAt(i - 1);
            for (int j = 1; j <= second.length(); j++) {
                current[j] = c == second.charAt(j - 1)
                    ? previous[j - 1] + 1
                    : Math.max(previous[j], current[j - 1]);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[second.length()];
    }
}

package com.gt.asjp.distance;

/**
 * Weighted Levenshtein distance over ASJP phonetic transcriptions.
 *
 * Every symbol of the transcription alphabet is a single character. Insertions and deletions cost 1.
 * A substitution between two different vowels costs the vowel weight, any other substitution between
 * different symbols costs 1.
 */
public final class PhoneticDistance {

    public static final double DEFAULT_VOWEL_WEIGHT = 1.0;

    private static final String VOWELS = "3aeEiou";
    private static final boolean[] IS_VOWEL = new boolean[128];

    static {
        for (char vowel : VOWELS.toCharArray()) {
            IS_VOWEL[vowel] = true;
        }
    }

    private PhoneticDistance() { }

    public static boolean isVowel(char symbol) {
        return symbol < IS_VOWEL.length && IS_VOWEL[symbol];
    }

    public static double levenshteinDistance(String left, String right) {
        return levenshteinDistance(left, right, DEFAULT_VOWEL_WEIGHT);
    }

    public static double levenshteinDistance(String left, String right, double vowelWeight) {
        if (left == null) {
            left = "";
        }
        if (right == null) {
            right = "";
        }

        int leftLength = left.length();
        int rightLength = right.length();

        double[][] distances = new double[leftLength + 1][rightLength + 1];
        for (int i = 1; i <= leftLength; i++) {
            distances[i][0] = i;
        }
        for (int j = 1; j <= rightLength; j++) {
            distances[0][j] = j;
        }

        for (int i = 1; i <= leftLength; i++) {
            char leftSymbol = left.charAt(i - 1);

            for (int j = 1; j <= rightLength; j++) {
                char rightSymbol = right.charAt(j - 1);

                double delCost = distances[i - 1][j] + 1.0;
                double insertCost = distances[i][j - 1] + 1.0;
                double subCost = distances[i - 1][j - 1] + substitutionCost(leftSymbol, rightSymbol, vowelWeight);

                distances[i][j] = Math.min(Math.min(delCost, insertCost), subCost);
            }
        }

        return distances[leftLength][rightLength];
    }

    private static double substitutionCost(char left, char right, double vowelWeight) {
        if (left == right) {
            return 0.0;
        }

        return isVowel(left) && isVowel(right) ? vowelWeight : 1.0;
    }
}

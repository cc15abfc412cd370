package com.gt.asjp.distance;

import java.util.List;

/**
 * Normalized Levenshtein distance (NLD) between the word forms two languages have for one concept.
 */
public final class ConceptDistance {

    private ConceptDistance() { }

    /**
     * Distance between two forms divided by the length of the longer one. Two empty forms are at distance 0.
     */
    public static double normalizedDistance(String left, String right, double vowelWeight) {
        String safeLeft = left == null ? "" : left;
        String safeRight = right == null ? "" : right;

        int maxLength = Math.max(safeLeft.length(), safeRight.length());
        if (maxLength == 0) {
            return 0.0;
        }

        return PhoneticDistance.levenshteinDistance(safeLeft, safeRight, vowelWeight) / maxLength;
    }

    public static double normalizedDistance(String left, String right) {
        return normalizedDistance(left, right, PhoneticDistance.DEFAULT_VOWEL_WEIGHT);
    }

    public static double meanConceptDistance(List<String> forms1, List<String> forms2) {
        return meanConceptDistance(forms1, forms2, PhoneticDistance.DEFAULT_VOWEL_WEIGHT);
    }

    /**
     * Mean NLD over every pair of forms in forms1 x forms2. Usually each language has a single form
     * for a concept, in which case this is just the NLD between those two forms.
     *
     * @return the mean, or 0 if either list is empty
     */
    public static double meanConceptDistance(List<String> forms1, List<String> forms2, double vowelWeight) {
        if (forms1 == null || forms2 == null || forms1.isEmpty() || forms2.isEmpty()) {
            return 0.0;
        }

        double total = 0.0;
        for (String form1 : forms1) {
            for (String form2 : forms2) {
                total += normalizedDistance(form1, form2, vowelWeight);
            }
        }

        return total / ((double) forms1.size() * forms2.size());
    }
}

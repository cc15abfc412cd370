package com.gt.asjp.distance;

import com.gt.asjp.exception.NoComparableConceptsException;
import com.gt.asjp.model.WordList;

import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Language-level NLD: the mean of the per-concept means over the concepts both word lists have forms for.
 */
public final class LanguageDistance {

    private LanguageDistance() { }

    // Sorted so the summation order, and with it the floating point result, never depends on map ordering
    public static SortedSet<String> sharedConcepts(WordList wordList1, WordList wordList2) {
        SortedSet<String> shared = new TreeSet<>(wordList1.concepts().keySet());
        shared.retainAll(wordList2.concepts().keySet());
        return shared;
    }

    public static double meanLanguageDistance(WordList wordList1, WordList wordList2) {
        return meanLanguageDistance(wordList1, wordList2, PhoneticDistance.DEFAULT_VOWEL_WEIGHT);
    }

    public static double meanLanguageDistance(WordList wordList1, WordList wordList2, double vowelWeight) {
        SortedSet<String> shared = sharedConcepts(wordList1, wordList2);
        if (shared.isEmpty()) {
            throw new NoComparableConceptsException(
                    "Word lists " + wordList1.identifier() + " and " + wordList2.identifier() + " share no concepts");
        }

        double total = 0.0;
        for (String concept : shared) {
            total += ConceptDistance.meanConceptDistance(wordList1.get(concept), wordList2.get(concept), vowelWeight);
        }

        return total / shared.size();
    }
}

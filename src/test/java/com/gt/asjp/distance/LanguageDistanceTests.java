package com.gt.asjp.distance;

import com.gt.asjp.exception.NoComparableConceptsException;
import com.gt.asjp.model.WordList;
import com.gt.asjp.util.TestUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(SpringExtension.class)
public class LanguageDistanceTests {

    private static final double DELTA = 1e-12;

    @Test
    public void testMeanLanguageDistance_singleSharedConcept() {
        WordList languageA = new WordList("aaa", "A", Map.of("stone", List.of("tan")));
        WordList languageB = new WordList("bbb", "B", Map.of("stone", List.of("ston"), "water", List.of("wat3r")));

        assertEquals(0.5, LanguageDistance.meanLanguageDistance(languageA, languageB), DELTA);
        assertEquals(0.5, LanguageDistance.meanLanguageDistance(languageB, languageA), DELTA);
    }

    @Test
    public void testMeanLanguageDistance() {
        WordList english = TestUtils.getEnglish();
        WordList swedish = TestUtils.getSwedish();

        assertEquals(TestUtils.ENGLISH_SWEDISH_NLD, LanguageDistance.meanLanguageDistance(english, swedish), DELTA);
        assertEquals(TestUtils.ENGLISH_SWEDISH_NLD, LanguageDistance.meanLanguageDistance(swedish, english), DELTA);
        assertEquals(0.0, LanguageDistance.meanLanguageDistance(english, english), DELTA);
    }

    @Test
    public void testMeanLanguageDistance_vowelWeight() {
        WordList english = TestUtils.getEnglish();
        WordList swedish = TestUtils.getSwedish();

        // I: E -> y, i -> o (vowels), insert g; stone: o -> e (vowels)
        double expected = ((1.0 + 0.5 + 1.0) / 3 + 0.5 + 0.5 + 0.4 + 0.5 / 4) / 5;
        assertEquals(expected, LanguageDistance.meanLanguageDistance(english, swedish, 0.5), DELTA);
    }

    @Test
    public void testMeanLanguageDistance_independentOfConceptOrder() {
        WordList english = TestUtils.getEnglish();
        WordList swedish = TestUtils.getSwedish();

        List<String> reversedConcepts = new ArrayList<>(swedish.concepts().keySet());
        Collections.reverse(reversedConcepts);
        Map<String, List<String>> reversed = new LinkedHashMap<>();
        for (String concept : reversedConcepts) {
            reversed.put(concept, swedish.get(concept));
        }
        WordList reversedSwedish = new WordList("swe", "SWEDISH", reversed);

        assertEquals(LanguageDistance.meanLanguageDistance(english, swedish),
                     LanguageDistance.meanLanguageDistance(english, reversedSwedish));
    }

    @Test
    public void testMeanLanguageDistance_noSharedConcepts() {
        NoComparableConceptsException ex = assertThrows(NoComparableConceptsException.class,
                () -> LanguageDistance.meanLanguageDistance(TestUtils.getEnglish(), TestUtils.getIsolate()));

        assertTrue(ex.getMessage().contains("eng"));
        assertTrue(ex.getMessage().contains("xis"));
    }

    @Test
    public void testSharedConcepts() {
        assertEquals(List.of("I", "fish", "stone", "water", "you"),
                     List.copyOf(LanguageDistance.sharedConcepts(TestUtils.getEnglish(), TestUtils.getSwedish())));
        assertEquals(List.of("stone"),
                     List.copyOf(LanguageDistance.sharedConcepts(TestUtils.getToyA(), TestUtils.getEnglish())));
        assertTrue(LanguageDistance.sharedConcepts(TestUtils.getToyA(), TestUtils.getIsolate()).isEmpty());
    }
}

package com.gt.asjp.similarity;

import com.gt.asjp.conf.CachingConfig;
import com.gt.asjp.distance.ConceptDistance;
import com.gt.asjp.distance.LanguageDistance;
import com.gt.asjp.distance.PhoneticDistance;
import com.gt.asjp.exception.InvalidRequestException;
import com.gt.asjp.exception.NoComparableConceptsException;
import com.gt.asjp.model.ConceptComparison;
import com.gt.asjp.model.LanguageComparison;
import com.gt.asjp.model.LanguageSummary;
import com.gt.asjp.model.WordList;
import com.gt.asjp.wordlist.WordListRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Component
public class LanguageSimilarityService {

    private static final Logger log = LoggerFactory.getLogger(LanguageSimilarityService.class);

    private final WordListRegistry wordListRegistry;
    private final double vowelWeight;

    @Autowired
    public LanguageSimilarityService(WordListRegistry wordListRegistry,
                                     @Value("${asjp.distance.vowelWeight:1.0}") double vowelWeight) {
        if (vowelWeight < 0) {
            throw new IllegalArgumentException("Vowel weight must not be negative: " + vowelWeight);
        }

        this.wordListRegistry = wordListRegistry;
        this.vowelWeight = vowelWeight;
        log.info("Comparing languages with vowel substitution weight {}", vowelWeight);
    }

    public double getVowelWeight() {
        return vowelWeight;
    }

    public List<LanguageSummary> getAllLanguages() {
        return wordListRegistry.wordLists().stream()
                .map(LanguageSummary::of)
                .collect(Collectors.toUnmodifiableList());
    }

    public WordList getWordList(String identifier) {
        return wordListRegistry.get(identifier);
    }

    public List<String> getForms(String identifier, String concept) {
        return wordListRegistry.get(identifier).get(concept);
    }

    public double wordDistance(String word1, String word2) {
        return PhoneticDistance.levenshteinDistance(word1, word2, vowelWeight);
    }

    public ConceptComparison compareConcept(String identifier1, String identifier2, String concept) {
        List<String> forms1 = getForms(identifier1, concept);
        List<String> forms2 = getForms(identifier2, concept);

        return new ConceptComparison(concept, forms1, forms2, ConceptDistance.meanConceptDistance(forms1, forms2, vowelWeight));
    }

    @Cacheable(CachingConfig.LANGUAGE_COMPARISONS)
    public LanguageComparison compareLanguages(String identifier1, String identifier2) {
        log.debug("Comparing {} and {}", identifier1, identifier2);

        return compare(wordListRegistry.get(identifier1), wordListRegistry.get(identifier2));
    }

    /**
     * Ranks every other loaded language by mean NLD to the given one, closest first.
     * Languages with no concept in common with it are left out.
     */
    public List<LanguageComparison> findNearestLanguages(String identifier, int count) {
        if (count <= 0) {
            throw new InvalidRequestException("Count must be positive: " + count);
        }

        WordList target = wordListRegistry.get(identifier);

        return wordListRegistry.wordLists().parallelStream()
                .filter(wordList -> !wordList.identifier().equals(identifier))  // don't include the target as its own neighbor
                .map(wordList -> compareIfPossible(target, wordList))
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingDouble(LanguageComparison::meanNld)
                        .thenComparing(LanguageComparison::identifier2))
                .limit(count)
                .collect(Collectors.toUnmodifiableList());
    }

    private LanguageComparison compareIfPossible(WordList target, WordList other) {
        try {
            return compare(target, other);
        } catch (NoComparableConceptsException ex) {
            log.debug("Skipping {}: {}", other.identifier(), ex.getMessage());
            return null;
        }
    }

    private LanguageComparison compare(WordList wordList1, WordList wordList2) {
        double meanNld = LanguageDistance.meanLanguageDistance(wordList1, wordList2, vowelWeight);

        return new LanguageComparison(wordList1.identifier(), wordList2.identifier(),
                LanguageDistance.sharedConcepts(wordList1, wordList2).size(), meanNld);
    }
}

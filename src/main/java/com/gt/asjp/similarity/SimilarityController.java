package com.gt.asjp.similarity;

import com.gt.asjp.model.ConceptComparison;
import com.gt.asjp.model.LanguageComparison;
import com.gt.asjp.model.LanguageSummary;
import com.gt.asjp.model.WordList;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/rest/similarity")
public class SimilarityController {

    private static final String DEFAULT_NEAREST_COUNT = "10";

    private final LanguageSimilarityService languageSimilarityService;

    @Autowired
    public SimilarityController(LanguageSimilarityService languageSimilarityService) {
        this.languageSimilarityService = languageSimilarityService;
    }

    @GetMapping(value = "/languages", produces = "application/json")
    public List<LanguageSummary> getAllLanguages() {
        return languageSimilarityService.getAllLanguages();
    }

    @GetMapping(value = "/wordList", produces = "application/json")
    public WordList getWordList(@RequestParam(value = "iso") String identifier) {
        return languageSimilarityService.getWordList(identifier);
    }

    @GetMapping(value = "/forms", produces = "application/json")
    public List<String> getForms(@RequestParam(value = "iso") String identifier,
                                 @RequestParam(value = "concept") String concept) {
        return languageSimilarityService.getForms(identifier, concept);
    }

    @GetMapping(value = "/wordDistance", produces = "application/json")
    public double getWordDistance(@RequestParam(value = "word1") String word1,
                                  @RequestParam(value = "word2") String word2) {
        return languageSimilarityService.wordDistance(word1, word2);
    }

    @GetMapping(value = "/conceptDistance", produces = "application/json")
    public ConceptComparison getConceptDistance(@RequestParam(value = "iso1") String identifier1,
                                                @RequestParam(value = "iso2") String identifier2,
                                                @RequestParam(value = "concept") String concept) {
        return languageSimilarityService.compareConcept(identifier1, identifier2, concept);
    }

    @GetMapping(value = "/languageDistance", produces = "application/json")
    public LanguageComparison getLanguageDistance(@RequestParam(value = "iso1") String identifier1,
                                                  @RequestParam(value = "iso2") String identifier2) {
        return languageSimilarityService.compareLanguages(identifier1, identifier2);
    }

    @GetMapping(value = "/nearest", produces = "application/json")
    public List<LanguageComparison> getNearestLanguages(@RequestParam(value = "iso") String identifier,
                                                        @RequestParam(value = "count", defaultValue = DEFAULT_NEAREST_COUNT) int count) {
        return languageSimilarityService.findNearestLanguages(identifier, count);
    }
}

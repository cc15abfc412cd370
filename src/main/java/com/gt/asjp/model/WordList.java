package com.gt.asjp.model;

import com.gt.asjp.exception.NotFoundException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The word list of a single language from the ASJP database.
 *
 * @param identifier ISO 639-3 code of the language
 * @param displayName name of the language according to the database, informational only
 * @param concepts concept identifiers (e.g. "stone") mapped to their word forms. Concepts without
 *                 any form in the database are absent, so every list here has at least one element.
 */
public record WordList(String identifier, String displayName, Map<String, List<String>> concepts) {

    public WordList {
        Map<String, List<String>> copied = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : concepts.entrySet()) {
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                throw new IllegalArgumentException("Concept " + entry.getKey() + " of " + identifier + " has no word forms");
            }
            copied.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        concepts = Collections.unmodifiableMap(copied);
    }

    public List<String> get(String concept) {
        List<String> forms = concepts.get(concept);
        if (forms == null) {
            throw new NotFoundException("No word forms for concept " + concept + " in " + identifier);
        }

        return forms;
    }

    public boolean hasConcept(String concept) {
        return concepts.containsKey(concept);
    }

    // Number of concepts with at least one word form
    public int size() {
        return concepts.size();
    }
}

package com.gt.asjp.wordlist;

import com.gt.asjp.exception.NotFoundException;
import com.gt.asjp.model.WordList;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Word lists of all loaded languages, keyed by identifier. Immutable once built.
 *
 * The database may hold several word lists for the same identifier. Only the one with the most
 * concepts is kept; on a tie the first one seen wins.
 */
public class WordListRegistry {

    private final Map<String, WordList> wordListsById;

    private WordListRegistry(Map<String, WordList> wordListsById) {
        this.wordListsById = Collections.unmodifiableMap(wordListsById);
    }

    public static WordListRegistry of(Iterable<WordList> wordLists) {
        Map<String, WordList> wordListsById = new LinkedHashMap<>();
        for (WordList wordList : wordLists) {
            wordListsById.merge(wordList.identifier(), wordList, WordListRegistry::keepRicher);
        }

        return new WordListRegistry(wordListsById);
    }

    static WordList keepRicher(WordList existing, WordList incoming) {
        return incoming.size() > existing.size() ? incoming : existing;
    }

    public WordList get(String identifier) {
        WordList wordList = wordListsById.get(identifier);
        if (wordList == null) {
            throw new NotFoundException("No word list for language " + identifier);
        }

        return wordList;
    }

    public boolean contains(String identifier) {
        return wordListsById.containsKey(identifier);
    }

    public List<String> identifiers() {
        return List.copyOf(wordListsById.keySet());
    }

    public Collection<WordList> wordLists() {
        return wordListsById.values();
    }

    public int size() {
        return wordListsById.size();
    }
}

package com.gt.asjp.model;

public record LanguageSummary(String identifier, String displayName, int conceptCount) {

    public static LanguageSummary of(WordList wordList) {
        return new LanguageSummary(wordList.identifier(), wordList.displayName(), wordList.size());
    }
}

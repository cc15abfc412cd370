package com.gt.asjp.model;

public record LanguageComparison(String identifier1, String identifier2, int sharedConceptCount, double meanNld) { }

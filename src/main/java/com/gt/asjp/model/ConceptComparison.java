package com.gt.asjp.model;

import java.util.List;

public record ConceptComparison(String concept, List<String> forms1, List<String> forms2, double meanNld) {

    public ConceptComparison {
        forms1 = List.copyOf(forms1);
        forms2 = List.copyOf(forms2);
    }
}

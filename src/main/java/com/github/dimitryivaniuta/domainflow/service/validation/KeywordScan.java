package com.github.dimitryivaniuta.domainflow.service.validation;

import java.util.List;
import java.util.Map;

/**
 * Keyword hits in one page.
 *
 * @param fromSets   matched rule patterns by keyword set id
 * @param adHocFound matched ad-hoc keywords
 * @param score      sum of matched rule weights, plus one per ad-hoc hit
 */
public record KeywordScan(Map<String, List<String>> fromSets, List<String> adHocFound, double score) {

    public boolean anyFound() {
        return !fromSets.isEmpty() || !adHocFound.isEmpty();
    }
}

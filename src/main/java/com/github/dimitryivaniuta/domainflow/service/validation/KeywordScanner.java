package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.domain.KeywordRule;
import com.github.dimitryivaniuta.domainflow.domain.KeywordRuleType;
import com.github.dimitryivaniuta.domainflow.domain.KeywordSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyword sets compiled once per batch and evaluated against extracted page text.
 *
 * <p>Disabled sets, inactive or blank rules and regexes that do not compile are skipped.
 * Instances are immutable and safe to share across the batch's worker threads.</p>
 */
public final class KeywordScanner {

    private static final Logger log = LoggerFactory.getLogger(KeywordScanner.class);

    private final Map<String, List<CompiledRule>> rulesBySet;
    private final List<String> adHocKeywords;

    private KeywordScanner(Map<String, List<CompiledRule>> rulesBySet, List<String> adHocKeywords) {
        this.rulesBySet = rulesBySet;
        this.adHocKeywords = adHocKeywords;
    }

    /**
     * Compiles the rules of {@code sets}.
     *
     * @param sets          keyword sets of the campaign
     * @param adHocKeywords plain keywords, matched case-insensitively
     * @return scanner
     */
    public static KeywordScanner compile(List<KeywordSet> sets, List<String> adHocKeywords) {
        Map<String, List<CompiledRule>> bySet = new LinkedHashMap<>();
        for (KeywordSet set : sets) {
            if (!set.isEnabled()) {
                continue;
            }
            List<CompiledRule> compiled = new ArrayList<>();
            for (KeywordRule rule : set.getRules()) {
                if (!rule.isActive() || rule.getPattern() == null || rule.getPattern().isEmpty()) {
                    continue;
                }
                CompiledRule c = compileRule(set.getId(), rule);
                if (c != null) {
                    compiled.add(c);
                }
            }
            if (!compiled.isEmpty()) {
                bySet.put(set.getId(), compiled);
            }
        }
        List<String> adHoc = adHocKeywords == null ? List.of() : adHocKeywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .toList();
        return new KeywordScanner(bySet, adHoc);
    }

    private static CompiledRule compileRule(String setId, KeywordRule rule) {
        if (rule.getRuleType() != KeywordRuleType.REGEX) {
            return new CompiledRule(rule, null);
        }
        try {
            return new CompiledRule(rule, Pattern.compile(rule.getPattern()));
        } catch (PatternSyntaxException e) {
            log.warn("Skipping regex rule '{}' of keyword set {}: {}", rule.getPattern(), setId, e.getDescription());
            return null;
        }
    }

    /**
     * Scans {@code text}.
     *
     * @param text extracted page text
     * @return hits and score
     */
    public KeywordScan scan(String text) {
        String content = text == null ? "" : text;
        String lower = content.toLowerCase(Locale.ROOT);

        Map<String, List<String>> fromSets = new LinkedHashMap<>();
        double score = 0.0d;
        for (Map.Entry<String, List<CompiledRule>> e : rulesBySet.entrySet()) {
            List<String> hits = new ArrayList<>();
            for (CompiledRule rule : e.getValue()) {
                if (rule.matches(content, lower)) {
                    hits.add(rule.rule().getPattern());
                    score += rule.rule().getWeight();
                }
            }
            if (!hits.isEmpty()) {
                fromSets.put(e.getKey(), hits);
            }
        }

        List<String> adHocFound = new ArrayList<>();
        for (String keyword : adHocKeywords) {
            if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                adHocFound.add(keyword);
                score += 1.0d;
            }
        }
        return new KeywordScan(fromSets, adHocFound, score);
    }

    private record CompiledRule(KeywordRule rule, Pattern regex) {

        boolean matches(String content, String lowerContent) {
            KeywordRuleType type = rule.getRuleType();
            if (type == KeywordRuleType.REGEX) {
                return regex.matcher(content).find();
            }
            if (type == KeywordRuleType.CASE_INSENSITIVE) {
                return lowerContent.contains(rule.getPattern().toLowerCase(Locale.ROOT));
            }
            return content.contains(rule.getPattern());
        }
    }
}

package com.github.dimitryivaniuta.domainflow.domain;

import java.util.Locale;
import java.util.TreeSet;

/**
 * Normalised generation parameters: what the fingerprint hashes and what the enumerator walks.
 *
 * @param patternType    placement of the variable part
 * @param characterSet   lower-cased, de-duplicated, sorted characters
 * @param constantString constant part, case preserved
 * @param variableLength length of each variable part
 * @param tld            lower-cased TLD with exactly one leading dot
 */
public record GenerationSpec(
        PatternType patternType,
        String characterSet,
        String constantString,
        int variableLength,
        String tld
) {

    /**
     * Normalises raw request parameters. Validation happens in the enumerator; this only canonicalises.
     *
     * @param patternType    pattern type
     * @param characterSet   raw character set
     * @param constantString raw constant
     * @param variableLength variable length
     * @param tld            raw TLD, with or without dots
     * @return normalised spec
     */
    public static GenerationSpec normalize(PatternType patternType, String characterSet, String constantString,
                                           int variableLength, String tld) {
        TreeSet<Character> chars = new TreeSet<>();
        String lower = characterSet == null ? "" : characterSet.toLowerCase(Locale.ROOT);
        for (char ch : lower.toCharArray()) {
            if (!Character.isWhitespace(ch)) {
                chars.add(ch);
            }
        }
        StringBuilder cs = new StringBuilder(chars.size());
        chars.forEach(cs::append);

        String t = tld == null ? "" : tld.trim().toLowerCase(Locale.ROOT);
        while (t.startsWith(".")) {
            t = t.substring(1);
        }
        while (t.endsWith(".")) {
            t = t.substring(0, t.length() - 1);
        }
        String normalizedTld = t.isEmpty() ? "" : "." + t;

        return new GenerationSpec(
                patternType,
                cs.toString(),
                constantString == null ? "" : constantString.trim(),
                variableLength,
                normalizedTld
        );
    }
}

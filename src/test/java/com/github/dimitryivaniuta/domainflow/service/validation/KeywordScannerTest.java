package com.github.dimitryivaniuta.domainflow.service.validation;

import com.github.dimitryivaniuta.domainflow.domain.KeywordRule;
import com.github.dimitryivaniuta.domainflow.domain.KeywordRuleType;
import com.github.dimitryivaniuta.domainflow.domain.KeywordSet;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class KeywordScannerTest {

    private static KeywordSet set(String id, KeywordRule... rules) {
        KeywordSet s = KeywordSet.create("set-" + id, null, List.of(rules));
        s.setId(id);
        return s;
    }

    private static KeywordRule rule(String pattern, KeywordRuleType type, double weight) {
        return new KeywordRule(pattern, type, weight, true);
    }

    @Test
    void ruleTypes_matchWithTheirOwnSemantics() {
        KeywordScanner scanner = KeywordScanner.compile(List.of(set("s1",
                rule("Buy Now", KeywordRuleType.STRING, 2.0),
                rule("FREE SHIPPING", KeywordRuleType.CASE_INSENSITIVE, 1.5),
                rule("\\bprice:\\s*\\$\\d+", KeywordRuleType.REGEX, 3.0),
                rule("absent", KeywordRuleType.STRING, 10.0))), List.of());

        KeywordScan scan = scanner.scan("Buy Now! free shipping today. price: $42");

        Assertions.assertEquals(List.of("Buy Now", "FREE SHIPPING", "\\bprice:\\s*\\$\\d+"), scan.fromSets().get("s1"));
        Assertions.assertEquals(6.5d, scan.score(), 1e-9);
        Assertions.assertTrue(scan.anyFound());
    }

    @Test
    void stringRules_areCaseSensitive() {
        KeywordScanner scanner = KeywordScanner.compile(List.of(set("s1", rule("Buy Now", KeywordRuleType.STRING, 1.0))), List.of());

        KeywordScan scan = scanner.scan("buy now");

        Assertions.assertFalse(scan.anyFound());
        Assertions.assertEquals(0.0d, scan.score());
    }

    @Test
    void adHocKeywords_matchIgnoringCase_andScoreOneEach() {
        KeywordScanner scanner = KeywordScanner.compile(List.of(), List.of("Casino", "poker", " "));

        KeywordScan scan = scanner.scan("Online CASINO and Poker tables");

        Assertions.assertEquals(List.of("Casino", "poker"), scan.adHocFound());
        Assertions.assertEquals(2.0d, scan.score(), 1e-9);
        Assertions.assertTrue(scan.fromSets().isEmpty());
    }

    @Test
    void disabledSets_inactiveRules_andBadRegexes_areSkipped() {
        KeywordSet disabled = set("off", rule("hello", KeywordRuleType.STRING, 1.0));
        disabled.setEnabled(false);
        KeywordRule inactive = new KeywordRule("hello", KeywordRuleType.STRING, 1.0, false);
        KeywordSet mixed = set("mixed", inactive, rule("([unclosed", KeywordRuleType.REGEX, 1.0), rule("world", KeywordRuleType.STRING, 1.0));

        KeywordScanner scanner = KeywordScanner.compile(List.of(disabled, mixed), null);
        KeywordScan scan = scanner.scan("hello world");

        Assertions.assertNull(scan.fromSets().get("off"));
        Assertions.assertEquals(List.of("world"), scan.fromSets().get("mixed"));
        Assertions.assertEquals(1.0d, scan.score(), 1e-9);
    }

    @Test
    void nullText_scansAsEmpty() {
        KeywordScanner scanner = KeywordScanner.compile(List.of(set("s", rule("x", KeywordRuleType.STRING, 1.0))), List.of("y"));

        Assertions.assertFalse(scanner.scan(null).anyFound());
    }
}

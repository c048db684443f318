package com.github.dimitryivaniuta.domainflow.service.generation;

import com.github.dimitryivaniuta.domainflow.domain.GenerationSpec;
import com.github.dimitryivaniuta.domainflow.domain.PatternType;
import com.github.dimitryivaniuta.domainflow.service.error.ExhaustionException;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import java.util.HashSet;
import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

/**
 * Offset to domain mapping for all pattern types.
 */
class PatternEnumeratorTest {

    private static GenerationSpec spec(PatternType type, String cs, String constant, int len, String tld) {
        return GenerationSpec.normalize(type, cs, constant, len, tld);
    }

    @Test
    void prefixPattern_enumeratesAllCombinationsInOffsetOrder() {
        GenerationSpec s = spec(PatternType.PREFIX, "abc", "test", 2, "com");

        List<String> domains = PatternEnumerator.enumerate(s, new OffsetRange(0, 9));

        Assertions.assertEquals(List.of(
                "aatest.com", "abtest.com", "actest.com",
                "batest.com", "bbtest.com", "bctest.com",
                "catest.com", "cbtest.com", "cctest.com"), domains);
        Assertions.assertEquals(9, PatternEnumerator.capacity(s));
    }

    @Test
    void suffixPattern_putsVariablePartAfterConstant() {
        GenerationSpec s = spec(PatternType.SUFFIX, "ab", "shop", 1, ".io");

        Assertions.assertEquals("shopa.io", PatternEnumerator.domainAt(s, 0));
        Assertions.assertEquals("shopb.io", PatternEnumerator.domainAt(s, 1));
    }

    @Test
    void bothPattern_splitsDigitsAroundConstant() {
        GenerationSpec s = spec(PatternType.BOTH, "ab", "x", 1, "net");

        Assertions.assertEquals(4, PatternEnumerator.capacity(s));
        Assertions.assertEquals(List.of("axa.net", "axb.net", "bxa.net", "bxb.net"),
                PatternEnumerator.enumerate(s, new OffsetRange(0, 4)));
    }

    @Test
    void enumerate_stopsAtCapacity() {
        GenerationSpec s = spec(PatternType.PREFIX, "abc", "test", 2, "com");

        List<String> tail = PatternEnumerator.enumerate(s, new OffsetRange(7, 20));

        Assertions.assertEquals(List.of("cbtest.com", "cctest.com"), tail);
    }

    @Test
    void domainAt_beyondCapacity_throwsExhaustion() {
        GenerationSpec s = spec(PatternType.PREFIX, "abc", "test", 2, "com");

        Assertions.assertThrows(ExhaustionException.class, () -> PatternEnumerator.domainAt(s, 9));
    }

    @Test
    void distinctOffsets_produceDistinctDomains() {
        GenerationSpec s = spec(PatternType.BOTH, "abc1", "mid", 2, "org");
        long capacity = PatternEnumerator.capacity(s);

        List<String> all = PatternEnumerator.enumerate(s, new OffsetRange(0, capacity));

        Assertions.assertEquals(capacity, all.size());
        Assertions.assertEquals(all.size(), new HashSet<>(all).size());
    }

    @Test
    void normalize_sortsAndDeduplicatesCharacterSet_andCanonicalisesTld() {
        GenerationSpec s = spec(PatternType.PREFIX, "CbaAc", " test ", 1, "..COM.");

        Assertions.assertEquals("abc", s.characterSet());
        Assertions.assertEquals("test", s.constantString());
        Assertions.assertEquals(".com", s.tld());
    }

    @Test
    void validate_rejectsUnusableSpecs() {
        Assertions.assertThrows(InvalidConfigException.class,
                () -> PatternEnumerator.validate(spec(PatternType.PREFIX, "", "x", 1, "com")));
        Assertions.assertThrows(InvalidConfigException.class,
                () -> PatternEnumerator.validate(spec(PatternType.PREFIX, "ab", "x", 0, "com")));
        Assertions.assertThrows(InvalidConfigException.class,
                () -> PatternEnumerator.validate(spec(PatternType.PREFIX, "ab", "x", 1, "")));
        Assertions.assertThrows(InvalidConfigException.class,
                () -> PatternEnumerator.validate(spec(PatternType.PREFIX, "a_b", "x", 1, "com")));
    }

    @Test
    void capacity_overflow_isRejected() {
        GenerationSpec s = spec(PatternType.BOTH, "abcdefghijklmnopqrstuvwxyz0123456789", "x", 10, "com");

        Assertions.assertThrows(InvalidConfigException.class, () -> PatternEnumerator.capacity(s));
    }
}

package com.github.dimitryivaniuta.domainflow.service.generation;

import com.github.dimitryivaniuta.domainflow.domain.GenerationSpec;
import com.github.dimitryivaniuta.domainflow.domain.PatternType;
import com.github.dimitryivaniuta.domainflow.service.error.ExhaustionException;
import com.github.dimitryivaniuta.domainflow.service.error.InvalidConfigException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps an enumeration offset to a domain name.
 *
 * <p>The variable characters are the digits of the offset in base {@code |characterSet|}, most
 * significant first, so with {@code "abc"} and length 2 offset 0 is {@code aa}, 1 is {@code ab} and
 * 8 is {@code cc}. For {@link PatternType#BOTH} the number has {@code 2 * variableLength} digits: the
 * high half goes before the constant, the low half after it.</p>
 *
 * <p>Stateless; all methods expect a {@link GenerationSpec#normalize normalised} spec.</p>
 */
public final class PatternEnumerator {

    private PatternEnumerator() {
    }

    /**
     * Rejects specs that cannot produce domains.
     *
     * @param spec normalised spec
     * @throws InvalidConfigException when the pattern is unusable
     */
    public static void validate(GenerationSpec spec) {
        if (spec.patternType() == null) {
            throw new InvalidConfigException("patternType must be one of prefix, suffix, both");
        }
        if (spec.characterSet() == null || spec.characterSet().isEmpty()) {
            throw new InvalidConfigException("characterSet must not be empty");
        }
        if (spec.variableLength() <= 0) {
            throw new InvalidConfigException("variableLength must be positive");
        }
        if (spec.tld() == null || spec.tld().length() < 2) {
            throw new InvalidConfigException("tld must not be empty");
        }
        for (char ch : spec.characterSet().toCharArray()) {
            if (!isLabelChar(ch)) {
                throw new InvalidConfigException("characterSet contains a character not allowed in domain names: '" + ch + "'");
            }
        }
        for (char ch : spec.constantString().toCharArray()) {
            if (!isLabelChar(ch) && ch != '.') {
                throw new InvalidConfigException("constantString contains a character not allowed in domain names: '" + ch + "'");
            }
        }
        for (char ch : spec.tld().substring(1).toCharArray()) {
            if (!isLabelChar(ch) && ch != '.') {
                throw new InvalidConfigException("tld contains a character not allowed in domain names: '" + ch + "'");
            }
        }
        capacity(spec);
    }

    /**
     * Number of distinct domains the pattern can produce.
     *
     * @param spec normalised spec
     * @return capacity
     * @throws InvalidConfigException when the capacity does not fit in a long
     */
    public static long capacity(GenerationSpec spec) {
        int digits = digitCount(spec);
        long radix = spec.characterSet().length();
        long total = 1L;
        try {
            for (int i = 0; i < digits; i++) {
                total = Math.multiplyExact(total, radix);
            }
        } catch (ArithmeticException e) {
            throw new InvalidConfigException("Pattern capacity exceeds " + Long.MAX_VALUE + " combinations");
        }
        return total;
    }

    /**
     * Domain at {@code offset}.
     *
     * @param spec   normalised spec
     * @param offset zero-based offset
     * @return domain name
     * @throws ExhaustionException when {@code offset >= capacity}
     */
    public static String domainAt(GenerationSpec spec, long offset) {
        long capacity = capacity(spec);
        if (offset < 0 || offset >= capacity) {
            throw new ExhaustionException(offset, capacity);
        }
        String cs = spec.characterSet();
        int radix = cs.length();
        int digits = digitCount(spec);

        char[] variable = new char[digits];
        long rest = offset;
        for (int i = digits - 1; i >= 0; i--) {
            variable[i] = cs.charAt((int) (rest % radix));
            rest /= radix;
        }

        String v = new String(variable);
        String label = switch (spec.patternType()) {
            case PREFIX -> v + spec.constantString();
            case SUFFIX -> spec.constantString() + v;
            case BOTH -> v.substring(0, spec.variableLength()) + spec.constantString() + v.substring(spec.variableLength());
        };
        return label + spec.tld();
    }

    /**
     * Domains for {@code [range.start, range.endExclusive)}, stopping early at capacity.
     *
     * @param spec  normalised spec
     * @param range reserved range
     * @return domains in offset order
     */
    public static List<String> enumerate(GenerationSpec spec, OffsetRange range) {
        List<String> out = new ArrayList<>((int) Math.min(range.size(), 10_000));
        for (long offset = range.start(); offset < range.endExclusive(); offset++) {
            try {
                out.add(domainAt(spec, offset));
            } catch (ExhaustionException e) {
                break;
            }
        }
        return out;
    }

    private static int digitCount(GenerationSpec spec) {
        return spec.patternType() == PatternType.BOTH ? spec.variableLength() * 2 : spec.variableLength();
    }

    private static boolean isLabelChar(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9') || ch == '-';
    }
}

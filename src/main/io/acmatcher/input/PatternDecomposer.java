package io.acmatcher.input;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Breaks a wildcard pattern into the literal parts and the complements the automaton has to look for.
 *
 * In a pattern, the wildcard byte stands for any single byte. The complement byte, when enabled, takes the byte that
 * follows it literally and asserts that this byte does not occur at that position: with {@code ?} as wildcard and
 * {@code !} as complement, {@code a?!bc} matches four bytes starting with {@code a}, ending with {@code c}, and
 * whose third byte is anything but {@code b}.
 */
public class PatternDecomposer {

    /**
     * Complement byte value that disables complement handling.
     */
    public static final byte NO_COMPLEMENT = 0;

    private static final Logger LOG = LoggerFactory.getLogger(PatternDecomposer.class);

    private final byte wildcard;
    private final byte complement;

    public PatternDecomposer(final byte wildcard, final byte complement) {
        if (wildcard == complement) {
            throw new IllegalArgumentException("Wildcard and complement must differ, both are " + (wildcard & 0xFF));
        }
        this.wildcard = wildcard;
        this.complement = complement;
    }

    public WildcardPattern decompose(final String pattern) {
        return decompose(pattern.getBytes(StandardCharsets.UTF_8));
    }

    public WildcardPattern decompose(final byte[] pattern) {
        if (pattern.length == 0) {
            throw new ParseException("Empty pattern");
        }

        final List<Part> parts = new ArrayList<>();
        final List<Complement> complements = new ArrayList<>();

        // complement markers seen so far; each one shares its position with its operand
        int markers = 0;

        int pos = 0;
        while (pos < pattern.length) {
            int end = pos;
            while (end < pattern.length && !isSpecial(pattern[end])) {
                end++;
            }

            if (end != pos) {
                Part part = new Part(pos - markers, Arrays.copyOfRange(pattern, pos, end));
                parts.add(part);
                LOG.debug("{}", part);
            }

            pos = end;
            if (isComplement(pattern, pos)) {
                if (pos + 1 == pattern.length) {
                    throw new ParseException("Complement character without operand", pos);
                }
                Complement c = new Complement(pos - markers, pattern[pos + 1]);
                complements.add(c);
                LOG.debug("{}", c);
                pos += 2;
                markers++;
            }

            while (pos < pattern.length && pattern[pos] == wildcard) {
                pos++;
            }
        }

        final int length = pattern.length - markers;
        LOG.debug("Pattern spans {} bytes with {} parts and {} complements", length, parts.size(), complements.size());
        return new WildcardPattern(parts, complements, length);
    }

    private boolean isSpecial(final byte b) {
        return b == wildcard || (complement != NO_COMPLEMENT && b == complement);
    }

    private boolean isComplement(final byte[] pattern, final int pos) {
        return complement != NO_COMPLEMENT && pos < pattern.length && pattern[pos] == complement;
    }
}

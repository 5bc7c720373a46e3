package io.acmatcher;

import io.acmatcher.input.PatternDecomposer;

import javax.annotation.concurrent.Immutable;

/**
 * Configuration for a Machine or a WildcardMachine.
 */
@Immutable
public class Configuration {

    public static final char DEFAULT_WILDCARD = '?';

    /**
     * Passing this to {@link Builder#withComplement(char)} disables complements in wildcard patterns.
     */
    public static final char NO_COMPLEMENT = (char) PatternDecomposer.NO_COMPLEMENT;

    /**
     * The byte that matches any single byte in a wildcard pattern.
     */
    private final byte wildcard;

    /**
     * The byte that, in a wildcard pattern, forbids the byte following it at that position. Zero means complements are
     * not recognized and the byte is taken literally.
     */
    private final byte complement;

    /**
     * Whether a Machine reports matches ordered by start position then pattern index, or in the order they were
     * found, which is ordered by end position. WildcardMachine matches are always ordered by start position.
     */
    private final boolean sortedMatches;

    private Configuration(byte wildcard, byte complement, boolean sortedMatches) {
        this.wildcard = wildcard;
        this.complement = complement;
        this.sortedMatches = sortedMatches;
    }

    public static Builder builder() {
        return new Builder();
    }

    public byte getWildcard() {
        return wildcard;
    }

    public byte getComplement() {
        return complement;
    }

    public boolean hasComplement() {
        return complement != PatternDecomposer.NO_COMPLEMENT;
    }

    public boolean isSortedMatches() {
        return sortedMatches;
    }

    PatternDecomposer newDecomposer() {
        return new PatternDecomposer(wildcard, complement);
    }

    @Override
    public String toString() {
        return "Configuration{wildcard=" + (char) wildcard
                + ", complement=" + (hasComplement() ? String.valueOf((char) complement) : "none")
                + ", sortedMatches=" + sortedMatches + "}";
    }

    public static class Builder {

        private char wildcard = DEFAULT_WILDCARD;
        private char complement = NO_COMPLEMENT;
        private boolean sortedMatches = true;

        public Builder withWildcard(char wildcard) {
            this.wildcard = wildcard;
            return this;
        }

        public Builder withComplement(char complement) {
            this.complement = complement;
            return this;
        }

        public Builder withSortedMatches(boolean sortedMatches) {
            this.sortedMatches = sortedMatches;
            return this;
        }

        public Configuration build() {
            // patterns are matched byte by byte, so the special characters must each encode to a single UTF-8 byte
            if (wildcard == 0 || wildcard > 0x7F) {
                throw new IllegalArgumentException("Wildcard must be a non-zero ASCII character, got U+"
                        + String.format("%04X", (int) wildcard));
            }
            if (complement > 0x7F) {
                throw new IllegalArgumentException("Complement must be an ASCII character, got U+"
                        + String.format("%04X", (int) complement));
            }
            if (wildcard == complement) {
                throw new IllegalArgumentException("Wildcard and complement must differ, both are '" + wildcard + "'");
            }
            return new Configuration((byte) wildcard, (byte) complement, sortedMatches);
        }
    }
}

package io.acmatcher.input;

import javax.annotation.concurrent.Immutable;
import java.util.Collections;
import java.util.List;

/**
 * A wildcard pattern broken down by the {@link PatternDecomposer}: the literal parts that must all be found, the
 * complements that must all be absent, and the length of the text window the pattern spans.
 *
 * Offsets are in compressed coordinates: every byte of the source pattern occupies one position, except that a
 * complement marker and its operand share a single position. Parts and complements are ordered by offset.
 */
@Immutable
public final class WildcardPattern {

    private final List<Part> parts;
    private final List<Complement> complements;
    private final int length;

    WildcardPattern(final List<Part> parts, final List<Complement> complements, final int length) {
        this.parts = Collections.unmodifiableList(parts);
        this.complements = Collections.unmodifiableList(complements);
        this.length = length;
    }

    public List<Part> getParts() {
        return parts;
    }

    public List<Complement> getComplements() {
        return complements;
    }

    public int numberOfParts() {
        return parts.size();
    }

    /**
     * The number of text bytes covered by one occurrence of the pattern.
     */
    public int length() {
        return length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WildcardPattern other = (WildcardPattern) o;
        return length == other.length && parts.equals(other.parts) && complements.equals(other.complements);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * parts.hashCode() + complements.hashCode()) + length;
    }

    @Override
    public String toString() {
        return "WildcardPattern{parts=" + parts + ", complements=" + complements + ", length=" + length + "}";
    }
}

package io.acmatcher;

import javax.annotation.concurrent.Immutable;

/**
 * An occurrence of a pattern in a text: the index of the pattern and the position of its first byte, both counted
 * from zero. Matches are ordered by start position, then by pattern index.
 */
@Immutable
public final class Match implements Comparable<Match> {

    private final int patternIndex;
    private final int start;

    public Match(final int patternIndex, final int start) {
        this.patternIndex = patternIndex;
        this.start = start;
    }

    public int getPatternIndex() {
        return patternIndex;
    }

    public int getStart() {
        return start;
    }

    @Override
    public int compareTo(final Match other) {
        if (start != other.start) {
            return Integer.compare(start, other.start);
        }
        return Integer.compare(patternIndex, other.patternIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Match match = (Match) o;
        return patternIndex == match.patternIndex && start == match.start;
    }

    @Override
    public int hashCode() {
        return 31 * patternIndex + start;
    }

    @Override
    public String toString() {
        return "Match{pattern=" + patternIndex + ", start=" + start + "}";
    }
}

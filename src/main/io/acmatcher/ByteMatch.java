package io.acmatcher;

import javax.annotation.concurrent.Immutable;

/**
 * Represents a place in a ByteMachine where a fragment ends. A ByteState carries the ByteMatches of the fragments
 * inserted up to it, followed by those inherited from its failure state. Instances are shared by reference between
 * the state that owns them and the states that inherited them; they are never mutated.
 */
@Immutable
final class ByteMatch {

    private final int fragmentId;
    private final int length;

    ByteMatch(final int fragmentId, final int length) {
        this.fragmentId = fragmentId;
        this.length = length;
    }

    int getFragmentId() {
        return fragmentId;
    }

    int getLength() {
        return length;
    }

    /**
     * Returns the position at which the fragment started, given the position of its last byte.
     *
     * @param endPosition the position of the last byte of the fragment in the text
     * @return the position of the first byte of the fragment in the text
     */
    int startFor(final int endPosition) {
        return endPosition - length + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ByteMatch other = (ByteMatch) o;
        return fragmentId == other.fragmentId && length == other.length;
    }

    @Override
    public int hashCode() {
        return 31 * fragmentId + length;
    }

    @Override
    public String toString() {
        return "BM: #" + fragmentId + " L=" + length;
    }
}

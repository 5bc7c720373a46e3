package io.acmatcher;

import it.unimi.dsi.fastutil.bytes.Byte2IntArrayMap;
import it.unimi.dsi.fastutil.bytes.Byte2IntMap;
import it.unimi.dsi.fastutil.objects.ObjectSet;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a state in a ByteMachine. A state maps bytes to the indices of the states they lead to, has a failure
 * state to fall back to when no transition exists for a byte, and carries the ByteMatches for every fragment ending
 * at it, including those inherited from its failure state.
 *
 * States are addressed by their index in the owning ByteMachine, never by reference, so transitions and failure links
 * are plain ints.
 */
class ByteState {

    /**
     * Stands for "no state": the missing transition for a byte, or the failure link of the root.
     */
    static final int NO_STATE = -1;

    // Most states have a handful of transitions, so a linear scan beats hashing. Iteration follows insertion order.
    private final Byte2IntArrayMap transitions = new Byte2IntArrayMap();

    private final List<ByteMatch> matches = new ArrayList<>();

    // The first ownMatchCount entries of matches were added by fragments ending here, the rest were inherited
    private int ownMatchCount = 0;

    private int failure = NO_STATE;

    ByteState() {
        transitions.defaultReturnValue(NO_STATE);
    }

    /**
     * Returns the index of the state the given byte leads to, or {@link #NO_STATE} if this state has no transition
     * for it.
     *
     * @param b the byte
     * @return the destination index, or {@link #NO_STATE}
     */
    int getTransition(final byte b) {
        return transitions.get(b);
    }

    void putTransition(final byte b, final int destination) {
        transitions.put(b, destination);
    }

    ObjectSet<Byte2IntMap.Entry> getTransitions() {
        return transitions.byte2IntEntrySet();
    }

    boolean hasNoTransitions() {
        return transitions.isEmpty();
    }

    int getFailure() {
        return failure;
    }

    void setFailure(final int failure) {
        this.failure = failure;
    }

    /**
     * Returns every fragment ending at this state, own entries first.
     *
     * @return an unmodifiable view of the ByteMatches of this state
     */
    List<ByteMatch> getMatches() {
        return Collections.unmodifiableList(matches);
    }

    int getOwnMatchCount() {
        return ownMatchCount;
    }

    /**
     * Adds a ByteMatch for a fragment ending at this state. Own matches may only be added before any have been
     * inherited.
     *
     * @param match the match
     */
    void addMatch(@Nonnull final ByteMatch match) {
        if (ownMatchCount != matches.size()) {
            throw new IllegalStateException("Cannot add a fragment to a state that has already been linked");
        }
        matches.add(match);
        ownMatchCount++;
    }

    /**
     * Appends a copy of the given ByteMatches, which belong to this state's failure state. The ByteMatch instances
     * themselves are shared; the failure state's list is left untouched.
     *
     * @param inherited the failure state's matches
     */
    void inheritMatches(@Nonnull final List<ByteMatch> inherited) {
        matches.addAll(inherited);
    }

    @Override
    public String toString() {
        return "BS: T=" + transitions + " F=" + failure + " M=" + matches;
    }
}

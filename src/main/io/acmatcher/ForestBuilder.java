package io.acmatcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;

import static io.acmatcher.ByteState.NO_STATE;

/**
 * Inserts fragments into the trie of a fresh ByteMachine. Fragments sharing a prefix share the states for that
 * prefix. Each inserted fragment adds exactly one ByteMatch to the state reached by consuming all of its bytes, so
 * inserting the same fragment twice yields two ByteMatches on the same state.
 */
class ForestBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(ForestBuilder.class);

    private final ByteMachine machine = new ByteMachine();

    /**
     * Adds a fragment to the forest.
     *
     * @param fragment the bytes of the fragment
     * @param id       the id reported when the fragment is found
     * @return this builder
     */
    ForestBuilder insert(@Nonnull final byte[] fragment, final int id) {
        return insert(fragment, 0, fragment.length, id);
    }

    /**
     * Adds the fragment at {@code bytes[from, from + length)} to the forest.
     */
    ForestBuilder insert(@Nonnull final byte[] bytes, final int from, final int length, final int id) {
        if (machine.isLinked()) {
            throw new IllegalStateException("Cannot insert fragment #" + id + " after the machine has been linked");
        }

        int current = ByteMachine.ROOT;
        for (int i = from; i < from + length; i++) {
            final byte b = bytes[i];
            final ByteState state = machine.getState(current);
            int next = state.getTransition(b);
            if (next == NO_STATE) {
                next = machine.addState();
                state.putTransition(b, next);
            }
            current = next;
        }

        machine.getState(current).addMatch(new ByteMatch(id, length));
        machine.countFragment();

        if (LOG.isTraceEnabled()) {
            LOG.trace("Fragment #{} of length {} ends at state {}", id, length, current);
        }
        return this;
    }

    /**
     * Computes the failure links and returns the completed machine. The builder must not be used afterwards.
     *
     * @return the linked machine
     */
    ByteMachine build() {
        FailureLinker.link(machine);
        LOG.debug("Built machine with {} states for {} fragments", machine.size(), machine.getFragmentCount());
        return machine;
    }
}

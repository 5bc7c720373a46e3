package io.acmatcher;

import it.unimi.dsi.fastutil.bytes.Byte2IntMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.acmatcher.ByteMachine.ROOT;
import static io.acmatcher.ByteState.NO_STATE;

/**
 * Turns the trie built by a ForestBuilder into a full Aho-Corasick automaton by computing the failure link of every
 * state, and copies the ByteMatches of each failure state into the state that fails to it, so that a Matcher never has
 * to walk failure links to collect matches.
 */
final class FailureLinker {

    private static final Logger LOG = LoggerFactory.getLogger(FailureLinker.class);

    private FailureLinker() { }

    /**
     * Links the machine. States are processed breadth-first from the root: the failure link of a state is derived from
     * the failure chain of its parent, and its inherited ByteMatches from its failure state, both of which are
     * shallower and hence already final.
     *
     * @param machine the machine, as left by the ForestBuilder
     */
    static void link(final ByteMachine machine) {
        if (machine.isLinked()) {
            throw new IllegalStateException("Machine is already linked");
        }
        final boolean trace = LOG.isTraceEnabled();

        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        queue.enqueue(ROOT);
        int visited = 0;

        while (!queue.isEmpty()) {
            final int index = queue.dequeueInt();
            final ByteState state = machine.getState(index);
            final int fallback = state.getFailure();
            visited++;

            for (Byte2IntMap.Entry transition : state.getTransitions()) {
                final byte b = transition.getByteKey();
                final int child = transition.getIntValue();
                queue.enqueue(child);

                // nothing along the parent's failure chain continues with b, so no proper suffix of the child's path
                // is a prefix of any fragment: fall back to the empty prefix
                final int childFailure = findFailure(machine, fallback, b);
                final ByteState childState = machine.getState(child);
                childState.setFailure(childFailure == NO_STATE ? ROOT : childFailure);
                childState.inheritMatches(machine.getState(childState.getFailure()).getMatches());

                if (trace) {
                    LOG.trace("State {} (from {} on {}) fails to {}", child, index, MachineWriter.printable(b),
                            childState.getFailure());
                }
            }
        }

        machine.markLinked();
        LOG.debug("Linked {} states", visited);
    }

    /**
     * Walks the failure chain starting at {@code from} and returns the destination of the first transition on
     * {@code b}, or {@link ByteState#NO_STATE} if the chain ends without one.
     */
    private static int findFailure(final ByteMachine machine, final int from, final byte b) {
        for (int index = from; index != NO_STATE; index = machine.getState(index).getFailure()) {
            final int next = machine.getState(index).getTransition(b);
            if (next != NO_STATE) {
                return next;
            }
        }
        return NO_STATE;
    }
}

package io.acmatcher;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;

import static io.acmatcher.ByteMachine.ROOT;
import static io.acmatcher.ByteState.NO_STATE;

/**
 * A cursor streaming bytes through a linked ByteMachine. Each matching pass uses its own Matcher, while the machine
 * itself is shared.
 */
@NotThreadSafe
class Matcher {

    private final ByteMachine machine;

    private int current = ROOT;

    Matcher(final ByteMachine machine) {
        if (!machine.isLinked()) {
            throw new IllegalStateException("Cannot match against a machine that has not been linked");
        }
        this.machine = machine;
    }

    /**
     * Consumes one byte. If the current state has no transition for it, failure links are followed until a state that
     * has one is found. When even the root has no transition, the byte is consumed, the Matcher stays at the root and
     * the step fails.
     *
     * @param b the next byte of the text
     * @return true if a transition was taken, in which case {@link #matches()} describes the fragments ending here
     */
    boolean step(final byte b) {
        int index = current;
        while (true) {
            final ByteState state = machine.getState(index);
            final int next = state.getTransition(b);
            if (next != NO_STATE) {
                current = next;
                return true;
            }
            final int failure = state.getFailure();
            if (failure == NO_STATE) {
                current = index;
                return false;
            }
            index = failure;
        }
    }

    /**
     * Returns every fragment ending at the last byte consumed by a successful {@link #step(byte)}.
     */
    List<ByteMatch> matches() {
        return machine.getState(current).getMatches();
    }

    int getCurrentState() {
        return current;
    }

    void reset() {
        current = ROOT;
    }
}

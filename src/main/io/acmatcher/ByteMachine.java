package io.acmatcher;

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;

/**
 * An Aho-Corasick automaton over bytes. The states live in an arena and are addressed by index; the root is always at
 * index {@link #ROOT}. A ByteMachine is filled by a {@link ForestBuilder} and completed by the {@link FailureLinker};
 * after that it is never modified again and any number of {@link Matcher}s may traverse it concurrently.
 */
@ThreadSafe
class ByteMachine {

    static final int ROOT = 0;

    private final List<ByteState> states = new ArrayList<>();

    private int fragmentCount = 0;

    private volatile boolean linked = false;

    ByteMachine() {
        states.add(new ByteState());
    }

    ByteState getState(final int index) {
        return states.get(index);
    }

    ByteState getRoot() {
        return states.get(ROOT);
    }

    /**
     * Appends a new, empty state to the arena.
     *
     * @return the index of the new state
     */
    int addState() {
        states.add(new ByteState());
        return states.size() - 1;
    }

    int size() {
        return states.size();
    }

    int getFragmentCount() {
        return fragmentCount;
    }

    void countFragment() {
        fragmentCount++;
    }

    boolean isLinked() {
        return linked;
    }

    void markLinked() {
        linked = true;
    }

    @Override
    public String toString() {
        return "ByteMachine{states=" + states.size() + ", fragments=" + fragmentCount + ", linked=" + linked + "}";
    }
}

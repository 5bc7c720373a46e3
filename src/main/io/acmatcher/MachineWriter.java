package io.acmatcher;

import io.acmatcher.input.Complement;
import io.acmatcher.input.Part;
import io.acmatcher.input.WildcardPattern;
import it.unimi.dsi.fastutil.bytes.Byte2IntMap;

import java.util.List;

/**
 * Renders machines, patterns and matches as text, for debugging and for line-oriented output.
 */
public final class MachineWriter {

    private MachineWriter() { }

    public static String write(final Machine machine) {
        return write(machine.getByteMachine());
    }

    public static String write(final WildcardMachine machine) {
        return write(machine.getPattern()) + write(machine.getByteMachine());
    }

    /**
     * Lists every state of the machine in index order, with its transitions, failure state, and the fragments ending
     * at it. Inherited fragments are marked with a {@code ^}.
     */
    static String write(final ByteMachine machine) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < machine.size(); i++) {
            final ByteState state = machine.getState(i);
            sb.append("State ").append(i).append(":\n");
            for (Byte2IntMap.Entry transition : state.getTransitions()) {
                sb.append("\tTransition on ").append(printable(transition.getByteKey()))
                        .append(" to ").append(transition.getIntValue()).append('\n');
            }
            sb.append("\tFallback to ");
            if (state.getFailure() == ByteState.NO_STATE) {
                sb.append("none");
            } else {
                sb.append(state.getFailure());
            }
            sb.append('\n');

            final List<ByteMatch> matches = state.getMatches();
            for (int m = 0; m < matches.size(); m++) {
                final ByteMatch match = matches.get(m);
                sb.append('\t').append(m < state.getOwnMatchCount() ? "" : "^").append("Result #")
                        .append(match.getFragmentId()).append(" of length ").append(match.getLength()).append('\n');
            }
        }
        return sb.toString();
    }

    public static String write(final WildcardPattern pattern) {
        final StringBuilder sb = new StringBuilder();
        for (Part part : pattern.getParts()) {
            sb.append(part).append('\n');
        }
        for (Complement complement : pattern.getComplements()) {
            sb.append("Complement to ").append(printable(complement.getForbidden()))
                    .append(" at offset ").append(complement.getOffset()).append('\n');
        }
        sb.append("Total length of pattern: ").append(pattern.length()).append('\n');
        return sb.toString();
    }

    /**
     * Writes one line per match with the 1-based start position followed by the 1-based pattern index.
     */
    public static String writeMatches(final List<Match> matches) {
        final StringBuilder sb = new StringBuilder();
        for (Match match : matches) {
            sb.append(match.getStart() + 1).append(' ').append(match.getPatternIndex() + 1).append('\n');
        }
        return sb.toString();
    }

    /**
     * Writes one line per match with the 1-based start position only, the format used for wildcard matches.
     */
    public static String writeStarts(final List<Match> matches) {
        final StringBuilder sb = new StringBuilder();
        for (Match match : matches) {
            sb.append(match.getStart() + 1).append('\n');
        }
        return sb.toString();
    }

    static String printable(final byte b) {
        if (b >= 0x20 && b < 0x7F) {
            return "'" + (char) b + "'";
        }
        return String.format("0x%02x", b & 0xFF);
    }
}

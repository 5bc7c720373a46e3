package io.acmatcher;

import io.acmatcher.input.WildcardPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;

/**
 * Reassembles the parts and complements reported by a Matcher into whole occurrences of a wildcard pattern.
 *
 * Every text position is the start of a candidate alignment of the pattern. An alignment is decided once the text
 * has been scanned up to its last byte, so at most {@code L} alignments (L being the pattern length) are undecided at
 * any time, and they are tracked in two rings of size L: the number of parts found for the alignment, and whether one
 * of its complements was violated. The slot of the alignment starting at position {@code s} is {@code s % L}; it is
 * cleared when the scan reaches {@code s} and checked once the scan reaches {@code s + L - 1}.
 *
 * Fragment ids below the number of parts designate parts; the following ones designate complements, in pattern
 * order.
 */
@NotThreadSafe
class WildcardMatchAggregator {

    static final int NO_MATCH = -1;

    private static final Logger LOG = LoggerFactory.getLogger(WildcardMatchAggregator.class);

    private final WildcardPattern pattern;
    private final int length;
    private final int numberOfParts;
    private final int textLength;

    private final int[] votes;
    private final boolean[] disabled;

    // the slot of the alignment starting at the position being fed
    private int slot = 0;

    private final boolean trace = LOG.isTraceEnabled();

    WildcardMatchAggregator(final WildcardPattern pattern, final int textLength) {
        this.pattern = pattern;
        this.length = pattern.length();
        this.numberOfParts = pattern.numberOfParts();
        this.textLength = textLength;
        this.votes = new int[length];
        this.disabled = new boolean[length];
    }

    /**
     * Accounts for the fragments ending at a text position. Positions must be fed in order, starting at zero, each
     * exactly once, including those where the Matcher found nothing.
     *
     * @param position the text position of the byte just consumed
     * @param matches  the fragments ending at that position
     * @return the start position of the whole pattern occurrence ending at {@code position}, or {@link #NO_MATCH}
     */
    int feed(final int position, final List<ByteMatch> matches) {
        votes[slot] = 0;
        disabled[slot] = false;

        for (ByteMatch match : matches) {
            final int id = match.getFragmentId();
            final boolean complement = id >= numberOfParts;
            final int offset = complement
                    ? pattern.getComplements().get(id - numberOfParts).getOffset()
                    : pattern.getParts().get(id).getOffset() + match.getLength() - 1;

            // the alignment would start before the text or end after it
            if (position < offset || position - offset + length > textLength) {
                continue;
            }

            // offset < length, so this stays positive
            final int target = (length + slot - offset) % length;
            if (complement) {
                disabled[target] = true;
                if (trace) {
                    LOG.trace("Complement #{} found at {}; disabling alignment at {}", id - numberOfParts, position,
                            position - offset);
                }
            } else if (!disabled[target]) {
                votes[target]++;
                if (trace) {
                    LOG.trace("{}/{} parts found for alignment at {}", votes[target], numberOfParts,
                            position - offset);
                }
            }
        }

        if (++slot == length) {
            slot = 0;
        }

        // slot now belongs to the alignment starting at position + 1 - length, which has just been fully scanned
        if (position + 1 >= length && !disabled[slot] && votes[slot] == numberOfParts) {
            return position + 1 - length;
        }
        return NO_MATCH;
    }
}

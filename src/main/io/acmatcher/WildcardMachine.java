package io.acmatcher;

import io.acmatcher.input.Complement;
import io.acmatcher.input.ParseException;
import io.acmatcher.input.Part;
import io.acmatcher.input.WildcardPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static io.acmatcher.WildcardMatchAggregator.NO_MATCH;

/**
 * Finds every occurrence of a single wildcard pattern in a text in a single pass. See
 * {@link io.acmatcher.input.PatternDecomposer} for the pattern syntax.
 *
 * The literal parts of the pattern and the bytes its complements forbid are all loaded into one ByteMachine; the
 * fragments it reports are then reassembled into whole-pattern occurrences by a WildcardMatchAggregator.
 *
 * Thread safe once compiled.
 */
@ThreadSafe
public class WildcardMachine {

    private static final Logger LOG = LoggerFactory.getLogger(WildcardMachine.class);

    private final WildcardPattern pattern;
    private final ByteMachine byteMachine;
    private final Configuration configuration;

    private WildcardMachine(final WildcardPattern pattern, final ByteMachine byteMachine,
                            final Configuration configuration) {
        this.pattern = pattern;
        this.byteMachine = byteMachine;
        this.configuration = configuration;
    }

    public static WildcardMachine compile(@Nonnull final String pattern) {
        return compile(pattern, Configuration.builder().build());
    }

    public static WildcardMachine compile(@Nonnull final String pattern, @Nonnull final Configuration configuration) {
        return compile(pattern.getBytes(StandardCharsets.UTF_8), configuration);
    }

    /**
     * Compiles a wildcard pattern.
     *
     * @param pattern       the pattern
     * @param configuration supplies the wildcard and complement bytes
     * @return the compiled machine
     * @throws ParseException if the pattern is empty or ends with a complement marker
     */
    public static WildcardMachine compile(@Nonnull final byte[] pattern, @Nonnull final Configuration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        final WildcardPattern decomposed = configuration.newDecomposer().decompose(pattern);

        final ForestBuilder forest = new ForestBuilder();
        final List<Part> parts = decomposed.getParts();
        for (int i = 0; i < parts.size(); i++) {
            forest.insert(parts.get(i).getBytes(), i);
        }
        final List<Complement> complements = decomposed.getComplements();
        for (int i = 0; i < complements.size(); i++) {
            forest.insert(new byte[] { complements.get(i).getForbidden() }, parts.size() + i);
        }

        final WildcardMachine machine = new WildcardMachine(decomposed, forest.build(), configuration);
        LOG.debug("Compiled {}", machine);
        return machine;
    }

    /**
     * Return every occurrence of the pattern in the text. Every match has pattern index zero.
     *
     * @param text the text
     * @return the matches, ordered by start position. The list may be empty but never null.
     */
    public List<Match> matches(@Nonnull final String text) {
        return matches(text.getBytes(StandardCharsets.UTF_8));
    }

    public List<Match> matches(@Nonnull final byte[] text) {
        Objects.requireNonNull(text, "text");
        final List<Match> result = new ArrayList<>();
        final Matcher matcher = new Matcher(byteMachine);
        final WildcardMatchAggregator aggregator = new WildcardMatchAggregator(pattern, text.length);

        for (int i = 0; i < text.length; i++) {
            final List<ByteMatch> found = matcher.step(text[i]) ? matcher.matches() : Collections.emptyList();
            final int start = aggregator.feed(i, found);
            if (start != NO_MATCH) {
                result.add(new Match(0, start));
            }
        }
        return result;
    }

    public WildcardPattern getPattern() {
        return pattern;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    ByteMachine getByteMachine() {
        return byteMachine;
    }

    @Override
    public String toString() {
        return "WildcardMachine{length=" + pattern.length() + ", parts=" + pattern.numberOfParts()
                + ", complements=" + pattern.getComplements().size() + ", " + byteMachine + "}";
    }
}

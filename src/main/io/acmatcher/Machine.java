package io.acmatcher;

import io.acmatcher.input.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Finds every occurrence of a fixed set of patterns in a text in a single pass.
 *
 * Patterns are identified by their index in the order they were added. Adding the same pattern twice is allowed and
 * each copy reports its own matches. Strings are encoded as UTF-8 and positions are byte offsets.
 *
 * The machine cannot be changed once built. It is thread safe: each call to {@link #matches(byte[])} traverses it
 * with its own cursor.
 */
@ThreadSafe
public class Machine {

    private static final Logger LOG = LoggerFactory.getLogger(Machine.class);

    private final ByteMachine byteMachine;
    private final int patternCount;
    private final Configuration configuration;

    private Machine(final ByteMachine byteMachine, final int patternCount, final Configuration configuration) {
        this.byteMachine = byteMachine;
        this.patternCount = patternCount;
        this.configuration = configuration;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a machine for the given patterns with the default configuration.
     *
     * @param patterns the patterns, which must not be empty strings
     * @return the machine
     */
    public static Machine of(final String... patterns) {
        Builder builder = builder();
        for (String pattern : patterns) {
            builder.addPattern(pattern);
        }
        return builder.build();
    }

    /**
     * Return every occurrence of every pattern in the text.
     *
     * @param text the text
     * @return the matches, ordered as the configuration says. The list may be empty but never null.
     */
    public List<Match> matches(@Nonnull final String text) {
        return matches(text.getBytes(StandardCharsets.UTF_8));
    }

    public List<Match> matches(@Nonnull final byte[] text) {
        Objects.requireNonNull(text, "text");
        final List<Match> result = new ArrayList<>();
        final Matcher matcher = new Matcher(byteMachine);

        for (int i = 0; i < text.length; i++) {
            if (matcher.step(text[i])) {
                for (ByteMatch match : matcher.matches()) {
                    result.add(new Match(match.getFragmentId(), match.startFor(i)));
                }
            }
        }

        if (configuration.isSortedMatches()) {
            Collections.sort(result);
        }
        return result;
    }

    public int getPatternCount() {
        return patternCount;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    ByteMachine getByteMachine() {
        return byteMachine;
    }

    @Override
    public String toString() {
        return "Machine{patterns=" + patternCount + ", " + byteMachine + "}";
    }

    public static class Builder {

        private final List<byte[]> patterns = new ArrayList<>();
        private Configuration configuration = Configuration.builder().build();

        private Builder() { }

        public Builder withConfiguration(@Nonnull Configuration configuration) {
            this.configuration = Objects.requireNonNull(configuration, "configuration");
            return this;
        }

        /**
         * Adds a pattern; its index is the number of patterns added before it.
         *
         * @throws ParseException if the pattern is empty
         */
        public Builder addPattern(@Nonnull String pattern) {
            return addPattern(pattern.getBytes(StandardCharsets.UTF_8));
        }

        public Builder addPattern(@Nonnull byte[] pattern) {
            if (pattern.length == 0) {
                throw new ParseException("Empty pattern at index " + patterns.size());
            }
            patterns.add(pattern.clone());
            return this;
        }

        public Builder addPatterns(@Nonnull Collection<String> patterns) {
            for (String pattern : patterns) {
                addPattern(pattern);
            }
            return this;
        }

        public Machine build() {
            final ForestBuilder forest = new ForestBuilder();
            for (int i = 0; i < patterns.size(); i++) {
                forest.insert(patterns.get(i), i);
            }
            final Machine machine = new Machine(forest.build(), patterns.size(), configuration);
            LOG.debug("Built {}", machine);
            return machine;
        }
    }
}

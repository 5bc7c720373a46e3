package io.acmatcher;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;

/**
 * Compiles machines from pattern definitions written as JSON.
 *
 * A pattern set for a {@link Machine} lists its patterns in order; pattern indices follow that order:
 * <pre>
 *   { "patterns": [ "he", "she", "his", "hers" ], "sorted": true }
 * </pre>
 * A wildcard pattern for a {@link WildcardMachine} names its special characters; both are optional and default to
 * {@code ?} and no complement:
 * <pre>
 *   { "pattern": "a?!bc", "wildcard": "?", "complement": "!" }
 * </pre>
 */
public final class JsonPatternCompiler {

    private static final JsonFactory JSON_FACTORY = JsonFactory.builder()
            .configure(StreamReadFeature.INCLUDE_SOURCE_IN_LOCATION, true)
            .build();

    static final String PATTERNS = "patterns";
    static final String SORTED = "sorted";
    static final String PATTERN = "pattern";
    static final String WILDCARD = "wildcard";
    static final String COMPLEMENT = "complement";

    private JsonPatternCompiler() { }

    /**
     * Verify the syntax of a pattern set.
     * @param source pattern set, as a String
     * @return null if the pattern set is valid, otherwise an error message
     */
    public static String checkMachine(final String source) {
        try {
            doCompileMachine(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Verify the syntax of a wildcard pattern definition.
     * @param source wildcard pattern definition, as a String
     * @return null if the definition is valid, otherwise an error message
     */
    public static String checkWildcardMachine(final String source) {
        try {
            doCompileWildcardMachine(JSON_FACTORY.createParser(source));
            return null;
        } catch (Exception e) {
            return e.getLocalizedMessage();
        }
    }

    /**
     * Compile a pattern set from its JSON form.
     *
     * @param source pattern set, as a String
     * @return the machine
     * @throws IOException if the pattern set isn't syntactically valid
     */
    public static Machine compileMachine(final String source) throws IOException {
        return doCompileMachine(JSON_FACTORY.createParser(source));
    }

    public static Machine compileMachine(final Reader source) throws IOException {
        return doCompileMachine(JSON_FACTORY.createParser(source));
    }

    public static Machine compileMachine(final byte[] source) throws IOException {
        return doCompileMachine(JSON_FACTORY.createParser(source));
    }

    public static Machine compileMachine(final InputStream source) throws IOException {
        return doCompileMachine(JSON_FACTORY.createParser(source));
    }

    /**
     * Compile a wildcard pattern from its JSON form.
     *
     * @param source wildcard pattern definition, as a String
     * @return the machine
     * @throws IOException if the definition isn't syntactically valid
     */
    public static WildcardMachine compileWildcardMachine(final String source) throws IOException {
        return doCompileWildcardMachine(JSON_FACTORY.createParser(source));
    }

    public static WildcardMachine compileWildcardMachine(final Reader source) throws IOException {
        return doCompileWildcardMachine(JSON_FACTORY.createParser(source));
    }

    public static WildcardMachine compileWildcardMachine(final byte[] source) throws IOException {
        return doCompileWildcardMachine(JSON_FACTORY.createParser(source));
    }

    public static WildcardMachine compileWildcardMachine(final InputStream source) throws IOException {
        return doCompileWildcardMachine(JSON_FACTORY.createParser(source));
    }

    private static Machine doCompileMachine(final JsonParser parser) throws IOException {
        final Machine.Builder builder = Machine.builder();
        final Configuration.Builder configuration = Configuration.builder();
        boolean patternsPresent = false;

        if (parser.nextToken() != JsonToken.START_OBJECT) {
            barf(parser, "Pattern set is not an object");
        }
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String fieldName = parser.getCurrentName();
            final JsonToken token = parser.nextToken();
            switch (fieldName) {
            case PATTERNS:
                if (token != JsonToken.START_ARRAY) {
                    barf(parser, "Value of \"" + PATTERNS + "\" must be an array");
                }
                while (parser.nextToken() != JsonToken.END_ARRAY) {
                    if (parser.getCurrentToken() != JsonToken.VALUE_STRING) {
                        barf(parser, "Pattern must be a string");
                    }
                    builder.addPattern(parser.getText());
                }
                patternsPresent = true;
                break;

            case SORTED:
                if (!token.isBoolean()) {
                    barf(parser, "Value of \"" + SORTED + "\" must be a boolean");
                }
                configuration.withSortedMatches(parser.getBooleanValue());
                break;

            default:
                barf(parser, "Unrecognized field \"" + fieldName + "\"");
            }
        }
        if (!patternsPresent) {
            barf(parser, "Pattern set must contain \"" + PATTERNS + "\"");
        }
        parser.close();
        return builder.withConfiguration(configuration.build()).build();
    }

    private static WildcardMachine doCompileWildcardMachine(final JsonParser parser) throws IOException {
        final Configuration.Builder configuration = Configuration.builder();
        String pattern = null;

        if (parser.nextToken() != JsonToken.START_OBJECT) {
            barf(parser, "Wildcard pattern definition is not an object");
        }
        while (parser.nextToken() != JsonToken.END_OBJECT) {
            final String fieldName = parser.getCurrentName();
            final JsonToken token = parser.nextToken();
            if (token != JsonToken.VALUE_STRING) {
                barf(parser, "Value of \"" + fieldName + "\" must be a string");
            }
            switch (fieldName) {
            case PATTERN:
                pattern = parser.getText();
                break;

            case WILDCARD:
                configuration.withWildcard(singleCharacter(parser, fieldName));
                break;

            case COMPLEMENT:
                configuration.withComplement(singleCharacter(parser, fieldName));
                break;

            default:
                barf(parser, "Unrecognized field \"" + fieldName + "\"");
            }
        }
        if (pattern == null) {
            barf(parser, "Wildcard pattern definition must contain \"" + PATTERN + "\"");
        }
        parser.close();
        return WildcardMachine.compile(pattern, configuration.build());
    }

    private static char singleCharacter(final JsonParser parser, final String fieldName) throws IOException {
        final String text = parser.getText();
        if (text.length() != 1) {
            barf(parser, "Value of \"" + fieldName + "\" must be a single character");
        }
        return text.charAt(0);
    }

    private static void barf(final JsonParser parser, final String message) throws JsonParseException {
        throw new JsonParseException(parser, message, parser.getCurrentLocation());
    }
}

package io.acmatcher;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ConfigurationTest {

    @Test
    public void testDefaults() {
        Configuration configuration = Configuration.builder().build();
        assertEquals((byte) '?', configuration.getWildcard());
        assertFalse(configuration.hasComplement());
        assertTrue(configuration.isSortedMatches());
        assertEquals("Configuration{wildcard=?, complement=none, sortedMatches=true}", configuration.toString());
    }

    @Test
    public void testCustomCharacters() {
        Configuration configuration = Configuration.builder()
                .withWildcard('*')
                .withComplement('~')
                .withSortedMatches(false)
                .build();
        assertEquals((byte) '*', configuration.getWildcard());
        assertEquals((byte) '~', configuration.getComplement());
        assertTrue(configuration.hasComplement());
        assertFalse(configuration.isSortedMatches());
    }

    @Test
    public void testNonAsciiWildcardIsRejected() {
        try {
            Configuration.builder().withWildcard('é').build();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Wildcard must be a non-zero ASCII character, got U+00E9", e.getMessage());
        }
    }

    @Test
    public void testNulWildcardIsRejected() {
        try {
            Configuration.builder().withWildcard(Configuration.NO_COMPLEMENT).build();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testNonAsciiComplementIsRejected() {
        try {
            Configuration.builder().withComplement('≠').build();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Complement must be an ASCII character, got U+2260", e.getMessage());
        }
    }

    @Test
    public void testWildcardEqualToComplementIsRejected() {
        try {
            Configuration.builder().withWildcard('!').withComplement('!').build();
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertEquals("Wildcard and complement must differ, both are '!'", e.getMessage());
        }
    }
}

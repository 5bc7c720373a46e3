package io.acmatcher;

import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static io.acmatcher.ByteMachine.ROOT;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MatcherTest {

    private ByteMachine machine;
    private Matcher matcher;

    @Before
    public void setup() {
        machine = new ForestBuilder()
                .insert(bytes("he"), 0)
                .insert(bytes("she"), 1)
                .insert(bytes("his"), 2)
                .insert(bytes("hers"), 3)
                .build();
        matcher = new Matcher(machine);
    }

    @Test
    public void testNoTransitionFromRootFails() {
        assertFalse(matcher.step((byte) 'x'));
        assertEquals(ROOT, matcher.getCurrentState());
    }

    @Test
    public void testStepFollowsTransitions() {
        assertTrue(matcher.step((byte) 'h'));
        assertTrue(matcher.matches().isEmpty());
        assertTrue(matcher.step((byte) 'e'));
        assertEquals(Arrays.asList(new ByteMatch(0, 2)), matcher.matches());
    }

    @Test
    public void testStepFallsBackThroughFailureLinks() {
        matcher.step((byte) 's');
        matcher.step((byte) 'h');
        assertTrue(matcher.step((byte) 'e'));
        assertEquals(Arrays.asList(new ByteMatch(1, 3), new ByteMatch(0, 2)), matcher.matches());

        // "she" has no 'r', its failure "he" does
        assertTrue(matcher.step((byte) 'r'));
        assertTrue(matcher.step((byte) 's'));
        assertEquals(Arrays.asList(new ByteMatch(3, 4)), matcher.matches());
    }

    @Test
    public void testFailedStepReturnsToRoot() {
        matcher.step((byte) 'h');
        assertNotEquals(ROOT, matcher.getCurrentState());
        assertFalse(matcher.step((byte) 'z'));
        assertEquals(ROOT, matcher.getCurrentState());
        assertTrue(matcher.step((byte) 's'));
    }

    @Test
    public void testReset() {
        matcher.step((byte) 'h');
        matcher.reset();
        assertEquals(ROOT, matcher.getCurrentState());
    }

    @Test
    public void testEmptyMachineNeverMatches() {
        Matcher empty = new Matcher(new ForestBuilder().build());
        for (int b = 0; b < 256; b++) {
            assertFalse(empty.step((byte) b));
        }
    }

    @Test
    public void testRequiresLinkedMachine() {
        try {
            new Matcher(new ByteMachine());
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}

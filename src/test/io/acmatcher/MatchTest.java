package io.acmatcher;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class MatchTest {

    @Test
    public void testOrderingByStartThenPattern() {
        List<Match> matches = new ArrayList<>(Arrays.asList(
                new Match(3, 4), new Match(0, 4), new Match(1, 3), new Match(2, 1)));
        Collections.sort(matches);
        assertEquals(Arrays.asList(new Match(2, 1), new Match(1, 3), new Match(0, 4), new Match(3, 4)), matches);
    }

    @Test
    public void testEquality() {
        assertEquals(new Match(1, 2), new Match(1, 2));
        assertEquals(new Match(1, 2).hashCode(), new Match(1, 2).hashCode());
        assertNotEquals(new Match(2, 1), new Match(1, 2));
        assertTrue(new Match(1, 2).compareTo(new Match(1, 2)) == 0);
    }

    @Test
    public void testToString() {
        assertEquals("Match{pattern=1, start=2}", new Match(1, 2).toString());
    }
}

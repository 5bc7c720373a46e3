package io.acmatcher.input;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class ParseExceptionTest {

    @Test
    public void testWithoutPosition() {
        ParseException e = new ParseException("Empty pattern");
        assertEquals("Empty pattern", e.getMessage());
        assertEquals(ParseException.NO_POSITION, e.getPosition());
    }

    @Test
    public void testWithPosition() {
        ParseException e = new ParseException("Complement character without operand", 7);
        assertEquals("Complement character without operand at pos 7", e.getMessage());
        assertEquals(7, e.getPosition());
    }
}

package io.acmatcher;

import io.acmatcher.input.PatternDecomposer;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MachineWriterTest {

    @Test
    public void testWriteMachine() {
        Machine machine = Machine.of("ab", "b");
        String expected = "State 0:\n"
                + "\tTransition on 'a' to 1\n"
                + "\tTransition on 'b' to 3\n"
                + "\tFallback to none\n"
                + "State 1:\n"
                + "\tTransition on 'b' to 2\n"
                + "\tFallback to 0\n"
                + "State 2:\n"
                + "\tFallback to 3\n"
                + "\tResult #0 of length 2\n"
                + "\t^Result #1 of length 1\n"
                + "State 3:\n"
                + "\tFallback to 0\n"
                + "\tResult #1 of length 1\n";
        assertEquals(expected, MachineWriter.write(machine));
    }

    @Test
    public void testEveryStateWrittenOnce() {
        Machine machine = Machine.of("he", "she", "his", "hers");
        String dump = MachineWriter.write(machine);
        int states = machine.getByteMachine().size();
        assertEquals(10, states);
        for (int i = 0; i < states; i++) {
            assertEquals(dump.indexOf("State " + i + ":\n"), dump.lastIndexOf("State " + i + ":\n"));
            assertTrue(dump.contains("State " + i + ":\n"));
        }
    }

    @Test
    public void testWritePattern() {
        PatternDecomposer decomposer = new PatternDecomposer((byte) '?', (byte) '!');
        String expected = "Part at offset 0 of length 1: \"a\"\n"
                + "Part at offset 2 of length 2: \"cd\"\n"
                + "Complement to 'b' at offset 1\n"
                + "Total length of pattern: 4\n";
        assertEquals(expected, MachineWriter.write(decomposer.decompose("a!bcd")));
    }

    @Test
    public void testWriteWildcardMachine() {
        WildcardMachine machine = WildcardMachine.compile("a?");
        String dump = MachineWriter.write(machine);
        assertTrue(dump, dump.startsWith("Part at offset 0 of length 1: \"a\"\nTotal length of pattern: 2\nState 0:\n"));
    }

    @Test
    public void testNonPrintableBytes() {
        assertEquals("0x00", MachineWriter.printable((byte) 0));
        assertEquals("0xff", MachineWriter.printable((byte) 0xFF));
        assertEquals("'~'", MachineWriter.printable((byte) '~'));
    }

    @Test
    public void testWriteMatches() {
        assertEquals("1 1\n3 2\n", MachineWriter.writeMatches(Arrays.asList(new Match(0, 0), new Match(1, 2))));
        assertEquals("1\n3\n", MachineWriter.writeStarts(Arrays.asList(new Match(0, 0), new Match(0, 2))));
    }
}

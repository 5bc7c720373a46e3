package io.acmatcher.input;

import javax.annotation.concurrent.Immutable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A maximal run of literal bytes in a wildcard pattern, located by its offset in the pattern's compressed coordinates.
 */
@Immutable
public final class Part {

    private final int offset;
    private final byte[] bytes;

    Part(final int offset, final byte[] bytes) {
        this.offset = offset;
        this.bytes = bytes;
    }

    public int getOffset() {
        return offset;
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    public int length() {
        return bytes.length;
    }

    /**
     * The offset of the last byte of this part, which is where the automaton reports it.
     */
    public int getEndOffset() {
        return offset + bytes.length - 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Part part = (Part) o;
        return offset == part.offset && Arrays.equals(bytes, part.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * offset + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "Part at offset " + offset + " of length " + bytes.length + ": \""
                + new String(bytes, StandardCharsets.UTF_8) + "\"";
    }
}

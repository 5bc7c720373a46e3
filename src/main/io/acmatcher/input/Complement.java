package io.acmatcher.input;

import javax.annotation.concurrent.Immutable;

/**
 * A position in a wildcard pattern, in compressed coordinates, where one particular byte must not occur.
 */
@Immutable
public final class Complement {

    private final int offset;
    private final byte forbidden;

    Complement(final int offset, final byte forbidden) {
        this.offset = offset;
        this.forbidden = forbidden;
    }

    public int getOffset() {
        return offset;
    }

    public byte getForbidden() {
        return forbidden;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Complement other = (Complement) o;
        return offset == other.offset && forbidden == other.forbidden;
    }

    @Override
    public int hashCode() {
        return 31 * offset + forbidden;
    }

    @Override
    public String toString() {
        return "Complement to byte " + (forbidden & 0xFF) + " at offset " + offset;
    }
}

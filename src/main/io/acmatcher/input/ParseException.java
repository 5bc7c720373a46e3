package io.acmatcher.input;

/**
 * A RuntimeException that indicates a malformed pattern, optionally pointing at the offending byte of the source
 * pattern.
 */
public class ParseException extends RuntimeException {

    public static final int NO_POSITION = -1;

    private final int position;

    public ParseException(String msg) {
        super(msg);
        this.position = NO_POSITION;
    }

    public ParseException(String msg, int position) {
        super(msg + " at pos " + position);
        this.position = position;
    }

    /**
     * The byte offset in the source pattern at which parsing failed, or {@link #NO_POSITION}.
     */
    public int getPosition() {
        return position;
    }
}

package org.weatherwatch.ruler;

/**
 * A RuntimeException that indicates a reading sequence was refused before analysis. When the refusal is caused by
 * one symbol, its offset in the sequence is available from {@link #getOffset()}.
 */
public class SequenceParseException extends RuntimeException {

    public static final int NO_OFFSET = -1;

    private final int offset;

    public SequenceParseException(String msg) {
        this(msg, NO_OFFSET);
    }

    public SequenceParseException(String msg, int offset) {
        super(msg);
        this.offset = offset;
    }

    /**
     * @return the offset of the offending symbol, or NO_OFFSET if the whole sequence was refused
     */
    public int getOffset() {
        return offset;
    }
}

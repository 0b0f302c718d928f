package org.weatherwatch.ruler;

/**
 * Configuration for a SequenceAnalyzer. The recognizers themselves accept any input; these options only control
 * what the analyzer lets through to them.
 */
public class Configuration {

    /**
     * Sequences longer than this are refused with a SequenceParseException. Unbounded by default.
     */
    private final int maxSequenceLength;

    /**
     * When true, any symbol outside t, h, r, a and x causes the sequence to be refused. When false, such symbols are
     * handed to the recognizers, which treat them like any other non-t, non-h reading.
     */
    private final boolean strictAlphabet;

    private Configuration(int maxSequenceLength, boolean strictAlphabet) {
        this.maxSequenceLength = maxSequenceLength;
        this.strictAlphabet = strictAlphabet;
    }

    public int getMaxSequenceLength() {
        return maxSequenceLength;
    }

    public boolean isStrictAlphabet() {
        return strictAlphabet;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private int maxSequenceLength = Integer.MAX_VALUE;
        private boolean strictAlphabet = false;

        public Builder withMaxSequenceLength(int maxSequenceLength) {
            if (maxSequenceLength < 0) {
                throw new IllegalArgumentException("maxSequenceLength must not be negative: " + maxSequenceLength);
            }
            this.maxSequenceLength = maxSequenceLength;
            return this;
        }

        public Builder withStrictAlphabet(boolean strictAlphabet) {
            this.strictAlphabet = strictAlphabet;
            return this;
        }

        public Configuration build() {
            return new Configuration(maxSequenceLength, strictAlphabet);
        }
    }
}

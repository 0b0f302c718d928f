package org.weatherwatch.ruler;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Pushdown automaton for the language { t^n h^n | n >= 1 }: a block of high-temperature readings followed by an
 * equally long block of low-humidity readings, and nothing else. The markers on the stack are indistinguishable, so
 * the stack is kept as its depth. Each call has its own stack; the instance holds no state.
 */
@ThreadSafe
@Immutable
public class BalancedStackPDA {

    /**
     * Returns true if the sequence is exactly n t's followed by n h's, for some n of at least one.
     *
     * @param sequence the readings
     * @return true if the sequence is balanced
     */
    public boolean accepts(@Nonnull final CharSequence sequence) {
        final int length = sequence.length();
        int depth = 0;
        int i = 0;

        while (i < length && SymbolClass.of(sequence.charAt(i)) == SymbolClass.T) {
            depth++;
            i++;
        }
        final boolean sawTemperature = i > 0;

        while (i < length && SymbolClass.of(sequence.charAt(i)) == SymbolClass.H) {
            if (depth == 0) {
                return false;
            }
            depth--;
            i++;
        }

        return sawTemperature && depth == 0 && i == length;
    }
}

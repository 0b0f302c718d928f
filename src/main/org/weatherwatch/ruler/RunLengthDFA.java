package org.weatherwatch.ruler;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Deterministic finite automaton recognizing the drought pattern: three or more high-temperature readings
 * immediately followed by two or more low-humidity readings, anywhere in a sequence. The pattern is regular, so a
 * fixed set of states suffices; the counters only record how long the current runs are.
 * <p>
 * Instances carry the state of the run in progress and must not be shared between threads. Use one automaton per
 * thread, or a new one per sequence.
 */
@NotThreadSafe
public class RunLengthDFA {

    private final TransitionTable table;

    private DroughtState state;
    private int temperatureCount;
    private int humidityCount;

    public RunLengthDFA() {
        this.table = TransitionTable.DROUGHT;
        reset();
    }

    /**
     * Returns to the initial state and clears both counters.
     */
    public void reset() {
        state = DroughtState.INITIAL;
        temperatureCount = 0;
        humidityCount = 0;
    }

    /**
     * Consumes exactly one symbol.
     *
     * @param symbol the reading; anything other than t or h is treated as an interruption
     */
    public void step(final char symbol) {
        final Transition transition = table.get(state, SymbolClass.of(symbol));
        temperatureCount = transition.getTemperatureAction().apply(temperatureCount);
        humidityCount = transition.getHumidityAction().apply(humidityCount);
        state = transition.getNextState();
    }

    /**
     * Resets the automaton and feeds it the sequence, stopping at the first symbol that reaches acceptance. The
     * remainder of the sequence is not read.
     *
     * @param sequence the readings
     * @return true if the sequence contains a drought pattern
     */
    public boolean run(@Nonnull final CharSequence sequence) {
        reset();
        for (int i = 0; i < sequence.length(); i++) {
            step(sequence.charAt(i));
            if (state.isAccepting()) {
                return true;
            }
        }
        return false;
    }

    public DroughtState getState() {
        return state;
    }

    public int getTemperatureCount() {
        return temperatureCount;
    }

    public int getHumidityCount() {
        return humidityCount;
    }

    public boolean isAccepting() {
        return state.isAccepting();
    }

    @Override
    public String toString() {
        return "DFA: " + state + " t=" + temperatureCount + " h=" + humidityCount;
    }
}

package org.weatherwatch.ruler;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static org.weatherwatch.ruler.CounterAction.INCREMENT;
import static org.weatherwatch.ruler.CounterAction.KEEP;
import static org.weatherwatch.ruler.CounterAction.RESET;
import static org.weatherwatch.ruler.CounterAction.SET_ONE;
import static org.weatherwatch.ruler.DroughtState.ACCEPT;
import static org.weatherwatch.ruler.DroughtState.INITIAL;
import static org.weatherwatch.ruler.DroughtState.SEEN_ONE_H;
import static org.weatherwatch.ruler.DroughtState.SEEN_ONE_T;
import static org.weatherwatch.ruler.DroughtState.SEEN_TWO_T;
import static org.weatherwatch.ruler.DroughtState.THRESHOLD_T;

/**
 * The complete (state, symbol class) to transition table of the drought recognizer. Every pair has exactly one
 * entry; the table is checked for completeness when it is built, so lookups never fall through to a default.
 */
@Immutable
final class TransitionTable {

    static final TransitionTable DROUGHT = buildDroughtTable();

    private final Map<DroughtState, Map<SymbolClass, Transition>> table;

    private TransitionTable(final Map<DroughtState, Map<SymbolClass, Transition>> table) {
        for (DroughtState state : DroughtState.values()) {
            Map<SymbolClass, Transition> row = table.get(state);
            for (SymbolClass symbolClass : SymbolClass.values()) {
                if (row == null || row.get(symbolClass) == null) {
                    throw new IllegalStateException("No transition for " + state + " on " + symbolClass);
                }
            }
        }
        this.table = Collections.unmodifiableMap(table);
    }

    @Nonnull
    Transition get(@Nonnull final DroughtState state, @Nonnull final SymbolClass symbolClass) {
        return table.get(state).get(symbolClass);
    }

    int size() {
        int size = 0;
        for (Map<SymbolClass, Transition> row : table.values()) {
            size += row.size();
        }
        return size;
    }

    private static TransitionTable buildDroughtTable() {
        final Builder builder = new Builder();

        // Any interruption sends us home with both counters cleared.
        final Transition backToInitial = new Transition(INITIAL, RESET, RESET);

        builder.put(INITIAL, SymbolClass.T, new Transition(SEEN_ONE_T, SET_ONE, RESET))
               .put(INITIAL, SymbolClass.H, backToInitial)
               .put(INITIAL, SymbolClass.OTHER, backToInitial);

        builder.put(SEEN_ONE_T, SymbolClass.T, new Transition(SEEN_TWO_T, INCREMENT, KEEP))
               .put(SEEN_ONE_T, SymbolClass.H, backToInitial)
               .put(SEEN_ONE_T, SymbolClass.OTHER, backToInitial);

        builder.put(SEEN_TWO_T, SymbolClass.T, new Transition(THRESHOLD_T, INCREMENT, KEEP))
               .put(SEEN_TWO_T, SymbolClass.H, backToInitial)
               .put(SEEN_TWO_T, SymbolClass.OTHER, backToInitial);

        builder.put(THRESHOLD_T, SymbolClass.T, new Transition(THRESHOLD_T, INCREMENT, KEEP))
               .put(THRESHOLD_T, SymbolClass.H, new Transition(SEEN_ONE_H, KEEP, SET_ONE))
               .put(THRESHOLD_T, SymbolClass.OTHER, backToInitial);

        // A t here opens a new run on this same symbol.
        builder.put(SEEN_ONE_H, SymbolClass.T, new Transition(SEEN_ONE_T, SET_ONE, RESET))
               .put(SEEN_ONE_H, SymbolClass.H, new Transition(ACCEPT, KEEP, INCREMENT))
               .put(SEEN_ONE_H, SymbolClass.OTHER, backToInitial);

        final Transition stay = new Transition(ACCEPT, KEEP, KEEP);
        builder.put(ACCEPT, SymbolClass.T, stay)
               .put(ACCEPT, SymbolClass.H, stay)
               .put(ACCEPT, SymbolClass.OTHER, stay);

        return builder.build();
    }

    static class Builder {

        private final Map<DroughtState, Map<SymbolClass, Transition>> table = new EnumMap<>(DroughtState.class);

        Builder put(final DroughtState state, final SymbolClass symbolClass, final Transition transition) {
            Map<SymbolClass, Transition> row = table.computeIfAbsent(state, s -> new EnumMap<>(SymbolClass.class));
            if (row.put(symbolClass, transition) != null) {
                throw new IllegalStateException("Duplicate transition for " + state + " on " + symbolClass);
            }
            return this;
        }

        TransitionTable build() {
            return new TransitionTable(table);
        }
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder();
        for (Map.Entry<DroughtState, Map<SymbolClass, Transition>> row : table.entrySet()) {
            b.append(row.getKey()).append(": ").append(row.getValue()).append('\n');
        }
        return b.toString();
    }
}

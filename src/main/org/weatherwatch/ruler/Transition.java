package org.weatherwatch.ruler;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import java.util.Objects;

/**
 * One entry of the drought transition table: the state to move to and the effect on both counters.
 */
@Immutable
final class Transition {

    private final DroughtState nextState;
    private final CounterAction temperatureAction;
    private final CounterAction humidityAction;

    Transition(@Nonnull final DroughtState nextState,
               @Nonnull final CounterAction temperatureAction,
               @Nonnull final CounterAction humidityAction) {
        this.nextState = Objects.requireNonNull(nextState);
        this.temperatureAction = Objects.requireNonNull(temperatureAction);
        this.humidityAction = Objects.requireNonNull(humidityAction);
    }

    DroughtState getNextState() {
        return nextState;
    }

    CounterAction getTemperatureAction() {
        return temperatureAction;
    }

    CounterAction getHumidityAction() {
        return humidityAction;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition other = (Transition) o;
        return nextState == other.nextState
                && temperatureAction == other.temperatureAction
                && humidityAction == other.humidityAction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(nextState, temperatureAction, humidityAction);
    }

    @Override
    public String toString() {
        return "-> " + nextState + " t:" + temperatureAction + " h:" + humidityAction;
    }
}

package org.weatherwatch.ruler;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The literal occurrences of each weather pattern found in one sequence, in the order they appear.
 */
@Immutable
public final class PatternMatches {

    private final List<String> drought;
    private final List<String> flood;

    PatternMatches(@Nonnull final List<String> drought, @Nonnull final List<String> flood) {
        this.drought = Collections.unmodifiableList(new ArrayList<>(drought));
        this.flood = Collections.unmodifiableList(new ArrayList<>(flood));
    }

    public List<String> getDrought() {
        return drought;
    }

    public List<String> getFlood() {
        return flood;
    }

    public List<String> get(@Nonnull final PatternType type) {
        switch (type) {
            case DROUGHT:
                return drought;
            case FLOOD:
                return flood;
            default:
                throw new IllegalArgumentException("Unknown pattern type: " + type);
        }
    }

    public boolean isEmpty() {
        return drought.isEmpty() && flood.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PatternMatches other = (PatternMatches) o;
        return drought.equals(other.drought) && flood.equals(other.flood);
    }

    @Override
    public int hashCode() {
        return 31 * drought.hashCode() + flood.hashCode();
    }

    @Override
    public String toString() {
        return "drought=" + drought + ", flood=" + flood;
    }
}

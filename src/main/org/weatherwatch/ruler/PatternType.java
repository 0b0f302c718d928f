package org.weatherwatch.ruler;

import java.util.regex.Pattern;

/**
 * The weather patterns the detector looks for, with the regular expressions that define them.
 */
public enum PatternType {
    DROUGHT("t{3,}h{2,}"),  // sustained heat, then dry air
    FLOOD("r{2,}x{3,}");    // repeated rain, then normal readings

    private final Pattern pattern;

    PatternType(final String regex) {
        this.pattern = Pattern.compile(regex);
    }

    public Pattern pattern() {
        return pattern;
    }
}

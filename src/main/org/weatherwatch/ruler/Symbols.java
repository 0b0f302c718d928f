package org.weatherwatch.ruler;

/**
 * The reading alphabet. Each symbol is one reading from a weather station, already compared against its threshold.
 */
public final class Symbols {

    private Symbols() {}

    public static final char TEMPERATURE_HIGH = 't';
    public static final char HUMIDITY_LOW = 'h';
    public static final char RAIN = 'r';
    public static final char ALERT = 'a';
    public static final char NORMAL = 'x';

    static final String ALPHABET = new String(new char[] {
            TEMPERATURE_HIGH, HUMIDITY_LOW, RAIN, ALERT, NORMAL
    });

    /**
     * Returns true if the symbol is one of the five reading symbols.
     *
     * @param symbol the character to check
     * @return true for t, h, r, a and x
     */
    public static boolean isKnown(final char symbol) {
        return ALPHABET.indexOf(symbol) >= 0;
    }
}

package org.weatherwatch.ruler;

/**
 * The classes of input symbols the recognizers tell apart. Every character falls into exactly one class.
 */
public enum SymbolClass {
    T,      // high temperature
    H,      // low humidity
    OTHER;  // rain, alert, normal reading, or anything else

    public static SymbolClass of(final char symbol) {
        switch (symbol) {
            case Symbols.TEMPERATURE_HIGH:
                return T;
            case Symbols.HUMIDITY_LOW:
                return H;
            default:
                return OTHER;
        }
    }
}

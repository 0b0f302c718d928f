package org.weatherwatch.ruler;

/**
 * States of the drought recognizer. The names give the progress made through "three or more t, then two or more h".
 */
public enum DroughtState {
    INITIAL,       // no progress
    SEEN_ONE_T,    // one t
    SEEN_TWO_T,    // two consecutive t
    THRESHOLD_T,   // three or more consecutive t
    SEEN_ONE_H,    // threshold reached, then one h
    ACCEPT;        // absorbing

    public boolean isAccepting() {
        return this == ACCEPT;
    }
}

package org.weatherwatch.ruler;

/**
 * What a transition does to one of the run-length counters.
 */
enum CounterAction {
    KEEP {
        @Override
        int apply(final int count) {
            return count;
        }
    },
    RESET {
        @Override
        int apply(final int count) {
            return 0;
        }
    },
    SET_ONE {
        @Override
        int apply(final int count) {
            return 1;
        }
    },
    INCREMENT {
        @Override
        int apply(final int count) {
            return count + 1;
        }
    };

    abstract int apply(int count);
}

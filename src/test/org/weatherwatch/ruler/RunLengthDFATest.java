package org.weatherwatch.ruler;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RunLengthDFATest {

    private RunLengthDFA dfa;

    @Before
    public void setUp() {
        dfa = new RunLengthDFA();
    }

    @Test
    public void newAutomatonStartsInInitialState() {
        assertEquals(DroughtState.INITIAL, dfa.getState());
        assertEquals(0, dfa.getTemperatureCount());
        assertEquals(0, dfa.getHumidityCount());
        assertFalse(dfa.isAccepting());
    }

    @Test
    public void testDroughtInsideNormalReadings() {
        assertTrue(dfa.run("xxttthhxx"));
        assertEquals(DroughtState.ACCEPT, dfa.getState());
        assertEquals(3, dfa.getTemperatureCount());
        assertEquals(2, dfa.getHumidityCount());
    }

    @Test
    public void testSingleHumidityReadingIsNotEnough() {
        assertFalse(dfa.run("ttth"));
        assertEquals(DroughtState.SEEN_ONE_H, dfa.getState());
        assertEquals(3, dfa.getTemperatureCount());
        assertEquals(1, dfa.getHumidityCount());
    }

    @Test
    public void testLongRunsStopAtAcceptance() {
        assertTrue(dfa.run("tttthhhh"));
        // stopped on the second h
        assertEquals(4, dfa.getTemperatureCount());
        assertEquals(2, dfa.getHumidityCount());
    }

    @Test
    public void testEmptySequence() {
        assertFalse(dfa.run(""));
        assertEquals(DroughtState.INITIAL, dfa.getState());
    }

    @Test
    public void testTwoTemperatureReadingsAreNotEnough() {
        assertFalse(dfa.run("tthh"));
        assertFalse(dfa.run("tthhh"));
        assertFalse(dfa.run("xtthhx"));
    }

    @Test
    public void testInterruptionsBreakThePattern() {
        assertFalse(dfa.run("ttxthh"));
        assertFalse(dfa.run("tttxhh"));
        assertFalse(dfa.run("ttthxh"));
        assertFalse(dfa.run("tttrhh"));
        assertFalse(dfa.run("tttahh"));
    }

    @Test
    public void testTemperatureAfterOneHumidityStartsNewRun() {
        assertFalse(dfa.run("ttthtthh"));
        assertTrue(dfa.run("ttthttthh"));
    }

    @Test
    public void testUnknownSymbolsAreInterruptions() {
        assertFalse(dfa.run("TTTHH"));
        assertFalse(dfa.run("ttt hh"));
        assertTrue(dfa.run("?!ttthh9"));
    }

    @Test
    public void stepFollowsTransitionTable() {
        dfa.step('t');
        assertEquals(DroughtState.SEEN_ONE_T, dfa.getState());
        assertEquals(1, dfa.getTemperatureCount());
        dfa.step('t');
        assertEquals(DroughtState.SEEN_TWO_T, dfa.getState());
        dfa.step('t');
        assertEquals(DroughtState.THRESHOLD_T, dfa.getState());
        dfa.step('t');
        assertEquals(DroughtState.THRESHOLD_T, dfa.getState());
        assertEquals(4, dfa.getTemperatureCount());
        dfa.step('h');
        assertEquals(DroughtState.SEEN_ONE_H, dfa.getState());
        assertEquals(1, dfa.getHumidityCount());
        dfa.step('t');
        assertEquals(DroughtState.SEEN_ONE_T, dfa.getState());
        assertEquals(1, dfa.getTemperatureCount());
        assertEquals(0, dfa.getHumidityCount());
        dfa.step('x');
        assertEquals(DroughtState.INITIAL, dfa.getState());
        assertEquals(0, dfa.getTemperatureCount());
        assertEquals(0, dfa.getHumidityCount());
    }

    @Test
    public void acceptIsAbsorbing() {
        for (char c : "ttthh".toCharArray()) {
            dfa.step(c);
        }
        assertTrue(dfa.isAccepting());
        for (char c : "xrahtq".toCharArray()) {
            dfa.step(c);
            assertEquals(DroughtState.ACCEPT, dfa.getState());
        }
    }

    @Test
    public void resetClearsStateAndCounters() {
        dfa.step('t');
        dfa.step('t');
        dfa.reset();
        assertEquals(DroughtState.INITIAL, dfa.getState());
        assertEquals(0, dfa.getTemperatureCount());
        assertEquals(0, dfa.getHumidityCount());
    }

    @Test
    public void runIsIndependentOfPreviousRuns() {
        RunLengthDFA fresh = new RunLengthDFA();
        String[] sequences = { "ttthh", "tt", "hh", "ttth", "h", "xxttthhxx", "" };
        for (String first : sequences) {
            for (String second : sequences) {
                dfa.run(first);
                assertEquals(first + " then " + second, fresh.run(second), dfa.run(second));
            }
        }
    }

    @Test
    public void runStopsReadingAfterAcceptance() {
        CountingSequence sequence = new CountingSequence("xttthhxxxxxxxx");
        assertTrue(dfa.run(sequence));
        assertEquals(6, sequence.reads);
    }

    @Test
    public void agreesWithRegexOnEveryShortSequence() {
        Pattern drought = Pattern.compile("t{3,}h{2,}");
        PatternDetector detector = new PatternDetector();
        for (String s : allSequences("thx", 8)) {
            boolean expected = drought.matcher(s).find();
            assertEquals(s, expected, dfa.run(s));
            assertEquals(s, expected, !detector.detect(s).getDrought().isEmpty());
        }
    }

    private static List<String> allSequences(String alphabet, int maxLength) {
        List<String> result = new ArrayList<>();
        result.add("");
        List<String> previous = new ArrayList<>(result);
        for (int length = 1; length <= maxLength; length++) {
            List<String> next = new ArrayList<>();
            for (String prefix : previous) {
                for (char c : alphabet.toCharArray()) {
                    next.add(prefix + c);
                }
            }
            result.addAll(next);
            previous = next;
        }
        return result;
    }

    private static class CountingSequence implements CharSequence {
        private final String value;
        int reads = 0;

        CountingSequence(String value) {
            this.value = value;
        }

        @Override
        public int length() {
            return value.length();
        }

        @Override
        public char charAt(int index) {
            reads++;
            return value.charAt(index);
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            return value.subSequence(start, end);
        }

        @Override
        public String toString() {
            return value;
        }
    }
}

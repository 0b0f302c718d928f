package org.weatherwatch.ruler;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Prints, for a fixed set of example sequences, what the regex detector finds and what the two recognizers decide.
 */
public class ExampleHarness {

    static final List<String> EXAMPLES = Arrays.asList(
            "xxttthhxx", "ttthh", "ttth", "tttthhhr", "rrxxrxx", "rrxxx", "rrxxxx", "tttthhhh");
    static final List<String> BALANCE_EXAMPLES = Arrays.asList(
            "th", "tthh", "ttthhh", "tth", "thh", "xth");

    public static void main(String[] args) {
        print(System.out);
    }

    static void print(final PrintStream out) {
        final PatternDetector detector = new PatternDetector();
        out.println("=== Pattern detection ===");
        for (String s : EXAMPLES) {
            PatternMatches matches = detector.detect(s);
            out.println("Sequence: " + s + " -> Drought: " + matches.getDrought() + ", Flood: " + matches.getFlood());
        }

        final RunLengthDFA dfa = new RunLengthDFA();
        out.println();
        out.println("=== Drought DFA ===");
        for (String s : EXAMPLES) {
            out.println("Sequence: " + s + " -> Drought pattern detected? " + yesNo(dfa.run(s)));
        }

        final BalancedStackPDA pda = new BalancedStackPDA();
        out.println();
        out.println("=== Balanced PDA ===");
        for (String s : BALANCE_EXAMPLES) {
            out.println("Sequence: " + s + " -> PDA accepts? " + yesNo(pda.accepts(s)));
        }
    }

    private static String yesNo(final boolean b) {
        return b ? "Yes" : "No";
    }
}

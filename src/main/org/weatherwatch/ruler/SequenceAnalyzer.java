package org.weatherwatch.ruler;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.ThreadSafe;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs the pattern detector and both recognizers over reading sequences. The analyzer is thread safe: the detector
 * and the PDA are stateless, and every call gets its own DFA.
 */
@ThreadSafe
public class SequenceAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(SequenceAnalyzer.class);
    // "{...} junk" is malformed, not a sequence followed by noise
    private static final ObjectMapper OBJECT_MAPPER =
            new ObjectMapper().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final Configuration configuration;
    private final PatternDetector detector = new PatternDetector();
    private final BalancedStackPDA pda = new BalancedStackPDA();

    public SequenceAnalyzer() {
        this(Configuration.builder().build());
    }

    public SequenceAnalyzer(@Nonnull final Configuration configuration) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    /**
     * Analyze one sequence.
     *
     * @param sequence the readings
     * @return the report for the sequence
     * @throws SequenceParseException if the configuration refuses the sequence
     */
    public SequenceReport analyze(@Nonnull final String sequence) throws SequenceParseException {
        Objects.requireNonNull(sequence, "sequence");
        validate(sequence);
        final RunLengthDFA dfa = new RunLengthDFA();
        return new SequenceReport(sequence, detector.detect(sequence), dfa.run(sequence), pda.accepts(sequence));
    }

    /**
     * Analyze each sequence in turn.
     *
     * @param sequences the sequences
     * @return one report per sequence, in the same order
     * @throws SequenceParseException if the configuration refuses any of the sequences
     */
    public List<SequenceReport> analyzeAll(@Nonnull final List<String> sequences) throws SequenceParseException {
        Objects.requireNonNull(sequences, "sequences");
        final List<SequenceReport> reports = new ArrayList<>(sequences.size());
        for (String sequence : sequences) {
            reports.add(analyze(sequence));
        }
        return reports;
    }

    /**
     * Analyze the sequence carried in a JSON object of the form {"sequence": "..."}. Other fields are ignored.
     *
     * @param json the JSON text
     * @return the report for the sequence
     * @throws IllegalArgumentException if the text is not JSON
     * @throws SequenceParseException if there is no string "sequence" field, or the configuration refuses it
     */
    public SequenceReport analyzeJSON(@Nonnull final String json) throws IllegalArgumentException, SequenceParseException {
        Objects.requireNonNull(json, "json");
        final JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (IOException e) {
            throw new IllegalArgumentException(e);
        }
        return analyzeJSON(root);
    }

    // as above, only with the JSON already parsed
    public SequenceReport analyzeJSON(@Nonnull final JsonNode root) throws SequenceParseException {
        if (root == null || !root.isObject()) {
            throw new SequenceParseException("Input must be a JSON object");
        }
        final JsonNode sequence = root.get(SequenceReport.SEQUENCE_FIELD);
        if (sequence == null || !sequence.isTextual()) {
            throw new SequenceParseException("Input must have a string \"" + SequenceReport.SEQUENCE_FIELD + "\" field");
        }
        return analyze(sequence.asText());
    }

    private void validate(final String sequence) {
        if (sequence.length() > configuration.getMaxSequenceLength()) {
            LOG.warn("Refusing sequence of length {}, limit is {}", sequence.length(),
                    configuration.getMaxSequenceLength());
            throw new SequenceParseException("Sequence length " + sequence.length() + " exceeds the limit of "
                    + configuration.getMaxSequenceLength());
        }
        if (configuration.isStrictAlphabet()) {
            for (int i = 0; i < sequence.length(); i++) {
                final char symbol = sequence.charAt(i);
                if (!Symbols.isKnown(symbol)) {
                    LOG.debug("Unknown symbol '{}' at offset {}", symbol, i);
                    throw new SequenceParseException("Unknown symbol '" + symbol + "' at offset " + i
                            + ", expected one of " + Symbols.ALPHABET, i);
                }
            }
        }
    }
}

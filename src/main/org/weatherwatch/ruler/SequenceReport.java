package org.weatherwatch.ruler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;

import java.util.List;
import java.util.Objects;

/**
 * The outcome of analyzing one sequence: the regex matches, the drought automaton's verdict and the balance
 * automaton's verdict.
 */
@Immutable
public final class SequenceReport {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    static final String SEQUENCE_FIELD = "sequence";
    static final String DROUGHT_MATCHES_FIELD = "droughtMatches";
    static final String FLOOD_MATCHES_FIELD = "floodMatches";
    static final String DROUGHT_DETECTED_FIELD = "droughtDetected";
    static final String BALANCED_FIELD = "balanced";

    private final String sequence;
    private final PatternMatches matches;
    private final boolean droughtDetected;
    private final boolean balanced;

    SequenceReport(@Nonnull final String sequence, @Nonnull final PatternMatches matches,
                   final boolean droughtDetected, final boolean balanced) {
        this.sequence = Objects.requireNonNull(sequence);
        this.matches = Objects.requireNonNull(matches);
        this.droughtDetected = droughtDetected;
        this.balanced = balanced;
    }

    public String getSequence() {
        return sequence;
    }

    public PatternMatches getMatches() {
        return matches;
    }

    /**
     * @return the verdict of the drought DFA
     */
    public boolean isDroughtDetected() {
        return droughtDetected;
    }

    /**
     * @return the verdict of the t^n h^n PDA
     */
    public boolean isBalanced() {
        return balanced;
    }

    public JsonNode toJsonNode() {
        final ObjectNode root = OBJECT_MAPPER.createObjectNode();
        root.put(SEQUENCE_FIELD, sequence);
        addAll(root.putArray(DROUGHT_MATCHES_FIELD), matches.getDrought());
        addAll(root.putArray(FLOOD_MATCHES_FIELD), matches.getFlood());
        root.put(DROUGHT_DETECTED_FIELD, droughtDetected);
        root.put(BALANCED_FIELD, balanced);
        return root;
    }

    public String toJson() {
        try {
            return OBJECT_MAPPER.writeValueAsString(toJsonNode());
        } catch (JsonProcessingException e) {
            // a tree of strings and booleans always serializes
            throw new IllegalStateException(e);
        }
    }

    private static void addAll(final ArrayNode array, final List<String> values) {
        for (String value : values) {
            array.add(value);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SequenceReport other = (SequenceReport) o;
        return droughtDetected == other.droughtDetected
                && balanced == other.balanced
                && sequence.equals(other.sequence)
                && matches.equals(other.matches);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequence, matches, droughtDetected, balanced);
    }

    @Override
    public String toString() {
        return "Report: " + sequence + " [" + matches + ", droughtDetected=" + droughtDetected
                + ", balanced=" + balanced + "]";
    }
}

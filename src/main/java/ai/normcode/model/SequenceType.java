package ai.normcode.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sequence category of an inference row. Selects the syntax extractor.
 */
public enum SequenceType {
    IMPERATIVE("imperative_in_composition"),
    JUDGEMENT("judgement_in_composition"),
    ASSIGNING("assigning"),
    GROUPING("grouping"),
    TIMING("timing"),
    LOOPING("looping");

    private final String inferenceSequence;

    SequenceType(String inferenceSequence) {
        this.inferenceSequence = inferenceSequence;
    }

    /**
     * Name written to the inference table.
     */
    @JsonValue
    public String inferenceSequence() {
        return inferenceSequence;
    }

    public String shortName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts both the short name ("imperative") and the table name
     * ("imperative_in_composition"); null if neither matches.
     */
    public static SequenceType fromTag(String tag) {
        if (tag == null) {
            return null;
        }
        final String t = tag.trim().toLowerCase(Locale.ROOT);
        for (SequenceType s : values()) {
            if (s.shortName().equals(t) || s.inferenceSequence.equals(t)) {
                return s;
            }
        }
        return null;
    }
}

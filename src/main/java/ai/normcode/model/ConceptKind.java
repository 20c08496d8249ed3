package ai.normcode.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of the concept a main line declares.
 */
public enum ConceptKind {
    OBJECT,
    PROPOSITION,
    RELATION,
    SUBJECT,
    IMPERATIVE,
    JUDGEMENT,
    OPERATOR,
    COMMENT,
    INFORMAL;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Kinds whose raw text (not a formatted name) identifies them.
     */
    public boolean isFunctionLike() {
        return this == IMPERATIVE || this == JUDGEMENT || this == OPERATOR;
    }

    @JsonCreator
    public static ConceptKind fromWireName(String wireName) {
        if (wireName == null) {
            return null;
        }
        for (ConceptKind k : values()) {
            if (k.wireName().equals(wireName)) {
                return k;
            }
        }
        return INFORMAL;
    }
}

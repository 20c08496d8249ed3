package ai.normcode.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Specific operator recognised from an operator prefix.
 * <p>
 * assigningMarker is the marker an assigning syntax reports for the kind ("" when the kind
 * has none).
 */
public enum OperatorKind {
    IDENTITY("="),
    ABSTRACTION("%"),
    SPECIFICATION("."),
    CONTINUATION("+"),
    SELECTION("-"),
    NOMINALIZATION(""),
    GROUPING(""),
    TIMING_CONDITIONAL(""),
    TIMING_COMPLETION(""),
    TIMING_ACTION(""),
    LOOPING("");

    private final String assigningMarker;

    OperatorKind(String assigningMarker) {
        this.assigningMarker = assigningMarker;
    }

    public String assigningMarker() {
        return assigningMarker;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OperatorKind fromWireName(String wireName) {
        if (wireName == null) {
            return null;
        }
        for (OperatorKind k : values()) {
            if (k.wireName().equals(wireName)) {
                return k;
            }
        }
        // older plans call selection "derelation"
        if ("derelation".equals(wireName)) {
            return SELECTION;
        }
        return null;
    }
}

package ai.normcode.model;

import java.util.List;

/**
 * Result of classifying one line's content.
 */
public record Classification(
        RoleMarker roleMarker,     // null when the line has no role marker
        ConceptKind conceptKind,   // null only for empty content
        OperatorKind operatorKind, // set only when conceptKind == OPERATOR
        String name,               // extracted concept name, may be null
        List<String> warnings
) {
    public Classification {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static Classification empty() {
        return new Classification(null, null, null, null, List.of());
    }
}

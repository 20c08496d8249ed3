package ai.normcode.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.normcode.model.Classification;
import ai.normcode.model.ConceptKind;
import ai.normcode.model.OperatorKind;
import ai.normcode.model.RoleMarker;

/**
 * Classifies the content of a concept line.
 * Rules are tried in the order they are listed; the first match wins:
 * 1) role marker (stripped and recorded)
 * 2) operator prefixes
 * 3) semantic concepts (judgement/imperative, subject, proposition, relation, object)
 * 4) comments, then informal text
 */
public final class MarkerClassifier {

    private record OperatorPrefix(String prefix, OperatorKind kind) {
    }

    private static final List<OperatorPrefix> OPERATOR_PREFIXES = List.of(
            new OperatorPrefix("$=", OperatorKind.IDENTITY),
            new OperatorPrefix("$%", OperatorKind.ABSTRACTION),
            new OperatorPrefix("$.", OperatorKind.SPECIFICATION),
            new OperatorPrefix("$+", OperatorKind.CONTINUATION),
            new OperatorPrefix("$-", OperatorKind.SELECTION),
            new OperatorPrefix("$::", OperatorKind.NOMINALIZATION),
            new OperatorPrefix("&[{}]", OperatorKind.GROUPING),
            new OperatorPrefix("&[#]", OperatorKind.GROUPING),
            new OperatorPrefix("@:'", OperatorKind.TIMING_CONDITIONAL),
            new OperatorPrefix("@:!", OperatorKind.TIMING_CONDITIONAL),
            new OperatorPrefix("@.", OperatorKind.TIMING_COMPLETION),
            new OperatorPrefix("@::", OperatorKind.TIMING_ACTION),
            new OperatorPrefix("*.", OperatorKind.LOOPING)
    );

    @FunctionalInterface
    private interface SemanticRule {
        /**
         * @return classification, or null when the rule does not apply
         */
        Classification apply(RoleMarker marker, String remaining);
    }

    private static final List<SemanticRule> SEMANTIC_RULES = List.of(
            MarkerClassifier::functional,
            MarkerClassifier::subject,
            (m, r) -> bracketed(m, r, '<', '>', ConceptKind.PROPOSITION, "proposition"),
            (m, r) -> bracketed(m, r, '[', ']', ConceptKind.RELATION, "relation"),
            (m, r) -> bracketed(m, r, '{', '}', ConceptKind.OBJECT, "object")
    );

    private static final List<String> COMMENT_PREFIXES = List.of("/:", "?:", "...:", "%{", "?{");
    private static final List<String> NON_PROPOSITION_PREFIXES = List.of("<$", "<:", "<=", "<-", "<*");

    private static final Pattern JUDGEMENT_COMBINATOR = Pattern.compile("::\\([^)]*\\)\\s*<");
    private static final Pattern PAREN_NAME = Pattern.compile("::\\(([^)]*)\\)");
    private static final Pattern LEGACY_JUDGEMENT_NAME = Pattern.compile("::<\\{([^}]+)\\}>");
    private static final Pattern SUBJECT = Pattern.compile("^:([A-Za-z_][A-Za-z0-9_]*):");

    private MarkerClassifier() {
    }

    public static Classification classify(String content) {
        if (content == null || content.isBlank()) {
            return Classification.empty();
        }
        final String trimmed = content.strip();

        final RoleMarker marker = RoleMarker.leading(trimmed);
        final String remaining = marker == null
                ? trimmed
                : trimmed.substring(marker.token().length()).strip();

        for (OperatorPrefix op : OPERATOR_PREFIXES) {
            if (remaining.startsWith(op.prefix())) {
                return new Classification(marker, ConceptKind.OPERATOR, op.kind(), null, List.of());
            }
        }

        for (SemanticRule rule : SEMANTIC_RULES) {
            final Classification c = rule.apply(marker, remaining);
            if (c != null) {
                return c;
            }
        }

        for (String prefix : COMMENT_PREFIXES) {
            if (remaining.startsWith(prefix)) {
                return new Classification(marker, ConceptKind.COMMENT, null, null, List.of());
            }
        }

        if (marker != null) {
            final List<String> warnings = List.of("Unrecognized concept format after " + marker.token());
            String name = null;
            if (!remaining.isEmpty()) {
                name = remaining.split("\\s+")[0];
            }
            return new Classification(marker, ConceptKind.INFORMAL, null, name, warnings);
        }

        if (trimmed.startsWith("/") || trimmed.startsWith("?") || trimmed.startsWith("%")) {
            return new Classification(null, ConceptKind.COMMENT, null, null, List.of());
        }
        final List<String> warnings = new ArrayList<>();
        if (!trimmed.startsWith("|")) {
            warnings.add("Line without inference marker or comment prefix");
        }
        return new Classification(null, ConceptKind.INFORMAL, null, null, warnings);
    }

    private static Classification functional(RoleMarker marker, String remaining) {
        if (!remaining.startsWith("::")) {
            return null;
        }
        if (JUDGEMENT_COMBINATOR.matcher(remaining).find() || remaining.contains("::<{")) {
            String name = group(PAREN_NAME, remaining);
            if (name == null) {
                name = group(LEGACY_JUDGEMENT_NAME, remaining);
            }
            return new Classification(marker, ConceptKind.JUDGEMENT, null, name, List.of());
        }
        return new Classification(marker, ConceptKind.IMPERATIVE, null, group(PAREN_NAME, remaining), List.of());
    }

    private static Classification subject(RoleMarker marker, String remaining) {
        final Matcher m = SUBJECT.matcher(remaining);
        if (!m.find()) {
            return null;
        }
        return new Classification(marker, ConceptKind.SUBJECT, null, m.group(1), List.of());
    }

    private static Classification bracketed(RoleMarker marker,
                                            String remaining,
                                            char open,
                                            char close,
                                            ConceptKind kind,
                                            String label) {
        if (remaining.isEmpty() || remaining.charAt(0) != open) {
            return null;
        }
        if (open == '<') {
            for (String p : NON_PROPOSITION_PREFIXES) {
                if (remaining.startsWith(p)) {
                    return null;
                }
            }
        }
        if (remaining.indexOf(close) < 0) {
            return new Classification(marker, ConceptKind.INFORMAL, null, null,
                    List.of("Unclosed " + label + " marker " + open));
        }
        final int end = remaining.indexOf(close, 1);
        final String name = end > 1 ? remaining.substring(1, end) : null;
        return new Classification(marker, kind, null, name, List.of());
    }

    private static String group(Pattern p, String text) {
        final Matcher m = p.matcher(text);
        return m.find() ? m.group(1) : null;
    }
}

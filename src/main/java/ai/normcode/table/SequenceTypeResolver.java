package ai.normcode.table;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.ConceptKind;
import ai.normcode.model.OperatorKind;
import ai.normcode.model.SequenceType;
import ai.normcode.parse.Annotations;

/**
 * Decides the sequence category of an operator concept. Tiers, in order:
 * 1) explicit inline ?{sequence} tag
 * 2) patterns on the operator text
 * 3) operator kind
 * 4) bare "::" (imperative)
 * An operator no tier recognises has no category.
 */
public final class SequenceTypeResolver {

    private static final Logger log = LoggerFactory.getLogger(SequenceTypeResolver.class);

    private record PatternRule(SequenceType type, Predicate<String> matches) {
    }

    private static final Pattern ASSIGNING_PREFIX = Pattern.compile("^(<=\\s*)?\\$[.=%+-]");

    private static final List<PatternRule> PATTERN_RULES = List.of(
            new PatternRule(SequenceType.JUDGEMENT, t ->
                    (t.contains("::") && t.contains(")<{")) || (t.contains("::<{") && t.contains("}>"))),
            new PatternRule(SequenceType.GROUPING, t -> t.contains("&[{}]") || t.contains("&[#]")),
            new PatternRule(SequenceType.LOOPING, t -> t.contains("*.") && t.contains("%>")),
            new PatternRule(SequenceType.ASSIGNING, t -> ASSIGNING_PREFIX.matcher(t).find()),
            new PatternRule(SequenceType.TIMING, t -> t.contains("@:'") || t.contains("@:!") || t.contains("@."))
    );

    private static final Map<OperatorKind, SequenceType> BY_OPERATOR_KIND = new EnumMap<>(OperatorKind.class);

    static {
        BY_OPERATOR_KIND.put(OperatorKind.IDENTITY, SequenceType.ASSIGNING);
        BY_OPERATOR_KIND.put(OperatorKind.ABSTRACTION, SequenceType.ASSIGNING);
        BY_OPERATOR_KIND.put(OperatorKind.SPECIFICATION, SequenceType.ASSIGNING);
        BY_OPERATOR_KIND.put(OperatorKind.CONTINUATION, SequenceType.ASSIGNING);
        BY_OPERATOR_KIND.put(OperatorKind.SELECTION, SequenceType.ASSIGNING);
        BY_OPERATOR_KIND.put(OperatorKind.TIMING_CONDITIONAL, SequenceType.TIMING);
        BY_OPERATOR_KIND.put(OperatorKind.TIMING_COMPLETION, SequenceType.TIMING);
        BY_OPERATOR_KIND.put(OperatorKind.TIMING_ACTION, SequenceType.TIMING);
    }

    private SequenceTypeResolver() {
    }

    public static Optional<SequenceType> resolve(ClassifiedLine operator) {
        if (operator == null) {
            return Optional.empty();
        }
        final String tag = Annotations.sequenceTag(operator.comments());
        if (tag != null) {
            final SequenceType tagged = SequenceType.fromTag(tag);
            if (tagged != null) {
                return Optional.of(tagged);
            }
            log.warn("Unknown sequence tag '{}' at {}, inferring from operator text", tag, operator.flowIndex());
        }
        return fromText(operator.text(), operator.operatorType(), operator.conceptType());
    }

    /**
     * Tiers 2 to 4 only.
     */
    public static Optional<SequenceType> fromText(String text, OperatorKind kind, ConceptKind conceptKind) {
        final String t = text == null ? "" : text;
        for (PatternRule rule : PATTERN_RULES) {
            if (rule.matches().test(t)) {
                return Optional.of(rule.type());
            }
        }
        if (kind != null && BY_OPERATOR_KIND.containsKey(kind)) {
            return Optional.of(BY_OPERATOR_KIND.get(kind));
        }
        if (t.contains("::") && !t.contains("::<{")) {
            return Optional.of(SequenceType.IMPERATIVE);
        }
        if (conceptKind == ConceptKind.IMPERATIVE) {
            return Optional.of(SequenceType.IMPERATIVE);
        }
        return Optional.empty();
    }
}

package ai.normcode.table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.ConceptEntry;
import ai.normcode.model.ConceptKind;
import ai.normcode.model.ConceptNames;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.Positions;
import ai.normcode.model.RoleMarker;
import ai.normcode.parse.Annotations;
import ai.normcode.parse.AxisLists;
import ai.normcode.parse.AxisSpec;

/**
 * Builds concept_repo rows: one per distinct value concept name, one per distinct operator text.
 * <p>
 * A concept is ground when nothing produces it, when it is supplied from outside (:&gt;:), or
 * when it carries an explicit ground marker. Final (:&lt;:) concepts are never ground, even
 * when the same name is also supplied from outside.
 */
public final class ConceptTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConceptTableBuilder.class);

    static final String PARADIGM = "paradigm";
    static final String OPERATOR = "operator";
    static final String DUMMY_REFERENCE = "%{dummy}(_)";

    private static final Pattern IMPERATIVE_HEAD = Pattern.compile("^:[:><]?:");
    private static final Pattern NATURAL_NAME = Pattern.compile(":[:><]?:\\(([^)]+)\\)");
    private static final Pattern NATURAL_NAME_COMBINATOR = Pattern.compile(":[:><]?:\\(([^)]+)\\)<\\{");
    private static final Pattern NATURAL_NAME_LEGACY = Pattern.compile("::<\\{([^}]+)\\}>");

    private final Disambiguator disambiguator;

    public ConceptTableBuilder(Disambiguator disambiguator) {
        this.disambiguator = Objects.requireNonNull(disambiguator, "disambiguator");
    }

    public List<ConceptEntry> build(List<InferenceCluster> clusters) {
        Objects.requireNonNull(clusters, "clusters");

        final Map<String, ValueConceptAccumulator> values = new LinkedHashMap<>();
        final Map<String, FunctionConceptAccumulator> functions = new LinkedHashMap<>();
        final Set<String> produced = new HashSet<>();

        for (InferenceCluster cluster : clusters) {
            final ClassifiedLine parent = cluster.conceptToInfer();
            if (parent != null && parent.conceptName() != null) {
                final boolean external = parent.hasMarker(RoleMarker.ROOT_EXTERNAL);
                if (!external) {
                    produced.add(parent.conceptName());
                }
                final ValueConceptAccumulator acc = value(values, parent);
                acc.finalConcept |= parent.hasMarker(RoleMarker.ROOT_FINAL);
                acc.userInput |= external;
            }

            final ClassifiedLine operator = cluster.functionConcept();
            if (operator != null && operator.ncMain() != null && !operator.ncMain().isEmpty()) {
                function(functions, operator);
            }

            for (ClassifiedLine vc : cluster.valueConcepts()) {
                if (vc.conceptName() != null) {
                    value(values, vc);
                }
            }

            for (ClassifiedLine oc : cluster.otherConcepts()) {
                if (oc.hasMarker(RoleMarker.OPERATOR)) {
                    function(functions, oc);
                    continue;
                }
                if (oc.conceptName() != null) {
                    // context concepts are bound per iteration, never supplied
                    produced.add(oc.conceptName());
                    value(values, oc);
                }
            }
        }

        final List<ConceptEntry> rows = new ArrayList<>(values.size() + functions.size());
        for (ValueConceptAccumulator acc : values.values()) {
            rows.add(valueEntry(acc, produced.contains(acc.name)));
        }
        for (FunctionConceptAccumulator acc : functions.values()) {
            rows.add(functionEntry(acc));
        }
        rows.sort((a, b) -> Positions.compare(a.firstPosition(), b.firstPosition()));

        log.debug("Concept table: {} value concepts, {} function concepts", values.size(), functions.size());
        return rows;
    }

    // --- accumulation ---

    private static final class ValueConceptAccumulator {
        final String name;
        final ConceptKind kind; // first seen
        final Set<String> positions = new TreeSet<>(Positions.ORDER);
        List<ClassifiedLine> comments = List.of();
        boolean finalConcept;
        boolean userInput;

        ValueConceptAccumulator(String name, ConceptKind kind) {
            this.name = name;
            this.kind = kind;
        }
    }

    private static final class FunctionConceptAccumulator {
        final String text;
        final Set<String> positions = new TreeSet<>(Positions.ORDER);
        List<ClassifiedLine> comments = List.of();

        FunctionConceptAccumulator(String text) {
            this.text = text;
        }
    }

    private static ValueConceptAccumulator value(Map<String, ValueConceptAccumulator> values, ClassifiedLine line) {
        final ValueConceptAccumulator acc = values.computeIfAbsent(
                line.conceptName(),
                k -> new ValueConceptAccumulator(k, line.conceptType()));
        if (Positions.isWellFormed(line.flowIndex())) {
            acc.positions.add(line.flowIndex());
        }
        if (line.comments().size() > acc.comments.size()) {
            acc.comments = line.comments();
        }
        return acc;
    }

    private static void function(Map<String, FunctionConceptAccumulator> functions, ClassifiedLine line) {
        final FunctionConceptAccumulator acc = functions.computeIfAbsent(
                line.text(), FunctionConceptAccumulator::new);
        if (Positions.isWellFormed(line.flowIndex())) {
            acc.positions.add(line.flowIndex());
        }
        if (line.comments().size() > acc.comments.size()) {
            acc.comments = line.comments();
        }
    }

    // --- rows ---

    private static ConceptEntry valueEntry(ValueConceptAccumulator acc, boolean isProduced) {
        final List<ClassifiedLine> comments = acc.comments;

        final boolean ground = !acc.finalConcept
                && (!isProduced || acc.userInput || hasGroundMarker(acc.name, comments));

        List<String> reference = null;
        if (ground) {
            final String file = Annotations.value(comments, Annotations.FILE_LOCATION);
            final String literal = Annotations.value(comments, Annotations.LITERAL_VALUE);
            final String fromName = Annotations.literalFromName(acc.name);
            if (file != null) {
                reference = List.of("%{file_location}(" + file + ")");
            } else if (literal != null) {
                reference = List.of(unquoted(literal));
            } else if (fromName != null) {
                reference = List.of(fromName);
            }
        }

        final List<String> axes = AxisLists.parseAxes(Annotations.value(comments, Annotations.REF_AXES));
        return new ConceptEntry(
                ConceptNames.conceptId(acc.name),
                ConceptNames.format(acc.name, acc.kind),
                ConceptNames.typeMarker(acc.kind),
                new ArrayList<>(acc.positions),
                null,
                ground,
                acc.finalConcept,
                Annotations.isTrue(comments, Annotations.IS_INVARIANT),
                reference,
                axes.isEmpty() ? AxisSpec.NONE_AXIS : axes.get(0),
                axes,
                Annotations.value(comments, Annotations.REF_ELEMENT),
                acc.name
        );
    }

    private static boolean hasGroundMarker(String name, List<ClassifiedLine> comments) {
        return Annotations.isTrue(comments, Annotations.IS_GROUND)
                || Annotations.value(comments, Annotations.LITERAL_VALUE) != null
                || Annotations.literal(comments, null) != null
                || Annotations.hasGroundComment(comments)
                || Annotations.value(comments, Annotations.FILE_LOCATION) != null
                || Annotations.literalFromName(name) != null;
    }

    private ConceptEntry functionEntry(FunctionConceptAccumulator acc) {
        final String name = ConceptNames.stripOperatorMarker(acc.text);

        final boolean judgementShaped = name.contains(")<{") || (name.contains("<{") && name.contains("}>"));
        final String elementType = judgementShaped || IMPERATIVE_HEAD.matcher(name).find() ? PARADIGM : OPERATOR;
        final String natural = naturalName(name);

        return new ConceptEntry(
                ConceptNames.functionId(natural),
                name,
                judgementShaped ? "<{}>" : "({})",
                new ArrayList<>(acc.positions),
                natural,
                true,
                false,
                false,
                List.of(PARADIGM.equals(elementType) ? paradigmReference(acc.comments) : DUMMY_REFERENCE),
                AxisSpec.NONE_AXIS,
                List.of(AxisSpec.NONE_AXIS),
                elementType,
                natural
        );
    }

    static String naturalName(String stripped) {
        for (Pattern p : List.of(NATURAL_NAME, NATURAL_NAME_COMBINATOR, NATURAL_NAME_LEGACY)) {
            final Matcher m = p.matcher(stripped);
            if (m.find()) {
                return m.group(1);
            }
        }
        return stripped;
    }

    private String paradigmReference(List<ClassifiedLine> comments) {
        final String provision = Annotations.value(comments, Annotations.V_INPUT_PROVISION);
        if (provision == null) {
            return DUMMY_REFERENCE;
        }
        final String norm;
        if (provision.endsWith(".md")) {
            norm = "prompt_location";
        } else if (provision.endsWith(".py")) {
            norm = "script_location";
        } else {
            norm = "file_location";
        }
        return "%{" + norm + "}" + disambiguator.next() + "(" + provision + ")";
    }

    private static String unquoted(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isQuote(text.charAt(start))) {
            start++;
        }
        while (end > start && isQuote(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    private static boolean isQuote(char c) {
        return c == '"' || c == '\'';
    }
}

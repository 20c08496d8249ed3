package ai.normcode.table.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

import ai.normcode.model.AssignSyntax;
import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.ConceptNames;
import ai.normcode.model.FlowInfo;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.OneOrMany;
import ai.normcode.model.OperatorKind;
import ai.normcode.model.WorkingInterpretation;
import ai.normcode.parse.Annotations;
import ai.normcode.parse.AxisLists;
import ai.normcode.parse.Literals;

/**
 * Assigning rows: the marker comes from the operator kind and picks the syntax variant.
 */
public final class AssigningExtractor implements SyntaxExtractor {

    private static final Logger log = LoggerFactory.getLogger(AssigningExtractor.class);

    private static final Pattern INLINE_SOURCES = Pattern.compile("%<\\[([^\\]]+)\\]");
    private static final Pattern CONTINUATION_DESTINATION = Pattern.compile("%>\\(\\[([^\\]]+)\\]\\)");
    private static final Pattern CONTINUATION_SOURCE = Pattern.compile("%<\\(\\{([^}]+)\\}\\)");
    private static final Pattern CONTINUATION_AXIS = Pattern.compile("%:\\(([^)]+)\\)");

    @Override
    public WorkingInterpretation extract(InferenceCluster cluster, FlowInfo flowInfo) {
        return new WorkingInterpretation.Assigning(
                WorkingInterpretation.emptyWorkspace(),
                flowInfo,
                syntax(cluster, flowInfo.flowIndex()));
    }

    AssignSyntax syntax(InferenceCluster cluster, String position) {
        final ClassifiedLine operator = cluster.functionConcept();
        final OperatorKind kind = operator.operatorType();
        final String text = operator.text();

        if (kind == OperatorKind.ABSTRACTION) {
            return abstraction(operator, cluster.conceptToInfer());
        }
        if (kind == OperatorKind.SPECIFICATION) {
            return new AssignSyntax.Specification(specificationSource(operator, position));
        }
        if (kind == OperatorKind.CONTINUATION) {
            final String dest = SourceRefs.group(CONTINUATION_DESTINATION, text);
            final String source = SourceRefs.group(CONTINUATION_SOURCE, text);
            return new AssignSyntax.Continuation(
                    source == null ? null : "{" + source + "}",
                    dest == null ? null : "[" + dest + "]",
                    SourceRefs.group(CONTINUATION_AXIS, text));
        }
        final String marker = kind == null ? "" : kind.assigningMarker();
        return new AssignSyntax.Direct(marker, SourceRefs.singleSource(text));
    }

    private static AssignSyntax.Abstraction abstraction(ClassifiedLine operator, ClassifiedLine inferred) {
        final Annotations.LiteralAnnotation literal = Annotations.literal(operator.comments(), "%");
        final String axes = Annotations.value(inferred, Annotations.REF_AXES);
        return new AssignSyntax.Abstraction(
                literal == null ? null : literal.value(),
                axes == null ? null : AxisLists.parseAxes(axes));
    }

    /**
     * Priority: %{assign_sources} annotation, inline %&lt;[...] list, single %&gt;(...) source.
     */
    private static OneOrMany specificationSource(ClassifiedLine operator, String position) {
        final String annotated = Annotations.value(operator.comments(), Annotations.ASSIGN_SOURCES);
        if (annotated != null) {
            final OneOrMany parsed = parseAssignSources(annotated);
            if (parsed != null) {
                return parsed;
            }
        }

        final String inline = SourceRefs.group(INLINE_SOURCES, operator.text());
        if (inline != null) {
            final OneOrMany parsed = OneOrMany.collapse(SourceRefs.splitTopLevel(inline));
            if (parsed != null) {
                return parsed;
            }
        }

        final String single = SourceRefs.singleSource(operator.text());
        if (single == null) {
            log.warn("Specification operator '.' at {} has no source in %>(...)", position);
            return null;
        }
        return OneOrMany.single(single);
    }

    static OneOrMany parseAssignSources(String annotated) {
        final Optional<JsonNode> literal = Literals.parse(annotated);
        if (literal.isPresent() && literal.get().isArray()) {
            final List<String> sources = new ArrayList<>();
            for (JsonNode item : literal.get()) {
                final String ref = Literals.scalarText(item).strip();
                sources.add(ConceptNames.isBracketed(ref) ? ref : "{" + ref + "}");
            }
            final OneOrMany collapsed = OneOrMany.collapse(sources);
            if (collapsed != null) {
                return collapsed;
            }
        }
        String inner = annotated.strip();
        if (inner.startsWith("[") && inner.endsWith("]")) {
            inner = inner.substring(1, inner.length() - 1);
        }
        return OneOrMany.collapse(SourceRefs.splitTopLevel(inner));
    }
}

package ai.normcode.table.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.FlowInfo;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.WorkingInterpretation;
import ai.normcode.model.WorkingInterpretation.GroupingSyntax;
import ai.normcode.parse.Annotations;
import ai.normcode.parse.AxisLists;
import ai.normcode.parse.AxisSpec;

/**
 * Grouping rows: &amp;[{}] groups "in", &amp;[#] groups "across".
 * <p>
 * Axes collapsed per value concept, first tier that applies:
 * - option_d_per_concept: every value concept has %{collapse_in_grouping}
 * - option_c_functional:  %{by_axes} on the operator
 * - option_b_inline:      %-[...] in the operator text
 * - fallback_ref_axes:    each value concept's own %{ref_axes}
 * The list always has exactly one entry per value concept.
 */
public final class GroupingExtractor implements SyntaxExtractor {

    public static final String PER_CONCEPT = "option_d_per_concept";
    public static final String FUNCTIONAL = "option_c_functional";
    public static final String INLINE = "option_b_inline";
    public static final String FALLBACK = "fallback_ref_axes";

    private static final Pattern CREATE_AXIS = Pattern.compile("%\\+\\(([^)]+)\\)");
    private static final String SOURCES = "%>[";
    private static final Pattern INLINE_AXES = Pattern.compile("%-\\[(.+?)\\](?=\\s|%|\\||$)");

    private record ByAxes(List<List<String>> axes, String source) {
    }

    @Override
    public WorkingInterpretation extract(InferenceCluster cluster, FlowInfo flowInfo) {
        return new WorkingInterpretation.Grouping(
                WorkingInterpretation.emptyWorkspace(),
                flowInfo,
                syntax(cluster));
    }

    GroupingSyntax syntax(InferenceCluster cluster) {
        final ClassifiedLine operator = cluster.functionConcept();
        final String text = operator.text();

        final String marker = text.contains("&[#]") && !text.contains("&[{}]") ? "across" : "in";
        final String createAxis = SourceRefs.group(CREATE_AXIS, text);
        final List<String> sources = SourceRefs.splitTopLevel(SourceRefs.bracketListAfter(SOURCES, text));

        final ByAxes byAxes = byAxes(text, operator.comments(), cluster.valueConcepts());
        return new GroupingSyntax(marker, sources, createAxis, byAxes.axes(), byAxes.source());
    }

    private static ByAxes byAxes(String text, List<ClassifiedLine> operatorComments, List<ClassifiedLine> values) {
        ByAxes resolved = perConcept(values);
        if (resolved == null) {
            resolved = applied(Annotations.value(operatorComments, Annotations.BY_AXES), values, FUNCTIONAL);
        }
        if (resolved == null) {
            final String inline = SourceRefs.group(INLINE_AXES, text);
            resolved = applied(inline == null ? null : "[" + inline + "]", values, INLINE);
        }
        if (resolved == null) {
            final List<List<String>> axes = new ArrayList<>(values.size());
            for (ClassifiedLine vc : values) {
                axes.add(AxisLists.parseAxes(Annotations.value(vc.comments(), Annotations.REF_AXES)));
            }
            resolved = new ByAxes(axes, FALLBACK);
        }
        return new ByAxes(fitted(resolved.axes(), values.size()), resolved.source());
    }

    private static ByAxes perConcept(List<ClassifiedLine> values) {
        if (values.isEmpty()) {
            return null;
        }
        final List<List<String>> axes = new ArrayList<>(values.size());
        for (ClassifiedLine vc : values) {
            final String collapse = Annotations.value(vc.comments(), Annotations.COLLAPSE_IN_GROUPING);
            if (collapse == null) {
                return null;
            }
            axes.add(AxisLists.parseAxisList(collapse).firstGroup());
        }
        return new ByAxes(axes, PER_CONCEPT);
    }

    // a nested list is taken as given; a flat one applies to every value concept
    private static ByAxes applied(String annotation, List<ClassifiedLine> values, String source) {
        if (annotation == null) {
            return null;
        }
        final AxisSpec spec = AxisLists.parseAxisList(annotation);
        if (spec.nested()) {
            return new ByAxes(spec.groups(), source);
        }
        return new ByAxes(Collections.nCopies(values.size(), spec.firstGroup()), source);
    }

    private static List<List<String>> fitted(List<List<String>> axes, int size) {
        final List<List<String>> out = new ArrayList<>(axes.subList(0, Math.min(axes.size(), size)));
        while (out.size() < size) {
            out.add(List.of(AxisSpec.NONE_AXIS));
        }
        return out;
    }
}

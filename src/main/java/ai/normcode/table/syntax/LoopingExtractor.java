package ai.normcode.table.syntax;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.FlowInfo;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.Positions;
import ai.normcode.model.WorkingInterpretation;
import ai.normcode.model.WorkingInterpretation.LoopingSyntax;
import ai.normcode.parse.Annotations;
import ai.normcode.parse.AxisLists;

/**
 * Looping rows ("every").
 * <p>
 * Operator markers: %&gt;([base]) base relation, %&lt;({result}) result object,
 * %:({name}) legacy group base, %@(N) loop index (default 1).
 * Context concepts "&lt;* {x}&lt;$({source})*N&gt;" give the current element; a negative N
 * marks the carry-state element instead.
 * <p>
 * group_base: %{group_base} on the operator, else the current element's first ref axis,
 * else the legacy %:(...) name.
 */
public final class LoopingExtractor implements SyntaxExtractor {

    private static final Logger log = LoggerFactory.getLogger(LoopingExtractor.class);

    static final String MARKER = "every";
    static final int DEFAULT_LOOP_INDEX = 1;

    private static final Pattern BASE = Pattern.compile("%>\\(\\[?([^\\])\\]]+)\\]?\\)");
    private static final Pattern RESULT = Pattern.compile("%<\\(\\{([^}]+)\\}\\)");
    private static final Pattern LEGACY_GROUP_BASE = Pattern.compile("%:\\(\\{([^}]+)\\}\\)");
    private static final Pattern LOOP_INDEX = Pattern.compile("%@\\((\\d+)\\)");
    private static final Pattern CONTEXT_SOURCE = Pattern.compile("<\\$\\(([^)]+)\\)\\*(-?\\d+)?");

    @Override
    public WorkingInterpretation extract(InferenceCluster cluster, FlowInfo flowInfo) {
        return new WorkingInterpretation.Looping(
                WorkingInterpretation.emptyWorkspace(),
                flowInfo,
                syntax(cluster));
    }

    LoopingSyntax syntax(InferenceCluster cluster) {
        final ClassifiedLine operator = cluster.functionConcept();
        final String text = operator.text();

        final String base = SourceRefs.group(BASE, text);
        final String result = SourceRefs.group(RESULT, text);
        final String legacyGroupBase = SourceRefs.group(LEGACY_GROUP_BASE, text);
        final String index = SourceRefs.group(LOOP_INDEX, text);

        String current = null;
        String currentSource = null;
        String carry = null;
        String carrySource = null;
        String currentAxis = null;

        for (ClassifiedLine context : cluster.contextConcepts()) {
            final Matcher m = CONTEXT_SOURCE.matcher(context.text());
            if (!m.find()) {
                current = context.conceptName();
                continue;
            }
            final Integer offset = offset(m.group(2), context);
            if (offset != null && offset < 0) {
                carry = context.conceptName();
                carrySource = m.group(1);
            } else {
                current = context.conceptName();
                currentSource = m.group(1);
                final String axis = AxisLists.primaryOrNull(Annotations.value(context.comments(), Annotations.REF_AXES));
                if (axis != null) {
                    currentAxis = axis;
                }
            }
        }

        String groupBase = Annotations.value(operator.comments(), Annotations.GROUP_BASE);
        if (groupBase == null) {
            groupBase = currentAxis != null ? currentAxis : legacyGroupBase;
        }

        return new LoopingSyntax(
                MARKER,
                loopIndex(index, operator),
                base == null ? null : "[" + base + "]",
                current == null ? null : "{" + current + "}",
                currentSource,
                groupBase,
                result == null ? List.of() : List.of("{" + result + "}"),
                carry == null ? null : "{" + carry + "}",
                carry == null ? null : carrySource
        );
    }

    private static int loopIndex(String digits, ClassifiedLine operator) {
        if (digits == null) {
            return DEFAULT_LOOP_INDEX;
        }
        final Integer n = Positions.parseIntOrNull(digits);
        if (n == null) {
            log.warn("Loop index %@({}) at {} is out of range, using {}",
                    digits, operator.flowIndex(), DEFAULT_LOOP_INDEX);
            return DEFAULT_LOOP_INDEX;
        }
        return n;
    }

    private static Integer offset(String digits, ClassifiedLine context) {
        if (digits == null) {
            return null;
        }
        final Integer n = Positions.parseIntOrNull(digits);
        if (n == null) {
            log.warn("Loop offset *{} at {} is out of range, taken as the current element",
                    digits, context.flowIndex());
        }
        return n;
    }
}

package ai.normcode.table.syntax;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.ConceptNames;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.Positions;
import ai.normcode.model.WorkingInterpretation.ValueSelector;
import ai.normcode.parse.Annotations;
import ai.normcode.parse.AxisLists;

/**
 * Value order and value selectors shared by imperative and judgement rows.
 * <p>
 * Order comes from, in priority:
 * 1) an explicit %{value_order} on the operator: [{a}, [b], &lt;c&gt;] numbered 1..N
 * 2) &lt;:{N}&gt; bindings on value concepts; unbound siblings are left out
 * 3) source order (1-based) when no value concept is bound
 */
final class ValueBindings {

    private static final Logger log = LoggerFactory.getLogger(ValueBindings.class);

    private static final Pattern BINDING = Pattern.compile("<:\\{(\\d+)\\}>");
    private static final Pattern ORDER_TOKEN = Pattern.compile("(\\{[^}]+\\}|\\[[^\\]]+\\]|<[^>]+>)");

    private final Map<String, Integer> order;
    private final Map<String, ValueSelector> selectors;

    private ValueBindings(Map<String, Integer> order, Map<String, ValueSelector> selectors) {
        this.order = order;
        this.selectors = selectors;
    }

    static ValueBindings of(InferenceCluster cluster) {
        final Map<String, Integer> order = new LinkedHashMap<>();
        final List<ClassifiedLine> values = cluster.valueConcepts();

        final String explicit = Annotations.value(cluster.functionConcept(), Annotations.VALUE_ORDER);
        if (explicit != null) {
            String inner = explicit.strip();
            if (inner.startsWith("[") && inner.endsWith("]")) {
                inner = inner.substring(1, inner.length() - 1).strip();
            }
            final Matcher m = ORDER_TOKEN.matcher(inner);
            int n = 0;
            while (m.find()) {
                order.put(m.group(1), ++n);
            }
        } else {
            final List<Integer> bindings = new ArrayList<>(values.size());
            boolean anyBound = false;
            for (ClassifiedLine vc : values) {
                final Integer n = binding(vc);
                bindings.add(n);
                anyBound |= n != null;
            }
            for (int i = 0; i < values.size(); i++) {
                final ClassifiedLine vc = values.get(i);
                if (vc.conceptName() == null) {
                    continue;
                }
                final String formatted = ConceptNames.format(vc.conceptName(), vc.conceptType());
                if (bindings.get(i) != null) {
                    order.put(formatted, bindings.get(i));
                } else if (!anyBound) {
                    order.put(formatted, i + 1);
                }
            }
        }

        final Map<String, ValueSelector> selectors = new LinkedHashMap<>();
        for (ClassifiedLine vc : values) {
            if (vc.conceptName() == null) {
                continue;
            }
            final String formatted = ConceptNames.format(vc.conceptName(), vc.conceptType());
            if (!order.containsKey(formatted)) {
                continue;
            }
            final ValueSelector selector = selector(vc.comments());
            if (selector != null) {
                selectors.put(formatted, selector);
            }
        }
        return new ValueBindings(order, selectors);
    }

    Map<String, Integer> order() {
        return order;
    }

    Map<String, ValueSelector> selectors() {
        return selectors;
    }

    static String paradigm(InferenceCluster cluster) {
        return Annotations.value(cluster.functionConcept(), Annotations.NORM_INPUT);
    }

    static String bodyFaculty(InferenceCluster cluster) {
        return Annotations.value(cluster.functionConcept(), Annotations.BODY_FACULTY);
    }

    /**
     * First axis of the inferred concept's %{ref_axes}, unless it is the sentinel.
     */
    static String outputAxis(InferenceCluster cluster) {
        return AxisLists.primaryOrNull(Annotations.value(cluster.conceptToInfer(), Annotations.REF_AXES));
    }

    private static ValueSelector selector(List<ClassifiedLine> comments) {
        final String source = Annotations.value(comments, Annotations.SELECTOR_SOURCE);
        final String key = Annotations.value(comments, Annotations.SELECTOR_KEY);
        final Integer index = parseIndex(Annotations.value(comments, Annotations.SELECTOR_INDEX));
        final Boolean packed = Annotations.isTrue(comments, Annotations.SELECTOR_PACKED) ? Boolean.TRUE : null;
        final Boolean unpack = Annotations.isTrue(comments, Annotations.SELECTOR_UNPACK) ? Boolean.TRUE : null;
        if (source == null && key == null && index == null && packed == null && unpack == null) {
            return null;
        }
        return new ValueSelector(source, key, index, packed, unpack);
    }

    /**
     * The &lt;:{N}&gt; binding of a value concept; an out-of-range N counts as unbound.
     */
    private static Integer binding(ClassifiedLine vc) {
        final Matcher m = BINDING.matcher(vc.text());
        if (!m.find()) {
            return null;
        }
        final Integer n = Positions.parseIntOrNull(m.group(1));
        if (n == null) {
            log.warn("Ignoring binding <:{{}}> at {}: out of range", m.group(1), vc.flowIndex());
        }
        return n;
    }

    private static Integer parseIndex(String text) {
        if (text == null) {
            return null;
        }
        final Integer n = Positions.parseIntOrNull(text);
        if (n == null) {
            log.warn("Ignoring selector index '{}': not an integer", text);
        }
        return n;
    }
}

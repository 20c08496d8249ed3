package ai.normcode.parse;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.Positions;
import ai.normcode.model.RoleMarker;

/**
 * Rebuilds parent/child relations from indentation and groups every parent that has an
 * operator child into an {@link InferenceCluster}.
 * <p>
 * Children of a parent:
 * - first "&lt;=" child   -> function concept
 * - "&lt;-" children      -> value concepts (source order)
 * - everything else    -> other concepts (source order), including further "&lt;=" children
 */
public final class ClusterBuilder {

    private static final Logger log = LoggerFactory.getLogger(ClusterBuilder.class);

    private record Frame(String position, int depth) {
    }

    private ClusterBuilder() {
    }

    public static List<InferenceCluster> build(List<ClassifiedLine> lines) {
        final Map<String, ClassifiedLine> byPosition = StructuralParser.attachComments(lines);
        final Map<String, List<String>> children = childrenByParent(lines);

        final List<String> parents = new ArrayList<>(children.keySet());
        parents.sort(Positions.ORDER);

        final List<InferenceCluster> clusters = new ArrayList<>();
        for (String parent : parents) {
            ClassifiedLine function = null;
            final List<ClassifiedLine> values = new ArrayList<>();
            final List<ClassifiedLine> others = new ArrayList<>();

            for (String childPosition : children.get(parent)) {
                final ClassifiedLine child = byPosition.get(childPosition);
                if (child == null) {
                    continue;
                }
                final String text = child.text().strip();
                if (RoleMarker.OPERATOR.prefixes(text)) {
                    if (function == null) {
                        function = child;
                    } else {
                        others.add(child);
                    }
                } else if (RoleMarker.VALUE.prefixes(text)) {
                    values.add(child);
                } else {
                    others.add(child);
                }
            }

            if (function != null) {
                clusters.add(new InferenceCluster(byPosition.get(parent), function, values, others));
            }
        }
        log.debug("Built {} clusters from {} parents", clusters.size(), parents.size());
        return clusters;
    }

    private static Map<String, List<String>> childrenByParent(List<ClassifiedLine> lines) {
        final Map<String, List<String>> children = new LinkedHashMap<>();
        final Deque<Frame> stack = new ArrayDeque<>();

        for (ClassifiedLine line : lines) {
            if (!line.isMain() || line.flowIndex() == null) {
                continue;
            }
            while (!stack.isEmpty() && stack.peek().depth() >= line.depth()) {
                stack.pop();
            }
            if (!stack.isEmpty()) {
                children.computeIfAbsent(stack.peek().position(), k -> new ArrayList<>())
                        .add(line.flowIndex());
            }
            stack.push(new Frame(line.flowIndex(), line.depth()));
        }
        return children;
    }
}

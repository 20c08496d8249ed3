package ai.normcode.table;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import ai.normcode.model.ConceptEntry;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.InferenceEntry;
import ai.normcode.model.SequenceType;

/**
 * Output of one compilation: the cluster intermediate and both tables.
 */
public record CompiledTables(
        List<InferenceCluster> clusters,
        List<ConceptEntry> concepts,
        List<InferenceEntry> inferences,
        int warnedLines,    // lines the classifier flagged
        int droppedClusters // clusters without a sequence category
) {
    public CompiledTables {
        clusters = List.copyOf(clusters);
        concepts = List.copyOf(concepts);
        inferences = List.copyOf(inferences);
    }

    static boolean isFunctionRow(ConceptEntry entry) {
        return entry.id().startsWith("fc-");
    }

    public long valueConceptCount() {
        return concepts.stream().filter(e -> !isFunctionRow(e)).count();
    }

    public long functionConceptCount() {
        return concepts.stream().filter(CompiledTables::isFunctionRow).count();
    }

    public List<String> groundConceptNames() {
        final List<String> out = new ArrayList<>();
        for (ConceptEntry e : concepts) {
            if (!isFunctionRow(e) && e.groundConcept()) {
                out.add(e.conceptName());
            }
        }
        return out;
    }

    public List<String> finalConceptNames() {
        final List<String> out = new ArrayList<>();
        for (ConceptEntry e : concepts) {
            if (e.finalConcept()) {
                out.add(e.conceptName());
            }
        }
        return out;
    }

    public Map<SequenceType, Integer> rowsBySequence() {
        final Map<SequenceType, Integer> out = new EnumMap<>(SequenceType.class);
        for (InferenceEntry e : inferences) {
            out.merge(e.inferenceSequence(), 1, Integer::sum);
        }
        return out;
    }

    /**
     * Positions of grouping rows; their bundled values may need packed selectors downstream.
     */
    public List<String> groupingPositions() {
        final List<String> out = new ArrayList<>();
        for (InferenceEntry e : inferences) {
            if (e.inferenceSequence() == SequenceType.GROUPING) {
                out.add(e.position());
            }
        }
        return out;
    }
}

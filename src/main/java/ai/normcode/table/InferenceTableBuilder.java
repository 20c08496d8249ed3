package ai.normcode.table;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.ConceptNames;
import ai.normcode.model.FlowInfo;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.InferenceEntry;
import ai.normcode.model.Positions;
import ai.normcode.model.RoleMarker;
import ai.normcode.model.SequenceType;
import ai.normcode.model.WorkingInterpretation;
import ai.normcode.table.syntax.SourceRefs;

/**
 * Builds inference_repo rows: one per cluster with a resolvable sequence category, plus one per
 * operator nested among a cluster's other concepts. Rows are sorted by position.
 */
public final class InferenceTableBuilder {

    private static final Logger log = LoggerFactory.getLogger(InferenceTableBuilder.class);

    private final InterpretationBuilder interpretations;
    private int dropped;

    public InferenceTableBuilder() {
        this(new InterpretationBuilder());
    }

    public InferenceTableBuilder(InterpretationBuilder interpretations) {
        this.interpretations = Objects.requireNonNull(interpretations, "interpretations");
    }

    public List<InferenceEntry> build(List<InferenceCluster> clusters) {
        Objects.requireNonNull(clusters, "clusters");
        dropped = 0;

        final List<InferenceEntry> rows = new ArrayList<>(clusters.size());
        for (InferenceCluster cluster : clusters) {
            if (cluster.functionConcept() == null) {
                continue;
            }
            final Optional<SequenceType> type = SequenceTypeResolver.resolve(cluster.functionConcept());
            if (type.isEmpty()) {
                dropped++;
                log.warn("No sequence type for operator '{}' at {}, cluster dropped",
                        cluster.functionConcept().text(), cluster.position());
                continue;
            }
            rows.add(entry(cluster, type.get()));

            for (ClassifiedLine oc : cluster.otherConcepts()) {
                if (oc.hasMarker(RoleMarker.OPERATOR)) {
                    nested(oc).ifPresent(rows::add);
                }
            }
        }

        // List.sort is stable: rows sharing a position keep their build order
        rows.sort((a, b) -> Positions.compare(a.position(), b.position()));
        log.debug("Inference table: {} rows, {} clusters dropped", rows.size(), dropped);
        return rows;
    }

    /**
     * Clusters left out of the last {@link #build} because no sequence category applied.
     */
    public int droppedCount() {
        return dropped;
    }

    private InferenceEntry entry(InferenceCluster cluster, SequenceType type) {
        final ClassifiedLine operator = cluster.functionConcept();
        final FlowInfo flowInfo = new FlowInfo(cluster.position());

        String conceptToInfer = conceptToInfer(cluster.conceptToInfer());
        if (conceptToInfer == null) {
            conceptToInfer = fallbackConceptToInfer(operator, type);
        }

        List<String> values = new ArrayList<>();
        for (ClassifiedLine vc : cluster.valueConcepts()) {
            if (vc.conceptName() != null) {
                values.add(ConceptNames.format(vc.conceptName(), vc.conceptType()));
            }
        }

        final List<String> contexts = new ArrayList<>();
        for (ClassifiedLine cc : cluster.contextConcepts()) {
            if (cc.conceptName() != null) {
                contexts.add(ConceptNames.format(cc.conceptName(), cc.conceptType()));
            }
        }
        if (type == SequenceType.TIMING) {
            values.addAll(contexts);
        }

        final WorkingInterpretation wi = interpretations.build(type, cluster, flowInfo);
        final List<String> ordered = explicitOrder(wi);
        if (!ordered.isEmpty()) {
            values = ordered;
        }

        return new InferenceEntry(
                flowInfo,
                type,
                conceptToInfer,
                ConceptNames.stripOperatorMarker(operator.text()),
                values,
                contexts,
                wi);
    }

    private Optional<InferenceEntry> nested(ClassifiedLine operator) {
        final Optional<SequenceType> type = SequenceTypeResolver.resolve(operator);
        if (type.isEmpty()) {
            log.debug("Nested operator '{}' at {} has no sequence type", operator.text(), operator.flowIndex());
            return Optional.empty();
        }
        final FlowInfo flowInfo = new FlowInfo(operator.flowIndex());
        final InferenceCluster promoted = InferenceCluster.promoted(operator);
        return Optional.of(new InferenceEntry(
                flowInfo,
                type.get(),
                fallbackConceptToInfer(operator, type.get()),
                ConceptNames.stripOperatorMarker(operator.text()),
                List.of(),
                List.of(),
                interpretations.build(type.get(), promoted, flowInfo)));
    }

    private static String conceptToInfer(ClassifiedLine parent) {
        if (parent == null) {
            return null;
        }
        if (parent.conceptType() != null && parent.conceptType().isFunctionLike()) {
            return parent.text().isEmpty() ? null : ConceptNames.stripOperatorMarker(parent.text());
        }
        return parent.conceptName() == null ? null : ConceptNames.format(parent.conceptName(), parent.conceptType());
    }

    static String fallbackConceptToInfer(ClassifiedLine operator, SequenceType type) {
        if (type != SequenceType.ASSIGNING) {
            return ConceptNames.stripOperatorMarker(operator.text());
        }
        String source = SourceRefs.singleSource(operator.text());
        if (source == null) {
            source = SourceRefs.firstListedObject(operator.text());
        }
        return source != null ? source : "{assigning_" + Positions.underscored(operator.flowIndex()) + "}";
    }

    private static List<String> explicitOrder(WorkingInterpretation wi) {
        if (wi instanceof WorkingInterpretation.Imperative imperative) {
            return new ArrayList<>(imperative.valueOrder().keySet());
        }
        if (wi instanceof WorkingInterpretation.Judgement judgement) {
            return new ArrayList<>(judgement.valueOrder().keySet());
        }
        return List.of();
    }
}

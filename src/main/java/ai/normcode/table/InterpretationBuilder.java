package ai.normcode.table;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import ai.normcode.model.FlowInfo;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.SequenceType;
import ai.normcode.model.WorkingInterpretation;
import ai.normcode.table.syntax.AssigningExtractor;
import ai.normcode.table.syntax.GroupingExtractor;
import ai.normcode.table.syntax.ImperativeExtractor;
import ai.normcode.table.syntax.JudgementExtractor;
import ai.normcode.table.syntax.LoopingExtractor;
import ai.normcode.table.syntax.SyntaxExtractor;
import ai.normcode.table.syntax.TimingExtractor;

/**
 * Dispatches a cluster to the extractor of its sequence category.
 */
public final class InterpretationBuilder {

    private final Map<SequenceType, SyntaxExtractor> extractors = new EnumMap<>(SequenceType.class);

    public InterpretationBuilder() {
        for (SequenceType type : SequenceType.values()) {
            extractors.put(type, extractorFor(type));
        }
    }

    public WorkingInterpretation build(SequenceType type, InferenceCluster cluster, FlowInfo flowInfo) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(cluster, "cluster");
        return extractors.get(type).extract(cluster, flowInfo);
    }

    private static SyntaxExtractor extractorFor(SequenceType type) {
        return switch (type) {
            case IMPERATIVE -> new ImperativeExtractor();
            case JUDGEMENT -> new JudgementExtractor();
            case ASSIGNING -> new AssigningExtractor();
            case GROUPING -> new GroupingExtractor();
            case TIMING -> new TimingExtractor();
            case LOOPING -> new LoopingExtractor();
        };
    }
}

package ai.normcode.table.syntax;

import ai.normcode.model.FlowInfo;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.WorkingInterpretation;

public final class ImperativeExtractor implements SyntaxExtractor {

    @Override
    public WorkingInterpretation extract(InferenceCluster cluster, FlowInfo flowInfo) {
        final ValueBindings bindings = ValueBindings.of(cluster);
        return new WorkingInterpretation.Imperative(
                WorkingInterpretation.emptyWorkspace(),
                flowInfo,
                ValueBindings.paradigm(cluster),
                ValueBindings.bodyFaculty(cluster),
                bindings.order(),
                bindings.selectors(),
                ValueBindings.outputAxis(cluster)
        );
    }
}

package ai.normcode.table.syntax;

import ai.normcode.model.FlowInfo;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.WorkingInterpretation;
import ai.normcode.model.WorkingInterpretation.AssertionCondition;

/**
 * Imperative bindings plus the assertion a judgement makes; "&lt;ALL True&gt;" in the operator
 * asserts truth along every axis.
 */
public final class JudgementExtractor implements SyntaxExtractor {

    static final String ALL_TRUE = "<ALL True>";

    @Override
    public WorkingInterpretation extract(InferenceCluster cluster, FlowInfo flowInfo) {
        final ValueBindings bindings = ValueBindings.of(cluster);
        final AssertionCondition assertion = cluster.functionConcept().text().contains(ALL_TRUE)
                ? AssertionCondition.allTrue()
                : null;
        return new WorkingInterpretation.Judgement(
                WorkingInterpretation.emptyWorkspace(),
                flowInfo,
                ValueBindings.paradigm(cluster),
                ValueBindings.bodyFaculty(cluster),
                bindings.order(),
                bindings.selectors(),
                assertion,
                ValueBindings.outputAxis(cluster)
        );
    }
}

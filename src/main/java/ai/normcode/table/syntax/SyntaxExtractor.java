package ai.normcode.table.syntax;

import ai.normcode.model.FlowInfo;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.WorkingInterpretation;

/**
 * Builds the working interpretation of one sequence category from a cluster.
 */
public interface SyntaxExtractor {

    WorkingInterpretation extract(InferenceCluster cluster, FlowInfo flowInfo);
}

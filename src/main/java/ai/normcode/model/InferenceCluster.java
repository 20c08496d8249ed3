package ai.normcode.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One parent concept grouped with its operator, value and other children.
 * Only built when the parent has an operator child.
 */
public record InferenceCluster(
        @JsonProperty("concept_to_infer") ClassifiedLine conceptToInfer,  // may be null
        @JsonProperty("function_concept") ClassifiedLine functionConcept, // first "<=" child
        @JsonProperty("value_concepts") List<ClassifiedLine> valueConcepts,   // "<-" children
        @JsonProperty("other_concepts") List<ClassifiedLine> otherConcepts    // "<*" and further "<=" children
) {
    public InferenceCluster {
        valueConcepts = valueConcepts == null ? List.of() : List.copyOf(valueConcepts);
        otherConcepts = otherConcepts == null ? List.of() : List.copyOf(otherConcepts);
    }

    /**
     * Position of the cluster: the parent's, falling back to the operator's.
     */
    public String position() {
        if (conceptToInfer != null && conceptToInfer.flowIndex() != null) {
            return conceptToInfer.flowIndex();
        }
        return functionConcept == null ? null : functionConcept.flowIndex();
    }

    public List<ClassifiedLine> contextConcepts() {
        return otherConcepts.stream()
                .filter(c -> c.hasMarker(RoleMarker.CONTEXT))
                .toList();
    }

    /**
     * Single-operator cluster used when a nested operator is promoted to its own row.
     */
    public static InferenceCluster promoted(ClassifiedLine operator) {
        return new InferenceCluster(null, operator, List.of(), List.of());
    }
}

package ai.normcode.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Row of inference_repo.json.
 */
public record InferenceEntry(
        @JsonProperty("flow_info") FlowInfo flowInfo,
        @JsonProperty("inference_sequence") SequenceType inferenceSequence,
        @JsonProperty("concept_to_infer") String conceptToInfer,
        @JsonProperty("function_concept") String functionConcept, // operator text without "<="
        @JsonProperty("value_concepts") List<String> valueConcepts,
        @JsonProperty("context_concepts") List<String> contextConcepts,
        @JsonProperty("working_interpretation") WorkingInterpretation workingInterpretation
) {
    public InferenceEntry {
        valueConcepts = valueConcepts == null ? List.of() : List.copyOf(valueConcepts);
        contextConcepts = contextConcepts == null ? List.of() : List.copyOf(contextConcepts);
    }

    public String position() {
        return flowInfo == null ? null : flowInfo.flowIndex();
    }
}

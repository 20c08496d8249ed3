package ai.normcode.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Row of concept_repo.json. Identity is naturalName (the unformatted name) for value
 * concepts and the stripped operator text for function concepts.
 */
public record ConceptEntry(
        @JsonProperty("id") String id,                         // c-<slug> | fc-<slug>
        @JsonProperty("concept_name") String conceptName,      // {name} | <name> | [name] | operator text
        @JsonProperty("type") String type,                     // "{}" | "<>" | "[]" | "({})" | "<{}>"
        @JsonProperty("flow_indices") List<String> flowIndices, // sorted, distinct
        @JsonProperty("description") String description,
        @JsonProperty("is_ground_concept") boolean groundConcept,
        @JsonProperty("is_final_concept") boolean finalConcept,
        @JsonProperty("is_invariant") boolean invariant,
        @JsonProperty("reference_data") List<String> referenceData, // null when absent
        @JsonProperty("axis_name") String axisName,
        @JsonProperty("reference_axis_names") List<String> referenceAxisNames,
        @JsonProperty("reference_element_type") String referenceElementType,
        @JsonProperty("natural_name") String naturalName
) {
    public ConceptEntry {
        flowIndices = flowIndices == null ? List.of() : List.copyOf(flowIndices);
        referenceAxisNames = referenceAxisNames == null ? List.of() : List.copyOf(referenceAxisNames);
        if (referenceData != null) {
            referenceData = List.copyOf(referenceData);
        }
    }

    public String firstPosition() {
        return Positions.first(flowIndices);
    }
}

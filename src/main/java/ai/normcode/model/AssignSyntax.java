package ai.normcode.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Syntax of an assigning row, one variant per assigning marker family.
 */
public sealed interface AssignSyntax {

    String marker();

    /**
     * ".": source is one reference or a list of references.
     */
    record Specification(
            @JsonProperty("marker") String marker,
            @JsonProperty("assign_source") OneOrMany assignSource
    ) implements AssignSyntax {
        public Specification(OneOrMany assignSource) {
            this(".", assignSource);
        }
    }

    /**
     * "+": appends source onto destination along an axis.
     */
    record Continuation(
            @JsonProperty("marker") String marker,
            @JsonProperty("assign_source") String assignSource,
            @JsonProperty("assign_destination") String assignDestination,
            @JsonProperty("by_axes") String byAxes
    ) implements AssignSyntax {
        public Continuation(String assignSource, String assignDestination, String byAxes) {
            this("+", assignSource, assignDestination, byAxes);
        }
    }

    /**
     * "%": a literal face value shaped by the inferred concept's axes.
     */
    record Abstraction(
            @JsonProperty("marker") String marker,
            @JsonProperty("face_value") OneOrMany faceValue,
            @JsonProperty("axis_names") List<String> axisNames
    ) implements AssignSyntax {
        public Abstraction(OneOrMany faceValue, List<String> axisNames) {
            this("%", faceValue, axisNames);
        }
    }

    /**
     * Every other marker ("=", "-", ""): a single positional source.
     */
    record Direct(
            @JsonProperty("marker") String marker,
            @JsonProperty("assign_source") String assignSource
    ) implements AssignSyntax {
    }
}

package ai.normcode.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Category-specific payload of an inference row, one variant per {@link SequenceType}.
 * Every variant carries an empty workspace and the row's flow info.
 */
public sealed interface WorkingInterpretation {

    Map<String, Object> workspace();

    FlowInfo flowInfo();

    static Map<String, Object> emptyWorkspace() {
        return Map.of();
    }

    record Imperative(
            @JsonProperty("workspace") Map<String, Object> workspace,
            @JsonProperty("flow_info") FlowInfo flowInfo,
            @JsonProperty("paradigm") String paradigm,
            @JsonProperty("body_faculty") String bodyFaculty,
            @JsonProperty("value_order") Map<String, Integer> valueOrder,
            @JsonInclude(JsonInclude.Include.NON_EMPTY)
            @JsonProperty("value_selectors") Map<String, ValueSelector> valueSelectors,
            @JsonInclude(JsonInclude.Include.NON_NULL)
            @JsonProperty("output_axis") String outputAxis
    ) implements WorkingInterpretation {
        public Imperative {
            valueOrder = valueOrder == null ? Map.of() : new LinkedHashMap<>(valueOrder);
            valueSelectors = valueSelectors == null ? Map.of() : new LinkedHashMap<>(valueSelectors);
        }
    }

    record Judgement(
            @JsonProperty("workspace") Map<String, Object> workspace,
            @JsonProperty("flow_info") FlowInfo flowInfo,
            @JsonProperty("paradigm") String paradigm,
            @JsonProperty("body_faculty") String bodyFaculty,
            @JsonProperty("value_order") Map<String, Integer> valueOrder,
            @JsonInclude(JsonInclude.Include.NON_EMPTY)
            @JsonProperty("value_selectors") Map<String, ValueSelector> valueSelectors,
            @JsonInclude(JsonInclude.Include.NON_NULL)
            @JsonProperty("assertion_condition") AssertionCondition assertionCondition,
            @JsonInclude(JsonInclude.Include.NON_NULL)
            @JsonProperty("output_axis") String outputAxis
    ) implements WorkingInterpretation {
        public Judgement {
            valueOrder = valueOrder == null ? Map.of() : new LinkedHashMap<>(valueOrder);
            valueSelectors = valueSelectors == null ? Map.of() : new LinkedHashMap<>(valueSelectors);
        }
    }

    record Assigning(
            @JsonProperty("workspace") Map<String, Object> workspace,
            @JsonProperty("flow_info") FlowInfo flowInfo,
            @JsonProperty("syntax") AssignSyntax syntax
    ) implements WorkingInterpretation {
    }

    record Grouping(
            @JsonProperty("workspace") Map<String, Object> workspace,
            @JsonProperty("flow_info") FlowInfo flowInfo,
            @JsonProperty("syntax") GroupingSyntax syntax
    ) implements WorkingInterpretation {
    }

    record Timing(
            @JsonProperty("workspace") Map<String, Object> workspace,
            @JsonProperty("flow_info") FlowInfo flowInfo,
            @JsonProperty("syntax") TimingSyntax syntax,
            @JsonProperty("blackboard") Object blackboard
    ) implements WorkingInterpretation {
    }

    record Looping(
            @JsonProperty("workspace") Map<String, Object> workspace,
            @JsonProperty("flow_info") FlowInfo flowInfo,
            @JsonProperty("syntax") LoopingSyntax syntax
    ) implements WorkingInterpretation {
    }

    // --- syntax payloads ---

    record GroupingSyntax(
            @JsonProperty("marker") String marker,              // "in" | "across"
            @JsonProperty("sources") List<String> sources,
            @JsonProperty("create_axis") String createAxis,
            @JsonProperty("by_axes") List<List<String>> byAxes, // one entry per value concept
            @JsonProperty("by_axes_source") String byAxesSource
    ) {
    }

    record TimingSyntax(
            @JsonProperty("marker") String marker,      // "if" | "if!" | "after"
            @JsonProperty("condition") String condition
    ) {
    }

    record LoopingSyntax(
            @JsonProperty("marker") String marker,
            @JsonProperty("loop_index") int loopIndex,
            @JsonProperty("LoopBaseConcept") String loopBaseConcept,
            @JsonProperty("CurrentLoopBaseConcept") String currentLoopBaseConcept,
            @JsonProperty("CurrentLoopBaseSource") String currentLoopBaseSource,
            @JsonProperty("group_base") String groupBase,
            @JsonProperty("ConceptToInfer") List<String> conceptToInfer,
            @JsonInclude(JsonInclude.Include.NON_NULL)
            @JsonProperty("CarryStateConcept") String carryStateConcept,
            @JsonInclude(JsonInclude.Include.NON_NULL)
            @JsonProperty("CarryStateSource") String carryStateSource
    ) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ValueSelector(
            @JsonProperty("source_concept") String sourceConcept,
            @JsonProperty("key") String key,
            @JsonProperty("index") Integer index,
            @JsonProperty("packed") Boolean packed,
            @JsonProperty("unpack") Boolean unpack
    ) {
    }

    record AssertionCondition(
            @JsonProperty("quantifiers") Map<String, String> quantifiers,
            @JsonProperty("condition") boolean condition
    ) {
        public static AssertionCondition allTrue() {
            return new AssertionCondition(Map.of("axis", "all"), true);
        }
    }
}

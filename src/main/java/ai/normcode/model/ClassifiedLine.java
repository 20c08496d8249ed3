package ai.normcode.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One physical line after structural parsing (an element of the .nci.json intermediate).
 * <p>
 * type:
 * - "main"           concept line, carries the classifier result in ncMain/inferenceMarker/...
 * - "comment"        side line, text in ncComment
 * - "inline_comment" text after the first '|' of a line, text in ncComment
 * <p>
 * attachedComments is only filled once comments are merged onto their owning main line.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClassifiedLine(
        @JsonProperty("flow_index") String flowIndex,
        @JsonProperty("type") LineRole type,
        @JsonProperty("depth") int depth,
        @JsonProperty("nc_main") String ncMain,
        @JsonProperty("inference_marker") RoleMarker inferenceMarker,
        @JsonProperty("concept_type") ConceptKind conceptType,
        @JsonProperty("operator_type") OperatorKind operatorType,
        @JsonProperty("concept_name") String conceptName,
        @JsonInclude(JsonInclude.Include.NON_EMPTY)
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("ncn_content") String ncnContent,
        @JsonProperty("nc_comment") String ncComment,
        @JsonProperty("attached_comments") List<ClassifiedLine> attachedComments
) {

    public ClassifiedLine {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        if (attachedComments != null) {
            attachedComments = List.copyOf(attachedComments);
        }
    }

    public static ClassifiedLine main(String flowIndex, int depth, String ncMain, Classification c) {
        Objects.requireNonNull(ncMain, "ncMain");
        Objects.requireNonNull(c, "c");
        return new ClassifiedLine(flowIndex, LineRole.MAIN, depth, ncMain,
                c.roleMarker(), c.conceptKind(), c.operatorKind(), c.name(), c.warnings(),
                null, null, null);
    }

    public static ClassifiedLine comment(String flowIndex, int depth, LineRole role, String text) {
        Objects.requireNonNull(role, "role");
        return new ClassifiedLine(flowIndex, role, depth, null,
                null, null, null, null, List.of(),
                null, text, null);
    }

    @JsonIgnore
    public boolean isMain() {
        return type == LineRole.MAIN;
    }

    @JsonIgnore
    public boolean isInlineComment() {
        return type == LineRole.INLINE_COMMENT;
    }

    /**
     * Raw main text; "" for comment lines.
     */
    public String text() {
        return ncMain == null ? "" : ncMain;
    }

    public List<ClassifiedLine> comments() {
        return attachedComments == null ? List.of() : attachedComments;
    }

    public boolean hasMarker(RoleMarker marker) {
        return inferenceMarker == marker;
    }

    public ClassifiedLine withNcnContent(String content) {
        return new ClassifiedLine(flowIndex, type, depth, ncMain, inferenceMarker, conceptType,
                operatorType, conceptName, warnings, content, ncComment, attachedComments);
    }

    public ClassifiedLine withAttachedComments(List<ClassifiedLine> comments) {
        return new ClassifiedLine(flowIndex, type, depth, ncMain, inferenceMarker, conceptType,
                operatorType, conceptName, warnings, ncnContent, ncComment,
                comments == null ? List.of() : new ArrayList<>(comments));
    }
}

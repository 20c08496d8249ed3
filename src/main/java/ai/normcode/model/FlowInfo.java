package ai.normcode.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FlowInfo(@JsonProperty("flow_index") String flowIndex) {
}

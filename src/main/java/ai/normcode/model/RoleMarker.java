package ai.normcode.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Line-leading markers that give a concept line its role in the hierarchy.
 * Declaration order is the matching priority.
 */
public enum RoleMarker {
    ROOT_FINAL(":<:"),
    ROOT_EXTERNAL(":>:"),
    OPERATOR("<="),
    VALUE("<-"),
    CONTEXT("<*");

    private static final List<RoleMarker> PRIORITY = List.of(values());

    private final String token;

    RoleMarker(String token) {
        this.token = token;
    }

    @JsonValue
    public String token() {
        return token;
    }

    public boolean prefixes(String text) {
        return text != null && text.startsWith(token);
    }

    /**
     * First marker (in priority order) the text starts with, or null.
     */
    public static RoleMarker leading(String text) {
        if (text == null) {
            return null;
        }
        for (RoleMarker m : PRIORITY) {
            if (text.startsWith(m.token)) {
                return m;
            }
        }
        return null;
    }

    @JsonCreator
    public static RoleMarker fromToken(String token) {
        for (RoleMarker m : PRIORITY) {
            if (m.token.equals(token)) {
                return m;
            }
        }
        return null;
    }
}

package ai.normcode.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a physical line after structural parsing.
 */
public enum LineRole {
    MAIN("main"),
    COMMENT("comment"),
    INLINE_COMMENT("inline_comment");

    private final String wireName;

    LineRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static LineRole fromWireName(String wireName) {
        for (LineRole r : values()) {
            if (r.wireName.equals(wireName)) {
                return r;
            }
        }
        return COMMENT;
    }
}

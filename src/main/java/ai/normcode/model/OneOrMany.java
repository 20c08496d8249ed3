package ai.normcode.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A value the tables write either as a bare string or as a list of strings.
 */
public record OneOrMany(List<String> values, boolean asList) {

    public OneOrMany {
        values = List.copyOf(Objects.requireNonNull(values, "values"));
        if (!asList && values.size() != 1) {
            throw new IllegalArgumentException("single value expected, got " + values.size());
        }
    }

    public static OneOrMany single(String value) {
        return new OneOrMany(List.of(value), false);
    }

    public static OneOrMany list(List<String> values) {
        return new OneOrMany(values, true);
    }

    /**
     * Bare string for one element, list otherwise; null for no elements.
     */
    public static OneOrMany collapse(List<String> values) {
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.size() == 1 ? single(values.get(0)) : list(values);
    }

    public String first() {
        return values.isEmpty() ? null : values.get(0);
    }

    @JsonValue
    public Object json() {
        return asList ? values : values.get(0);
    }
}

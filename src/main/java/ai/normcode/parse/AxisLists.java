package ai.normcode.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parses axis annotations. Results are never empty: missing or unusable input yields the
 * "_none_axis" sentinel.
 */
public final class AxisLists {

    private AxisLists() {
    }

    /**
     * Simple axis list as used by %{ref_axes}: "[date, signal]", "[date]" or "date".
     */
    public static List<String> parseAxes(String text) {
        if (text == null || text.isBlank()) {
            return List.of(AxisSpec.NONE_AXIS);
        }
        final String inner = stripBrackets(text.strip());
        final List<String> axes = splitNames(inner);
        return axes.isEmpty() ? List.of(AxisSpec.NONE_AXIS) : axes;
    }

    /**
     * First axis of a simple axis list, or null when it is the sentinel.
     */
    public static String primaryOrNull(String text) {
        if (text == null) {
            return null;
        }
        final String first = parseAxes(text).get(0);
        return AxisSpec.NONE_AXIS.equals(first) ? null : first;
    }

    /**
     * Axis list that may be a scalar, a flat list or a list of lists, quoted or not:
     * "section", "[section, date]", "[[section], [date]]", "[['section']]".
     */
    public static AxisSpec parseAxisList(String text) {
        if (text == null || text.isBlank()) {
            return AxisSpec.none();
        }
        final String value = text.strip();

        final Optional<JsonNode> parsed = Literals.parse(value);
        if (parsed.isPresent()) {
            return fromLiteral(parsed.get());
        }

        if (value.startsWith("[[")) {
            final List<List<String>> groups = nestedGroups(value);
            if (groups.isEmpty()) {
                return new AxisSpec(List.of(List.of(AxisSpec.NONE_AXIS)), true);
            }
            return new AxisSpec(groups, true);
        }
        if (value.startsWith("[")) {
            final List<String> axes = splitNames(stripBrackets(value));
            return axes.isEmpty() ? AxisSpec.none() : AxisSpec.flat(axes);
        }
        return AxisSpec.flat(List.of(unquote(value)));
    }

    private static AxisSpec fromLiteral(JsonNode node) {
        if (!node.isArray()) {
            return AxisSpec.flat(List.of(Literals.scalarText(node)));
        }
        if (node.isEmpty()) {
            return AxisSpec.none();
        }
        if (node.get(0).isArray()) {
            final List<List<String>> groups = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                groups.add(item.isArray() ? Literals.strings(item) : List.of(Literals.scalarText(item)));
            }
            return new AxisSpec(groups, true);
        }
        return AxisSpec.flat(Literals.strings(node));
    }

    // "[[a, b], [c]]" -> [[a, b], [c]]
    private static List<List<String>> nestedGroups(String value) {
        final List<List<String>> groups = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '[') {
                depth++;
                if (depth == 2) {
                    current.setLength(0);
                } else if (depth > 2) {
                    current.append(c);
                }
            } else if (c == ']') {
                depth--;
                if (depth == 1) {
                    final List<String> inner = splitNames(current.toString());
                    if (!inner.isEmpty()) {
                        groups.add(inner);
                    }
                } else if (depth >= 2) {
                    current.append(c);
                }
            } else if (depth >= 2) {
                current.append(c);
            }
        }
        return groups;
    }

    private static List<String> splitNames(String inner) {
        final List<String> out = new ArrayList<>();
        for (String part : inner.split(",")) {
            final String name = unquote(part.strip());
            if (!name.isEmpty()) {
                out.add(name);
            }
        }
        return out;
    }

    private static String stripBrackets(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == '[' || s.charAt(start) == ']')) {
            start++;
        }
        while (end > start && (s.charAt(end - 1) == '[' || s.charAt(end - 1) == ']')) {
            end--;
        }
        return s.substring(start, end);
    }

    private static String unquote(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == '"' || s.charAt(start) == '\'')) {
            start++;
        }
        while (end > start && (s.charAt(end - 1) == '"' || s.charAt(end - 1) == '\'')) {
            end--;
        }
        return s.substring(start, end).strip();
    }
}

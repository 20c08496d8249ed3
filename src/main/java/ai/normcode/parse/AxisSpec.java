package ai.normcode.parse;

import java.util.List;

/**
 * Parsed axis annotation. A flat list ("[date, signal]") is a single group with
 * nested == false; a list of lists ("[[date], [signal]]") has one group per inner list.
 */
public record AxisSpec(List<List<String>> groups, boolean nested) {

    public static final String NONE_AXIS = "_none_axis";

    public AxisSpec {
        groups = groups.stream().map(List::copyOf).toList();
    }

    public static AxisSpec flat(List<String> axes) {
        return new AxisSpec(List.of(axes), false);
    }

    public static AxisSpec none() {
        return flat(List.of(NONE_AXIS));
    }

    /**
     * Axes of a flat spec, or the first group of a nested one.
     */
    public List<String> firstGroup() {
        return groups.isEmpty() ? List.of(NONE_AXIS) : groups.get(0);
    }
}

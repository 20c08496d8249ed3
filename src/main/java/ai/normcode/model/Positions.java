package ai.normcode.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers for dot-separated hierarchical positions ("1.2.1").
 * Positions carry ordering and depth only.
 */
public final class Positions {

    private static final Pattern WELL_FORMED = Pattern.compile("\\d+(\\.\\d+)*");

    /**
     * Numeric-tuple order; null, empty or malformed positions sort last.
     */
    public static final Comparator<String> ORDER = Positions::compare;

    private Positions() {
    }

    /**
     * Dot-separated digit runs, each of which fits an int.
     */
    public static boolean isWellFormed(String position) {
        return !components(position).isEmpty();
    }

    /**
     * Numeric components; empty for null, empty, malformed or out-of-range positions.
     */
    public static List<Integer> components(String position) {
        if (position == null || !WELL_FORMED.matcher(position).matches()) {
            return List.of();
        }
        final String[] parts = position.split("\\.");
        final List<Integer> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            final Integer n = parseIntOrNull(p);
            if (n == null) {
                return List.of();
            }
            out.add(n);
        }
        return out;
    }

    /**
     * Integer value of a (possibly signed) digit run; null when absent or out of int range.
     */
    public static Integer parseIntOrNull(String digits) {
        if (digits == null) {
            return null;
        }
        try {
            return Integer.valueOf(digits.strip());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    public static String join(List<Integer> components) {
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < components.size(); i++) {
            if (i > 0) {
                sb.append('.');
            }
            sb.append(components.get(i));
        }
        return sb.toString();
    }

    public static int compare(String a, String b) {
        final List<Integer> ca = components(a);
        final List<Integer> cb = components(b);
        if (ca.isEmpty() || cb.isEmpty()) {
            if (ca.isEmpty() && cb.isEmpty()) {
                return 0;
            }
            return ca.isEmpty() ? 1 : -1;
        }
        final int n = Math.min(ca.size(), cb.size());
        for (int i = 0; i < n; i++) {
            final int c = Integer.compare(ca.get(i), cb.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(ca.size(), cb.size());
    }

    /**
     * First position of a row, compared with {@link #ORDER}; null for rows without positions.
     */
    public static String first(List<String> positions) {
        return positions == null || positions.isEmpty() ? null : positions.get(0);
    }

    /**
     * "1.2.3" becomes "1_2_3", for synthesized placeholder names.
     */
    public static String underscored(String position) {
        return position == null ? "unknown" : position.replace('.', '_');
    }
}

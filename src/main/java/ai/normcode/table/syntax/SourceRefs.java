package ai.normcode.table.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Positional source markers inside operator text.
 */
public final class SourceRefs {

    private static final Pattern OBJECT_SOURCE = Pattern.compile("%>\\(\\{([^}]+)\\}\\)");
    private static final Pattern RELATION_SOURCE = Pattern.compile("%>\\(\\[([^\\]]+)\\]\\)");
    private static final Pattern PROPOSITION_SOURCE = Pattern.compile("%>\\(<([^>]+)>\\)");
    private static final Pattern LISTED_OBJECT_SOURCE = Pattern.compile("%>\\[\\{([^}]+)\\}");

    private SourceRefs() {
    }

    /**
     * Single source from %>({x}), %>([x]) or %>(&lt;x&gt;), tried in that order, with the
     * brackets of its kind; null when none is present.
     */
    public static String singleSource(String text) {
        String g = group(OBJECT_SOURCE, text);
        if (g != null) {
            return "{" + g + "}";
        }
        g = group(RELATION_SOURCE, text);
        if (g != null) {
            return "[" + g + "]";
        }
        g = group(PROPOSITION_SOURCE, text);
        if (g != null) {
            return "<" + g + ">";
        }
        return null;
    }

    /**
     * First object inside a bracketed source list, %>[{x}, ...]; null when absent.
     */
    public static String firstListedObject(String text) {
        final String g = group(LISTED_OBJECT_SOURCE, text);
        return g == null ? null : "{" + g + "}";
    }

    /**
     * Splits "{a}, [b, c], &lt;d&gt;" on top-level commas only.
     */
    public static List<String> splitTopLevel(String text) {
        final List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        final StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '{' || c == '[' || c == '<') {
                depth++;
                current.append(c);
            } else if (c == '}' || c == ']' || c == '>') {
                depth--;
                current.append(c);
            } else if (c == ',' && depth == 0) {
                addIfPresent(out, current);
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        addIfPresent(out, current);
        return out;
    }

    /**
     * Content of the bracket list opened by {@code opener} (which ends with '['), up to its
     * matching ']'; null when the opener is absent or never closed.
     */
    public static String bracketListAfter(String opener, String text) {
        if (text == null) {
            return null;
        }
        final int start = text.indexOf(opener);
        if (start < 0) {
            return null;
        }
        final int from = start + opener.length();
        int depth = 1;
        for (int i = from; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']' && --depth == 0) {
                return text.substring(from, i);
            }
        }
        return null;
    }

    public static String group(Pattern p, String text) {
        if (text == null) {
            return null;
        }
        final Matcher m = p.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    private static void addIfPresent(List<String> out, StringBuilder current) {
        final String s = current.toString().strip();
        if (!s.isEmpty()) {
            out.add(s);
        }
    }
}

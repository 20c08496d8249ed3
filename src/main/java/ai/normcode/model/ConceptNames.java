package ai.normcode.model;

import java.util.Locale;
import java.util.regex.Pattern;

public final class ConceptNames {

    private static final Pattern BRACKETS = Pattern.compile("[{}\\[\\]<>]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NOT_ID_CHAR = Pattern.compile("[^a-z0-9-]");
    private static final Pattern NOT_ALNUM_RUN = Pattern.compile("[^a-z0-9]+");
    private static final Pattern OPERATOR_PREFIX = Pattern.compile("^<=\\s*");

    private static final int MAX_FUNCTION_ID_LENGTH = 50;

    private ConceptNames() {
    }

    /**
     * Wraps a name in the brackets of its kind: {object}, &lt;proposition&gt;, [relation].
     * Every other kind is written as an object.
     */
    public static String format(String name, ConceptKind kind) {
        if (kind == ConceptKind.PROPOSITION) {
            return "<" + name + ">";
        }
        if (kind == ConceptKind.RELATION) {
            return "[" + name + "]";
        }
        return "{" + name + "}";
    }

    public static String typeMarker(ConceptKind kind) {
        if (kind == ConceptKind.PROPOSITION) {
            return "<>";
        }
        if (kind == ConceptKind.RELATION) {
            return "[]";
        }
        return "{}";
    }

    public static String conceptId(String name) {
        String clean = BRACKETS.matcher(name).replaceAll("");
        clean = clean.trim().toLowerCase(Locale.ROOT);
        clean = WHITESPACE.matcher(clean).replaceAll("-");
        clean = NOT_ID_CHAR.matcher(clean).replaceAll("");
        return "c-" + clean;
    }

    public static String functionId(String naturalName) {
        String slug = NOT_ALNUM_RUN.matcher(naturalName.toLowerCase(Locale.ROOT)).replaceAll("-");
        slug = stripDashes(slug);
        if (slug.length() > MAX_FUNCTION_ID_LENGTH) {
            slug = slug.substring(0, MAX_FUNCTION_ID_LENGTH);
        }
        return "fc-" + slug;
    }

    /**
     * Removes a leading operator role marker ("&lt;=") and the whitespace after it.
     */
    public static String stripOperatorMarker(String text) {
        if (text == null) {
            return null;
        }
        return OPERATOR_PREFIX.matcher(text).replaceFirst("");
    }

    /**
     * True for names that already carry concept brackets.
     */
    public static boolean isBracketed(String ref) {
        return ref.startsWith("{") || ref.startsWith("[") || ref.startsWith("<");
    }

    private static String stripDashes(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == '-') {
            start++;
        }
        while (end > start && s.charAt(end - 1) == '-') {
            end--;
        }
        return s.substring(start, end);
    }
}

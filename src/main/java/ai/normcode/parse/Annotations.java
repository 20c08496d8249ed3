package ai.normcode.parse;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.LineRole;
import ai.normcode.model.OneOrMany;

/**
 * Reads side annotations from the comments attached to a concept line.
 * <p>
 * Forms:
 * - keyed:   | %{key}: value
 * - literal: | %{literal<$% name>}: value
 * - inline:  ?{key}: value | ?{other}: value
 */
public final class Annotations {

    public static final String REF_AXES = "ref_axes";
    public static final String REF_ELEMENT = "ref_element";
    public static final String REF_SHAPE = "ref_shape";
    public static final String FILE_LOCATION = "file_location";
    public static final String IS_INVARIANT = "is_invariant";
    public static final String IS_GROUND = "is_ground";
    public static final String LITERAL_VALUE = "literal_value";
    public static final String V_INPUT_PROVISION = "v_input_provision";
    public static final String NORM_INPUT = "norm_input";
    public static final String BODY_FACULTY = "body_faculty";
    public static final String VALUE_ORDER = "value_order";
    public static final String SELECTOR_SOURCE = "selector_source";
    public static final String SELECTOR_KEY = "selector_key";
    public static final String SELECTOR_INDEX = "selector_index";
    public static final String SELECTOR_PACKED = "selector_packed";
    public static final String SELECTOR_UNPACK = "selector_unpack";
    public static final String ASSIGN_SOURCES = "assign_sources";
    public static final String BY_AXES = "by_axes";
    public static final String COLLAPSE_IN_GROUPING = "collapse_in_grouping";
    public static final String GROUP_BASE = "group_base";

    public static final String TAG_SEQUENCE = "sequence";
    public static final String TAG_FLOW_INDEX = "flow_index";

    public static final String GROUND_COMMENT = "/: Ground:";

    private static final Pattern LITERAL = Pattern.compile(
            "\\|\\s*%\\{literal<\\$([%=.+-])\\s*([^>]+)>\\}:\\s*(.+)");
    private static final Pattern INLINE_TAG = Pattern.compile("\\?\\{(\\w+)\\}:\\s*(.+)");
    private static final Pattern LITERAL_NAME = Pattern.compile(":\\s*[\"']([^\"']+)[\"']");

    private Annotations() {
    }

    /**
     * A literal annotation: the concept it names and its face value.
     */
    public record LiteralAnnotation(String conceptName, String marker, OneOrMany value) {
    }

    /**
     * Value of "| %{key}: value" in one comment text, trimmed; null if absent.
     */
    public static String keyed(String commentText, String key) {
        if (commentText == null) {
            return null;
        }
        final Pattern p = Pattern.compile("\\|\\s*%\\{\\s*" + Pattern.quote(key) + "\\s*\\}:\\s*(.+)");
        final Matcher m = p.matcher(commentText);
        return m.find() ? m.group(1).strip() : null;
    }

    /**
     * First non-empty keyed value among the attached (non-inline) comments.
     */
    public static String value(List<ClassifiedLine> comments, String key) {
        for (ClassifiedLine c : comments) {
            if (c.type() != LineRole.COMMENT) {
                continue;
            }
            final String v = keyed(c.ncComment(), key);
            if (v != null && !v.isEmpty()) {
                return v;
            }
        }
        return null;
    }

    public static String value(ClassifiedLine line, String key) {
        return line == null ? null : value(line.comments(), key);
    }

    public static boolean isTrue(List<ClassifiedLine> comments, String key) {
        final String v = value(comments, key);
        return v != null && "true".equalsIgnoreCase(v);
    }

    /**
     * First literal annotation, optionally restricted to one assigning marker ("%", "=", ...).
     */
    public static LiteralAnnotation literal(List<ClassifiedLine> comments, String marker) {
        for (ClassifiedLine c : comments) {
            final String text = c.ncComment();
            if (text == null) {
                continue;
            }
            final Matcher m = LITERAL.matcher(text);
            if (!m.find()) {
                continue;
            }
            final String found = m.group(1);
            if (marker != null && !marker.equals(found)) {
                continue;
            }
            return new LiteralAnnotation(m.group(2).strip(), found, Literals.wrap(m.group(3).strip()));
        }
        return null;
    }

    /**
     * Parses "?{a}: x | ?{b}: y" into {a=x, b=y}.
     */
    public static Map<String, String> inlineTags(String inlineComment) {
        final Map<String, String> out = new LinkedHashMap<>();
        if (inlineComment == null) {
            return out;
        }
        for (String part : inlineComment.split("\\|")) {
            final Matcher m = INLINE_TAG.matcher(part.strip());
            if (m.find()) {
                out.put(m.group(1), m.group(2).strip());
            }
        }
        return out;
    }

    /**
     * Explicit ?{sequence} tag from the inline comments; null when none.
     */
    public static String sequenceTag(List<ClassifiedLine> comments) {
        for (ClassifiedLine c : comments) {
            if (!c.isInlineComment()) {
                continue;
            }
            final String v = inlineTags(c.ncComment()).get(TAG_SEQUENCE);
            if (v != null) {
                return v;
            }
        }
        return null;
    }

    public static boolean hasGroundComment(List<ClassifiedLine> comments) {
        for (ClassifiedLine c : comments) {
            if (c.ncComment() != null && c.ncComment().contains(GROUND_COMMENT)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Literal carried by a concept's own name: {@code phase: "phase_1"} gives phase_1.
     */
    public static String literalFromName(String conceptName) {
        if (conceptName == null) {
            return null;
        }
        final Matcher m = LITERAL_NAME.matcher(conceptName);
        return m.find() ? m.group(1) : null;
    }
}

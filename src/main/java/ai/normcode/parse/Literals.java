package ai.normcode.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import ai.normcode.model.OneOrMany;

/**
 * Structural literals inside annotations: numbers, quoted strings (single or double quotes),
 * True / False / None, and flat or nested lists of those. Scalars print back in the same
 * notation, so None stays None and true prints as True.
 */
public final class Literals {

    private static final ObjectMapper LENIENT = JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build();

    private Literals() {
    }

    /**
     * Parses text as a literal; empty when it is not one.
     */
    public static Optional<JsonNode> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        try {
            final JsonNode node = LENIENT.readTree(jsonKeywords(text.strip()));
            if (node == null || node.isMissingNode() || node.isObject()) {
                return Optional.empty();
            }
            return Optional.of(node);
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }

    /**
     * String form of a parsed scalar; containers keep their literal text.
     */
    public static String scalarText(JsonNode node) {
        if (node == null || node.isNull()) {
            return "None";
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? "True" : "False";
        }
        if (node.isContainerNode()) {
            return node.toString();
        }
        return node.asText();
    }

    /**
     * Rewrites the bare words True, False and None outside quotes as true, false and null.
     */
    static String jsonKeywords(String text) {
        final StringBuilder out = new StringBuilder(text.length());
        char quote = 0;
        int i = 0;
        while (i < text.length()) {
            final char c = text.charAt(i);
            if (quote != 0) {
                out.append(c);
                if (c == '\\' && i + 1 < text.length()) {
                    out.append(text.charAt(++i));
                } else if (c == quote) {
                    quote = 0;
                }
                i++;
            } else if (c == '"' || c == '\'') {
                quote = c;
                out.append(c);
                i++;
            } else if (Character.isLetter(c) || c == '_') {
                int end = i;
                while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '_')) {
                    end++;
                }
                final String word = text.substring(i, end);
                switch (word) {
                    case "True" -> out.append("true");
                    case "False" -> out.append("false");
                    case "None" -> out.append("null");
                    default -> out.append(word);
                }
                i = end;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    public static List<String> strings(JsonNode array) {
        final List<String> out = new ArrayList<>(array.size());
        for (JsonNode item : array) {
            out.add(scalarText(item));
        }
        return out;
    }

    /**
     * Wraps a literal in face-value notation: 1 becomes %(1), [1, 2] becomes [%(1), %(2)].
     * Text that does not parse is wrapped as-is.
     */
    public static OneOrMany wrap(String raw) {
        final Optional<JsonNode> parsed = parse(raw);
        if (parsed.isEmpty()) {
            return OneOrMany.single("%(" + (raw == null ? "" : raw.strip()) + ")");
        }
        final JsonNode node = parsed.get();
        if (node.isArray()) {
            final List<String> wrapped = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                wrapped.add("%(" + scalarText(item) + ")");
            }
            return OneOrMany.list(wrapped);
        }
        return OneOrMany.single("%(" + scalarText(node) + ")");
    }
}

package ai.normcode.reindex;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.normcode.model.Positions;
import ai.normcode.model.RoleMarker;

/**
 * Rewrites the ?{flow_index} tag of every role line from the indentation hierarchy.
 * <p>
 * Roots count up from the base index; children are parent.1, parent.2, ...
 * Every other line, and every line separator, is kept as is.
 */
public final class FlowIndexRegenerator {

    private static final Logger log = LoggerFactory.getLogger(FlowIndexRegenerator.class);

    public static final String DEFAULT_BASE_INDEX = "1";

    private static final Pattern EXISTING_TAG = Pattern.compile("\\?\\{flow_index\\}(?::(?:[ \\t]*[\\d.]+)?)?");
    private static final String TAG = "?{flow_index}";
    private static final String ANNOTATION_SEPARATOR = " | ";

    private final List<Integer> base;

    public FlowIndexRegenerator() {
        this(DEFAULT_BASE_INDEX);
    }

    public FlowIndexRegenerator(String baseIndex) {
        if (!Positions.isWellFormed(baseIndex)) {
            throw new IllegalArgumentException("Invalid base index: " + baseIndex);
        }
        this.base = Positions.components(baseIndex);
    }

    /**
     * Updated text plus the position given to each role line (0-based line number).
     */
    public record Result(String content, Map<Integer, String> positions) {
        public int updatedCount() {
            return positions.size();
        }
    }

    private static final class Node {
        final int indent;
        final String position;
        int children;

        Node(int indent, String position) {
            this.indent = indent;
            this.position = position;
        }
    }

    public Result regenerate(String content) {
        Objects.requireNonNull(content, "content");

        final String[] lines = content.split("\n", -1);
        final Map<Integer, String> positions = assign(lines);

        final StringBuilder out = new StringBuilder(content.length() + positions.size() * 24);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) {
                out.append('\n');
            }
            final String position = positions.get(i);
            out.append(position == null ? lines[i] : withPosition(lines[i], position));
        }
        return new Result(out.toString(), positions);
    }

    /**
     * Regenerates a file in place; with dryRun the file is left untouched.
     */
    public Result regenerate(Path file, boolean dryRun) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("File not found: " + file);
        }
        final Result result = regenerate(Files.readString(file, StandardCharsets.UTF_8));
        if (!dryRun) {
            Files.writeString(file, result.content(), StandardCharsets.UTF_8);
            log.info("Updated {} flow indices in {}", result.updatedCount(), file);
        }
        return result;
    }

    private Map<Integer, String> assign(String[] lines) {
        final Map<Integer, Integer> indents = new LinkedHashMap<>();
        int minIndent = Integer.MAX_VALUE;
        for (int i = 0; i < lines.length; i++) {
            if (isRoleLine(lines[i])) {
                final int indent = indentOf(lines[i]);
                indents.put(i, indent);
                minIndent = Math.min(minIndent, indent);
            }
        }

        final Map<Integer, String> positions = new LinkedHashMap<>();
        final Deque<Node> stack = new ArrayDeque<>();
        int roots = 0;
        for (Map.Entry<Integer, Integer> e : indents.entrySet()) {
            final int indent = e.getValue();
            while (!stack.isEmpty() && stack.peek().indent >= indent) {
                stack.pop();
            }
            final String position;
            if (indent == minIndent || stack.isEmpty()) {
                stack.clear();
                position = rootPosition(roots++);
            } else {
                final Node parent = stack.peek();
                position = parent.position + "." + (++parent.children);
            }
            stack.push(new Node(indent, position));
            positions.put(e.getKey(), position);
        }
        return positions;
    }

    private String rootPosition(int offset) {
        final List<Integer> components = new ArrayList<>(base);
        final int last = components.size() - 1;
        components.set(last, components.get(last) + offset);
        return Positions.join(components);
    }

    static boolean isRoleLine(String line) {
        final String stripped = line.strip();
        if (stripped.isEmpty()) {
            return false;
        }
        return RoleMarker.leading(stripped) != null;
    }

    static int indentOf(String line) {
        int n = 0;
        while (n < line.length() && Character.isWhitespace(line.charAt(n))) {
            n++;
        }
        return n;
    }

    /**
     * Replaces an existing tag (an empty one included), else inserts one after the first " | ",
     * else appends one.
     * A trailing carriage return stays at the end of the line.
     */
    static String withPosition(String line, String position) {
        String body = line;
        String cr = "";
        if (body.endsWith("\r")) {
            body = body.substring(0, body.length() - 1);
            cr = "\r";
        }
        final String tag = TAG + ": " + position;

        if (body.contains(TAG)) {
            return EXISTING_TAG.matcher(body).replaceAll(Matcher.quoteReplacement(tag)) + cr;
        }
        final int sep = body.indexOf(ANNOTATION_SEPARATOR);
        if (sep >= 0) {
            return body.substring(0, sep) + ANNOTATION_SEPARATOR + tag + ANNOTATION_SEPARATOR
                    + body.substring(sep + ANNOTATION_SEPARATOR.length()) + cr;
        }
        return body.stripTrailing() + ANNOTATION_SEPARATOR + tag + cr;
    }
}

package ai.normcode.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.normcode.model.Classification;
import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.LineRole;
import ai.normcode.model.Positions;

/**
 * Turns plan text into an ordered list of classified lines.
 * <p>
 * - depth = leading spaces / 4
 * - concept lines get a position from a per-depth counter stack, unless they carry an
 *   explicit ?{flow_index} tag, which is adopted and resets the stack
 * - every other line inherits the position of the nearest preceding concept line
 * - text after the first unescaped '|' becomes a separate inline comment line
 * - a "|?{natural language}: ..." line right after a concept line is folded into it
 */
public final class StructuralParser {

    private static final Logger log = LoggerFactory.getLogger(StructuralParser.class);

    public static final int INDENT_WIDTH = 4;

    private static final List<String> CONCEPT_PREFIXES = List.of(
            ":<:", ":>:", "<=", "<-", "<*", "$%", "$.", "*.", "$+", "&[", "@:", "::");

    private static final String NCN_PREFIX = "|?{natural language}:";
    private static final String NCN_SHORT_PREFIX = "|?{";

    private static final Pattern EXPLICIT_POSITION = Pattern.compile(
            "\\?\\{(?:flow_index|position)\\}:\\s*([\\d.]+)");

    private int warnedLines;

    /**
     * One line before natural-language merging.
     */
    private record RawLine(String content, int depth, String flowIndex, LineRole role, Classification c) {
    }

    public List<ClassifiedLine> parse(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return merge(assignPositions(text.lines().toList()));
    }

    public int warnedLineCount() {
        return warnedLines;
    }

    public static int depthOf(String rawLine) {
        int spaces = 0;
        while (spaces < rawLine.length() && Character.isWhitespace(rawLine.charAt(spaces))) {
            spaces++;
        }
        return spaces / INDENT_WIDTH;
    }

    public static boolean isConceptLine(String mainPart) {
        for (String prefix : CONCEPT_PREFIXES) {
            if (mainPart.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private List<RawLine> assignPositions(List<String> lines) {
        final List<RawLine> out = new ArrayList<>();
        List<Integer> counters = new ArrayList<>();
        String lastPosition = null;

        for (String raw : lines) {
            if (raw.isBlank()) {
                continue;
            }
            final int depth = depthOf(raw);
            final String content = raw.strip();

            final boolean ncn = content.startsWith(NCN_PREFIX) || content.startsWith(NCN_SHORT_PREFIX);
            String mainPart = content;
            String inlineComment = null;
            String explicitPosition = null;

            if (!ncn) {
                final int pipe = firstUnescapedPipe(content);
                if (pipe >= 0) {
                    mainPart = content.substring(0, pipe).strip();
                    inlineComment = content.substring(pipe + 1).strip();
                    explicitPosition = explicitPosition(inlineComment);
                }
            }

            final boolean concept = isConceptLine(mainPart);
            final String position;
            if (concept) {
                if (explicitPosition != null) {
                    position = explicitPosition;
                    counters = new ArrayList<>(Positions.components(explicitPosition));
                } else {
                    while (counters.size() <= depth) {
                        counters.add(0);
                    }
                    counters = new ArrayList<>(counters.subList(0, depth + 1));
                    counters.set(depth, counters.get(depth) + 1);
                    position = Positions.join(counters);
                }
                lastPosition = position;
            } else {
                position = lastPosition;
            }

            if (!concept && mainPart.isEmpty() && inlineComment != null) {
                out.add(new RawLine("| " + inlineComment, depth, position, LineRole.COMMENT, null));
                continue;
            }
            if (concept || !mainPart.isEmpty()) {
                final Classification c = concept ? MarkerClassifier.classify(mainPart) : null;
                if (c != null && !c.warnings().isEmpty()) {
                    warnedLines++;
                    log.debug("Line {} ({}): {}", position, mainPart, c.warnings());
                }
                out.add(new RawLine(mainPart, depth, position, concept ? LineRole.MAIN : LineRole.COMMENT, c));
            }
            if (inlineComment != null && !inlineComment.isEmpty()) {
                out.add(new RawLine(inlineComment, depth, position, LineRole.INLINE_COMMENT, null));
            }
        }
        return out;
    }

    private static List<ClassifiedLine> merge(List<RawLine> raw) {
        final List<ClassifiedLine> out = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            final RawLine line = raw.get(i);
            if (line.role() == LineRole.MAIN) {
                ClassifiedLine main = ClassifiedLine.main(line.flowIndex(), line.depth(), line.content(), line.c());

                int lookahead = i + 1;
                if (lookahead < raw.size() && raw.get(lookahead).role() == LineRole.INLINE_COMMENT) {
                    lookahead++;
                }
                if (lookahead < raw.size()) {
                    final String next = raw.get(lookahead).content();
                    if (isNaturalLanguage(next)) {
                        main = main.withNcnContent(naturalLanguageText(next));
                    }
                }
                out.add(main);
            } else if (line.role() == LineRole.COMMENT && isNaturalLanguage(line.content())) {
                // already folded into its concept line
                continue;
            } else {
                out.add(ClassifiedLine.comment(line.flowIndex(), line.depth(), line.role(), line.content()));
            }
        }
        return out;
    }

    /**
     * Main lines keyed by position, each carrying the comment lines that share its position.
     * A later main line with the same position replaces an earlier one.
     */
    public static Map<String, ClassifiedLine> attachComments(List<ClassifiedLine> lines) {
        final Map<String, ClassifiedLine> mains = new LinkedHashMap<>();
        final Map<String, List<ClassifiedLine>> comments = new LinkedHashMap<>();
        for (ClassifiedLine line : lines) {
            final String position = line.flowIndex();
            if (position == null) {
                continue;
            }
            if (line.isMain()) {
                mains.put(position, line);
                comments.computeIfAbsent(position, k -> new ArrayList<>());
            } else {
                comments.computeIfAbsent(position, k -> new ArrayList<>()).add(line);
            }
        }
        final Map<String, ClassifiedLine> out = new LinkedHashMap<>();
        for (var e : mains.entrySet()) {
            out.put(e.getKey(), e.getValue().withAttachedComments(comments.get(e.getKey())));
        }
        return out;
    }

    private static boolean isNaturalLanguage(String content) {
        return content.startsWith(NCN_PREFIX) || content.startsWith(NCN_SHORT_PREFIX);
    }

    private static String naturalLanguageText(String content) {
        if (content.contains(NCN_PREFIX)) {
            return content.substring(content.indexOf(NCN_PREFIX) + NCN_PREFIX.length()).strip();
        }
        final int colon = content.indexOf(':');
        return colon >= 0 ? content.substring(colon + 1).strip() : "";
    }

    private static String explicitPosition(String inlineComment) {
        if (inlineComment == null) {
            return null;
        }
        final Matcher m = EXPLICIT_POSITION.matcher(inlineComment);
        if (!m.find()) {
            return null;
        }
        String value = m.group(1);
        while (value.endsWith(".")) {
            value = value.substring(0, value.length() - 1);
        }
        if (!Positions.isWellFormed(value)) {
            log.warn("Ignoring explicit position '{}': not a valid position", value);
            return null;
        }
        return value;
    }

    private static int firstUnescapedPipe(String content) {
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '|' && (i == 0 || content.charAt(i - 1) != '\\')) {
                return i;
            }
        }
        return -1;
    }
}

package ai.normcode.table.syntax;

import java.util.regex.Pattern;

import ai.normcode.model.FlowInfo;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.WorkingInterpretation;
import ai.normcode.model.WorkingInterpretation.TimingSyntax;

/**
 * Timing rows.
 * <p>
 * marker:
 * - "if!"   for @:!
 * - "if"    for @:'
 * - "after" for @.
 * The condition of "after" keeps its own brackets (object brackets when it has none);
 * the conditional markers always test a proposition.
 */
public final class TimingExtractor implements SyntaxExtractor {

    private static final Pattern CONDITION = Pattern.compile("@[:'!.]+\\s*\\(<?([^>)]+)>?\\)");

    @Override
    public WorkingInterpretation extract(InferenceCluster cluster, FlowInfo flowInfo) {
        return new WorkingInterpretation.Timing(
                WorkingInterpretation.emptyWorkspace(),
                flowInfo,
                syntax(cluster.functionConcept().text()),
                null);
    }

    static TimingSyntax syntax(String text) {
        final String marker;
        if (text.contains("@:!")) {
            marker = "if!";
        } else if (text.contains("@:'")) {
            marker = "if";
        } else if (text.contains("@.")) {
            marker = "after";
        } else {
            marker = "if";
        }

        final String condition = SourceRefs.group(CONDITION, text);
        String formatted = null;
        if (condition != null) {
            if ("after".equals(marker)) {
                formatted = condition.startsWith("{") || condition.startsWith("[") || condition.startsWith("<")
                        ? condition
                        : "{" + condition + "}";
            } else {
                formatted = "<" + condition + ">";
            }
        }
        return new TimingSyntax(marker, formatted);
    }
}

package ai.normcode;

import java.util.List;

import ai.normcode.model.InferenceCluster;
import ai.normcode.parse.ClusterBuilder;
import ai.normcode.parse.StructuralParser;

/**
 * Small plan sources for tests, one line per argument.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static String plan(String... lines) {
        return String.join("\n", lines) + "\n";
    }

    public static List<InferenceCluster> clusters(String... lines) {
        return ClusterBuilder.build(new StructuralParser().parse(plan(lines)));
    }

    public static InferenceCluster firstCluster(String... lines) {
        final List<InferenceCluster> clusters = clusters(lines);
        if (clusters.isEmpty()) {
            throw new IllegalStateException("no cluster in fixture");
        }
        return clusters.get(0);
    }
}

package ai.normcode.table;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.normcode.model.ClassifiedLine;
import ai.normcode.model.ConceptEntry;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.InferenceEntry;
import ai.normcode.parse.ClusterBuilder;
import ai.normcode.parse.StructuralParser;

/**
 * Text to tables: structural parse, clustering, then activation into the concept and
 * inference tables.
 */
public final class NormCodeCompiler {

    private static final Logger log = LoggerFactory.getLogger(NormCodeCompiler.class);

    private final CompilerOptions options;

    public NormCodeCompiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public NormCodeCompiler() {
        this(CompilerOptions.defaults());
    }

    public CompiledTables compile(String text) {
        Objects.requireNonNull(text, "text");

        final StructuralParser parser = new StructuralParser();
        final List<ClassifiedLine> lines = parser.parse(text);
        final List<InferenceCluster> clusters = ClusterBuilder.build(lines);
        log.info("Parsed {} lines into {} clusters", lines.size(), clusters.size());

        return activate(clusters, parser.warnedLineCount());
    }

    /**
     * Builds both tables from an already clustered source, e.g. a re-read .nci.json.
     */
    public CompiledTables activate(List<InferenceCluster> clusters) {
        return activate(clusters, 0);
    }

    private CompiledTables activate(List<InferenceCluster> clusters, int warnedLines) {
        Objects.requireNonNull(clusters, "clusters");

        final List<ConceptEntry> concepts = new ConceptTableBuilder(options.disambiguator()).build(clusters);
        final InferenceTableBuilder inferenceBuilder = new InferenceTableBuilder();
        final List<InferenceEntry> inferences = inferenceBuilder.build(clusters);
        log.info("Activated {} concepts and {} inferences", concepts.size(), inferences.size());

        return new CompiledTables(clusters, concepts, inferences, warnedLines, inferenceBuilder.droppedCount());
    }
}

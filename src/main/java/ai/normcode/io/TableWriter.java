package ai.normcode.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import ai.normcode.model.InferenceCluster;
import ai.normcode.table.CompiledTables;

/**
 * Writes the cluster intermediate and both tables as indented JSON.
 */
public final class TableWriter {

    public static final String CONCEPT_REPO = "concept_repo.json";
    public static final String INFERENCE_REPO = "inference_repo.json";

    private final Path outDir;
    private final ObjectMapper jsonMapper;

    public TableWriter(Path outDir) {
        this.outDir = Objects.requireNonNull(outDir, "outDir");
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path outDir() {
        return outDir;
    }

    public void writeTables(CompiledTables tables) throws IOException {
        Objects.requireNonNull(tables, "tables");

        Files.createDirectories(outDir);
        writeJson(outDir.resolve(CONCEPT_REPO), tables.concepts());
        writeJson(outDir.resolve(INFERENCE_REPO), tables.inferences());
    }

    /**
     * Writes the cluster list to an explicit file (not under outDir).
     */
    public void writeNci(Path file, List<InferenceCluster> clusters) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(clusters, "clusters");

        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writeJson(file, clusters);
    }

    /**
     * x.pf.ncd is written as x.pf.nci.json, any other name as &lt;name&gt;.nci.json.
     */
    public static Path nciPathFor(Path source) {
        final String name = source.getFileName().toString();
        final String nciName;
        if (name.endsWith(".pf.ncd")) {
            nciName = name.substring(0, name.length() - ".ncd".length()) + ".nci.json";
        } else {
            final int dot = name.lastIndexOf('.');
            nciName = (dot > 0 ? name.substring(0, dot) : name) + ".nci.json";
        }
        return source.resolveSibling(nciName);
    }

    private void writeJson(Path file, Object data) throws IOException {
        jsonMapper.writeValue(file.toFile(), data);
    }
}

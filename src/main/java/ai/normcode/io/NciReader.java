package ai.normcode.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import ai.normcode.model.InferenceCluster;

/**
 * Reads a .nci.json cluster list back for activation.
 */
public final class NciReader {

    private static final TypeReference<List<InferenceCluster>> CLUSTERS = new TypeReference<>() {
    };

    private final ObjectMapper jsonMapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public List<InferenceCluster> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Cluster file not found: " + file);
        }
        return jsonMapper.readValue(file.toFile(), CLUSTERS);
    }

    public static boolean isNci(Path file) {
        return file.getFileName().toString().endsWith(".nci.json");
    }
}

package ai.normcode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import ai.normcode.io.NciReader;
import ai.normcode.io.TableWriter;
import ai.normcode.model.InferenceCluster;
import ai.normcode.model.SequenceType;
import ai.normcode.table.CompiledTables;
import ai.normcode.table.CompilerOptions;
import ai.normcode.table.Disambiguator;
import ai.normcode.table.NormCodeCompiler;

public final class Main {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path input = null;
        Path outDir = null;
        boolean writeNci = true;
        Long seed = null;

        try {
            for (String arg : args) {
                if ("--help".equals(arg) || "-h".equals(arg)) {
                    printUsage();
                    return 0;
                }
                if (arg.startsWith("--outDir=")) {
                    outDir = Paths.get(arg.substring("--outDir=".length()));
                    continue;
                }
                if (arg.startsWith("--writeNci=")) {
                    writeNci = Boolean.parseBoolean(arg.substring("--writeNci=".length()));
                    continue;
                }
                if (arg.startsWith("--seed=")) {
                    final String value = arg.substring("--seed=".length()).trim();
                    try {
                        seed = Long.parseLong(value);
                    } catch (NumberFormatException ex) {
                        System.err.println("ERROR: invalid seed: " + value);
                        printUsage();
                        return 2;
                    }
                    continue;
                }
                if (arg.startsWith("--")) {
                    System.err.println("ERROR: unknown argument: " + arg);
                    printUsage();
                    return 2;
                }
                if (input == null) {
                    input = Paths.get(arg);
                    continue;
                }
                System.err.println("ERROR: unexpected argument: " + arg);
                printUsage();
                return 2;
            }

            if (input == null) {
                System.err.println("ERROR: missing input file");
                printUsage();
                return 2;
            }
            input = input.toAbsolutePath().normalize();
            final Path inputDir = input.getParent();

            if (outDir == null) {
                outDir = inputDir.resolve("repos");
            } else if (!outDir.isAbsolute()) {
                outDir = inputDir.resolve(outDir).normalize();
            }

            final CompilerOptions options = new CompilerOptions(
                    seed == null ? Disambiguator.counter() : Disambiguator.seeded(seed),
                    writeNci);
            final NormCodeCompiler compiler = new NormCodeCompiler(options);
            final TableWriter writer = new TableWriter(outDir);

            final CompiledTables tables;
            if (NciReader.isNci(input)) {
                final List<InferenceCluster> clusters = new NciReader().read(input);
                tables = compiler.activate(clusters);
            } else {
                if (!Files.isRegularFile(input)) {
                    throw new IOException("Input file not found: " + input);
                }
                tables = compiler.compile(Files.readString(input, StandardCharsets.UTF_8));
                if (options.writeIntermediate()) {
                    final Path nci = TableWriter.nciPathFor(input);
                    writer.writeNci(nci, tables.clusters());
                    System.out.println("Clusters written to: " + nci);
                }
            }
            writer.writeTables(tables);

            printSummary(tables, outDir);
            return 0;
        } catch (IOException ex) {
            System.err.println("ERROR: IO failure: " + safeMsg(ex.getMessage()));
            return 2;
        } catch (Exception ex) {
            System.err.println("ERROR: failed to compile: "
                    + ex.getClass().getSimpleName() + ": " + safeMsg(ex.getMessage()));
            return 1;
        }
    }

    private static void printSummary(CompiledTables tables, Path outDir) {
        System.out.println("Tables written to: " + outDir);
        System.out.println("Concepts: " + tables.valueConceptCount()
                + " value, " + tables.functionConceptCount() + " function");
        System.out.println("Ground concepts: " + tables.groundConceptNames());
        System.out.println("Final concepts: " + tables.finalConceptNames());

        final Map<SequenceType, Integer> bySequence = tables.rowsBySequence();
        System.out.println("Inferences: " + tables.inferences().size());
        for (var e : bySequence.entrySet()) {
            System.out.println("  " + e.getKey().inferenceSequence() + ": " + e.getValue());
        }

        final List<String> grouping = tables.groupingPositions();
        if (!grouping.isEmpty()) {
            System.err.println("WARN: grouping rows bundle their values, downstream readers may need"
                    + " packed selectors: " + grouping);
        }
        if (tables.warnedLines() > 0) {
            System.err.println("WARN: lines with classifier warnings: " + tables.warnedLines());
        }
        if (tables.droppedClusters() > 0) {
            System.err.println("WARN: clusters without a sequence type: " + tables.droppedClusters());
        }
    }

    private static void printUsage() {
        System.out.println("Usage: normcode-compiler <input> [options]");
        System.out.println("  <input>                 .pf.ncd/.ncd source, or a .nci.json cluster file");
        System.out.println("Options:");
        System.out.println("  --outDir=<path>         Output directory (default: <input dir>/repos)");
        System.out.println("  --writeNci=<bool>       Also write the .nci.json cluster file (default: true)");
        System.out.println("  --seed=<long>           Seed for paradigm reference tags (default: counter)");
        System.out.println("  --help, -h              Show this help");
    }

    private static String safeMsg(String msg) {
        if (msg == null) {
            return "";
        }
        return msg.length() > 200 ? msg.substring(0, 200) + "..." : msg;
    }
}

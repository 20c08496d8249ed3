package ai.normcode;

import java.nio.file.Path;
import java.nio.file.Paths;

import ai.normcode.reindex.FlowIndexRegenerator;

/**
 * Regenerates the ?{flow_index} tags of a source file in place.
 */
public final class FlowIndexMain {

    public static void main(String[] args) {
        final int code = run(args);
        if (code != 0) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        Path file = null;
        boolean dryRun = false;
        for (String arg : args) {
            if ("--dry-run".equals(arg)) {
                dryRun = true;
            } else if (file == null && !arg.startsWith("--")) {
                file = Paths.get(arg);
            }
        }
        if (file == null) {
            printUsage();
            return 1;
        }

        try {
            final FlowIndexRegenerator.Result result = new FlowIndexRegenerator().regenerate(file, dryRun);
            if (dryRun) {
                System.out.println("Dry run, nothing written.");
                System.out.println("Role lines with flow_index: " + result.updatedCount());
            } else {
                System.out.println("Updated " + result.updatedCount() + " flow indices in " + file);
            }
            return 0;
        } catch (Exception ex) {
            System.err.println("ERROR: " + ex.getClass().getSimpleName() + ": " + ex.getMessage());
            return 1;
        }
    }

    private static void printUsage() {
        System.out.println("Usage: flow-index <path/to/file.pf.ncd> [--dry-run]");
        System.out.println("  --dry-run    Count the positions without modifying the file");
    }
}

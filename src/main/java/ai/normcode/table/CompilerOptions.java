package ai.normcode.table;

import java.util.Objects;

/**
 * Knobs of one compilation run.
 */
public record CompilerOptions(
        Disambiguator disambiguator, // tags paradigm file references
        boolean writeIntermediate    // also write the .nci.json cluster list
) {
    public CompilerOptions {
        Objects.requireNonNull(disambiguator, "disambiguator");
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(Disambiguator.counter(), true);
    }

    public static CompilerOptions seeded(long seed, boolean writeIntermediate) {
        return new CompilerOptions(Disambiguator.seeded(seed), writeIntermediate);
    }
}

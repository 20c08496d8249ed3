package ai.normcode.table;

import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Short hex tag that keeps paradigm file references distinct in the concept table.
 * Three lowercase hex digits; uniqueness is not required.
 */
public interface Disambiguator {

    String next();

    /**
     * 000, 001, 002, ... wrapping after fff.
     */
    static Disambiguator counter() {
        final AtomicInteger n = new AtomicInteger();
        return () -> String.format("%03x", n.getAndIncrement() & 0xfff);
    }

    static Disambiguator seeded(long seed) {
        final Random random = new Random(seed);
        return () -> String.format("%03x", random.nextInt(0x1000));
    }
}

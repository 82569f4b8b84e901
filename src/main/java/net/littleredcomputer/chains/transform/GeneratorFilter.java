// Copyright 2018 Colin Smith. MIT License.
package net.littleredcomputer.chains.transform;

import net.littleredcomputer.chains.SGBRandom;

import javax.annotation.Nullable;
import java.util.stream.Stream;

/**
 * Randomly drops items with a fixed probability. Used to thin out enumerations before
 * the expensive work downstream of them.
 */
public class GeneratorFilter {
    private static final GeneratorFilter PASS_ALL = new GeneratorFilter(0.0, null);

    private final double probability;
    @Nullable private final SGBRandom random;

    /**
     * @param probability chance in [0, 1] that any given item is dropped
     * @param random source of draws; may be null only when probability is 0
     */
    public GeneratorFilter(double probability, @Nullable SGBRandom random) {
        if (!(probability >= 0 && probability <= 1)) {
            throw new IllegalArgumentException("filter probability must be in [0, 1]: " + probability);
        }
        if (probability > 0 && random == null) throw new IllegalArgumentException("a random source is required");
        this.probability = probability;
        this.random = random;
    }

    public static GeneratorFilter passAll() { return PASS_ALL; }

    public double probability() { return probability; }

    public boolean passes() {
        return probability == 0 || random.nextUnit() >= probability;
    }

    public <T> Stream<T> filter(Stream<T> items) {
        return probability == 0 ? items : items.filter(x -> passes());
    }
}

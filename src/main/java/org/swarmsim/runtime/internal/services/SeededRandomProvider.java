package org.swarmsim.runtime.internal.services;

import org.apache.commons.math3.random.Well19937c;
import org.swarmsim.runtime.spi.IRandomProvider;

/**
 * Default implementation of {@link IRandomProvider} backed by Apache Commons Math {@link Well19937c}.
 * <p>
 * Not thread-safe. Each simulation owns its own provider and only draws from it while seeding
 * the initial population.
 */
public final class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Well19937c rng;

    /**
     * Creates a new seeded random provider.
     * @param seed The initial seed for the random number generator.
     */
    public SeededRandomProvider(final long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    /**
     * Creates a provider with a seed derived from the clock, for simulations that did not ask
     * for a reproducible population.
     */
    public static SeededRandomProvider unseeded() {
        return new SeededRandomProvider(mix64(System.nanoTime() ^ Thread.currentThread().getId()));
    }

    @Override
    public double nextDouble() {
        return rng.nextDouble();
    }

    @Override
    public double nextGaussian() {
        return rng.nextGaussian();
    }

    public long getSeed() {
        return seed;
    }

    /**
     * A SplitMix64 mix function for good bit diffusion.
     * @param z The value to mix.
     * @return The mixed value.
     */
    private static long mix64(long z) {
        z = (z ^ (z >>> 33)) * 0xff51afd7ed558ccdL;
        z = (z ^ (z >>> 33)) * 0xc4ceb9fe1a85ec53L;
        return z ^ (z >>> 33);
    }
}

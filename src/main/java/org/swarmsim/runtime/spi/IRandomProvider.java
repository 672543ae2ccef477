package org.swarmsim.runtime.spi;

/**
 * Provides randomness scoped to a single simulation.
 * Implementations should be pure with respect to their seed so that two providers created with
 * the same seed produce the same sequence.
 */
public interface IRandomProvider {

    /**
     * Returns a random double in the range [0.0, 1.0).
     *
     * @return the random double
     */
    double nextDouble();

    /**
     * Returns a normally distributed value with mean 0 and standard deviation 1.
     *
     * @return the Gaussian sample
     */
    double nextGaussian();

    /**
     * Returns a random double uniformly distributed in {@code [min, max)}.
     *
     * @param min inclusive lower bound
     * @param max exclusive upper bound
     * @return the random double
     */
    default double nextUniform(final double min, final double max) {
        return min + (max - min) * nextDouble();
    }
}

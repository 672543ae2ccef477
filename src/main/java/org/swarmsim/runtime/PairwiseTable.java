package org.swarmsim.runtime;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.swarmsim.runtime.math.VectorMath;
import org.swarmsim.runtime.model.Agent;

import java.util.Arrays;
import java.util.List;

/**
 * Scratch table of pairwise distances and unit directions for one tick.
 * <p>
 * Each unordered pair is measured once; the entry for {@code (j, i)} reuses the distance of
 * {@code (i, j)} and stores the negated direction. Entries are indexed by position in the agent
 * list, not by agent id. Between ticks every entry holds the "unknown" sentinel ({@code NaN}
 * distance, {@code null} direction) and must not be read.
 * <p>
 * Not thread-safe. A table belongs to exactly one {@link FlockUpdateEngine}.
 */
public final class PairwiseTable {

    private double[][] distances = new double[0][0];
    private Vector3D[][] directions = new Vector3D[0][0];
    private int size;

    /**
     * Measures every pair of {@code agents}. Self entries stay at the sentinel.
     *
     * @param agents The agents of the current tick.
     */
    public void compute(final List<Agent> agents) {
        ensureCapacity(agents.size());
        size = agents.size();
        for (int i = 0; i < size; i++) {
            final Vector3D from = agents.get(i).getPosition();
            for (int j = i + 1; j < size; j++) {
                final Vector3D to = agents.get(j).getPosition();
                final double distance = VectorMath.distance(from, to);
                final Vector3D direction = VectorMath.normalize(to.subtract(from));
                distances[i][j] = distance;
                distances[j][i] = distance;
                directions[i][j] = direction;
                directions[j][i] = direction.negate();
            }
        }
    }

    /**
     * @return The distance between the agents at list positions {@code i} and {@code j}.
     * @throws IllegalStateException if the entry has not been computed this tick.
     */
    public double distance(final int i, final int j) {
        final double distance = distances[i][j];
        if (Double.isNaN(distance)) {
            throw new IllegalStateException("Distance " + i + "->" + j + " has not been computed for this tick");
        }
        return distance;
    }

    /**
     * @return The unit direction from agent {@code i} towards agent {@code j}, or the zero vector
     *         if they share a position.
     * @throws IllegalStateException if the entry has not been computed this tick.
     */
    public Vector3D direction(final int i, final int j) {
        final Vector3D direction = directions[i][j];
        if (direction == null) {
            throw new IllegalStateException("Direction " + i + "->" + j + " has not been computed for this tick");
        }
        return direction;
    }

    /**
     * Resets every entry to the sentinel.
     */
    public void reset() {
        for (int i = 0; i < distances.length; i++) {
            Arrays.fill(distances[i], Double.NaN);
            Arrays.fill(directions[i], null);
        }
        size = 0;
    }

    /**
     * @return {@code true} if no entry holds a value from a previous computation.
     */
    public boolean isReset() {
        for (int i = 0; i < distances.length; i++) {
            for (int j = 0; j < distances.length; j++) {
                if (!Double.isNaN(distances[i][j]) || directions[i][j] != null) {
                    return false;
                }
            }
        }
        return size == 0;
    }

    private void ensureCapacity(final int count) {
        if (distances.length == count) {
            return;
        }
        distances = new double[count][count];
        directions = new Vector3D[count][count];
        reset();
    }
}

package org.swarmsim.runtime;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.swarmsim.runtime.math.VectorMath;
import org.swarmsim.runtime.model.Agent;
import org.swarmsim.runtime.model.ZoneRadii;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes the next heading of every agent using zone-based flocking rules.
 * <p>
 * For each agent the neighbours are classified by distance:
 * <ul>
 *   <li>If any neighbour lies inside the zone of repulsion, only those neighbours count and the
 *       agent steers away from each of them.</li>
 *   <li>Otherwise orientation-zone neighbours contribute half of their heading and attraction-zone
 *       neighbours contribute half of the direction towards them. When only one of the two kinds
 *       contributed, the sum is doubled.</li>
 * </ul>
 * A sum that is exactly zero keeps the current heading; any other sum is normalized.
 * <p>
 * The engine never mutates the agents it is given. It owns one {@link PairwiseTable} which is
 * rebuilt at the start and reset at the end of every call, so an engine must not be shared by
 * concurrently ticking simulations.
 */
public final class FlockUpdateEngine {

    private final PairwiseTable table = new PairwiseTable();

    /**
     * Computes the new heading of every agent for one tick.
     *
     * @param agents The current agents. Not modified.
     * @param radii  The zone radii of the simulation.
     * @return New headings keyed by agent id, in the iteration order of {@code agents}.
     */
    public Map<Integer, Vector3D> computeNextHeadings(final List<Agent> agents, final ZoneRadii radii) {
        final Map<Integer, Vector3D> headings = new LinkedHashMap<>(agents.size() * 2);
        try {
            table.compute(agents);
            for (int i = 0; i < agents.size(); i++) {
                final Agent agent = agents.get(i);
                headings.put(agent.getId(), nextHeading(agents, i, radii));
            }
        } finally {
            table.reset();
        }
        return headings;
    }

    /**
     * @return {@code true} if no pairwise measurement survived the last call.
     */
    public boolean isScratchReset() {
        return table.isReset();
    }

    private Vector3D nextHeading(final List<Agent> agents, final int i, final ZoneRadii radii) {
        final boolean repulsionMode = hasRepulsionNeighbour(agents.size(), i, radii);
        Vector3D direction = Vector3D.ZERO;
        boolean sawOrientation = false;
        boolean sawAttraction = false;

        for (int j = 0; j < agents.size(); j++) {
            if (j == i) {
                continue;
            }
            final double distance = table.distance(i, j);
            if (repulsionMode) {
                if (radii.isRepulsion(distance)) {
                    direction = direction.subtract(table.direction(i, j));
                }
            } else if (radii.isOrientation(distance)) {
                direction = direction.add(0.5, agents.get(j).getHeading());
                sawOrientation = true;
            } else if (radii.isAttraction(distance)) {
                direction = direction.add(0.5, table.direction(i, j));
                sawAttraction = true;
            }
        }

        // A single kind of influence is amplified so it turns as hard as both combined.
        if (!repulsionMode && !(sawOrientation && sawAttraction)) {
            direction = direction.scalarMultiply(2.0);
        }

        if (VectorMath.isExactlyZero(direction)) {
            return agents.get(i).getHeading();
        }
        return VectorMath.normalize(direction);
    }

    private boolean hasRepulsionNeighbour(final int count, final int i, final ZoneRadii radii) {
        for (int j = 0; j < count; j++) {
            if (j != i && radii.isRepulsion(table.distance(i, j))) {
                return true;
            }
        }
        return false;
    }
}

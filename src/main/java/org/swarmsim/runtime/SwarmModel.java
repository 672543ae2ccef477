package org.swarmsim.runtime;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.swarmsim.runtime.math.VectorMath;
import org.swarmsim.runtime.model.Agent;
import org.swarmsim.runtime.model.AgentState;
import org.swarmsim.runtime.model.ZoneRadii;
import org.swarmsim.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The agents of one simulation together with the rules that move them.
 * <p>
 * A tick first asks the {@link FlockUpdateEngine} for every new heading, then integrates all
 * positions, so every agent reacts to the same pre-tick state.
 * <p>
 * Not thread-safe. The owning simulation serializes all access.
 */
public class SwarmModel {

    static final double SPAWN_EXTENT = 15.0;
    static final double DEFAULT_SPEED = 1.0;
    static final double DEFAULT_VISION = 360.0;
    static final double DEFAULT_TURNING_ANGLE = 40.0;
    private static final double HEADING_BASE_X = 0.1;
    private static final double HEADING_JITTER = 0.1;

    private final List<Agent> agents;
    private final ZoneRadii radii;
    private final boolean strictTurnRate;
    private final FlockUpdateEngine engine = new FlockUpdateEngine();

    /**
     * Creates a model over an explicit set of agents.
     *
     * @param agents         The agents, in a fixed order.
     * @param radii          The zone radii.
     * @param strictTurnRate Whether turns are clamped to each agent's turning angle.
     */
    public SwarmModel(final List<Agent> agents, final ZoneRadii radii, final boolean strictTurnRate) {
        this.agents = new ArrayList<>(agents);
        this.radii = radii;
        this.strictTurnRate = strictTurnRate;
    }

    /**
     * Seeds a population of {@code count} agents with ids {@code 0..count-1}.
     * Positions are uniform in a square of the x/y plane; headings point roughly along +z with a
     * small random tilt.
     *
     * @param count          The number of agents.
     * @param radii          The zone radii.
     * @param random         Source of randomness for the initial placement.
     * @param strictTurnRate Whether turns are clamped to each agent's turning angle.
     * @return The seeded model.
     */
    public static SwarmModel seed(final int count, final ZoneRadii radii, final IRandomProvider random,
                                  final boolean strictTurnRate) {
        final List<Agent> agents = new ArrayList<>(count);
        for (int id = 0; id < count; id++) {
            final Vector3D position = new Vector3D(
                random.nextUniform(-SPAWN_EXTENT, SPAWN_EXTENT),
                random.nextUniform(-SPAWN_EXTENT, SPAWN_EXTENT),
                0.0);
            agents.add(new Agent(id, position, randomHeading(random), DEFAULT_SPEED, DEFAULT_VISION, DEFAULT_TURNING_ANGLE));
        }
        return new SwarmModel(agents, radii, strictTurnRate);
    }

    /**
     * Advances every agent by one tick.
     *
     * @param timestep Simulated time per tick.
     * @return The state of every agent after the tick.
     */
    public List<AgentState> step(final double timestep) {
        final Map<Integer, Vector3D> headings = engine.computeNextHeadings(agents, radii);
        for (final Agent agent : agents) {
            Vector3D heading = headings.get(agent.getId());
            if (strictTurnRate) {
                heading = TurnRateLimiter.limit(agent.getHeading(), heading, agent.getTurningAngle());
            }
            agent.advance(heading, timestep);
        }
        return agentStates();
    }

    /**
     * @return The current state of every agent.
     */
    public List<AgentState> agentStates() {
        final List<AgentState> states = new ArrayList<>(agents.size());
        for (final Agent agent : agents) {
            states.add(agent.toState());
        }
        return states;
    }

    public List<Agent> getAgents() {
        return Collections.unmodifiableList(agents);
    }

    public ZoneRadii getRadii() {
        return radii;
    }

    public boolean isStrictTurnRate() {
        return strictTurnRate;
    }

    private static Vector3D randomHeading(final IRandomProvider random) {
        final Vector3D raw = new Vector3D(
            HEADING_BASE_X,
            Math.sin(HEADING_BASE_X) + HEADING_JITTER * random.nextGaussian(),
            Math.cos(HEADING_BASE_X) + HEADING_JITTER * random.nextGaussian());
        return VectorMath.normalize(raw);
    }
}

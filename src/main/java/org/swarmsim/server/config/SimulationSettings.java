package org.swarmsim.server.config;

import org.swarmsim.runtime.model.SwarmMode;

/**
 * Validated settings of a simulation, fixed at creation.
 *
 * @param numAgents      Number of agents, between 1 and {@link #MAX_AGENTS}.
 * @param mode           The swarm mode selecting the zone radii.
 * @param timestep       Simulated time per tick, must be positive.
 * @param updateInterval Wall-clock seconds between ticks, must be positive.
 * @param seed           Optional seed for the initial population, {@code null} for a random one.
 * @param strictTurnRate Whether each turn is clamped to the agent's turning angle.
 */
public record SimulationSettings(
    int numAgents,
    SwarmMode mode,
    double timestep,
    double updateInterval,
    Long seed,
    boolean strictTurnRate
) {

    /**
     * Hard upper bound on the number of agents. The update rule compares every pair of agents.
     */
    public static final int MAX_AGENTS = 500;

    public static final int DEFAULT_NUM_AGENTS = 20;
    public static final double DEFAULT_TIMESTEP = 0.1;
    public static final double DEFAULT_UPDATE_INTERVAL = 0.1;

    public SimulationSettings {
        if (numAgents < 1 || numAgents > MAX_AGENTS) {
            throw new InvalidConfigurationException(
                "num_agents must be between 1 and " + MAX_AGENTS + ", got " + numAgents);
        }
        if (mode == null) {
            throw new InvalidConfigurationException("mode is required. Allowed: " + SwarmMode.allowedNames());
        }
        if (!(timestep > 0.0) || Double.isInfinite(timestep)) {
            throw new InvalidConfigurationException("timestep must be a positive number, got " + timestep);
        }
        if (!(updateInterval > 0.0) || Double.isInfinite(updateInterval)) {
            throw new InvalidConfigurationException("update_interval must be a positive number, got " + updateInterval);
        }
    }

    /**
     * Creates settings with the default timestep and update interval and a random population.
     */
    public static SimulationSettings of(final int numAgents, final SwarmMode mode) {
        return new SimulationSettings(numAgents, mode, DEFAULT_TIMESTEP, DEFAULT_UPDATE_INTERVAL, null, false);
    }

    /**
     * Resolves a mode name as received from a client.
     *
     * @param name The mode name, case-insensitive.
     * @return The mode.
     * @throws InvalidConfigurationException if the name does not denote a mode.
     */
    public static SwarmMode parseMode(final String name) {
        return SwarmMode.fromName(name).orElseThrow(() -> new InvalidConfigurationException(
            "Unsupported mode '" + name + "'. Allowed: " + SwarmMode.allowedNames()));
    }

    /**
     * @return The update interval in nanoseconds, at least 1.
     */
    public long updateIntervalNanos() {
        return Math.max(1L, (long) (updateInterval * 1_000_000_000L));
    }
}

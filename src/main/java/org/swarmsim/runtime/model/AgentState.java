package org.swarmsim.runtime.model;

/**
 * Point-in-time copy of an agent's kinematic state as exposed to observers.
 *
 * @param id       The agent id.
 * @param position Position as {@code [x, y, z]}.
 * @param heading  Unit heading as {@code [x, y, z]}.
 */
public record AgentState(int id, double[] position, double[] heading) {
}

package org.swarmsim.runtime.model;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.swarmsim.runtime.math.VectorMath;

import java.util.Objects;

/**
 * A single point agent of the swarm.
 * <p>
 * Identity, speed and perception parameters are fixed at construction. Position and heading are
 * replaced together once per tick through {@link #advance(Vector3D, double)}; the owning simulation
 * guarantees that only its tick loop calls it.
 * <p>
 * {@code vision} and {@code turningAngle} are in degrees. {@code vision} is carried for clients but
 * not consulted by the zone rules; {@code turningAngle} is only applied when strict turn-rate
 * limiting is enabled.
 */
public final class Agent {

    /**
     * Allowed deviation of a heading's norm from 1.
     */
    public static final double HEADING_TOLERANCE = 1.0e-6;

    private final int id;
    private final double speed;
    private final double vision;
    private final double turningAngle;
    private Vector3D position;
    private Vector3D heading;

    /**
     * Creates a new agent.
     *
     * @param id           Immutable identity of the agent.
     * @param position     Initial position.
     * @param heading      Initial heading, must be unit length.
     * @param speed        Distance travelled per unit of time, must be positive.
     * @param vision       Perception cone in degrees, must not be negative.
     * @param turningAngle Maximum turn per tick in degrees, must not be negative.
     * @throws IllegalArgumentException if any kinematic invariant is violated.
     */
    public Agent(final int id, final Vector3D position, final Vector3D heading,
                 final double speed, final double vision, final double turningAngle) {
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(heading, "heading");
        if (position.isNaN() || position.isInfinite()) {
            throw new IllegalArgumentException("Agent " + id + " position must be finite: " + position);
        }
        if (heading.isNaN() || !VectorMath.isUnit(heading, HEADING_TOLERANCE)) {
            throw new IllegalArgumentException("Agent " + id + " heading must be a unit vector: " + heading);
        }
        if (!(speed > 0.0) || Double.isInfinite(speed)) {
            throw new IllegalArgumentException("Agent " + id + " speed must be positive: " + speed);
        }
        if (!(vision >= 0.0) || !(turningAngle >= 0.0)) {
            throw new IllegalArgumentException("Agent " + id + " vision and turning angle must not be negative");
        }
        this.id = id;
        this.position = position;
        this.heading = heading;
        this.speed = speed;
        this.vision = vision;
        this.turningAngle = turningAngle;
    }

    /**
     * Stores {@code newHeading} and moves the agent by {@code newHeading * speed * timestep}.
     *
     * @param newHeading The heading computed for this tick.
     * @param timestep   The simulated time elapsed during the tick.
     */
    public void advance(final Vector3D newHeading, final double timestep) {
        this.heading = newHeading;
        this.position = position.add(speed * timestep, newHeading);
    }

    /**
     * @return An immutable view of this agent's kinematic state.
     */
    public AgentState toState() {
        return new AgentState(id, position.toArray(), heading.toArray());
    }

    public int getId() {
        return id;
    }

    public Vector3D getPosition() {
        return position;
    }

    public Vector3D getHeading() {
        return heading;
    }

    public double getSpeed() {
        return speed;
    }

    public double getVision() {
        return vision;
    }

    public double getTurningAngle() {
        return turningAngle;
    }

    @Override
    public String toString() {
        return "Agent{id=" + id + ", position=" + position + ", heading=" + heading + '}';
    }
}

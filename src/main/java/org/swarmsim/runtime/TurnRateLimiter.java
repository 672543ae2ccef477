package org.swarmsim.runtime;

import org.apache.commons.math3.geometry.euclidean.threed.Rotation;
import org.apache.commons.math3.geometry.euclidean.threed.RotationConvention;
import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;
import org.swarmsim.runtime.math.VectorMath;

/**
 * Clamps a change of heading to a maximum turn per tick.
 * <p>
 * Used only in strict turn-rate mode. The previous heading is rotated towards the desired heading,
 * in the plane the two span, by at most the agent's turning angle. For exactly opposite headings
 * the plane is undefined and an arbitrary axis orthogonal to the previous heading is used.
 */
public final class TurnRateLimiter {

    private TurnRateLimiter() {
        // Utility class
    }

    /**
     * @param previous           The heading before this tick, unit length.
     * @param desired            The heading computed by the zone rules, unit length.
     * @param maxTurnDegrees     The largest allowed turn in degrees.
     * @return {@code desired} if the turn is within the limit, otherwise the clamped heading.
     */
    public static Vector3D limit(final Vector3D previous, final Vector3D desired, final double maxTurnDegrees) {
        final double maxTurn = Math.toRadians(maxTurnDegrees);
        final double turn = VectorMath.angleBetween(previous, desired);
        if (turn <= maxTurn) {
            return desired;
        }
        Vector3D axis = previous.crossProduct(desired);
        if (axis.getNorm() < VectorMath.EPSILON) {
            axis = previous.orthogonal();
        }
        final Rotation rotation = new Rotation(axis, maxTurn, RotationConvention.VECTOR_OPERATOR);
        return VectorMath.normalize(rotation.applyTo(previous));
    }
}

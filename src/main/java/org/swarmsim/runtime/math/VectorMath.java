package org.swarmsim.runtime.math;

import org.apache.commons.math3.geometry.euclidean.threed.Vector3D;

/**
 * Stateless vector helpers used by the flock update rules.
 * <p>
 * Commons Math throws on normalizing or measuring the angle of a zero vector. The update rules
 * regularly produce such vectors (cancelled influences, coincident agents), so these helpers
 * degrade gracefully instead of throwing.
 */
public final class VectorMath {

    /**
     * Norms below this value are treated as zero.
     */
    public static final double EPSILON = 1.0e-12;

    private VectorMath() {
        // Utility class
    }

    /**
     * Returns the unit vector pointing in the same direction as {@code vector}.
     *
     * @param vector The vector to normalize.
     * @return The normalized vector, or {@code vector} itself if its norm is (close to) zero.
     */
    public static Vector3D normalize(final Vector3D vector) {
        final double norm = vector.getNorm();
        if (norm < EPSILON || !Double.isFinite(norm)) {
            return vector;
        }
        return vector.scalarMultiply(1.0 / norm);
    }

    /**
     * Returns the angle between two vectors in radians, within [0, π].
     * A zero vector has no direction; the angle is reported as 0 in that case.
     */
    public static double angleBetween(final Vector3D v1, final Vector3D v2) {
        if (v1.getNorm() < EPSILON || v2.getNorm() < EPSILON) {
            return 0.0;
        }
        return Vector3D.angle(v1, v2);
    }

    /**
     * Euclidean distance between two points.
     */
    public static double distance(final Vector3D from, final Vector3D to) {
        return Vector3D.distance(from, to);
    }

    /**
     * @return {@code true} if every component is exactly zero.
     */
    public static boolean isExactlyZero(final Vector3D vector) {
        return vector.getX() == 0.0 && vector.getY() == 0.0 && vector.getZ() == 0.0;
    }

    /**
     * @return {@code true} if the norm of {@code vector} is within {@code tolerance} of 1.
     */
    public static boolean isUnit(final Vector3D vector, final double tolerance) {
        return Math.abs(vector.getNorm() - 1.0) <= tolerance;
    }
}

package org.swarmsim.runtime.model;

/**
 * The three radii partitioning the distance axis around an agent.
 * <ul>
 *   <li>repulsion: {@code (0, zor]}</li>
 *   <li>orientation: {@code (zor, zoo]}</li>
 *   <li>attraction: {@code (zoo, zoa]}</li>
 *   <li>out of range: {@code (zoa, ∞)}</li>
 * </ul>
 *
 * @param zor Radius of the zone of repulsion.
 * @param zoo Radius of the zone of orientation.
 * @param zoa Radius of the zone of attraction.
 */
public record ZoneRadii(double zor, double zoo, double zoa) {

    public ZoneRadii {
        if (!(zor > 0.0) || !(zor < zoo) || !(zoo < zoa) || Double.isInfinite(zoa)) {
            throw new IllegalArgumentException(
                String.format("Zone radii must satisfy 0 < zor < zoo < zoa, got zor=%s zoo=%s zoa=%s", zor, zoo, zoa));
        }
    }

    public boolean isRepulsion(final double distance) {
        return distance <= zor;
    }

    public boolean isOrientation(final double distance) {
        return distance > zor && distance <= zoo;
    }

    public boolean isAttraction(final double distance) {
        return distance > zoo && distance <= zoa;
    }
}

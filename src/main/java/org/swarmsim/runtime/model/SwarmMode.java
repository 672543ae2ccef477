package org.swarmsim.runtime.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The supported swarm parameterizations. All modes run the same update rule and differ only in
 * their zone radii.
 */
public enum SwarmMode {
    SWARM(new ZoneRadii(2.0, 3.0, 7.0)),
    TORUS(new ZoneRadii(0.3, 0.8, 15.0)),
    HPP(new ZoneRadii(0.5, 10.0, 20.0)),
    DPP(new ZoneRadii(0.2, 4.0, 10.0));

    private final ZoneRadii radii;

    SwarmMode(final ZoneRadii radii) {
        this.radii = radii;
    }

    public ZoneRadii radii() {
        return radii;
    }

    /**
     * @return The lower-case name used in configuration and on the wire, e.g. {@code "torus"}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Looks up a mode by its name, ignoring case and surrounding whitespace.
     *
     * @param name The mode name, e.g. {@code "hpp"}.
     * @return The matching mode, or empty if the name is unknown or null.
     */
    public static Optional<SwarmMode> fromName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        final String normalized = name.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(mode -> mode.name().equals(normalized)).findFirst();
    }

    /**
     * @return The wire names of all modes, for error messages.
     */
    public static String allowedNames() {
        return Arrays.stream(values()).map(SwarmMode::wireName).collect(Collectors.joining(", ", "[", "]"));
    }
}

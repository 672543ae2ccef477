package org.swarmsim.server.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.swarmsim.server.config.SimulationSettings;

/**
 * Wire view of the settings a simulation was created with.
 */
public record SimulationParams(
    @JsonProperty("num_agents") int numAgents,
    @JsonProperty("mode") String mode,
    @JsonProperty("timestep") double timestep,
    @JsonProperty("update_interval") double updateInterval,
    @JsonProperty("strict_turn_rate") boolean strictTurnRate
) {

    public static SimulationParams from(final SimulationSettings settings) {
        return new SimulationParams(
            settings.numAgents(),
            settings.mode().wireName(),
            settings.timestep(),
            settings.updateInterval(),
            settings.strictTurnRate());
    }
}

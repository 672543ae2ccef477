package org.swarmsim.node.processes.http.api.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/simulations}. Every field is optional; missing fields take the
 * controller's configured defaults.
 */
public record CreateSimulationRequest(
    @JsonProperty("num_agents") Integer numAgents,
    @JsonProperty("mode") String mode,
    @JsonProperty("timestep") Double timestep,
    @JsonProperty("update_interval") Double updateInterval,
    @JsonProperty("seed") Long seed,
    @JsonProperty("strict_turn_rate") Boolean strictTurnRate
) {
    public static final CreateSimulationRequest EMPTY = new CreateSimulationRequest(null, null, null, null, null, null);
}

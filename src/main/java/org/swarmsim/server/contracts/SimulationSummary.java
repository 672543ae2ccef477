package org.swarmsim.server.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the simulation listing.
 */
public record SimulationSummary(
    @JsonProperty("simulation_id") String simulationId,
    @JsonProperty("num_agents") int numAgents,
    @JsonProperty("mode") String mode,
    @JsonProperty("tick") long tick,
    @JsonProperty("state") String state
) {
}

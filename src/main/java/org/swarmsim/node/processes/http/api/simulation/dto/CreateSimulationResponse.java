package org.swarmsim.node.processes.http.api.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateSimulationResponse(
    @JsonProperty("simulation_id") String simulationId,
    @JsonProperty("num_agents") int numAgents,
    @JsonProperty("mode") String mode
) {
}

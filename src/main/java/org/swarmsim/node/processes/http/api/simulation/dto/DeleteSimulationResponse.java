package org.swarmsim.node.processes.http.api.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeleteSimulationResponse(
    @JsonProperty("status") String status,
    @JsonProperty("simulation_id") String simulationId
) {
    public static DeleteSimulationResponse deleted(final String simulationId) {
        return new DeleteSimulationResponse("deleted", simulationId);
    }
}

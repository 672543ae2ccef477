package org.swarmsim.server.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.swarmsim.runtime.model.AgentState;

import java.util.List;

/**
 * The complete state of a simulation at one tick, taken atomically.
 * Sent as the first message of every stream and returned by the REST API.
 */
public record SimulationSnapshot(
    @JsonProperty("simulation_id") String simulationId,
    @JsonProperty("tick") long tick,
    @JsonProperty("params") SimulationParams params,
    @JsonProperty("agents") List<AgentState> agents
) implements IStreamMessage {

    @Override
    @JsonProperty("type")
    public String type() {
        return "snapshot";
    }
}

package org.swarmsim.server.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.swarmsim.runtime.model.AgentState;

import java.util.List;

/**
 * The delta broadcast after every completed tick.
 *
 * @param simulationId The simulation that produced the tick.
 * @param tick         The tick number, starting at 1 for the first completed tick.
 * @param agents       The state of every agent after the tick.
 */
public record TickMessage(
    @JsonProperty("simulation_id") String simulationId,
    @JsonProperty("tick") long tick,
    @JsonProperty("agents") List<AgentState> agents
) implements IStreamMessage {

    @Override
    @JsonProperty("type")
    public String type() {
        return "tick";
    }
}

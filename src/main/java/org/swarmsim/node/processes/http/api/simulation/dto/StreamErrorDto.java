package org.swarmsim.node.processes.http.api.simulation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.swarmsim.server.contracts.IStreamMessage;

/**
 * Sent on a stream that cannot be served, right before the socket is closed.
 */
public record StreamErrorDto(@JsonProperty("message") String message) implements IStreamMessage {

    @Override
    @JsonProperty("type")
    public String type() {
        return "error";
    }
}

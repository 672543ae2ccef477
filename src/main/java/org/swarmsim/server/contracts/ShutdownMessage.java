package org.swarmsim.server.contracts;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Terminal marker: no further messages follow on the subscription.
 *
 * @param reason {@link #REASON_DELETED} when the simulation was deleted,
 *               {@link #REASON_ERROR} when its tick loop failed.
 */
public record ShutdownMessage(@JsonProperty("reason") String reason) implements IStreamMessage {

    public static final String REASON_DELETED = "deleted";
    public static final String REASON_ERROR = "error";

    @Override
    @JsonProperty("type")
    public String type() {
        return "shutdown";
    }
}

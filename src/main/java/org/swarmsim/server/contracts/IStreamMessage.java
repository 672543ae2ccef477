package org.swarmsim.server.contracts;

/**
 * A message delivered to a simulation subscriber.
 */
public interface IStreamMessage {

    /**
     * @return The message discriminator written to the wire, e.g. {@code "tick"}.
     */
    String type();
}

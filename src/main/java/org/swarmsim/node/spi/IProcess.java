package org.swarmsim.node.spi;

/**
 * A long-running component managed by the {@link org.swarmsim.node.Node}.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block; continuous work belongs on the process's own threads.
     */
    void start();

    /**
     * Stops the process and releases its resources. Called in reverse start order.
     */
    void stop();
}

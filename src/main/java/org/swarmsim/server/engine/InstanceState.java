package org.swarmsim.server.engine;

/**
 * Lifecycle state of a {@link SimulationInstance}.
 */
public enum InstanceState {
    /**
     * No tick loop is running.
     */
    IDLE,

    /**
     * The tick loop is active.
     */
    RUNNING,

    /**
     * Cancellation of the tick loop was requested and the instance is waiting for it to exit.
     */
    STOPPING,

    /**
     * A tick failed. The loop has exited, the last snapshot is preserved, and the instance
     * accepts no further subscribers.
     */
    ERROR,

    /**
     * The instance was deleted and released all resources. Terminal.
     */
    CLOSED
}

package org.swarmsim.server;

/**
 * Thrown when an operation names a simulation id the registry does not know.
 */
public class SimulationNotFoundException extends RuntimeException {

    private final String simulationId;

    public SimulationNotFoundException(final String simulationId) {
        super("Simulation not found: " + simulationId);
        this.simulationId = simulationId;
    }

    public String getSimulationId() {
        return simulationId;
    }
}

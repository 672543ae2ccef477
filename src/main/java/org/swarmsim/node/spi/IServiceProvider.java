package org.swarmsim.node.spi;

/**
 * A process that exposes one service to other processes.
 * <p>
 * Dependent processes name the provider in their {@code require} block and receive the exposed
 * service in their dependency map, e.g. the simulation registry process hands its
 * {@code SimulationRegistry} to the HTTP server.
 */
public interface IServiceProvider {

    /**
     * @return The service instance, or {@code null} if nothing is exposed.
     */
    Object getExposedService();
}

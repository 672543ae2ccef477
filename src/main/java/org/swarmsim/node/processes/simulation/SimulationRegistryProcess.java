package org.swarmsim.node.processes.simulation;

import com.typesafe.config.Config;
import org.swarmsim.node.processes.AbstractProcess;
import org.swarmsim.node.spi.IServiceProvider;
import org.swarmsim.server.SimulationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Owns the node's {@link SimulationRegistry} and exposes it to dependent processes.
 * Stopping the process deletes every simulation.
 */
public class SimulationRegistryProcess extends AbstractProcess implements IServiceProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimulationRegistryProcess.class);

    private final SimulationRegistry registry;

    public SimulationRegistryProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.registry = new SimulationRegistry(options);
    }

    @Override
    public Object getExposedService() {
        return registry;
    }

    @Override
    public void start() {
        LOGGER.debug("Simulation registry '{}' ready", processName);
    }

    @Override
    public void stop() {
        final int remaining = registry.size();
        registry.close();
        LOGGER.info("Simulation registry '{}' stopped, {} simulation(s) closed", processName, remaining);
    }
}

package org.swarmsim.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.swarmsim.node.spi.IProcess;
import org.swarmsim.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The Swarmsim node. Loads the processes declared under {@code node.processes}, wires their
 * dependencies and manages their lifecycle.
 *
 * <p>A process may declare dependencies on other processes in a {@code require} block, mapping a
 * local name to the name of the providing process. Providers implement {@link IServiceProvider};
 * the node instantiates processes in dependency order and passes the exposed services to the
 * dependent process's constructor.</p>
 *
 * <pre>
 * node.processes {
 *   simulations { className = "...SimulationRegistryProcess" }
 *   httpServer {
 *     className = "...HttpServerProcess"
 *     require { simulationRegistry = "simulations" }
 *     options { ... }
 *   }
 * }
 * </pre>
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_CONFIG_PATH = "node.processes";

    private final Map<String, IProcess> managedProcesses = new LinkedHashMap<>();
    private Thread shutdownHook;

    /**
     * Constructs the Node, instantiating all configured processes.
     *
     * @param config The fully resolved application configuration.
     */
    public Node(final Config config) {
        try {
            initializeProcesses(config);
        } catch (final Exception e) {
            LOGGER.error("Failed to initialize the node.", e);
            throw new IllegalStateException("Node initialization failed", e);
        }
    }

    /**
     * Starts all managed processes in dependency order and registers a shutdown hook.
     */
    public void start() {
        if (managedProcesses.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        } else {
            managedProcesses.forEach((name, process) -> {
                try {
                    LOGGER.debug("Starting process '{}'...", name);
                    process.start();
                } catch (final Exception e) {
                    LOGGER.error("Failed to start process '{}'. The node may be unstable.", name, e);
                }
            });
        }

        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started with {} process(es). Running until interrupted.", managedProcesses.size());
    }

    /**
     * Stops all managed processes in reverse start order.
     */
    public void stop() {
        LOGGER.info("Shutdown sequence initiated...");

        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                // Already running as the hook, or the JVM is shutting down
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
            shutdownHook = null;
        }

        final List<String> processNames = new ArrayList<>(managedProcesses.keySet());
        Collections.reverse(processNames);
        for (final String name : processNames) {
            try {
                LOGGER.debug("Stopping process '{}'...", name);
                managedProcesses.get(name).stop();
            } catch (final Exception e) {
                LOGGER.error("Error while stopping process '{}'.", name, e);
            }
        }
        LOGGER.info("All processes stopped. Goodbye.");
    }

    /**
     * @return The names of all successfully instantiated processes, in start order.
     */
    public List<String> getProcessNames() {
        return List.copyOf(managedProcesses.keySet());
    }

    /**
     * @return The process registered under {@code name}, if it was instantiated.
     */
    public Optional<IProcess> getProcess(final String name) {
        return Optional.ofNullable(managedProcesses.get(name));
    }

    private void initializeProcesses(final Config config) {
        if (!config.hasPath(PROCESSES_CONFIG_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_CONFIG_PATH);
            return;
        }

        final Map<String, ProcessDefinition> definitions = parseDefinitions(config.getObject(PROCESSES_CONFIG_PATH));
        final List<String> order = topologicalSort(definitions);
        LOGGER.debug("Process instantiation order: {}", order);

        final Map<String, Object> exposedServices = new HashMap<>();
        for (final String processName : order) {
            try {
                final IProcess process = instantiate(definitions.get(processName), exposedServices);
                managedProcesses.put(processName, process);
                if (process instanceof IServiceProvider) {
                    final Object service = ((IServiceProvider) process).getExposedService();
                    if (service != null) {
                        exposedServices.put(processName, service);
                        LOGGER.debug("Process '{}' exposes service: {}", processName, service.getClass().getSimpleName());
                    }
                }
            } catch (final Exception e) {
                LOGGER.error("Failed to initialize process '{}'. Skipping this process.", processName, e);
            }
        }
        LOGGER.info("Initialized {} process(es) successfully.", managedProcesses.size());
    }

    private Map<String, ProcessDefinition> parseDefinitions(final ConfigObject processesConfig) {
        final Map<String, ProcessDefinition> definitions = new LinkedHashMap<>();
        for (final String processName : processesConfig.keySet()) {
            try {
                final Config processConfig = processesConfig.toConfig().getConfig(processName);
                final String className = processConfig.getString("className");
                final Config options = processConfig.hasPath("options")
                    ? processConfig.getConfig("options")
                    : ConfigFactory.empty();

                final Map<String, String> requires = new LinkedHashMap<>();
                if (processConfig.hasPath("require")) {
                    final Config requireConfig = processConfig.getConfig("require");
                    for (final String localName : requireConfig.root().keySet()) {
                        requires.put(localName, requireConfig.getString(localName));
                    }
                }
                definitions.put(processName, new ProcessDefinition(processName, className, options, requires));
            } catch (final Exception e) {
                LOGGER.error("Failed to parse process '{}'. Skipping this process.", processName, e);
            }
        }
        return definitions;
    }

    private IProcess instantiate(final ProcessDefinition definition, final Map<String, Object> exposedServices) throws Exception {
        final Map<String, Object> dependencies = new HashMap<>();
        for (final Map.Entry<String, String> requirement : definition.requires().entrySet()) {
            final Object service = exposedServices.get(requirement.getValue());
            if (service == null) {
                throw new IllegalStateException("Process '" + definition.name() + "' requires service from '"
                    + requirement.getValue() + "' but it is not available.");
            }
            dependencies.put(requirement.getKey(), service);
        }

        final Class<?> processClass = Class.forName(definition.className());
        if (!IProcess.class.isAssignableFrom(processClass)) {
            throw new IllegalArgumentException("Class " + definition.className() + " does not implement IProcess.");
        }
        final Constructor<?> constructor = processClass.getConstructor(String.class, Map.class, Config.class);
        return (IProcess) constructor.newInstance(definition.name(), dependencies, definition.options());
    }

    /**
     * Orders process definitions so that every process comes after the processes it requires
     * (Kahn's algorithm). Ties keep configuration order.
     *
     * @throws IllegalStateException on an unknown or circular dependency.
     */
    static List<String> topologicalSort(final Map<String, ProcessDefinition> definitions) {
        final Map<String, Set<String>> dependents = new HashMap<>();
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (final String name : definitions.keySet()) {
            dependents.put(name, new LinkedHashSet<>());
            inDegree.put(name, 0);
        }
        for (final ProcessDefinition definition : definitions.values()) {
            for (final String required : definition.requires().values()) {
                if (!definitions.containsKey(required)) {
                    throw new IllegalStateException("Process '" + definition.name() + "' depends on '" + required
                        + "' which is not defined in the configuration.");
                }
                dependents.get(required).add(definition.name());
                inDegree.merge(definition.name(), 1, Integer::sum);
            }
        }

        final Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });
        final List<String> result = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String current = ready.poll();
            result.add(current);
            for (final String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (result.size() != definitions.size()) {
            final List<String> remaining = new ArrayList<>(definitions.keySet());
            remaining.removeAll(result);
            throw new IllegalStateException("Circular dependency detected among processes: " + remaining
                + ". Check the 'require' configuration.");
        }
        return result;
    }

    /**
     * A process entry from the configuration.
     *
     * @param requires local dependency name to providing process name
     */
    record ProcessDefinition(String name, String className, Config options, Map<String, String> requires) {
    }
}

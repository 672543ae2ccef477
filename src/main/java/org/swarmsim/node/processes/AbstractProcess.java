package org.swarmsim.node.processes;

import com.typesafe.config.Config;
import org.swarmsim.node.spi.IProcess;

import java.util.Collections;
import java.util.Map;

/**
 * Base class for processes created by the {@link org.swarmsim.node.Node}. Every process is built
 * through the same {@code (name, dependencies, options)} constructor.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  The name of this process in {@code node.processes}.
     * @param dependencies Services resolved from the {@code require} block, keyed by local name.
     * @param options      The {@code options} block of this process.
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? dependencies : Collections.emptyMap();
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }

    /**
     * Looks up a required dependency.
     *
     * @param name         The local name from the {@code require} block.
     * @param expectedType The type the dependency must have.
     * @return The dependency.
     * @throws IllegalArgumentException if it is missing or of the wrong type.
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final Object dependency = dependencies.get(name);
        if (dependency == null) {
            throw new IllegalArgumentException(
                "Required dependency '" + name + "' not found for process '" + processName + "'");
        }
        if (!expectedType.isInstance(dependency)) {
            throw new IllegalArgumentException(
                "Dependency '" + name + "' for process '" + processName + "' is "
                    + dependency.getClass().getName() + " but expected " + expectedType.getName());
        }
        return expectedType.cast(dependency);
    }
}

package org.swarmsim.server;

import com.typesafe.config.Config;
import org.swarmsim.runtime.SwarmModel;
import org.swarmsim.runtime.internal.services.SeededRandomProvider;
import org.swarmsim.runtime.spi.IRandomProvider;
import org.swarmsim.server.config.InvalidConfigurationException;
import org.swarmsim.server.config.SimulationSettings;
import org.swarmsim.server.contracts.SimulationSummary;
import org.swarmsim.server.engine.SimulationInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Maps opaque simulation ids to {@link SimulationInstance}s.
 * <p>
 * The registry's own lock guards only the id map. It is never held while an instance is closed,
 * so creating or deleting one simulation never waits on another simulation's tick loop.
 * <p>
 * Configuration options (all optional):
 * <pre>
 * max-agents = 500                # upper bound for num_agents, at most SimulationSettings.MAX_AGENTS
 * subscriber-buffer-size = 1024   # per-subscriber buffer, oldest messages are dropped when full
 * loop-shutdown-timeout-ms = 5000 # how long stopping waits for a tick loop to exit
 * </pre>
 */
public final class SimulationRegistry implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimulationRegistry.class);

    private static final int DEFAULT_SUBSCRIBER_BUFFER_SIZE = 1024;
    private static final long DEFAULT_LOOP_SHUTDOWN_TIMEOUT_MS = 5000L;

    private final Map<String, SimulationInstance> instances = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final ExecutorService lifecycleExecutor;
    private final int maxAgents;
    private final int subscriberBufferSize;
    private final long loopShutdownTimeoutMs;

    /**
     * Creates an empty registry.
     *
     * @param options The registry configuration, see class documentation.
     */
    public SimulationRegistry(final Config options) {
        this.maxAgents = options.hasPath("max-agents")
            ? Math.min(options.getInt("max-agents"), SimulationSettings.MAX_AGENTS)
            : SimulationSettings.MAX_AGENTS;
        this.subscriberBufferSize = options.hasPath("subscriber-buffer-size")
            ? options.getInt("subscriber-buffer-size")
            : DEFAULT_SUBSCRIBER_BUFFER_SIZE;
        this.loopShutdownTimeoutMs = options.hasPath("loop-shutdown-timeout-ms")
            ? options.getLong("loop-shutdown-timeout-ms")
            : DEFAULT_LOOP_SHUTDOWN_TIMEOUT_MS;
        if (maxAgents < 1 || subscriberBufferSize < 1 || loopShutdownTimeoutMs < 1) {
            throw new IllegalArgumentException("max-agents, subscriber-buffer-size and loop-shutdown-timeout-ms must be positive");
        }

        final AtomicInteger threadCounter = new AtomicInteger();
        this.lifecycleExecutor = Executors.newCachedThreadPool(runnable -> {
            final Thread thread = new Thread(runnable, "swarm-lifecycle-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        LOGGER.debug("SimulationRegistry initialized (max-agents={}, subscriber-buffer-size={})", maxAgents, subscriberBufferSize);
    }

    /**
     * Creates and registers a new, idle simulation.
     *
     * @param settings The validated simulation settings.
     * @return The new instance.
     * @throws InvalidConfigurationException if the settings exceed this registry's limits.
     */
    public SimulationInstance create(final SimulationSettings settings) {
        if (settings.numAgents() > maxAgents) {
            throw new InvalidConfigurationException(
                "num_agents must be between 1 and " + maxAgents + ", got " + settings.numAgents());
        }
        final String id = UUID.randomUUID().toString();
        final IRandomProvider random = settings.seed() != null
            ? new SeededRandomProvider(settings.seed())
            : SeededRandomProvider.unseeded();
        final SwarmModel model = SwarmModel.seed(
            settings.numAgents(), settings.mode().radii(), random, settings.strictTurnRate());
        final SimulationInstance instance = new SimulationInstance(
            id, settings, model, lifecycleExecutor, subscriberBufferSize, loopShutdownTimeoutMs);

        lock.lock();
        try {
            instances.put(id, instance);
        } finally {
            lock.unlock();
        }
        LOGGER.info("Created simulation {} ({} agents, mode {})", id, settings.numAgents(), settings.mode().wireName());
        return instance;
    }

    /**
     * @return The instance registered under {@code simulationId}, if any.
     */
    public Optional<SimulationInstance> get(final String simulationId) {
        if (simulationId == null) {
            return Optional.empty();
        }
        lock.lock();
        try {
            return Optional.ofNullable(instances.get(simulationId));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The instance registered under {@code simulationId}.
     * @throws SimulationNotFoundException if there is none.
     */
    public SimulationInstance require(final String simulationId) {
        return get(simulationId).orElseThrow(() -> new SimulationNotFoundException(simulationId));
    }

    /**
     * @return A summary of every registered simulation, in creation order.
     */
    public List<SimulationSummary> list() {
        final List<SimulationInstance> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(instances.values());
        } finally {
            lock.unlock();
        }
        final List<SimulationSummary> summaries = new ArrayList<>(snapshot.size());
        for (final SimulationInstance instance : snapshot) {
            final SimulationSettings settings = instance.getSettings();
            summaries.add(new SimulationSummary(
                instance.getId(),
                settings.numAgents(),
                settings.mode().wireName(),
                instance.getTick(),
                instance.getState().name()));
        }
        return summaries;
    }

    /**
     * Removes a simulation and closes it, notifying its subscribers.
     *
     * @param simulationId The simulation to delete.
     * @return {@code true} if the simulation existed.
     */
    public boolean delete(final String simulationId) {
        final SimulationInstance removed;
        lock.lock();
        try {
            removed = simulationId == null ? null : instances.remove(simulationId);
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        removed.close();
        LOGGER.info("Deleted simulation {}", simulationId);
        return true;
    }

    /**
     * @return The number of registered simulations.
     */
    public int size() {
        lock.lock();
        try {
            return instances.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes every simulation and stops the lifecycle executor.
     */
    @Override
    public void close() {
        final List<String> ids;
        lock.lock();
        try {
            ids = new ArrayList<>(instances.keySet());
        } finally {
            lock.unlock();
        }
        ids.forEach(this::delete);

        lifecycleExecutor.shutdown();
        try {
            if (!lifecycleExecutor.awaitTermination(loopShutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Lifecycle executor did not terminate within {} ms", loopShutdownTimeoutMs);
                lifecycleExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            lifecycleExecutor.shutdownNow();
        }
        LOGGER.debug("SimulationRegistry closed ({} simulation(s) deleted)", ids.size());
    }
}

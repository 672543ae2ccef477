package org.swarmsim.server.engine;

import org.swarmsim.runtime.SwarmModel;
import org.swarmsim.runtime.model.AgentState;
import org.swarmsim.server.config.SimulationSettings;
import org.swarmsim.server.contracts.ShutdownMessage;
import org.swarmsim.server.contracts.SimulationParams;
import org.swarmsim.server.contracts.SimulationSnapshot;
import org.swarmsim.server.contracts.TickMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A running flocking simulation and its live subscribers.
 * <p>
 * The instance advances its {@link SwarmModel} on a dedicated tick-loop thread while at least one
 * subscriber is registered:
 * <pre>
 *   IDLE --register()--&gt; RUNNING --last unregister()--&gt; STOPPING --&gt; IDLE
 *   IDLE|RUNNING --close()--&gt; CLOSED
 *   RUNNING --tick failure--&gt; ERROR
 * </pre>
 * <p>
 * <strong>Locking:</strong> {@code stateLock} guards the agents, the tick counter and the subscriber
 * set. The tick loop holds it only while stepping the model, never while broadcasting or sleeping.
 * {@code lifecycleLock} serializes starting, stopping and closing so that at most one tick loop
 * exists at any time; the tick loop itself never takes it. When both are needed,
 * {@code lifecycleLock} is acquired first.
 * <p>
 * Thread Safety: all public methods may be called from any thread.
 */
public final class SimulationInstance {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimulationInstance.class);

    private final String id;
    private final SimulationSettings settings;
    private final SimulationParams params;
    private final SwarmModel model;
    private final Executor lifecycleExecutor;
    private final int subscriberBufferSize;
    private final long loopShutdownTimeoutMs;

    private final ReentrantLock stateLock = new ReentrantLock();
    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final AtomicReference<InstanceState> state = new AtomicReference<>(InstanceState.IDLE);

    // Guarded by stateLock
    private final Set<Subscription> subscribers = new LinkedHashSet<>();
    private long tick;

    // Guarded by lifecycleLock
    private TickLoop activeLoop;

    /**
     * Creates an idle simulation instance.
     *
     * @param id                    The opaque simulation id.
     * @param settings              The validated settings.
     * @param model                 The seeded swarm, owned exclusively by this instance from now on.
     * @param lifecycleExecutor     Runs the asynchronous stop triggered by the last unregistration.
     * @param subscriberBufferSize  Capacity of each subscriber's delivery buffer.
     * @param loopShutdownTimeoutMs How long to wait for the tick loop to exit when stopping.
     */
    public SimulationInstance(final String id,
                              final SimulationSettings settings,
                              final SwarmModel model,
                              final Executor lifecycleExecutor,
                              final int subscriberBufferSize,
                              final long loopShutdownTimeoutMs) {
        this.id = id;
        this.settings = settings;
        this.params = SimulationParams.from(settings);
        this.model = model;
        this.lifecycleExecutor = lifecycleExecutor;
        this.subscriberBufferSize = subscriberBufferSize;
        this.loopShutdownTimeoutMs = loopShutdownTimeoutMs;
    }

    /**
     * Takes a consistent snapshot of the simulation. Never observes a partially applied tick.
     * Works in every state, including {@link InstanceState#ERROR} and {@link InstanceState#CLOSED}.
     *
     * @return The current tick, parameters and agent states.
     */
    public SimulationSnapshot snapshot() {
        stateLock.lock();
        try {
            return new SimulationSnapshot(id, tick, params, model.agentStates());
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Registers a new subscriber and makes sure the tick loop is running.
     * <p>
     * Callers should take a {@link #snapshot()} right after registering and before consuming
     * the subscription, to establish a baseline the following ticks build on.
     *
     * @return The new subscription.
     * @throws IllegalStateException if the instance is closed or failed.
     */
    public Subscription register() {
        final Subscription subscription = new Subscription(subscriberBufferSize);
        stateLock.lock();
        try {
            ensureUsable();
            subscribers.add(subscription);
        } finally {
            stateLock.unlock();
        }

        lifecycleLock.lock();
        try {
            // A pending stop holds lifecycleLock until the previous loop has exited.
            final InstanceState current = state.get();
            if (current == InstanceState.CLOSED || current == InstanceState.ERROR) {
                removeSubscriber(subscription);
                throw new IllegalStateException("Simulation " + id + " is " + current + " and accepts no subscribers");
            }
            if (activeLoop == null) {
                startLoop();
            }
        } finally {
            lifecycleLock.unlock();
        }
        LOGGER.debug("Subscriber {} registered on simulation {}", subscription.getId(), id);
        return subscription;
    }

    /**
     * Removes a subscriber. When it was the last one, the tick loop is stopped asynchronously.
     * Unknown or already removed subscriptions are ignored.
     *
     * @param subscription The subscription to remove.
     * @return A future that completes once the triggered stop (if any) has finished.
     */
    public CompletableFuture<Void> unregister(final Subscription subscription) {
        if (subscription == null) {
            return CompletableFuture.completedFuture(null);
        }
        final boolean lastSubscriber;
        stateLock.lock();
        try {
            lastSubscriber = subscribers.remove(subscription) && subscribers.isEmpty();
        } finally {
            stateLock.unlock();
        }
        if (!lastSubscriber) {
            return CompletableFuture.completedFuture(null);
        }
        LOGGER.debug("Last subscriber left simulation {}, stopping tick loop", id);
        try {
            return CompletableFuture.runAsync(this::stopIfUnobserved, lifecycleExecutor);
        } catch (final RejectedExecutionException e) {
            LOGGER.debug("Lifecycle executor unavailable, stopping simulation {} inline", id);
            stopIfUnobserved();
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * Stops the tick loop, sends a shutdown marker to every subscriber and releases them.
     * Idempotent.
     */
    public void close() {
        final List<Subscription> detached;
        final long lastTick;
        lifecycleLock.lock();
        try {
            if (state.get() == InstanceState.CLOSED) {
                return;
            }
            if (activeLoop != null) {
                haltLoop();
            }
            stateLock.lock();
            try {
                detached = new ArrayList<>(subscribers);
                subscribers.clear();
                lastTick = tick;
                state.set(InstanceState.CLOSED);
            } finally {
                stateLock.unlock();
            }
        } finally {
            lifecycleLock.unlock();
        }

        final ShutdownMessage shutdown = new ShutdownMessage(ShutdownMessage.REASON_DELETED);
        for (final Subscription subscription : detached) {
            subscription.deliver(shutdown);
        }
        LOGGER.info("Simulation {} closed at tick {} ({} subscriber(s) notified)", id, lastTick, detached.size());
    }

    public String getId() {
        return id;
    }

    public SimulationSettings getSettings() {
        return settings;
    }

    public InstanceState getState() {
        return state.get();
    }

    /**
     * @return The number of completed ticks.
     */
    public long getTick() {
        stateLock.lock();
        try {
            return tick;
        } finally {
            stateLock.unlock();
        }
    }

    public int getSubscriberCount() {
        stateLock.lock();
        try {
            return subscribers.size();
        } finally {
            stateLock.unlock();
        }
    }

    private void ensureUsable() {
        final InstanceState current = state.get();
        if (current == InstanceState.CLOSED || current == InstanceState.ERROR) {
            throw new IllegalStateException("Simulation " + id + " is " + current + " and accepts no subscribers");
        }
    }

    private void removeSubscriber(final Subscription subscription) {
        stateLock.lock();
        try {
            subscribers.remove(subscription);
        } finally {
            stateLock.unlock();
        }
    }

    // Requires lifecycleLock
    private void startLoop() {
        activeLoop = new TickLoop();
        state.set(InstanceState.RUNNING);
        activeLoop.start();
        LOGGER.info("Simulation {} started ({} agents, mode {}, every {} s)",
            id, settings.numAgents(), settings.mode().wireName(), settings.updateInterval());
    }

    private void stopIfUnobserved() {
        lifecycleLock.lock();
        try {
            if (activeLoop == null || state.get() != InstanceState.RUNNING) {
                return;
            }
            if (getSubscriberCount() > 0) {
                LOGGER.debug("Simulation {} gained a subscriber before stopping, keeping it running", id);
                return;
            }
            if (haltLoop()) {
                state.compareAndSet(InstanceState.STOPPING, InstanceState.IDLE);
                LOGGER.info("Simulation {} idle at tick {}", id, getTick());
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    // Requires lifecycleLock. Returns false if the loop did not exit in time; the loop is then kept
    // as activeLoop so that close() joins it again before releasing the subscribers.
    private boolean haltLoop() {
        state.compareAndSet(InstanceState.RUNNING, InstanceState.STOPPING);
        if (activeLoop.cancelAndAwait(loopShutdownTimeoutMs)) {
            activeLoop = null;
            return true;
        }
        LOGGER.error("Tick loop of simulation {} did not stop within {} ms, marking it as failed", id, loopShutdownTimeoutMs);
        state.set(InstanceState.ERROR);
        return false;
    }

    private TickMessage advance() {
        stateLock.lock();
        try {
            final List<AgentState> agents = model.step(settings.timestep());
            tick++;
            return new TickMessage(id, tick, agents);
        } finally {
            stateLock.unlock();
        }
    }

    private void broadcast(final TickMessage payload) {
        final List<Subscription> targets;
        stateLock.lock();
        try {
            targets = new ArrayList<>(subscribers);
        } finally {
            stateLock.unlock();
        }
        for (final Subscription subscription : targets) {
            subscription.deliver(payload);
        }
    }

    private void fail(final RuntimeException cause) {
        final List<Subscription> detached;
        final long lastTick;
        stateLock.lock();
        try {
            detached = new ArrayList<>(subscribers);
            subscribers.clear();
            lastTick = tick;
            state.set(InstanceState.ERROR);
        } finally {
            stateLock.unlock();
        }
        LOGGER.error("Simulation {} stopped with ERROR after tick {} due to {}: {}",
            id, lastTick, cause.getClass().getSimpleName(), cause.getMessage());
        LOGGER.debug("Exception details:", cause);

        final ShutdownMessage shutdown = new ShutdownMessage(ShutdownMessage.REASON_ERROR);
        for (final Subscription subscription : detached) {
            subscription.deliver(shutdown);
        }
    }

    /**
     * One run of the tick loop. Cancellation is signalled through a latch that also serves as the
     * inter-tick sleep, so a cancelled loop wakes up immediately and never starts another tick.
     */
    private final class TickLoop implements Runnable {

        private final CountDownLatch cancelSignal = new CountDownLatch(1);
        private final Thread thread;

        TickLoop() {
            this.thread = new Thread(this, "swarm-tick-" + id.substring(0, Math.min(8, id.length())));
            this.thread.setDaemon(true);
        }

        void start() {
            thread.start();
        }

        boolean isCancelled() {
            return cancelSignal.getCount() == 0;
        }

        boolean cancelAndAwait(final long timeoutMs) {
            cancelSignal.countDown();
            try {
                thread.join(timeoutMs);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("Interrupted while waiting for the tick loop of simulation {} to stop", id);
            }
            return !thread.isAlive();
        }

        @Override
        public void run() {
            LOGGER.debug("Tick loop of simulation {} started", id);
            try {
                while (!isCancelled()) {
                    broadcast(advance());
                    if (cancelSignal.await(settings.updateIntervalNanos(), TimeUnit.NANOSECONDS)) {
                        break;
                    }
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.debug("Tick loop of simulation {} interrupted, shutting down.", id);
            } catch (final RuntimeException e) {
                fail(e);
            } finally {
                LOGGER.debug("Tick loop of simulation {} has terminated.", id);
            }
        }
    }
}

package org.swarmsim.node.processes.http.api.simulation;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.websocket.WsCloseContext;
import io.javalin.websocket.WsConnectContext;
import io.javalin.websocket.WsContext;
import io.javalin.websocket.WsErrorContext;
import org.swarmsim.node.processes.http.AbstractController;
import org.swarmsim.node.processes.http.api.simulation.dto.StreamErrorDto;
import org.swarmsim.node.spi.ServiceRegistry;
import org.swarmsim.server.SimulationRegistry;
import org.swarmsim.server.contracts.IStreamMessage;
import org.swarmsim.server.contracts.ShutdownMessage;
import org.swarmsim.server.contracts.SimulationSnapshot;
import org.swarmsim.server.contracts.TickMessage;
import org.swarmsim.server.engine.SimulationInstance;
import org.swarmsim.server.engine.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * WebSocket endpoint streaming a simulation to its observers.
 * <p>
 * A client connecting to {@code {basePath}/{simulationId}} becomes a subscriber of the simulation.
 * It first receives a {@code snapshot} message, then one {@code tick} message per tick. When the
 * simulation is deleted or fails, a {@code shutdown} message is sent and the socket is closed.
 * Disconnecting unregisters the subscriber; the last one leaving pauses the simulation.
 * <p>
 * Options: {@code poll-timeout-ms} (default 500), how often a relay re-checks that its socket is open.
 */
public class SimulationStreamController extends AbstractController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimulationStreamController.class);

    static final int CLOSE_NORMAL = 1000;
    static final int CLOSE_POLICY_VIOLATION = 1008;
    static final int CLOSE_UNAVAILABLE = 1011;

    private final SimulationRegistry simulations;
    private final long pollTimeoutMs;
    private final Map<String, StreamSession> sessions = new ConcurrentHashMap<>();
    private final ExecutorService relayExecutor;

    public SimulationStreamController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.simulations = registry.get(SimulationRegistry.class);
        this.pollTimeoutMs = options.hasPath("poll-timeout-ms") ? options.getLong("poll-timeout-ms") : 500L;
        final AtomicInteger threadCounter = new AtomicInteger();
        this.relayExecutor = Executors.newCachedThreadPool(runnable -> {
            final Thread thread = new Thread(runnable, "swarm-stream-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.ws(path(basePath, "{simulationId}"), ws -> {
            ws.onConnect(this::handleConnect);
            ws.onClose(this::handleClose);
            ws.onError(this::handleError);
        });
    }

    /**
     * @return The number of currently connected stream clients.
     */
    public int getActiveSessionCount() {
        return sessions.size();
    }

    /**
     * Releases every open stream and stops the relay threads.
     */
    @Override
    public void close() {
        final int active = getActiveSessionCount();
        sessions.keySet().forEach(this::release);
        relayExecutor.shutdown();
        try {
            if (!relayExecutor.awaitTermination(pollTimeoutMs + 1000L, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Stream relays did not terminate within {} ms", pollTimeoutMs + 1000L);
                relayExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            relayExecutor.shutdownNow();
        }
        LOGGER.debug("Stream controller closed ({} stream(s) released)", active);
    }

    void handleConnect(final WsConnectContext ctx) {
        final String simulationId = ctx.pathParam("simulationId");
        final Optional<SimulationInstance> found = simulations.get(simulationId);
        if (found.isEmpty()) {
            LOGGER.debug("Stream requested for unknown simulation {}", simulationId);
            reject(ctx, CLOSE_POLICY_VIOLATION, "Simulation not found: " + simulationId);
            return;
        }

        final SimulationInstance instance = found.get();
        final Subscription subscription;
        try {
            subscription = instance.register();
        } catch (final IllegalStateException e) {
            LOGGER.debug("Stream rejected for simulation {}: {}", simulationId, e.getMessage());
            reject(ctx, CLOSE_UNAVAILABLE, e.getMessage());
            return;
        }

        final SimulationSnapshot snapshot = instance.snapshot();
        final StreamSession session = new StreamSession(instance, subscription, snapshot.tick());
        sessions.put(ctx.sessionId(), session);
        ctx.send(snapshot);
        relayExecutor.execute(() -> relay(ctx, session));
        LOGGER.debug("Stream {} opened on simulation {}", ctx.sessionId(), simulationId);
    }

    void handleClose(final WsCloseContext ctx) {
        release(ctx.sessionId());
        LOGGER.debug("Stream {} closed ({} {})", ctx.sessionId(), ctx.status(), ctx.reason());
    }

    void handleError(final WsErrorContext ctx) {
        release(ctx.sessionId());
        final Throwable error = ctx.error();
        LOGGER.debug("Stream {} failed: {}", ctx.sessionId(), error != null ? error.getMessage() : "unknown error");
    }

    private void relay(final WsContext ctx, final StreamSession session) {
        try {
            while (session.open.get() && ctx.session.isOpen()) {
                final IStreamMessage message = session.subscription.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
                if (message == null || session.isCoveredBySnapshot(message)) {
                    continue;
                }
                ctx.send(message);
                if (message instanceof ShutdownMessage) {
                    ctx.closeSession(CLOSE_NORMAL, ((ShutdownMessage) message).reason());
                    return;
                }
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Relay of stream {} interrupted", ctx.sessionId());
        } catch (final RuntimeException e) {
            LOGGER.warn("Relay of stream {} stopped: {}", ctx.sessionId(), e.getMessage());
            LOGGER.debug("Exception details:", e);
        } finally {
            release(ctx.sessionId());
        }
    }

    private void release(final String sessionId) {
        final StreamSession session = sessions.remove(sessionId);
        if (session != null && session.open.compareAndSet(true, false)) {
            session.instance.unregister(session.subscription);
        }
    }

    private static void reject(final WsContext ctx, final int closeCode, final String message) {
        ctx.send(new StreamErrorDto(message));
        ctx.closeSession(closeCode, message);
    }

    private static final class StreamSession {
        private final SimulationInstance instance;
        private final Subscription subscription;
        private final long baselineTick;
        private final AtomicBoolean open = new AtomicBoolean(true);

        StreamSession(final SimulationInstance instance, final Subscription subscription, final long baselineTick) {
            this.instance = instance;
            this.subscription = subscription;
            this.baselineTick = baselineTick;
        }

        // Ticks published between registering and taking the snapshot are already part of it.
        boolean isCoveredBySnapshot(final IStreamMessage message) {
            return message instanceof TickMessage && ((TickMessage) message).tick() <= baselineTick;
        }
    }
}

package org.swarmsim.node.processes.http.api.simulation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.swarmsim.node.processes.http.AbstractController;
import org.swarmsim.node.processes.http.api.simulation.dto.CreateSimulationRequest;
import org.swarmsim.node.processes.http.api.simulation.dto.CreateSimulationResponse;
import org.swarmsim.node.processes.http.api.simulation.dto.DeleteSimulationResponse;
import org.swarmsim.node.processes.http.api.simulation.dto.ErrorResponseDto;
import org.swarmsim.node.spi.ServiceRegistry;
import org.swarmsim.runtime.model.SwarmMode;
import org.swarmsim.server.SimulationNotFoundException;
import org.swarmsim.server.SimulationRegistry;
import org.swarmsim.server.config.InvalidConfigurationException;
import org.swarmsim.server.config.SimulationSettings;
import org.swarmsim.server.engine.SimulationInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * REST API for creating, listing, inspecting and deleting simulations.
 * <p>
 * Options:
 * <pre>
 * defaults {
 *   num-agents = 20
 *   mode = "swarm"
 *   timestep = 0.1
 *   update-interval = 0.1
 * }
 * </pre>
 */
public class SimulationController extends AbstractController {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimulationController.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private final SimulationRegistry simulations;
    private final int defaultNumAgents;
    private final SwarmMode defaultMode;
    private final double defaultTimestep;
    private final double defaultUpdateInterval;

    /**
     * @param registry Must provide a {@link SimulationRegistry}.
     * @param options  Optional {@code defaults} block, see class documentation.
     */
    public SimulationController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
        this.simulations = registry.get(SimulationRegistry.class);
        final Config defaults = options.hasPath("defaults") ? options.getConfig("defaults") : options;
        this.defaultNumAgents = defaults.hasPath("num-agents")
            ? defaults.getInt("num-agents")
            : SimulationSettings.DEFAULT_NUM_AGENTS;
        this.defaultMode = defaults.hasPath("mode")
            ? SimulationSettings.parseMode(defaults.getString("mode"))
            : SwarmMode.SWARM;
        this.defaultTimestep = defaults.hasPath("timestep")
            ? defaults.getDouble("timestep")
            : SimulationSettings.DEFAULT_TIMESTEP;
        this.defaultUpdateInterval = defaults.hasPath("update-interval")
            ? defaults.getDouble("update-interval")
            : SimulationSettings.DEFAULT_UPDATE_INTERVAL;
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        final String root = path(basePath, "");
        final String item = path(basePath, "{simulationId}");

        app.post(root, this::createSimulation);
        app.get(root, this::listSimulations);
        app.get(item, this::getSimulation);
        app.delete(item, this::deleteSimulation);

        app.exception(InvalidConfigurationException.class, (e, ctx) -> {
            LOGGER.warn("Rejected simulation configuration for request {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.BAD_REQUEST).json(ErrorResponseDto.of(
                HttpStatus.BAD_REQUEST.getCode(),
                HttpStatus.BAD_REQUEST.getMessage(),
                e.getMessage()
            ));
        });
        app.exception(SimulationNotFoundException.class, (e, ctx) -> {
            LOGGER.warn("Not found handler triggered for request {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.NOT_FOUND).json(ErrorResponseDto.of(
                HttpStatus.NOT_FOUND.getCode(),
                HttpStatus.NOT_FOUND.getMessage(),
                e.getMessage()
            ));
        });
        app.exception(IllegalStateException.class, (e, ctx) -> {
            LOGGER.warn("Invalid state for request {}: {}", ctx.path(), e.getMessage());
            ctx.status(HttpStatus.CONFLICT).json(ErrorResponseDto.of(
                HttpStatus.CONFLICT.getCode(),
                HttpStatus.CONFLICT.getMessage(),
                e.getMessage()
            ));
        });
        app.exception(Exception.class, (e, ctx) -> {
            LOGGER.error("Unhandled exception for request {}", ctx.path(), e);
            ctx.status(HttpStatus.INTERNAL_SERVER_ERROR).json(ErrorResponseDto.of(
                HttpStatus.INTERNAL_SERVER_ERROR.getCode(),
                HttpStatus.INTERNAL_SERVER_ERROR.getMessage(),
                "An internal server error occurred."
            ));
        });
    }

    void createSimulation(final Context ctx) {
        final SimulationSettings settings = toSettings(parseRequest(ctx.body()));
        final SimulationInstance instance = simulations.create(settings);
        ctx.status(HttpStatus.CREATED).json(new CreateSimulationResponse(
            instance.getId(), settings.numAgents(), settings.mode().wireName()));
    }

    void listSimulations(final Context ctx) {
        ctx.status(HttpStatus.OK).json(simulations.list());
    }

    void getSimulation(final Context ctx) {
        final SimulationInstance instance = simulations.require(ctx.pathParam("simulationId"));
        ctx.status(HttpStatus.OK).json(instance.snapshot());
    }

    void deleteSimulation(final Context ctx) {
        final String simulationId = ctx.pathParam("simulationId");
        if (!simulations.delete(simulationId)) {
            throw new SimulationNotFoundException(simulationId);
        }
        ctx.status(HttpStatus.OK).json(DeleteSimulationResponse.deleted(simulationId));
    }

    /**
     * Applies the configured defaults to a request and validates the result.
     *
     * @throws InvalidConfigurationException if the resulting settings are invalid.
     */
    SimulationSettings toSettings(final CreateSimulationRequest request) {
        return new SimulationSettings(
            request.numAgents() != null ? request.numAgents() : defaultNumAgents,
            request.mode() != null ? SimulationSettings.parseMode(request.mode()) : defaultMode,
            request.timestep() != null ? request.timestep() : defaultTimestep,
            request.updateInterval() != null ? request.updateInterval() : defaultUpdateInterval,
            request.seed(),
            Boolean.TRUE.equals(request.strictTurnRate()));
    }

    private static CreateSimulationRequest parseRequest(final String body) {
        if (body == null || body.isBlank()) {
            return CreateSimulationRequest.EMPTY;
        }
        try {
            final CreateSimulationRequest request = OBJECT_MAPPER.readValue(body, CreateSimulationRequest.class);
            return request != null ? request : CreateSimulationRequest.EMPTY;
        } catch (final JsonProcessingException e) {
            throw new InvalidConfigurationException("Malformed request body: " + e.getOriginalMessage());
        }
    }
}

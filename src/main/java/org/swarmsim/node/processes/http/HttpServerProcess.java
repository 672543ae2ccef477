package org.swarmsim.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.swarmsim.node.processes.AbstractProcess;
import org.swarmsim.node.spi.IController;
import org.swarmsim.node.spi.ServiceRegistry;
import org.swarmsim.server.SimulationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a Javalin server whose endpoints are assembled from the {@code routes} block of its options.
 * <p>
 * Nested keys of the {@code routes} block form the URL path; a {@code "$controller"} entry mounts
 * an {@link IController} at the path of its parent:
 * <pre>
 * routes {
 *   api.simulations."$controller" { className = "...SimulationController", options { ... } }
 *   health."$controller" { className = "...NodeController" }
 * }
 * </pre>
 * Requires the {@code simulationRegistry} dependency, which controllers obtain from the
 * process's {@link ServiceRegistry}.
 */
public class HttpServerProcess extends AbstractProcess {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private static final String ROUTES_CONFIG_KEY = "routes";
    private static final String CONTROLLER_ACTION_KEY = "$controller";

    private final List<RouteDefinition> routeDefinitions = new ArrayList<>();
    private final List<IController> controllers = new ArrayList<>();
    private final ServiceRegistry controllerRegistry = new ServiceRegistry();
    private Javalin app;

    /**
     * @param processName  The name of this process instance.
     * @param dependencies Must contain {@code simulationRegistry}.
     * @param options      Network, CORS and route settings.
     */
    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        controllerRegistry.register(SimulationRegistry.class, getDependency("simulationRegistry", SimulationRegistry.class));
        parseRoutes();
        LOGGER.debug("HttpServerProcess '{}' initialized with {} route(s).", processName, routeDefinitions.size());
    }

    @Override
    public void start() {
        if (app != null) {
            LOGGER.warn("HTTP server is already running.");
            return;
        }

        final String host = options.hasPath("network.host") ? options.getString("network.host") : "0.0.0.0";
        final int port = options.hasPath("network.port") ? options.getInt("network.port") : 8000;
        final boolean corsEnabled = options.hasPath("cors.enabled") && options.getBoolean("cors.enabled");

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.statusCode(), ms);
                }
            });

            final int minThreads = options.hasPath("network.threadPool.minThreads")
                ? options.getInt("network.threadPool.minThreads")
                : 8;
            final int maxThreads = options.hasPath("network.threadPool.maxThreads")
                ? options.getInt("network.threadPool.maxThreads")
                : 200;
            final int idleTimeout = options.hasPath("network.threadPool.idleTimeoutMs")
                ? options.getInt("network.threadPool.idleTimeoutMs")
                : 60000;
            final QueuedThreadPool threadPool = new QueuedThreadPool(maxThreads, minThreads, idleTimeout);
            threadPool.setName(processName);
            config.jetty.threadPool = threadPool;
            LOGGER.debug("Configured thread pool '{}' with {} min threads, {} max threads, {} ms idle timeout",
                threadPool.getName(), minThreads, maxThreads, idleTimeout);

            if (corsEnabled) {
                config.bundledPlugins.enableCors(cors -> cors.addRule(rule -> rule.anyHost()));
            }
        });

        for (final RouteDefinition definition : routeDefinitions) {
            try {
                registerController(definition, app);
            } catch (final Exception e) {
                LOGGER.error("Failed to register controller at path '{}'", definition.basePath(), e);
            }
        }

        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            closeControllers();
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * @return The port the server is bound to, which differs from the configured one when that was 0.
     * @throws IllegalStateException if the server is not running.
     */
    public int getPort() {
        if (app == null) {
            throw new IllegalStateException("HTTP server '" + processName + "' is not running");
        }
        return app.port();
    }

    private void parseRoutes() {
        if (!options.hasPath(ROUTES_CONFIG_KEY)) {
            LOGGER.warn("No '{}' block found in http-server configuration. No routes will be served.", ROUTES_CONFIG_KEY);
            return;
        }
        parseConfigLevel(options.getConfig(ROUTES_CONFIG_KEY).root(), "");
    }

    private void parseConfigLevel(final ConfigObject configObject, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : configObject.entrySet()) {
            final String key = entry.getKey();
            final ConfigValue value = entry.getValue();
            if (key.equals(CONTROLLER_ACTION_KEY)) {
                if (value.valueType() == ConfigValueType.OBJECT) {
                    routeDefinitions.add(new RouteDefinition(currentPath.isEmpty() ? "/" : currentPath, (ConfigObject) value));
                } else {
                    LOGGER.error("Invalid config for '{}' at path '{}'. Expected an object.", CONTROLLER_ACTION_KEY, currentPath);
                }
            } else if (value.valueType() == ConfigValueType.OBJECT) {
                parseConfigLevel((ConfigObject) value, currentPath + "/" + key);
            }
        }
    }

    private void registerController(final RouteDefinition definition, final Javalin app) throws Exception {
        final Config controllerConfig = definition.config().toConfig();
        final String className = controllerConfig.getString("className");
        final Config controllerOptions = controllerConfig.hasPath("options")
            ? controllerConfig.getConfig("options")
            : ConfigFactory.empty();

        LOGGER.debug("Registering controller '{}' at base path '{}'", className, definition.basePath());
        final Class<?> controllerClass = Class.forName(className);
        if (!IController.class.isAssignableFrom(controllerClass)) {
            throw new IllegalArgumentException("Class " + className + " does not implement IController.");
        }
        final Constructor<?> constructor = controllerClass.getConstructor(ServiceRegistry.class, Config.class);
        final IController controller = (IController) constructor.newInstance(controllerRegistry, controllerOptions);
        controller.registerRoutes(app, definition.basePath());
        controllers.add(controller);
    }

    private void closeControllers() {
        for (final IController controller : controllers) {
            if (controller instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) controller).close();
                } catch (final Exception e) {
                    LOGGER.warn("Failed to close controller {}", controller.getClass().getSimpleName(), e);
                }
            }
        }
        controllers.clear();
    }

    /**
     * @return The controllers mounted by the running server, in registration order.
     */
    List<IController> getControllers() {
        return List.copyOf(controllers);
    }

    private record RouteDefinition(String basePath, ConfigObject config) {
    }
}

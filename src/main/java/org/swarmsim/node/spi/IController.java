package org.swarmsim.node.spi;

import io.javalin.Javalin;

/**
 * An HTTP or WebSocket endpoint group mounted by the HTTP server process.
 */
public interface IController {

    /**
     * Registers this controller's handlers.
     *
     * @param app      The Javalin application.
     * @param basePath The path all of this controller's routes are nested under, e.g. {@code /api/simulations}.
     */
    void registerRoutes(Javalin app, String basePath);
}

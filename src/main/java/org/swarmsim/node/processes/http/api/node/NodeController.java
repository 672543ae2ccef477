package org.swarmsim.node.processes.http.api.node;

import com.typesafe.config.Config;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.swarmsim.node.processes.http.AbstractController;
import org.swarmsim.node.processes.http.api.node.dto.HealthResponseDto;
import org.swarmsim.node.spi.ServiceRegistry;

/**
 * Liveness endpoint of the node.
 */
public class NodeController extends AbstractController {

    public NodeController(final ServiceRegistry registry, final Config options) {
        super(registry, options);
    }

    @Override
    public void registerRoutes(final Javalin app, final String basePath) {
        app.get(path(basePath, ""), this::getHealth);
    }

    void getHealth(final Context ctx) {
        ctx.status(HttpStatus.OK).json(HealthResponseDto.OK);
    }
}

package org.swarmsim.node.processes.http;

import com.typesafe.config.Config;
import org.swarmsim.node.spi.IController;
import org.swarmsim.node.spi.ServiceRegistry;

/**
 * Base class for controllers instantiated by {@link HttpServerProcess}. Every controller is built
 * through the same {@code (ServiceRegistry, Config)} constructor.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    /**
     * @param registry The services of the owning HTTP server process.
     * @param options  The {@code options} block of this controller's route entry.
     */
    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }

    /**
     * Joins a base path and a suffix without doubling or dropping the separator.
     */
    protected static String path(final String basePath, final String suffix) {
        final String base = basePath.endsWith("/") ? basePath.substring(0, basePath.length() - 1) : basePath;
        if (suffix.isEmpty()) {
            return base.isEmpty() ? "/" : base;
        }
        return base + (suffix.startsWith("/") ? suffix : "/" + suffix);
    }
}

package org.glossa.node.processes.http;

import com.typesafe.config.Config;
import org.glossa.node.spi.IController;
import org.glossa.node.spi.ServiceRegistry;

/**
 * Base class for {@link IController} implementations. Every controller is constructed with the
 * server's {@link ServiceRegistry} and its own {@code options} block, which lets the HTTP server
 * instantiate controllers reflectively from the {@code routes} configuration.
 */
public abstract class AbstractController implements IController {

    protected final ServiceRegistry registry;
    protected final Config options;

    protected AbstractController(final ServiceRegistry registry, final Config options) {
        this.registry = registry;
        this.options = options;
    }
}

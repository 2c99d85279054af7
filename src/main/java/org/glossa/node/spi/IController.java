package org.glossa.node.spi;

import io.javalin.Javalin;

/**
 * An HTTP API controller mounted by the HTTP server process under a configured base path.
 */
public interface IController {

    /**
     * Registers all routes of this controller.
     *
     * @param app      the Javalin application
     * @param basePath the base path under which the routes are nested, ending with "/"
     */
    void registerRoutes(Javalin app, String basePath);
}

package org.glossa.node.processes.http;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import io.javalin.Javalin;
import org.eclipse.jetty.util.thread.QueuedThreadPool;
import org.glossa.node.processes.AbstractProcess;
import org.glossa.node.spi.IController;
import org.glossa.node.spi.ServiceRegistry;
import org.glossa.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A Node process that runs the Javalin HTTP server. Controllers are mounted from the
 * {@code routes} tree of its options: every {@code "$controller"} entry mounts the named
 * {@link IController} at the path formed by its enclosing keys.
 *
 * <pre>
 * httpServer {
 *   className = "org.glossa.node.processes.http.HttpServerProcess"
 *   require { workspace = "workspace" }
 *   options {
 *     network { host = "0.0.0.0", port = 8000 }
 *     cors { enabled = true, allowedOrigins = ["*"] }
 *     routes {
 *       api {
 *         auth { "$controller" { className = "org.glossa.node.processes.http.api.auth.AuthController" } }
 *       }
 *     }
 *   }
 * }
 * </pre>
 *
 * <p>The injected {@link Workspace} is registered in the {@link ServiceRegistry} handed to every
 * controller.</p>
 */
public class HttpServerProcess extends AbstractProcess {
    private static final Logger LOGGER = LoggerFactory.getLogger(HttpServerProcess.class);

    private static final String ROUTES_CONFIG_KEY = "routes";
    private static final String CONTROLLER_ACTION_KEY = "$controller";
    private static final long DEFAULT_MAX_REQUEST_SIZE = 50L * 1024 * 1024;

    private final List<RouteDefinition> routeDefinitions = new ArrayList<>();
    private final ServiceRegistry controllerRegistry;
    private Javalin app;

    /**
     * @param processName  the name of this process in the configuration
     * @param dependencies expects {@code workspace}, exposed by the workspace process
     * @param options      network, CORS and route configuration
     */
    public HttpServerProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);

        this.controllerRegistry = new ServiceRegistry();
        this.controllerRegistry.register(Workspace.class, getDependency("workspace", Workspace.class));

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

        app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.requestLogger.http((ctx, ms) -> {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Request: {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.statusCode(), ms);
                }
            });

            config.http.maxRequestSize = options.hasPath("network.maxRequestSizeBytes")
                ? options.getBytes("network.maxRequestSizeBytes")
                : DEFAULT_MAX_REQUEST_SIZE;

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

            configureCors(config);
        });

        registerControllers(app);

        app.start(host, port);
        LOGGER.info("HTTP server started on {}:{}", host, app.port());
    }

    @Override
    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
            LOGGER.info("HTTP server stopped.");
        }
    }

    /**
     * @return the bound port, or -1 if the server is not running
     */
    public int getPort() {
        return app != null ? app.port() : -1;
    }

    private void configureCors(final io.javalin.config.JavalinConfig config) {
        if (!options.hasPath("cors.enabled") || !options.getBoolean("cors.enabled")) {
            return;
        }
        final List<String> origins = options.hasPath("cors.allowedOrigins")
            ? options.getStringList("cors.allowedOrigins")
            : List.of("*");

        config.bundledPlugins.enableCors(cors -> cors.addRule(rule -> {
            if (origins.contains("*")) {
                rule.anyHost();
            } else {
                origins.forEach(origin -> rule.allowHost(origin));
            }
        }));
        LOGGER.debug("CORS enabled for origins {}", origins);
    }

    private void parseRoutes() {
        if (!options.hasPath(ROUTES_CONFIG_KEY)) {
            LOGGER.warn("No '{}' block found in http-server configuration. No routes will be served.", ROUTES_CONFIG_KEY);
            return;
        }
        parseConfigLevel(options.getObject(ROUTES_CONFIG_KEY), "/");
    }

    private void parseConfigLevel(final ConfigObject configObject, final String currentPath) {
        for (final Map.Entry<String, ConfigValue> entry : configObject.entrySet()) {
            final String key = entry.getKey();
            final ConfigValue value = entry.getValue();
            if (value.valueType() != ConfigValueType.OBJECT) {
                LOGGER.error("Invalid route config at path '{}{}'. Expected an object.", currentPath, key);
                continue;
            }
            if (CONTROLLER_ACTION_KEY.equals(key)) {
                routeDefinitions.add(new RouteDefinition(currentPath, (ConfigObject) value));
            } else {
                parseConfigLevel((ConfigObject) value, (currentPath + key + "/").replaceAll("//", "/"));
            }
        }
    }

    private void registerControllers(final Javalin app) {
        for (final RouteDefinition def : routeDefinitions) {
            try {
                registerController(def, app);
            } catch (final Exception e) {
                LOGGER.error("Failed to register controller at path '{}'", def.basePath, e);
            }
        }
    }

    private void registerController(final RouteDefinition def, final Javalin app) throws Exception {
        final Config controllerConfig = def.configValue.toConfig();
        final String className = controllerConfig.getString("className");
        final Config controllerOptions = controllerConfig.hasPath("options")
            ? controllerConfig.getConfig("options")
            : ConfigFactory.empty();

        final Class<?> controllerClass = Class.forName(className);
        if (!IController.class.isAssignableFrom(controllerClass)) {
            throw new IllegalArgumentException("Class " + className + " does not implement IController.");
        }
        final Constructor<?> constructor = controllerClass.getConstructor(ServiceRegistry.class, Config.class);
        final IController controller = (IController) constructor.newInstance(controllerRegistry, controllerOptions);

        controller.registerRoutes(app, def.basePath);
        LOGGER.debug("Registered controller '{}' at base path '{}'", className, def.basePath);
    }

    private static final class RouteDefinition {
        private final String basePath;
        private final ConfigObject configValue;

        RouteDefinition(final String basePath, final ConfigObject configValue) {
            this.basePath = Objects.requireNonNull(basePath);
            this.configValue = Objects.requireNonNull(configValue);
        }
    }
}

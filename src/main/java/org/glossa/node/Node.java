package org.glossa.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.glossa.node.spi.IProcess;
import org.glossa.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The running Glossa service. Reads the {@code node.processes} block, instantiates every
 * configured {@link IProcess} in dependency order, and manages their lifecycle.
 *
 * <p>Each process entry names a {@code className} with a public
 * {@code (String, Map<String, Object>, Config)} constructor, optional {@code options}, and an
 * optional {@code require} block mapping local names to other processes. A required process must
 * implement {@link IServiceProvider}; its exposed service is injected under the local name.</p>
 *
 * <pre>
 * node.processes {
 *   workspace { className = "org.glossa.node.processes.workspace.WorkspaceProcess", options { ... } }
 *   httpServer {
 *     className = "org.glossa.node.processes.http.HttpServerProcess"
 *     require { workspace = "workspace" }
 *     options { ... }
 *   }
 * }
 * </pre>
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_CONFIG_PATH = "node.processes";

    private final Map<String, IProcess> managedProcesses = new LinkedHashMap<>();
    private Thread shutdownHook;
    private boolean stopped;

    /**
     * Creates the node and instantiates all configured processes. Processes that fail to
     * instantiate are logged and skipped.
     *
     * @param config the fully resolved application configuration
     * @throws IllegalStateException if process dependencies are missing or circular
     */
    public Node(final Config config) {
        initializeProcesses(config);
    }

    /**
     * Starts all processes in dependency order and registers a JVM shutdown hook.
     */
    public void start() {
        if (managedProcesses.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        }
        managedProcesses.forEach((name, process) -> {
            try {
                LOGGER.debug("Starting process '{}'...", name);
                process.start();
            } catch (final Exception e) {
                LOGGER.error("Failed to start process '{}'. The node may be unstable.", name, e);
            }
        });

        shutdownHook = new Thread(this::stop, "glossa-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started with {} process(es).", managedProcesses.size());
    }

    /**
     * Stops all processes in reverse start order. Calling it again has no effect.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;

        if (shutdownHook != null && Thread.currentThread() != shutdownHook) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                // JVM is already shutting down
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
        }

        final List<String> names = new ArrayList<>(managedProcesses.keySet());
        Collections.reverse(names);
        for (final String name : names) {
            try {
                LOGGER.debug("Stopping process '{}'...", name);
                managedProcesses.get(name).stop();
            } catch (final Exception e) {
                LOGGER.error("Error while stopping process '{}'.", name, e);
            }
        }
        LOGGER.info("All processes stopped.");
    }

    /**
     * @return the names of the instantiated processes, in start order
     */
    public List<String> getProcessNames() {
        return List.copyOf(managedProcesses.keySet());
    }

    /**
     * @param name the process name
     * @return the process instance, or null if it was not instantiated
     */
    public IProcess getProcess(final String name) {
        return managedProcesses.get(name);
    }

    private void initializeProcesses(final Config config) {
        if (!config.hasPath(PROCESSES_CONFIG_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_CONFIG_PATH);
            return;
        }

        final ConfigObject processesConfig = config.getObject(PROCESSES_CONFIG_PATH);
        final Map<String, ProcessDefinition> definitions = new LinkedHashMap<>();
        for (final String processName : processesConfig.keySet()) {
            try {
                definitions.put(processName, ProcessDefinition.parse(processName, processesConfig.toConfig().getConfig(processName)));
            } catch (final Exception e) {
                LOGGER.error("Failed to parse process '{}'. Skipping this process.", processName, e);
            }
        }

        final Map<String, Object> exposedServices = new HashMap<>();
        for (final String processName : dependencyOrder(definitions)) {
            final ProcessDefinition def = definitions.get(processName);
            try {
                final IProcess process = instantiate(def, resolveDependencies(def, exposedServices));
                managedProcesses.put(processName, process);
                if (process instanceof IServiceProvider) {
                    final Object service = ((IServiceProvider) process).getExposedService();
                    if (service != null) {
                        exposedServices.put(processName, service);
                    }
                }
                LOGGER.debug("Instantiated process '{}' ({}).", processName, def.className);
            } catch (final Exception e) {
                LOGGER.error("Failed to initialize process '{}'. Skipping this process.", processName, e);
            }
        }
        LOGGER.info("Initialized {} process(es).", managedProcesses.size());
    }

    private static Map<String, Object> resolveDependencies(final ProcessDefinition def,
                                                           final Map<String, Object> exposedServices) {
        final Map<String, Object> injected = new HashMap<>();
        def.requires.forEach((localName, sourceProcess) -> {
            final Object service = exposedServices.get(sourceProcess);
            if (service == null) {
                throw new IllegalStateException("Process '" + def.name + "' requires a service from '"
                    + sourceProcess + "' but it is not available.");
            }
            injected.put(localName, service);
        });
        return injected;
    }

    private static IProcess instantiate(final ProcessDefinition def, final Map<String, Object> dependencies) throws Exception {
        final Class<?> processClass = Class.forName(def.className);
        if (!IProcess.class.isAssignableFrom(processClass)) {
            throw new IllegalArgumentException("Class " + def.className + " does not implement IProcess.");
        }
        final Constructor<?> constructor = processClass.getConstructor(String.class, Map.class, Config.class);
        return (IProcess) constructor.newInstance(def.name, dependencies, def.options);
    }

    /**
     * Orders processes so that every process comes after the processes it requires
     * (Kahn's algorithm). Ties keep configuration order.
     *
     * @throws IllegalStateException on an unknown or circular dependency
     */
    static List<String> dependencyOrder(final Map<String, ProcessDefinition> definitions) {
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        final Map<String, Set<String>> dependents = new HashMap<>();
        for (final String name : definitions.keySet()) {
            inDegree.put(name, 0);
            dependents.put(name, new LinkedHashSet<>());
        }
        for (final ProcessDefinition def : definitions.values()) {
            for (final String required : def.requires.values()) {
                if (!definitions.containsKey(required)) {
                    throw new IllegalStateException("Process '" + def.name + "' depends on '" + required
                        + "' which is not defined in the configuration.");
                }
                if (dependents.get(required).add(def.name)) {
                    inDegree.merge(def.name, 1, Integer::sum);
                }
            }
        }

        final Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });

        final List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String current = ready.poll();
            order.add(current);
            for (final String dependent : dependents.get(current)) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() != definitions.size()) {
            final List<String> remaining = new ArrayList<>(definitions.keySet());
            remaining.removeAll(order);
            throw new IllegalStateException("Circular dependency detected among processes: " + remaining
                + ". Check the 'require' configuration.");
        }
        return order;
    }

    static final class ProcessDefinition {
        final String name;
        final String className;
        final Config options;
        final Map<String, String> requires;

        ProcessDefinition(final String name, final String className, final Config options, final Map<String, String> requires) {
            this.name = name;
            this.className = className;
            this.options = options;
            this.requires = requires;
        }

        static ProcessDefinition parse(final String name, final Config processConfig) {
            final Config options = processConfig.hasPath("options")
                ? processConfig.getConfig("options")
                : ConfigFactory.empty();
            final Map<String, String> requires = new LinkedHashMap<>();
            if (processConfig.hasPath("require")) {
                final Config requireConfig = processConfig.getConfig("require");
                for (final String localName : processConfig.getObject("require").keySet()) {
                    requires.put(localName, requireConfig.getString(localName));
                }
            }
            return new ProcessDefinition(name, processConfig.getString("className"), options, requires);
        }
    }
}

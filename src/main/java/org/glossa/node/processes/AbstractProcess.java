package org.glossa.node.processes;

import com.typesafe.config.Config;
import org.glossa.node.spi.IProcess;

import java.util.Collections;
import java.util.Map;

/**
 * Base class for {@link IProcess} implementations instantiated by the Node. Every process is
 * constructed with its configured name, its injected dependencies and its {@code options} block.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  the name of this process in the configuration
     * @param dependencies dependencies declared under {@code require}, keyed by local name
     * @param options      the process options
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? dependencies : Collections.emptyMap();
        this.options = options;
    }

    /**
     * Retrieves a required dependency.
     *
     * @param name         the local dependency name from the {@code require} block
     * @param expectedType the expected type
     * @param <T>          the dependency type
     * @return the dependency
     * @throws IllegalArgumentException if the dependency is missing or has the wrong type
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final Object dep = dependencies.get(name);
        if (dep == null) {
            throw new IllegalArgumentException(
                "Required dependency '" + name + "' not found for process '" + processName + "'");
        }
        if (!expectedType.isInstance(dep)) {
            throw new IllegalArgumentException(
                "Dependency '" + name + "' for process '" + processName + "' is "
                    + dep.getClass().getName() + " but expected " + expectedType.getName());
        }
        return expectedType.cast(dep);
    }
}

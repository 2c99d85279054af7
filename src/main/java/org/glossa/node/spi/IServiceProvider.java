package org.glossa.node.spi;

/**
 * Implemented by processes that expose a service to other processes.
 * <p>
 * Consumers declare the dependency in their {@code require} block; the Node injects the exposed
 * instance into their constructor under the declared local name. For example,
 * {@code WorkspaceProcess} exposes the {@code Workspace} consumed by {@code HttpServerProcess}.
 */
public interface IServiceProvider {

    /**
     * @return the service instance exposed to dependent processes, or null if none
     */
    Object getExposedService();
}

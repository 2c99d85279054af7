package org.glossa.node.spi;

/**
 * A long-running component managed by the {@link org.glossa.node.Node}, such as the workspace
 * or the HTTP server.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block; servers run on their own threads.
     */
    void start();

    /**
     * Stops the process and releases its resources.
     */
    void stop();
}

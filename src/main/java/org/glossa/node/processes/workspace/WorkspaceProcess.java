package org.glossa.node.processes.workspace;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.glossa.node.processes.AbstractProcess;
import org.glossa.node.spi.IServiceProvider;
import org.glossa.workspace.Workspace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * A Node process that owns the {@link Workspace} and exposes it to dependent processes.
 *
 * <pre>
 * workspace {
 *   className = "org.glossa.node.processes.workspace.WorkspaceProcess"
 *   options {
 *     storage { type = "file", rootDirectory = "${user.home}/glossa-data" }
 *     documents { previewLength = 120, textExtensions = [".txt"] }
 *   }
 * }
 * </pre>
 */
public class WorkspaceProcess extends AbstractProcess implements IServiceProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(WorkspaceProcess.class);

    private final Workspace workspace;

    public WorkspaceProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.workspace = Workspace.create(options, new ObjectMapper());
        LOGGER.debug("WorkspaceProcess '{}' initialized.", processName);
    }

    @Override
    public void start() {
        // Stores are passive; nothing runs in the background
        LOGGER.debug("WorkspaceProcess '{}' ready.", processName);
    }

    @Override
    public void stop() {
        LOGGER.info("Workspace closed, {} session(s) dropped.", workspace.sessions().activeSessions());
    }

    @Override
    public Object getExposedService() {
        return workspace;
    }
}

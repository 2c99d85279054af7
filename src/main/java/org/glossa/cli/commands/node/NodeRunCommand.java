package org.glossa.cli.commands.node;

import com.typesafe.config.Config;
import org.glossa.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the Glossa server and blocks until the JVM is stopped."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);
    private static final String PID_FILE_NAME = ".glossa.pid";

    @ParentCommand
    private NodeCommand parent;

    @Option(names = {"-d", "--detach"}, description = "Write a PID file for running the node in the background.")
    private boolean detach;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getParent().getConfig();

        if (detach) {
            LOGGER.info("Starting node in detached mode...");
            createPidFile();
        } else {
            LOGGER.info("Starting node in foreground...");
        }

        final Node node = new Node(config);
        node.start();

        // The shutdown hook registered by the node stops all processes.
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Node stopped.");
        }
        return 0;
    }

    private void createPidFile() throws IOException {
        final File pidFile = new File(PID_FILE_NAME);
        try (PrintWriter writer = new PrintWriter(pidFile)) {
            writer.println(ProcessHandle.current().pid());
        }
        pidFile.deleteOnExit();
        LOGGER.info("PID file created at {}", pidFile.getAbsolutePath());
    }
}

package org.glossa.cli.commands.node;

import org.glossa.cli.CommandLineInterface;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "node",
    description = "Manages the Glossa annotation server",
    subcommands = {
        NodeRunCommand.class
    }
)
public class NodeCommand {
    @ParentCommand
    private CommandLineInterface parent;

    public CommandLineInterface getParent() {
        return parent;
    }
}

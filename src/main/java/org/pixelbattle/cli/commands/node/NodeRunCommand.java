package org.pixelbattle.cli.commands.node;

import com.typesafe.config.Config;
import org.pixelbattle.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the PixelBattle node in the foreground."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);

    @ParentCommand
    private NodeCommand parent;

    @Override
    public Integer call() {
        final Config config = parent.getParent().getConfig();
        LOGGER.info("Starting node in foreground...");

        final Node node = new Node(config);
        node.start();

        // The shutdown hook registered by the node stops the processes.
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Node stopped gracefully.");
        }
        return 0;
    }
}

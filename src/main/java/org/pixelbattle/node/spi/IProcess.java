package org.pixelbattle.node.spi;

/**
 * A long-running, manageable component hosted by the {@link org.pixelbattle.node.Node}.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block: continuous work belongs on a thread or executor owned by
     * the process.
     */
    void start();

    /**
     * Stops the process and releases its resources. Called once, in reverse start order.
     */
    void stop();
}

package org.pixelbattle.node.spi;

/**
 * Implemented by processes that expose a service to other processes. The node injects the exposed
 * service into every process that declares it under {@code require}.
 */
public interface IServiceProvider {

    /**
     * @return the exposed service, or {@code null} if there is nothing to expose
     */
    Object getExposedService();
}

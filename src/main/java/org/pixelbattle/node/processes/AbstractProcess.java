package org.pixelbattle.node.processes;

import com.typesafe.config.Config;
import org.pixelbattle.node.spi.IProcess;

import java.util.Collections;
import java.util.Map;

/**
 * Base class for {@link IProcess} implementations. Every process is constructed by the node with
 * the same three arguments: its configured name, the services it required, and its options block.
 */
public abstract class AbstractProcess implements IProcess {

    protected final String processName;
    protected final Map<String, Object> dependencies;
    protected final Config options;

    /**
     * @param processName  name of this process in the configuration
     * @param dependencies local dependency name to injected service
     * @param options      the process's {@code options} block
     */
    protected AbstractProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        this.processName = processName;
        this.dependencies = dependencies != null ? dependencies : Collections.emptyMap();
        this.options = options;
    }

    public String getProcessName() {
        return processName;
    }

    /**
     * Retrieves a required dependency.
     *
     * @throws IllegalArgumentException if the dependency is missing or has the wrong type
     */
    protected <T> T getDependency(final String name, final Class<T> expectedType) {
        final T dep = getOptionalDependency(name, expectedType);
        if (dep == null) {
            throw new IllegalArgumentException(
                "Required dependency '" + name + "' not found for process '" + processName + "'");
        }
        return dep;
    }

    /**
     * Retrieves an optional dependency.
     *
     * @return the dependency, or {@code null} if it was not declared
     * @throws IllegalArgumentException if the dependency has the wrong type
     */
    protected <T> T getOptionalDependency(final String name, final Class<T> expectedType) {
        final Object dep = dependencies.get(name);
        if (dep == null) {
            return null;
        }
        if (!expectedType.isInstance(dep)) {
            throw new IllegalArgumentException(
                "Dependency '" + name + "' for process '" + processName + "' is "
                    + dep.getClass().getName() + " but expected " + expectedType.getName());
        }
        return expectedType.cast(dep);
    }
}

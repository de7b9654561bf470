package org.pixelbattle.node;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.pixelbattle.node.spi.IProcess;
import org.pixelbattle.node.spi.IServiceProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hosts the configured processes of a PixelBattle node: the ledger itself and whatever drives it
 * (cycle watchdog, future front ends).
 *
 * <p>Processes are declared under {@code node.processes}. Each entry names a class implementing
 * {@link IProcess} with a {@code (String, Map, Config)} constructor, an optional {@code options}
 * block and an optional {@code require} block mapping local names to other processes whose exposed
 * services get injected. Processes are created in dependency order and stopped in reverse.</p>
 */
public final class Node {
    private static final Logger LOGGER = LoggerFactory.getLogger(Node.class);
    private static final String PROCESSES_PATH = "node.processes";

    private final Map<String, IProcess> managedProcesses = new LinkedHashMap<>();
    private Thread shutdownHook;

    /**
     * Creates all configured processes.
     *
     * @param config the resolved application configuration
     * @throws IllegalStateException if a process cannot be created or the dependencies are circular
     */
    public Node(final Config config) {
        try {
            initializeProcesses(config);
        } catch (final Exception e) {
            LOGGER.error("Failed to initialize the node.", e);
            throw new IllegalStateException("Node initialization failed", e);
        }
    }

    /**
     * Starts all processes in creation order and registers a shutdown hook.
     *
     * @throws IllegalStateException if a process fails to start; processes started so far are stopped again
     */
    public void start() {
        if (managedProcesses.isEmpty()) {
            LOGGER.warn("No processes configured to start. The node will be idle.");
        }
        final List<String> started = new ArrayList<>();
        for (final Map.Entry<String, IProcess> entry : managedProcesses.entrySet()) {
            try {
                LOGGER.debug("Starting process '{}'...", entry.getKey());
                entry.getValue().start();
                started.add(entry.getKey());
            } catch (final RuntimeException e) {
                LOGGER.error("Failed to start process '{}'. Stopping the node.", entry.getKey(), e);
                stopAll(started);
                throw new IllegalStateException("Process '" + entry.getKey() + "' failed to start", e);
            }
        }

        shutdownHook = new Thread(this::stop, "shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);
        LOGGER.info("Node started with {} process(es): {}", managedProcesses.size(), managedProcesses.keySet());
    }

    /**
     * Stops all processes in reverse creation order.
     */
    public void stop() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (final IllegalStateException e) {
                // JVM is already shutting down and running this hook
                LOGGER.debug("Could not remove shutdown hook: {}", e.getMessage());
            }
            shutdownHook = null;
        }
        LOGGER.info("Shutdown sequence initiated...");
        stopAll(new ArrayList<>(managedProcesses.keySet()));
        LOGGER.info("All processes stopped.");
    }

    /**
     * @return the process registered under {@code name}, or {@code null}
     */
    public IProcess getProcess(final String name) {
        return managedProcesses.get(name);
    }

    public Map<String, IProcess> getProcesses() {
        return Collections.unmodifiableMap(managedProcesses);
    }

    private void stopAll(final List<String> names) {
        final List<String> reversed = new ArrayList<>(names);
        Collections.reverse(reversed);
        for (final String name : reversed) {
            try {
                managedProcesses.get(name).stop();
                LOGGER.debug("Process '{}' stopped.", name);
            } catch (final RuntimeException e) {
                LOGGER.error("Error while stopping process '{}'.", name, e);
            }
        }
    }

    private void initializeProcesses(final Config config) throws ReflectiveOperationException {
        if (!config.hasPath(PROCESSES_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No processes will be loaded.", PROCESSES_PATH);
            return;
        }
        final ConfigObject processesConfig = config.getObject(PROCESSES_PATH);

        final Map<String, ProcessDefinition> definitions = new LinkedHashMap<>();
        for (final String name : processesConfig.keySet()) {
            final Config processConfig = processesConfig.toConfig().getConfig(quote(name));
            final Config options = processConfig.hasPath("options")
                ? processConfig.getConfig("options")
                : ConfigFactory.empty();
            final Map<String, String> requires = new LinkedHashMap<>();
            if (processConfig.hasPath("require")) {
                final Config requireConfig = processConfig.getConfig("require");
                for (final String localName : processConfig.getObject("require").keySet()) {
                    requires.put(localName, requireConfig.getString(quote(localName)));
                }
            }
            definitions.put(name, new ProcessDefinition(name, processConfig.getString("className"), options, requires));
        }

        final Map<String, Object> exposedServices = new HashMap<>();
        for (final String name : dependencyOrder(definitions)) {
            final ProcessDefinition def = definitions.get(name);
            final Map<String, Object> injected = new HashMap<>();
            for (final Map.Entry<String, String> requirement : def.requires().entrySet()) {
                final Object service = exposedServices.get(requirement.getValue());
                if (service == null) {
                    throw new IllegalStateException("Process '" + name + "' requires '" + requirement.getValue()
                        + "', which exposes no service.");
                }
                injected.put(requirement.getKey(), service);
            }

            final Class<?> processClass = Class.forName(def.className());
            if (!IProcess.class.isAssignableFrom(processClass)) {
                throw new IllegalArgumentException("Class " + def.className() + " does not implement IProcess.");
            }
            final Constructor<?> constructor = processClass.getConstructor(String.class, Map.class, Config.class);
            final IProcess process = (IProcess) constructor.newInstance(name, injected, def.options());
            managedProcesses.put(name, process);

            if (process instanceof IServiceProvider provider && provider.getExposedService() != null) {
                exposedServices.put(name, provider.getExposedService());
            }
            LOGGER.debug("Created process '{}' ({}) with dependencies {}.", name, def.className(), def.requires().values());
        }
    }

    /**
     * Orders processes so that every process comes after the ones it requires (Kahn's algorithm).
     * Ties keep configuration order.
     */
    private static List<String> dependencyOrder(final Map<String, ProcessDefinition> definitions) {
        final Map<String, Integer> inDegree = new LinkedHashMap<>();
        final Map<String, List<String>> dependents = new HashMap<>();
        for (final ProcessDefinition def : definitions.values()) {
            inDegree.put(def.name(), def.requires().size());
            for (final String required : def.requires().values()) {
                if (!definitions.containsKey(required)) {
                    throw new IllegalStateException("Process '" + def.name() + "' depends on '" + required
                        + "' which is not defined in the configuration.");
                }
                dependents.computeIfAbsent(required, k -> new ArrayList<>()).add(def.name());
            }
        }

        final Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((name, degree) -> {
            if (degree == 0) {
                ready.add(name);
            }
        });
        final List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            final String current = ready.poll();
            order.add(current);
            for (final String dependent : dependents.getOrDefault(current, List.of())) {
                if (inDegree.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }
        if (order.size() != definitions.size()) {
            final List<String> remaining = new ArrayList<>(definitions.keySet());
            remaining.removeAll(order);
            throw new IllegalStateException("Circular dependency detected among processes: " + remaining);
        }
        return order;
    }

    private static String quote(final String key) {
        return "\"" + key + "\"";
    }

    private record ProcessDefinition(String name, String className, Config options, Map<String, String> requires) {
    }
}

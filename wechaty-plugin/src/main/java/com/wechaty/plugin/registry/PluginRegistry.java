package com.wechaty.plugin.registry;

import com.wechaty.plugin.PluginNotFoundException;
import com.wechaty.plugin.PluginStatus;
import com.wechaty.plugin.WechatyPlugin;
import com.wechaty.plugin.loader.PluginLocator;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registered plugins by name, in registration order. The order is the
 * dispatch order of every event and survives stop/start cycles.
 *
 * <p>
 * Each registered name has exactly one status; plugin and status are added
 * and removed together. Mutations are serialized on the registry, but an
 * {@link #activePlugins()} snapshot already handed to a dispatcher is not
 * affected by later mutations.
 * </p>
 */
@Slf4j
public class PluginRegistry {

    /**
     * A plugin and the name it is registered under. The registered name stays
     * the key even if the plugin's options are renamed later.
     */
    public record Registration(String name, WechatyPlugin plugin) {
    }

    private final Map<String, WechatyPlugin> plugins = new LinkedHashMap<>();
    private final Map<String, PluginStatus> statuses = new HashMap<>();
    private final PluginLocator locator;

    public PluginRegistry() {
        this(new PluginLocator());
    }

    public PluginRegistry(PluginLocator locator) {
        this.locator = locator;
    }

    // =========================================================================
    // Registration
    // =========================================================================

    /**
     * Register a plugin as running, at the end of the dispatch order. A plugin
     * whose name is already registered is ignored.
     *
     * @return false if the name was taken
     */
    public synchronized boolean add(WechatyPlugin plugin) {
        Objects.requireNonNull(plugin, "plugin");
        String name = plugin.getName();
        if (plugins.containsKey(name)) {
            log.warn("plugin <{}> already exists, ignoring", name);
            return false;
        }
        plugins.put(name, plugin);
        statuses.put(name, PluginStatus.RUNNING);
        log.info("registered plugin <{}>", name);
        return true;
    }

    /**
     * Resolve a plugin from a URL or local path and register it.
     *
     * @throws com.wechaty.plugin.PluginLoadException if the locator resolves to
     *                                                no plugin
     */
    public WechatyPlugin add(String pluginLocator) {
        WechatyPlugin plugin = locator.resolve(pluginLocator);
        add(plugin);
        return plugin;
    }

    public synchronized void remove(String name) {
        requireRegistered(name);
        plugins.remove(name);
        statuses.remove(name);
        log.info("removed plugin <{}>", name);
    }

    // =========================================================================
    // Status
    // =========================================================================

    public synchronized void start(String name) {
        log.info("starting the plugin <{}>", name);
        requireRegistered(name);
        statuses.put(name, PluginStatus.RUNNING);
    }

    public synchronized void stop(String name) {
        log.info("stopping the plugin <{}>", name);
        requireRegistered(name);
        if (statuses.get(name) == PluginStatus.STOPPED) {
            log.warn("plugin <{}> is already stopped", name);
        }
        statuses.put(name, PluginStatus.STOPPED);
    }

    public synchronized PluginStatus status(String name) {
        requireRegistered(name);
        return statuses.get(name);
    }

    /**
     * Whether {@code name} is registered and running. Unlike
     * {@link #status(String)} this never throws.
     */
    public synchronized boolean isRunning(String name) {
        return statuses.get(name) == PluginStatus.RUNNING;
    }

    // =========================================================================
    // Queries
    // =========================================================================

    /**
     * Running plugins in dispatch order, with the names they were registered
     * under.
     */
    public synchronized List<Registration> activeRegistrations() {
        List<Registration> active = new ArrayList<>();
        for (var entry : plugins.entrySet()) {
            if (statuses.get(entry.getKey()) == PluginStatus.RUNNING) {
                active.add(new Registration(entry.getKey(), entry.getValue()));
            }
        }
        return active;
    }

    /**
     * Running plugins in dispatch order.
     */
    public List<WechatyPlugin> activePlugins() {
        return activeRegistrations().stream().map(Registration::plugin).toList();
    }

    /** All registrations in dispatch order, running or not. */
    public synchronized List<Registration> registrations() {
        List<Registration> all = new ArrayList<>();
        plugins.forEach((name, plugin) -> all.add(new Registration(name, plugin)));
        return all;
    }

    /** All plugins in dispatch order, running or not. */
    public synchronized List<WechatyPlugin> plugins() {
        return List.copyOf(plugins.values());
    }

    public synchronized List<String> names() {
        return List.copyOf(plugins.keySet());
    }

    public synchronized boolean contains(String name) {
        return plugins.containsKey(name);
    }

    public synchronized int size() {
        return plugins.size();
    }

    private void requireRegistered(String name) {
        if (!plugins.containsKey(name) || !statuses.containsKey(name)) {
            throw new PluginNotFoundException(name);
        }
    }
}

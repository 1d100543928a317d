package com.wechaty.plugin.manager;

import com.wechaty.common.config.WechatyConfig;
import com.wechaty.common.config.WechatyConfig.PluginsConfig;
import com.wechaty.common.config.WechatyConfig.ServerConfig;
import com.wechaty.plugin.PluginInitException;
import com.wechaty.plugin.PluginStatus;
import com.wechaty.plugin.RouteContributor;
import com.wechaty.plugin.WechatyPlugin;
import com.wechaty.plugin.events.PluginEvent;
import com.wechaty.plugin.events.PluginEventDispatcher;
import com.wechaty.plugin.events.PluginEventDispatcher.DispatchReport;
import com.wechaty.plugin.events.PluginEventDispatcher.FailurePolicy;
import com.wechaty.plugin.http.PluginHttpRegistry;
import com.wechaty.plugin.http.PluginRouteTable;
import com.wechaty.plugin.http.PluginWebServer;
import com.wechaty.plugin.http.RouteRegistrar;
import com.wechaty.plugin.registry.PluginRegistry;
import com.wechaty.plugin.registry.PluginRegistry.Registration;
import com.wechaty.plugin.runtime.WechatyRuntime;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Owns the plugins of one bot: registration, lifecycle, event fan-out and the
 * embedded web server serving plugin routes.
 *
 * <p>
 * {@link #start()} binds every registered plugin to the bot, initializes it
 * and collects its routes, then starts the web server. Each plugin instance is
 * initialized at most once, however often it is stopped and started again.
 * Plugins added after {@code start()} are initialized when they are added.
 * </p>
 */
@Slf4j
public class WechatyPluginManager {

    /**
     * Address of the embedded web server. {@code host} may carry a scheme.
     */
    public record Endpoint(String host, int port) {

        public Endpoint {
            if (host == null || host.isBlank()) {
                host = WechatyConfig.DEFAULT_HOST;
            }
        }
    }

    private final WechatyRuntime runtime;
    private final Endpoint endpoint;
    private final boolean serverEnabled;
    private final List<String> disabledPlugins;

    private final PluginRegistry registry;
    private final PluginEventDispatcher dispatcher;
    private final PluginHttpRegistry httpRegistry = new PluginHttpRegistry();
    private final PluginWebServer webServer = new PluginWebServer(httpRegistry);
    private final Set<WechatyPlugin> initialized = Collections.newSetFromMap(new IdentityHashMap<>());

    private volatile boolean started;

    public WechatyPluginManager(WechatyRuntime runtime, Endpoint endpoint) {
        this(runtime, endpoint, true, List.of(), FailurePolicy.FAIL_FAST, new PluginRegistry());
    }

    public WechatyPluginManager(WechatyRuntime runtime, WechatyConfig config) {
        this(runtime, endpointOf(config), serverConfig(config).isEnabled(),
                pluginsConfig(config).getDisabled(),
                pluginsConfig(config).isIsolateFailures() ? FailurePolicy.ISOLATE : FailurePolicy.FAIL_FAST,
                new PluginRegistry());
    }

    WechatyPluginManager(WechatyRuntime runtime, Endpoint endpoint, boolean serverEnabled,
                         List<String> disabledPlugins, FailurePolicy failurePolicy, PluginRegistry registry) {
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.serverEnabled = serverEnabled;
        this.disabledPlugins = disabledPlugins != null ? List.copyOf(disabledPlugins) : List.of();
        this.registry = registry;
        this.dispatcher = new PluginEventDispatcher(registry, failurePolicy);
    }

    private static ServerConfig serverConfig(WechatyConfig config) {
        return config != null && config.getServer() != null ? config.getServer() : new ServerConfig();
    }

    private static PluginsConfig pluginsConfig(WechatyConfig config) {
        return config != null && config.getPlugins() != null ? config.getPlugins() : new PluginsConfig();
    }

    private static Endpoint endpointOf(WechatyConfig config) {
        ServerConfig server = serverConfig(config);
        return new Endpoint(server.getHost(), server.getPort());
    }

    // =========================================================================
    // Plugin management
    // =========================================================================

    /**
     * Register a plugin. After {@link #start()} it is initialized right away.
     *
     * @throws PluginInitException if initialization fails; the plugin is
     *                             unregistered again
     */
    public synchronized void addPlugin(WechatyPlugin plugin) {
        if (registry.add(plugin) && started) {
            initialize(plugin.getName(), plugin);
        }
    }

    /**
     * Load a plugin from a URL or local path and register it.
     */
    public synchronized WechatyPlugin addPlugin(String pluginLocator) {
        WechatyPlugin plugin = registry.add(pluginLocator);
        if (started && registry.plugins().contains(plugin)) {
            initialize(plugin.getName(), plugin);
        }
        return plugin;
    }

    public void removePlugin(String name) {
        registry.remove(name);
    }

    public void startPlugin(String name) {
        registry.start(name);
    }

    public void stopPlugin(String name) {
        registry.stop(name);
    }

    public PluginStatus pluginStatus(String name) {
        return registry.status(name);
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    public PluginHttpRegistry getHttpRegistry() {
        return httpRegistry;
    }

    public FailurePolicy getFailurePolicy() {
        return dispatcher.getFailurePolicy();
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Base URL of the embedded web server.
     */
    public String serverEndpoint() {
        String host = endpoint.host();
        if (host.startsWith("http")) {
            return host + ":" + endpoint.port();
        }
        return "http://" + host + ":" + endpoint.port();
    }

    /**
     * Initialize the registered plugins in dispatch order and start the web
     * server.
     *
     * @throws PluginInitException if a plugin fails to initialize or to
     *                             contribute its routes; that plugin is
     *                             unregistered, later plugins are not
     *                             initialized and the server is not started
     */
    public synchronized void start() {
        if (started) {
            log.debug("plugin manager of bot <{}> already started", runtime.name());
            return;
        }
        log.info("starting {} plugin(s) for bot <{}>", registry.size(), runtime.name());
        for (Registration registration : registry.registrations()) {
            initialize(registration.name(), registration.plugin());
        }
        for (String name : disabledPlugins) {
            if (registry.contains(name)) {
                registry.stop(name);
            } else {
                log.warn("disabled plugin <{}> is not registered", name);
            }
        }
        started = true;

        if (!serverEnabled) {
            log.info("plugin web server disabled");
            return;
        }
        int port = webServer.start(endpoint.host(), endpoint.port());
        log.info("plugin routes served at {} (bound port {})\n{}",
                serverEndpoint(), port, routesTable());
    }

    public synchronized void stop() {
        webServer.stop();
        started = false;
    }

    public boolean isStarted() {
        return started;
    }

    /** Port the web server is bound to, or -1 when it is not running. */
    public int boundPort() {
        return webServer.port();
    }

    /**
     * Bind, initialize and collect the routes of a registered plugin. On
     * failure the routes it already contributed are dropped and the plugin is
     * removed from the registry, so it never sees an event uninitialized.
     */
    private synchronized void initialize(String name, WechatyPlugin plugin) {
        if (initialized.contains(plugin)) {
            return;
        }
        List<Runnable> routeHandles = new ArrayList<>();
        try {
            plugin.bind(runtime);
            plugin.initPlugin(runtime);
            if (plugin instanceof RouteContributor contributor) {
                RouteRegistrar routes = httpRegistry.forPlugin(name);
                contributor.contributeRoutes((path, methods, handler) -> {
                    Runnable handle = routes.route(path, methods, handler);
                    routeHandles.add(handle);
                    return handle;
                });
            }
        } catch (Exception e) {
            log.error("plugin <{}> failed to initialize: {}", name, e.getMessage(), e);
            routeHandles.forEach(Runnable::run);
            if (registry.contains(name)) {
                registry.remove(name);
            }
            throw new PluginInitException(name, e);
        }
        initialized.add(plugin);
        log.debug("initialized plugin <{}>", name);
    }

    // =========================================================================
    // Events
    // =========================================================================

    /**
     * Validate an untyped event from the puppet and fan it out to the running
     * plugins.
     */
    public DispatchReport emitEvents(String kind, Object... args) {
        return dispatcher.emit(kind, args);
    }

    public DispatchReport dispatch(PluginEvent event) {
        return dispatcher.dispatch(event);
    }

    // =========================================================================
    // Monitoring
    // =========================================================================

    public String routesTable() {
        return PluginRouteTable.render(httpRegistry.getRoutes());
    }

    /**
     * Drain the output of every plugin that has written something since the
     * last call, keyed by plugin name in dispatch order.
     */
    public Map<String, Map<String, Object>> drainOutputs() {
        Map<String, Map<String, Object>> outputs = new LinkedHashMap<>();
        for (Registration registration : registry.registrations()) {
            Map<String, Object> output = registration.plugin().drainOutput();
            if (!output.isEmpty()) {
                outputs.put(registration.name(), output);
            }
        }
        return outputs;
    }
}

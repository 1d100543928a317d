package com.wechaty.plugin.http;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * HTTP routes contributed by plugins, served by {@link PluginWebServer}.
 */
@Slf4j
public class PluginHttpRegistry {

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HttpRouteRegistration {
        private String path;
        /** Upper-case method names, sorted. */
        private Set<String> methods;
        /** {@code <plugin>:<path>}, unique per route. */
        private String endpoint;
        private String pluginName;
        private boolean websocket;
        private PluginHttpHandler handler;
    }

    private final List<HttpRouteRegistration> routes = new CopyOnWriteArrayList<>();

    /**
     * A registrar that records every route under {@code pluginName}.
     */
    public RouteRegistrar forPlugin(String pluginName) {
        Objects.requireNonNull(pluginName, "pluginName");
        return (path, methods, handler) -> register(pluginName, path, methods, handler);
    }

    /**
     * Register a plugin route. A missing path, an empty method set or a method
     * already served on the same path is logged and ignored.
     *
     * @return a Runnable that, when called, unregisters the route
     */
    public synchronized Runnable register(String pluginName, String path, Set<String> methods,
                                          PluginHttpHandler handler) {
        Objects.requireNonNull(handler, "handler");
        String normalizedPath = PluginHttpPath.normalize(path);
        if (normalizedPath == null) {
            log.warn("plugin <{}>: route path missing", pluginName);
            return () -> {
            };
        }
        Set<String> normalizedMethods = normalizeMethods(methods);
        if (normalizedMethods.isEmpty()) {
            log.warn("plugin <{}>: route {} has no methods", pluginName, normalizedPath);
            return () -> {
            };
        }

        for (HttpRouteRegistration existing : routes) {
            if (normalizedPath.equals(existing.getPath())
                    && !Collections.disjoint(existing.getMethods(), normalizedMethods)) {
                log.warn("plugin <{}>: route {} {} already registered by <{}>",
                        pluginName, normalizedMethods, normalizedPath, existing.getPluginName());
                return () -> {
                };
            }
        }

        HttpRouteRegistration entry = HttpRouteRegistration.builder()
                .path(normalizedPath)
                .methods(normalizedMethods)
                .endpoint(pluginName + ":" + normalizedPath)
                .pluginName(pluginName)
                .websocket(false)
                .handler(handler)
                .build();
        routes.add(entry);
        log.debug("registered plugin route {} {} (plugin: {})", normalizedMethods, normalizedPath, pluginName);

        return () -> routes.remove(entry);
    }

    /**
     * The route serving {@code method} on {@code path}.
     */
    public Optional<HttpRouteRegistration> find(String method, String path) {
        String normalizedPath = PluginHttpPath.normalize(path);
        String normalizedMethod = method != null ? method.toUpperCase(Locale.ROOT) : "";
        return routes.stream()
                .filter(r -> r.getPath().equals(normalizedPath))
                .filter(r -> r.getMethods().contains(normalizedMethod))
                .findFirst();
    }

    /** Whether any method is served on {@code path}. */
    public boolean hasPath(String path) {
        String normalizedPath = PluginHttpPath.normalize(path);
        return routes.stream().anyMatch(r -> r.getPath().equals(normalizedPath));
    }

    public List<HttpRouteRegistration> getRoutes() {
        return List.copyOf(routes);
    }

    public void clear() {
        routes.clear();
    }

    private static Set<String> normalizeMethods(Set<String> methods) {
        Set<String> normalized = new TreeSet<>();
        if (methods != null) {
            for (String method : methods) {
                if (method != null && !method.isBlank()) {
                    normalized.add(method.trim().toUpperCase(Locale.ROOT));
                }
            }
        }
        return Collections.unmodifiableSet(normalized);
    }
}

package com.wechaty.plugin.http;

import java.util.Set;

/**
 * Route registration scoped to a single plugin.
 */
public interface RouteRegistrar {

    /**
     * Register {@code handler} for {@code path} under the given methods.
     *
     * @return a handle that removes the route again
     */
    Runnable route(String path, Set<String> methods, PluginHttpHandler handler);

    default Runnable get(String path, PluginHttpHandler handler) {
        return route(path, Set.of("GET"), handler);
    }

    default Runnable post(String path, PluginHttpHandler handler) {
        return route(path, Set.of("POST"), handler);
    }
}

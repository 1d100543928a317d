package com.wechaty.plugin.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * An HTTP request handed to a plugin route.
 *
 * @param method upper-case method name
 * @param path   decoded path without the query string
 * @param query  decoded query parameters
 * @param body   raw request body, empty when there is none
 */
public record PluginHttpRequest(String method, String path, Map<String, List<String>> query, byte[] body) {

    public PluginHttpRequest {
        query = query != null ? Map.copyOf(query) : Map.of();
        body = body != null ? body : new byte[0];
    }

    public String firstParam(String name) {
        List<String> values = query.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }
}

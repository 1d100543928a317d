package com.wechaty.plugin.http;

/**
 * Handler of a plugin route. The returned object is serialized to JSON as the
 * response body.
 */
@FunctionalInterface
public interface PluginHttpHandler {

    Object handle(PluginHttpRequest request) throws Exception;
}

package com.wechaty.plugin.loader;

import com.wechaty.plugin.WechatyPlugin;

import java.util.Optional;

/**
 * Strategy that turns a plugin locator into a plugin instance.
 */
@FunctionalInterface
public interface PluginLoader {

    /**
     * @return the plugin, or empty when the locator cannot be resolved
     */
    Optional<WechatyPlugin> load(String locator);
}

package com.wechaty.plugin.loader;

import com.wechaty.plugin.WechatyPlugin;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Loads plugins from a path on the local file system.
 */
@Slf4j
public class LocalFilePluginLoader implements PluginLoader {

    // TODO: resolve a jar path to a plugin via ServiceLoader once the plugin jar layout is fixed
    @Override
    public Optional<WechatyPlugin> load(String path) {
        log.info("load plugin from local file <{}>", path);
        return Optional.empty();
    }
}

package com.wechaty.plugin.loader;

import com.wechaty.plugin.WechatyPlugin;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Loads plugins from a remote source such as a repository URL. Fetching and
 * running remote code is not supported, so nothing resolves.
 */
@Slf4j
public class RemotePluginLoader implements PluginLoader {

    @Override
    public Optional<WechatyPlugin> load(String url) {
        log.info("load plugin from remote source <{}>", url);
        return Optional.empty();
    }
}

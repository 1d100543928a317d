package com.wechaty.plugin;

import lombok.Getter;

/**
 * Raised by registry operations on a name that is not registered.
 */
@Getter
public class PluginNotFoundException extends WechatyPluginException {

    private final String pluginName;

    public PluginNotFoundException(String pluginName) {
        super("plugin <" + pluginName + "> does not exist");
        this.pluginName = pluginName;
    }
}

package com.wechaty.plugin;

import lombok.Getter;

/**
 * Raised when a plugin fails to initialize or to contribute its routes.
 */
@Getter
public class PluginInitException extends WechatyPluginException {

    private final String pluginName;

    public PluginInitException(String pluginName, Throwable cause) {
        super("plugin <" + pluginName + "> failed to initialize: " + cause.getMessage(), cause);
        this.pluginName = pluginName;
    }
}

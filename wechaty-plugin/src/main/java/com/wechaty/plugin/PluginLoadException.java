package com.wechaty.plugin;

import lombok.Getter;

/**
 * Raised when a plugin locator cannot be resolved to a plugin instance.
 */
@Getter
public class PluginLoadException extends WechatyPluginException {

    private final String locator;

    public PluginLoadException(String locator) {
        super("can't load plugin <" + locator + ">");
        this.locator = locator;
    }
}

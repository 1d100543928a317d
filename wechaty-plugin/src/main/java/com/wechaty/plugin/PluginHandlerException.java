package com.wechaty.plugin;

import com.wechaty.plugin.events.EventKind;
import lombok.Getter;

/**
 * Wraps a checked exception thrown by a plugin's event handler.
 */
@Getter
public class PluginHandlerException extends WechatyPluginException {

    private final String pluginName;
    private final EventKind kind;

    public PluginHandlerException(String pluginName, EventKind kind, Throwable cause) {
        super("plugin <" + pluginName + "> failed handling " + kind.key() + ": " + cause.getMessage(), cause);
        this.pluginName = pluginName;
        this.kind = kind;
    }
}

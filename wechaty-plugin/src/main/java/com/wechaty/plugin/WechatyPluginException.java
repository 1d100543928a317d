package com.wechaty.plugin;

import com.wechaty.common.WechatyException;

/**
 * Base exception for plugin management and event dispatch failures.
 */
public class WechatyPluginException extends WechatyException {

    public WechatyPluginException(String message) {
        super(message);
    }

    public WechatyPluginException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.wechaty.plugin;

/**
 * Running state of a registered plugin.
 */
public enum PluginStatus {
    RUNNING,
    STOPPED
}

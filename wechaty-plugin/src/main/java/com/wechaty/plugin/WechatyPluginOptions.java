package com.wechaty.plugin;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Options a plugin is created with.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WechatyPluginOptions {
    /** Registry name; the plugin's class name when unset. */
    private String name;
    /** Free-form metadata, never interpreted by the manager. */
    private Map<String, Object> metadata;
}

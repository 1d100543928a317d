package com.wechaty.common.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration type for a Wechaty bot.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class WechatyConfig {

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 8004;

    /** Embedded web server settings (plugin routes). */
    private ServerConfig server;

    /** Plugin manager settings. */
    private PluginsConfig plugins;

    /**
     * A config with every section populated by its defaults.
     */
    public static WechatyConfig defaults() {
        WechatyConfig config = new WechatyConfig();
        config.setServer(new ServerConfig());
        config.setPlugins(new PluginsConfig());
        return config;
    }

    // --- Nested config types ---

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServerConfig {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        /** When false the plugin manager never binds a listener. */
        private boolean enabled = true;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PluginsConfig {
        /**
         * Keep dispatching to later plugins when one handler throws.
         * Off by default: the first failure aborts the fan-out.
         */
        private boolean isolateFailures;
        /** Plugin names to mark stopped when the manager starts. */
        private List<String> disabled = new ArrayList<>();
    }
}

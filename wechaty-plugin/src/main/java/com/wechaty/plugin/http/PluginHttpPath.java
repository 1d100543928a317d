package com.wechaty.plugin.http;

/**
 * Route path normalization.
 */
public final class PluginHttpPath {

    private PluginHttpPath() {
    }

    /**
     * Trim {@code path} and make sure it starts with '/'. Trailing slashes are
     * dropped except for the root path.
     *
     * @return the normalized path, or null for a null or blank path
     */
    public static String normalize(String path) {
        String trimmed = path != null ? path.trim() : "";
        if (trimmed.isEmpty()) {
            return null;
        }
        String normalized = trimmed.startsWith("/") ? trimmed : "/" + trimmed;
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}

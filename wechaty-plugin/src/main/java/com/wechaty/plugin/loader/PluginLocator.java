package com.wechaty.plugin.loader;

import com.wechaty.plugin.PluginLoadException;
import com.wechaty.plugin.WechatyPlugin;

import java.util.regex.Pattern;

/**
 * Routes a plugin locator to the remote loader when it looks like a URL and
 * to the local file loader otherwise.
 */
public class PluginLocator {

    private static final Pattern URL_PATTERN = Pattern.compile(
            "^(?:http|ftp)s?://"
                    + "(?:(?:[A-Z0-9](?:[A-Z0-9-]{0,61}[A-Z0-9])?\\.)+(?:[A-Z]{2,6}\\.?|[A-Z0-9-]{2,}\\.?)"
                    + "|localhost"
                    + "|\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})"
                    + "(?::\\d+)?"
                    + "(?:/?|[/?]\\S+)$",
            Pattern.CASE_INSENSITIVE);

    private final PluginLoader localLoader;
    private final PluginLoader remoteLoader;

    public PluginLocator() {
        this(new LocalFilePluginLoader(), new RemotePluginLoader());
    }

    public PluginLocator(PluginLoader localLoader, PluginLoader remoteLoader) {
        this.localLoader = localLoader;
        this.remoteLoader = remoteLoader;
    }

    /**
     * Whether the locator is a URL (http, https, ftp or ftps scheme; domain,
     * localhost or IPv4 host; optional port and path).
     */
    public static boolean isUrl(String locator) {
        return locator != null && URL_PATTERN.matcher(locator).matches();
    }

    /**
     * @throws PluginLoadException if the selected loader resolves nothing
     */
    public WechatyPlugin resolve(String locator) {
        if (locator == null || locator.isBlank()) {
            throw new PluginLoadException(String.valueOf(locator));
        }
        PluginLoader loader = isUrl(locator) ? remoteLoader : localLoader;
        return loader.load(locator).orElseThrow(() -> new PluginLoadException(locator));
    }
}

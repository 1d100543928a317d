package com.wechaty.plugin.loader;

import com.wechaty.plugin.PluginLoadException;
import com.wechaty.plugin.RecordingPlugin;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PluginLocatorTest {

    @Test
    void recognizesUrls() {
        assertTrue(PluginLocator.isUrl("http://example.com"));
        assertTrue(PluginLocator.isUrl("https://github.com/wechaty/plugins/ding-dong.jar"));
        assertTrue(PluginLocator.isUrl("ftp://localhost:2121/plugin"));
        assertTrue(PluginLocator.isUrl("HTTPS://10.0.0.1:8004/"));
    }

    @Test
    void rejectsNonUrls() {
        assertFalse(PluginLocator.isUrl("./plugins/ding-dong"));
        assertFalse(PluginLocator.isUrl("/opt/wechaty/plugin.jar"));
        assertFalse(PluginLocator.isUrl("file:///opt/plugin.jar"));
        assertFalse(PluginLocator.isUrl("example.com"));
        assertFalse(PluginLocator.isUrl(null));
    }

    @Test
    void routesByLocatorShape() {
        List<String> local = new ArrayList<>();
        List<String> remote = new ArrayList<>();
        PluginLocator locator = new PluginLocator(
                path -> {
                    local.add(path);
                    return Optional.of(new RecordingPlugin("local"));
                },
                url -> {
                    remote.add(url);
                    return Optional.of(new RecordingPlugin("remote"));
                });

        assertEquals("local", locator.resolve("./ding-dong").getName());
        assertEquals("remote", locator.resolve("https://example.com/ding-dong").getName());
        assertEquals(List.of("./ding-dong"), local);
        assertEquals(List.of("https://example.com/ding-dong"), remote);
    }

    @Test
    void defaultLoadersResolveNothing() {
        PluginLocator locator = new PluginLocator();
        PluginLoadException e = assertThrows(PluginLoadException.class, () -> locator.resolve("./ding-dong"));
        assertEquals("./ding-dong", e.getLocator());
        assertThrows(PluginLoadException.class, () -> locator.resolve("https://example.com/ding-dong"));
        assertThrows(PluginLoadException.class, () -> locator.resolve(" "));
    }
}

package com.wechaty.plugin.registry;

import com.wechaty.plugin.PluginLoadException;
import com.wechaty.plugin.PluginNotFoundException;
import com.wechaty.plugin.PluginStatus;
import com.wechaty.plugin.RecordingPlugin;
import com.wechaty.plugin.WechatyPlugin;
import com.wechaty.plugin.loader.PluginLocator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PluginRegistryTest {

    PluginRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PluginRegistry();
    }

    @Test
    void addedPluginIsRunning() {
        assertTrue(registry.add(new RecordingPlugin("ding")));
        assertEquals(PluginStatus.RUNNING, registry.status("ding"));
        assertTrue(registry.isRunning("ding"));
        assertEquals(1, registry.size());
    }

    @Test
    void duplicateNameIsIgnored() {
        RecordingPlugin first = new RecordingPlugin("ding");
        registry.add(first);
        registry.stop("ding");

        assertFalse(registry.add(new RecordingPlugin("ding")));
        assertEquals(1, registry.size());
        assertSame(first, registry.plugins().get(0));
        assertEquals(PluginStatus.STOPPED, registry.status("ding"));
    }

    @Test
    void unknownNamesRaisePluginNotFound() {
        PluginNotFoundException e = assertThrows(PluginNotFoundException.class, () -> registry.remove("ghost"));
        assertEquals("ghost", e.getPluginName());
        assertThrows(PluginNotFoundException.class, () -> registry.start("ghost"));
        assertThrows(PluginNotFoundException.class, () -> registry.stop("ghost"));
        assertThrows(PluginNotFoundException.class, () -> registry.status("ghost"));
        assertFalse(registry.isRunning("ghost"));
    }

    @Test
    void removeDropsPluginAndStatus() {
        registry.add(new RecordingPlugin("ding"));
        registry.remove("ding");

        assertFalse(registry.contains("ding"));
        assertThrows(PluginNotFoundException.class, () -> registry.status("ding"));
        assertTrue(registry.activePlugins().isEmpty());
    }

    @Test
    void doubleStopIsNotAnError() {
        registry.add(new RecordingPlugin("ding"));
        registry.stop("ding");
        assertDoesNotThrow(() -> registry.stop("ding"));
        assertEquals(PluginStatus.STOPPED, registry.status("ding"));
    }

    @Test
    void orderSurvivesStopAndStart() {
        registry.add(new RecordingPlugin("a"));
        registry.add(new RecordingPlugin("b"));
        registry.add(new RecordingPlugin("c"));

        registry.stop("a");
        assertEquals(List.of("b", "c"), names(registry.activePlugins()));

        registry.start("a");
        assertEquals(List.of("a", "b", "c"), names(registry.activePlugins()));
        assertEquals(List.of("a", "b", "c"), registry.names());
    }

    @Test
    void registrationsKeepRegisteredName() {
        RecordingPlugin plugin = new RecordingPlugin("a");
        registry.add(plugin);
        registry.add(new RecordingPlugin("b"));
        registry.stop("b");
        plugin.getOptions().setName("renamed");

        assertEquals(List.of("a"), registry.activeRegistrations().stream()
                .map(PluginRegistry.Registration::name).toList());
        assertEquals(List.of("a", "b"), registry.registrations().stream()
                .map(PluginRegistry.Registration::name).toList());
        assertSame(plugin, registry.activeRegistrations().get(0).plugin());
    }

    @Test
    void activePluginsIsSnapshot() {
        registry.add(new RecordingPlugin("a"));
        List<WechatyPlugin> snapshot = registry.activePlugins();
        registry.add(new RecordingPlugin("b"));
        assertEquals(1, snapshot.size());
    }

    @Test
    void locatorThatResolvesNothingRaisesLoadError() {
        assertThrows(PluginLoadException.class, () -> registry.add("https://example.com/plugin.jar"));
        assertThrows(PluginLoadException.class, () -> registry.add("./plugins/ding-dong"));
        assertEquals(0, registry.size());
    }

    @Test
    void locatorResolvedPluginIsRegistered() {
        RecordingPlugin loaded = new RecordingPlugin("loaded");
        PluginRegistry withLoader = new PluginRegistry(
                new PluginLocator(path -> Optional.of(loaded), url -> Optional.empty()));

        assertSame(loaded, withLoader.add("./plugins/loaded"));
        assertTrue(withLoader.isRunning("loaded"));
    }

    private static List<String> names(List<WechatyPlugin> plugins) {
        return plugins.stream().map(WechatyPlugin::getName).toList();
    }
}

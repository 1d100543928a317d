package com.wechaty.plugin.http;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PluginRouteTableTest {

    @Test
    void emptyRoutes() {
        assertEquals("No routes were registered.", PluginRouteTable.render(List.of()));
        assertEquals("No routes were registered.", PluginRouteTable.render(null));
    }

    @Test
    void rendersSortedTable() {
        PluginHttpRegistry registry = new PluginHttpRegistry();
        registry.forPlugin("zeta").get("/z", request -> "z");
        registry.forPlugin("alpha").route("/status", Set.of("POST", "GET"), request -> "ok");

        String[] lines = PluginRouteTable.render(registry.getRoutes()).split("\n");

        assertEquals(4, lines.length);
        assertEquals("Endpoint      | Methods   | Websocket | Rule", lines[0]);
        assertEquals("------------- | --------- | --------- | -------", lines[1]);
        assertEquals("alpha:/status | GET, POST | false     | /status", lines[2]);
        assertEquals("zeta:/z       | GET       | false     | /z", lines[3]);
    }
}

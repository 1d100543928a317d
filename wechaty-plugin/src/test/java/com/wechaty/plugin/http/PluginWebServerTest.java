package com.wechaty.plugin.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wechaty.common.WechatyException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PluginWebServerTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    PluginHttpRegistry registry;
    PluginWebServer server;
    HttpClient client;
    int port;

    @BeforeEach
    void setUp() {
        registry = new PluginHttpRegistry();
        RouteRegistrar routes = registry.forPlugin("ding-dong");
        routes.get("/ding", request -> Map.of("reply", "dong", "who", String.valueOf(request.firstParam("who"))));
        routes.post("/echo", request -> Map.of("body", request.bodyAsString()));
        routes.get("/broken", request -> {
            throw new IllegalStateException("handler broke");
        });

        server = new PluginWebServer(registry);
        port = server.start("http://127.0.0.1", 0);
        client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws Exception {
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String pathAndQuery) {
        return URI.create("http://127.0.0.1:" + port + pathAndQuery);
    }

    @Test
    void bindsEphemeralPort() {
        assertTrue(port > 0);
        assertEquals(port, server.port());
        assertTrue(server.isRunning());
    }

    @Test
    void servesContributedRoute() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/ding?who=bot")).GET());

        assertEquals(200, response.statusCode());
        JsonNode body = mapper.readTree(response.body());
        assertEquals("dong", body.get("reply").asText());
        assertEquals("bot", body.get("who").asText());
    }

    @Test
    void passesRequestBody() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/echo"))
                .POST(HttpRequest.BodyPublishers.ofString("ding")));

        assertEquals(200, response.statusCode());
        assertEquals("ding", mapper.readTree(response.body()).get("body").asText());
    }

    @Test
    void unknownPathIsNotFound() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/nope")).GET());
        assertEquals(404, response.statusCode());
        assertFalse(mapper.readTree(response.body()).get("ok").asBoolean());
    }

    @Test
    void wrongMethodIsNotAllowed() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/ding"))
                .POST(HttpRequest.BodyPublishers.noBody()));
        assertEquals(405, response.statusCode());
    }

    @Test
    void failingHandlerIsServerError() throws Exception {
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/broken")).GET());
        assertEquals(500, response.statusCode());
        assertEquals("handler broke", mapper.readTree(response.body()).get("error").asText());
    }

    @Test
    void bindFailureIsReported() {
        PluginWebServer second = new PluginWebServer(registry);
        assertThrows(WechatyException.class, () -> second.start("127.0.0.1", port));
        assertFalse(second.isRunning());
    }

    @Test
    void stopReleasesPort() {
        server.stop();
        assertFalse(server.isRunning());
        assertEquals(-1, server.port());
    }

    @Test
    void stripsScheme() {
        assertEquals("127.0.0.1", PluginWebServer.stripScheme("http://127.0.0.1/"));
        assertEquals("localhost", PluginWebServer.stripScheme("localhost"));
        assertEquals("0.0.0.0", PluginWebServer.stripScheme(null));
    }
}

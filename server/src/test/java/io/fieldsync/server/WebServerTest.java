package io.fieldsync.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.core.DefaultFieldMerger;
import io.fieldsync.core.VersionedFieldCatalog;
import io.fieldsync.server.presence.BroadcastHub;
import io.fieldsync.server.presence.PresenceRegistry;
import io.fieldsync.server.transport.WebSocketGateway;
import io.fieldsync.storage.DurableEntityStore;
import io.fieldsync.storage.DurableEventLog;
import io.fieldsync.storage.FileSnapshotter;
import io.fieldsync.storage.FileWal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.WebSocket;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP API and the WebSocket endpoint.
 *
 * Focus:
 *  - Status codes: 201 create, 409 conflicts, 404 unknown, 400 bad input, 413 too large.
 *  - Conflict body shape.
 *  - Event listing endpoints.
 *  - A WebSocket client in the room sees mutations made over HTTP.
 */
class WebServerTest {

    private static final int PORT = 18080; // test-only port

    @TempDir
    Path dir;

    private final ObjectMapper json = new ObjectMapper();
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        var store = new DurableEntityStore(new FileWal(dir.resolve("wal"), 1L << 30),
                new FileSnapshotter(dir.resolve("snaps")));
        var events = new DurableEventLog(new FileWal(dir.resolve("events"), 1L << 30));
        var hub = new BroadcastHub(new PresenceRegistry());
        var sync = new SyncService(store, events, hub, VersionedFieldCatalog.defaults(),
                new DefaultFieldMerger(), Clock.systemUTC(), 3);

        server = new WebServer(PORT, sync, new WebSocketGateway(hub), 100);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
    }

    private String baseUrl() {
        return "http://localhost:" + PORT;
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.BodyPublisher publisher = body == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(body);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + path))
                .method(method, publisher)
                .header("Content-Type", "application/json")
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private Map<?, ?> parse(HttpResponse<String> resp) throws Exception {
        return json.readValue(resp.body(), Map.class);
    }

    private Map<?, ?> createCamera() throws Exception {
        HttpResponse<String> resp = send("POST", "/productions/p1/camera", """
                {
                  "data": { "id": "CAM 1", "name": "Main", "model": "HDC-3500" },
                  "userId": "alice",
                  "userName": "Alice"
                }
                """);
        assertEquals(201, resp.statusCode(), resp.body());
        return parse(resp);
    }

    @Test
    void health_is_ok() throws Exception {
        HttpResponse<String> resp = send("GET", "/admin/health", null);
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("ok"));
    }

    @Test
    void create_then_read_and_list() throws Exception {
        Map<?, ?> cam = createCamera();
        String uuid = (String) cam.get("uuid");

        assertEquals("CAM 1", cam.get("id"));
        assertEquals("camera", cam.get("entityType"));
        assertEquals(1, cam.get("revision"));
        assertEquals(1, ((Map<?, ?>) ((Map<?, ?>) cam.get("fieldVersions")).get("name")).get("version"));

        HttpResponse<String> one = send("GET", "/entities/camera/" + uuid, null);
        assertEquals(200, one.statusCode());
        assertEquals("Main", parse(one).get("name"));

        HttpResponse<String> list = send("GET", "/productions/p1/camera", null);
        assertEquals(200, list.statusCode());
        assertEquals(1, json.readValue(list.body(), List.class).size());
    }

    @Test
    void stale_field_versions_return_409_with_conflicts_and_applied_subset() throws Exception {
        Map<?, ?> cam = createCamera();
        String uuid = (String) cam.get("uuid");
        String stale = json.writeValueAsString(cam.get("fieldVersions"));

        HttpResponse<String> first = send("PUT", "/entities/camera/" + uuid,
                "{\"fieldVersions\":" + stale + ",\"data\":{\"name\":\"Alice's\"},\"userId\":\"alice\"}");
        assertEquals(200, first.statusCode(), first.body());

        HttpResponse<String> second = send("PUT", "/entities/camera/" + uuid,
                "{\"fieldVersions\":" + stale + ",\"data\":{\"name\":\"Bob's\",\"model\":\"HDC-5500\"},\"userId\":\"bob\"}");
        assertEquals(409, second.statusCode());

        Map<?, ?> body = parse(second);
        assertEquals("Conflict detected", body.get("error"));
        List<?> conflicts = (List<?>) body.get("conflicts");
        assertEquals(1, conflicts.size());
        Map<?, ?> c = (Map<?, ?>) conflicts.get(0);
        assertEquals("name", c.get("field"));
        assertEquals(1, c.get("clientVersion"));
        assertEquals(2, c.get("serverVersion"));
        assertEquals("Alice's", c.get("serverValue"));
        assertEquals(List.of("model"), body.get("acceptedFields"));
        assertEquals("HDC-5500", ((Map<?, ?>) body.get("entity")).get("model"));
    }

    @Test
    void stale_record_version_returns_409() throws Exception {
        String uuid = (String) createCamera().get("uuid");
        send("PUT", "/entities/camera/" + uuid, "{\"version\":1,\"data\":{\"note\":\"a\"}}");

        HttpResponse<String> resp = send("PUT", "/entities/camera/" + uuid, "{\"version\":1,\"data\":{\"note\":\"b\"}}");
        assertEquals(409, resp.statusCode());
        assertEquals(2, parse(resp).get("currentVersion"));
    }

    @Test
    void malformed_field_versions_return_400() throws Exception {
        String uuid = (String) createCamera().get("uuid");

        HttpResponse<String> resp = send("PUT", "/entities/camera/" + uuid,
                "{\"fieldVersions\":[1,2],\"data\":{\"name\":\"x\"}}");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("fieldVersions is malformed"));
    }

    @Test
    void delete_without_body_then_entity_is_gone() throws Exception {
        String uuid = (String) createCamera().get("uuid");

        HttpResponse<String> del = send("DELETE", "/entities/camera/" + uuid, null);
        assertEquals(200, del.statusCode(), del.body());
        assertEquals(404, send("GET", "/entities/camera/" + uuid, null).statusCode());
        assertEquals(404, send("DELETE", "/entities/camera/" + uuid, null).statusCode());
    }

    @Test
    void unknown_entity_and_type_return_404() throws Exception {
        assertEquals(404, send("GET", "/entities/camera/no-such-key", null).statusCode());
        assertEquals(404, send("GET", "/entities/spaceship/k1", null).statusCode());
        assertEquals(404, send("GET", "/productions/p1/spaceship", null).statusCode());
        assertEquals(404, send("GET", "/nowhere", null).statusCode());
    }

    @Test
    void empty_key_returns_400() throws Exception {
        HttpResponse<String> resp = send("GET", "/entities/camera/", null);
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("key must not be empty"));
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        HttpResponse<String> resp = send("POST", "/productions/p1/camera", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        // Larger than MAX_BODY_BYTES (10 MiB).
        String big = "x".repeat(11 * 1024 * 1024);

        HttpResponse<String> resp = send("POST", "/productions/p1/camera", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void event_endpoints_list_history() throws Exception {
        String uuid = (String) createCamera().get("uuid");
        send("PUT", "/entities/camera/" + uuid, "{\"data\":{\"note\":\"a\"},\"userId\":\"alice\"}");

        HttpResponse<String> all = send("GET", "/productions/p1/events", null);
        assertEquals(200, all.statusCode());
        List<?> events = json.readValue(all.body(), List.class);
        assertEquals(2, events.size());
        Map<?, ?> newest = (Map<?, ?>) events.get(0);
        assertEquals("UPDATE", newest.get("operation"));
        assertEquals(Map.of("note", Map.of("to", "a")), stripNulls((Map<?, ?>) newest.get("changes")));

        HttpResponse<String> limited = send("GET", "/productions/p1/events?limit=1", null);
        assertEquals(1, json.readValue(limited.body(), List.class).size());
        assertEquals(400, send("GET", "/productions/p1/events?limit=zero", null).statusCode());

        HttpResponse<String> perEntity = send("GET", "/productions/p1/events/entity/" + uuid, null);
        assertEquals(2, json.readValue(perEntity.body(), List.class).size());

        Map<?, ?> oldest = (Map<?, ?>) events.get(1);
        long createdAt = ((Number) oldest.get("timestampMillis")).longValue();
        HttpResponse<String> since = send("GET", "/productions/p1/events/since/" + createdAt, null);
        List<?> newer = json.readValue(since.body(), List.class);
        assertEquals(1, newer.size());
        assertEquals("UPDATE", ((Map<?, ?>) newer.get(0)).get("operation"));
        assertEquals(400, send("GET", "/productions/p1/events/since/yesterday", null).statusCode());
    }

    @Test
    void websocket_member_receives_session_presence_and_mutations() throws Exception {
        BlockingQueue<String> frames = new LinkedBlockingQueue<>();
        WebSocket ws = client.newWebSocketBuilder()
                .buildAsync(URI.create("ws://localhost:" + PORT + "/ws"), new WebSocket.Listener() {
                    private final StringBuilder partial = new StringBuilder();

                    @Override
                    public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
                        partial.append(data);
                        if (last) {
                            frames.add(partial.toString());
                            partial.setLength(0);
                        }
                        webSocket.request(1);
                        return null;
                    }
                })
                .get(5, TimeUnit.SECONDS);
        try {
            Map<?, ?> session = json.readValue(frames.poll(5, TimeUnit.SECONDS), Map.class);
            assertEquals("session", session.get("event"));
            assertNotNull(((Map<?, ?>) session.get("data")).get("sessionId"));

            ws.sendText("{\"event\":\"production:join\",\"data\":{\"productionId\":\"p1\",\"userId\":\"carol\",\"userName\":\"Carol\"}}", true)
                    .get(5, TimeUnit.SECONDS);
            String presence = frames.poll(5, TimeUnit.SECONDS);
            assertNotNull(presence);
            assertTrue(presence.contains("presence:update") && presence.contains("Carol"));

            createCamera();
            String created = frames.poll(5, TimeUnit.SECONDS);
            assertNotNull(created);
            assertTrue(created.contains("camera:created") && created.contains("CAM 1"));
        } finally {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "bye").get(5, TimeUnit.SECONDS);
        }
    }

    private static Map<Object, Object> stripNulls(Map<?, ?> m) {
        var out = new LinkedHashMap<Object, Object>();
        for (var e : m.entrySet()) {
            if (e.getValue() instanceof Map<?, ?> inner) {
                out.put(e.getKey(), stripNulls(inner));
            } else if (e.getValue() != null) {
                out.put(e.getKey(), e.getValue());
            }
        }
        return out;
    }
}

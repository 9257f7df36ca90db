package io.fieldsync.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.core.ChangeEvent;
import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;
import io.fieldsync.core.EntityType;
import io.fieldsync.server.dto.ConflictResponse;
import io.fieldsync.server.dto.CreateRequest;
import io.fieldsync.server.dto.DeleteRequest;
import io.fieldsync.server.dto.EventView;
import io.fieldsync.server.dto.UpdateRequest;
import io.fieldsync.server.transport.WebSocketGateway;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over SyncService, plus the WebSocket endpoint.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - POST   /productions/{pid}/{type}                   create
 *   - GET    /productions/{pid}/{type}                   list live entities
 *   - GET    /entities/{type}/{key}                      read one
 *   - PUT    /entities/{type}/{key}                      field-level update (409 on conflicts)
 *   - DELETE /entities/{type}/{key}                      soft delete
 *   - GET    /productions/{pid}/events?limit=N           newest first
 *   - GET    /productions/{pid}/events/entity/{key}      newest first
 *   - GET    /productions/{pid}/events/since/{millis}    oldest first, strictly after
 *   - GET    /admin/health
 *   - GET    /ws                                         WebSocket upgrade
 *
 * Mutations may carry X-Session-Id (the id sent on the WebSocket "session" frame)
 * so the originating connection is left out of the broadcast.
 */
public final class WebServer {
    public static final String SESSION_HEADER = "X-Session-Id";

    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final int MAX_EVENT_PAGE = 1000;

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private final SyncService sync;
    private final int eventPageLimit;

    public WebServer(int port, SyncService sync, WebSocketGateway gateway, int eventPageLimit) {
        this.sync = sync;
        this.eventPageLimit = eventPageLimit;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(Handlers.path(this::route)
                        .addPrefixPath("/ws", Handlers.websocket(gateway)))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            // Storage calls fsync; keep them off the IO threads.
            exchange.dispatch(this::route);
            return;
        }
        String path = exchange.getRequestPath();
        String method = exchange.getRequestMethod().toString();
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        String[] seg = path.length() > 1 ? path.substring(1).split("/", -1) : new String[0];

        if ("/admin/health".equals(path)) {
            send(exchange, 200, Map.of("status", "ok"));
            RequestLogger.logRequest(method, path, 200, 0, -1, null);
        } else if (seg.length >= 3 && "productions".equals(seg[0])) {
            routeProduction(exchange, method, seg);
        } else if (seg.length == 3 && "entities".equals(seg[0])) {
            routeEntity(exchange, method, seg[1], seg[2]);
        } else {
            reject(exchange, method, 404, "not found");
        }
    }

    private void routeProduction(HttpServerExchange ex, String method, String[] seg) {
        String pid = seg[1];
        if (pid.isBlank()) {
            reject(ex, method, 400, "productionId must not be empty");
            return;
        }
        if ("events".equals(seg[2])) {
            if (!"GET".equals(method)) {
                reject(ex, method, 405, "method not allowed");
            } else if (seg.length == 3) {
                run(ex, NO_BODY, body -> listEvents(ex, pid));
            } else if (seg.length == 5 && "entity".equals(seg[3])) {
                run(ex, NO_BODY, body -> eventsOf(sync.entityHistory(pid, entityKey(seg[4]))));
            } else if (seg.length == 5 && "since".equals(seg[3])) {
                run(ex, NO_BODY, body -> eventsOf(sync.eventsSince(pid, sinceMillis(seg[4]))));
            } else {
                reject(ex, method, 404, "not found");
            }
            return;
        }
        if (seg.length != 3) {
            reject(ex, method, 404, "not found");
            return;
        }
        EntityType type = entityTypeOrNull(seg[2]);
        if (type == null) {
            reject(ex, method, 404, "unknown entity type: " + seg[2]);
            return;
        }
        switch (method) {
            case "POST" -> withBody(ex, body -> handleCreate(ex, pid, type, body));
            case "GET" -> run(ex, NO_BODY, body -> {
                List<Map<String, Object>> out = new ArrayList<>();
                for (EntityRecord r : sync.list(pid, type)) out.add(r.snapshot());
                return new Reply(200, out);
            });
            default -> reject(ex, method, 405, "method not allowed");
        }
    }

    private void routeEntity(HttpServerExchange ex, String method, String typeName, String rawKey) {
        EntityType type = entityTypeOrNull(typeName);
        if (type == null) {
            reject(ex, method, 404, "unknown entity type: " + typeName);
            return;
        }
        if (rawKey.isBlank()) {
            reject(ex, method, 400, "key must not be empty");
            return;
        }
        var key = new EntityKey(rawKey);
        switch (method) {
            case "GET" -> run(ex, NO_BODY, body -> new Reply(200, sync.get(type, key).snapshot()));
            case "PUT" -> withBody(ex, body -> handleUpdate(ex, type, key, body));
            case "DELETE" -> withBody(ex, body -> handleDelete(ex, type, key, body));
            default -> reject(ex, method, 405, "method not allowed");
        }
    }

    // ---------- handlers ----------

    /** POST /productions/{pid}/{type} */
    private Reply handleCreate(HttpServerExchange ex, String pid, EntityType type, byte[] body) throws Exception {
        var req = json.readValue(body, CreateRequest.class);
        EntityRecord created = sync.create(pid, type, req.data, req.userId, req.userName, sessionOf(ex));
        return new Reply(201, created.snapshot());
    }

    /** PUT /entities/{type}/{key} */
    private Reply handleUpdate(HttpServerExchange ex, EntityType type, EntityKey key, byte[] body) throws Exception {
        var req = json.readValue(body, UpdateRequest.class);
        UpdateResult r = sync.proposeUpdate(type, key, req.fieldVersions, req.version, req.data,
                req.userId, req.userName, sessionOf(ex));
        if (!r.hasConflicts()) {
            return new Reply(200, r.entity().snapshot());
        }
        var dto = new ConflictResponse();
        dto.conflicts = r.merge().conflicts();
        dto.acceptedFields = r.merge().acceptedFields();
        dto.entity = r.entity().snapshot();
        return new Reply(409, dto);
    }

    /** DELETE /entities/{type}/{key}; the body is optional. */
    private Reply handleDelete(HttpServerExchange ex, EntityType type, EntityKey key, byte[] body) throws Exception {
        var req = body.length == 0 ? new DeleteRequest() : json.readValue(body, DeleteRequest.class);
        EntityRecord deleted = sync.delete(type, key, req.userId, req.userName, sessionOf(ex));
        return new Reply(200, Map.of("deleted", true, EntityRecord.KEY_FIELD, deleted.key().value()));
    }

    /** GET /productions/{pid}/events?limit=N */
    private Reply listEvents(HttpServerExchange ex, String pid) {
        int limit = eventPageLimit;
        String raw = firstOrNull(ex.getQueryParameters().get("limit"));
        if (raw != null) {
            try {
                limit = Integer.parseInt(raw);
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("limit must be an integer", nfe);
            }
            if (limit < 1 || limit > MAX_EVENT_PAGE) {
                throw new IllegalArgumentException("limit must be in [1, " + MAX_EVENT_PAGE + "]");
            }
        }
        return eventsOf(sync.history(pid, limit));
    }

    private static Reply eventsOf(List<ChangeEvent> events) {
        List<EventView> out = new ArrayList<>(events.size());
        for (ChangeEvent e : events) out.add(EventView.of(e));
        return new Reply(200, out);
    }

    // ---------- execution + error mapping ----------

    private static final byte[] NO_BODY = new byte[0];

    /** Work for one request: body in, status + JSON-serializable body out. */
    @FunctionalInterface
    private interface Action {
        Reply apply(byte[] body) throws Exception;
    }

    private record Reply(int status, Object body) {}

    private void withBody(HttpServerExchange ex, Action action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> run(exchange, data, action),
                (exchange, ioEx) -> {
                    String method = exchange.getRequestMethod().toString();
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(method, exchange.getRequestPath(), 400, 0, -1, ioEx);
                }
        );
    }

    private void run(HttpServerExchange ex, byte[] data, Action action) {
        String method = ex.getRequestMethod().toString();
        long start = System.nanoTime();
        int status;
        long serviceMs = -1L;
        Throwable error = null;

        try {
            if (data.length > MAX_BODY_BYTES) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
            } else {
                long sStart = System.nanoTime();
                Reply reply = action.apply(data);
                serviceMs = (System.nanoTime() - sStart) / 1_000_000L;
                status = reply.status();
                send(ex, status, reply.body());
            }
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (EntityNotFoundException missing) {
            status = 404;
            error = missing;
            send(ex, status, Map.of("error", missing.getMessage()));
        } catch (StaleRevisionException stale) {
            status = 409;
            error = stale;
            var body = new LinkedHashMap<String, Object>();
            body.put("error", "Conflict detected");
            body.put("message", stale.getMessage());
            body.put("currentVersion", stale.currentRevision());
            body.put("clientVersion", stale.clientRevision());
            send(ex, status, body);
        } catch (WriteContentionException busy) {
            status = 409;
            error = busy;
            send(ex, status, Map.of("error", "write contention", "message", busy.getMessage()));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, ex.getRequestPath(), ex.getStatusCode(), totalMs, serviceMs, error);
        }
    }

    private void reject(HttpServerExchange ex, String method, int status, String message) {
        send(ex, status, Map.of("error", message));
        RequestLogger.logRequest(method, ex.getRequestPath(), status, 0, -1, null);
    }

    // ---------- helpers ----------

    private static EntityType entityTypeOrNull(String name) {
        try {
            return EntityType.fromWireName(name);
        } catch (IllegalArgumentException unknown) {
            return null;
        }
    }

    private static EntityKey entityKey(String raw) {
        if (raw.isBlank()) throw new IllegalArgumentException("key must not be empty");
        return new EntityKey(raw);
    }

    private static Instant sinceMillis(String raw) {
        try {
            return Instant.ofEpochMilli(Long.parseLong(raw));
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("since must be epoch milliseconds", nfe);
        }
    }

    private static String sessionOf(HttpServerExchange ex) {
        String s = ex.getRequestHeaders().getFirst(SESSION_HEADER);
        return s == null || s.isBlank() ? null : s;
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}

package io.fieldsync.server.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.server.dto.SocketFrame;
import io.fieldsync.server.presence.BroadcastHub;
import io.fieldsync.server.presence.SessionChannel;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.spi.WebSocketHttpExchange;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * WebSocket endpoint: session bookkeeping and inbound room frames.
 *
 * Inbound frames ({@code {"event": ..., "data": {...}}}):
 *   - production:join  {productionId, userId, userName}
 *   - production:leave {productionId, userId}
 *
 * Outbound, besides what {@link BroadcastHub} fans out:
 *   - session {sessionId}: first frame on every connection
 *   - error   {message}:   reply to a frame that could not be handled
 *
 * Closing the connection counts as leaving every room it joined.
 */
public final class WebSocketGateway implements WebSocketConnectionCallback {
    private static final Logger log = Logger.getLogger(WebSocketGateway.class.getName());

    public static final String JOIN = "production:join";
    public static final String LEAVE = "production:leave";
    public static final String SESSION = "session";
    public static final String ERROR = "error";

    private final BroadcastHub hub;
    private final ObjectMapper json;

    public WebSocketGateway(BroadcastHub hub) {
        this(hub, new ObjectMapper());
    }

    public WebSocketGateway(BroadcastHub hub, ObjectMapper json) {
        this.hub = Objects.requireNonNull(hub, "hub");
        this.json = Objects.requireNonNull(json, "json");
    }

    @Override
    public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
        var session = new WebSocketSessionChannel(UUID.randomUUID().toString(), channel);
        log.fine(() -> "connected " + session + " from " + channel.getSourceAddress());

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                handleFrame(session, message.getData());
            }
        });
        channel.addCloseTask(ch -> {
            log.fine(() -> "closed " + session);
            hub.disconnect(session);
        });

        reply(session, SESSION, Map.of("sessionId", session.id()));
        channel.resumeReceives();
    }

    /** Dispatch one inbound text frame from {@code session}. */
    void handleFrame(SessionChannel session, String text) {
        SocketFrame frame;
        try {
            frame = json.readValue(text, SocketFrame.class);
        } catch (JsonProcessingException e) {
            log.log(Level.WARNING, "unreadable frame from session " + session.id(), e);
            reply(session, ERROR, Map.of("message", "invalid JSON"));
            return;
        }

        try {
            Map<?, ?> data = frame.data instanceof Map<?, ?> m ? m : Map.of();
            if (JOIN.equals(frame.event)) {
                String userId = required(data, "userId");
                String userName = optional(data, "userName");
                hub.join(required(data, "productionId"), userId, userName == null ? userId : userName, session);
            } else if (LEAVE.equals(frame.event)) {
                hub.leave(required(data, "productionId"), session);
            } else {
                throw new IllegalArgumentException("unknown event: " + frame.event);
            }
        } catch (IllegalArgumentException bad) {
            log.fine(() -> "rejected frame from session " + session.id() + ": " + bad.getMessage());
            reply(session, ERROR, Map.of("message", bad.getMessage()));
        }
    }

    private void reply(SessionChannel session, String event, Object data) {
        try {
            session.send(json.writeValueAsString(new SocketFrame(event, data)));
        } catch (IOException e) {
            log.log(Level.WARNING, "cannot send " + event + " to session " + session.id(), e);
        }
    }

    private static String required(Map<?, ?> data, String field) {
        Object v = data.get(field);
        if (!(v instanceof String s) || s.isBlank()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
        return s;
    }

    private static String optional(Map<?, ?> data, String field) {
        Object v = data.get(field);
        return v instanceof String s && !s.isBlank() ? s : null;
    }
}

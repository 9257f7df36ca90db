package io.fieldsync.server.transport;

import io.fieldsync.server.presence.BroadcastHub;
import io.fieldsync.server.presence.Presence;
import io.fieldsync.server.presence.PresenceRegistry;
import io.fieldsync.server.presence.RecordingChannel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketGatewayTest {

    private final PresenceRegistry registry = new PresenceRegistry();
    private final WebSocketGateway gateway = new WebSocketGateway(new BroadcastHub(registry));

    private static String join(String pid, String userId, String userName) {
        return "{\"event\":\"production:join\",\"data\":{\"productionId\":\"" + pid
                + "\",\"userId\":\"" + userId + "\",\"userName\":\"" + userName + "\"}}";
    }

    @Test
    void join_frame_adds_the_session_to_the_room() {
        var ch = new RecordingChannel("s1");
        gateway.handleFrame(ch, join("p1", "u1", "Alice"));

        assertEquals(List.of(new Presence("u1", "Alice")), registry.presence("p1"));
        assertEquals(1, ch.framesFor("presence:update").size());
    }

    @Test
    void join_without_user_name_uses_the_user_id() {
        var ch = new RecordingChannel("s1");
        gateway.handleFrame(ch, "{\"event\":\"production:join\",\"data\":{\"productionId\":\"p1\",\"userId\":\"u1\"}}");

        assertEquals(List.of(new Presence("u1", "u1")), registry.presence("p1"));
    }

    @Test
    void leave_frame_removes_only_that_connection() {
        var phone = new RecordingChannel("s1");
        var laptop = new RecordingChannel("s2");
        gateway.handleFrame(phone, join("p1", "u1", "Alice"));
        gateway.handleFrame(laptop, join("p1", "u1", "Alice"));

        gateway.handleFrame(phone, "{\"event\":\"production:leave\",\"data\":{\"productionId\":\"p1\",\"userId\":\"u1\"}}");

        assertEquals(1, registry.members("p1").size());
        assertEquals("s2", registry.members("p1").get(0).channel().id());
    }

    @Test
    void bad_frames_get_an_error_reply_and_change_nothing() {
        var ch = new RecordingChannel("s1");

        gateway.handleFrame(ch, "{ not json");
        gateway.handleFrame(ch, "{\"event\":\"production:join\",\"data\":{\"userId\":\"u1\"}}");
        gateway.handleFrame(ch, "{\"event\":\"camera:updated\",\"data\":{}}");

        assertEquals(3, ch.framesFor("error").size());
        assertTrue(ch.frames().get(0).contains("invalid JSON"));
        assertTrue(ch.frames().get(1).contains("productionId must not be empty"));
        assertEquals(0, registry.roomCount());
    }
}

package io.fieldsync.server.presence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.core.ChangeOperation;
import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;
import io.fieldsync.core.EntityType;
import io.fieldsync.server.dto.SocketFrame;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Real-time fan-out to production rooms.
 * <p>
 * Topics:
 *  - {@code presence:update}: full presence list of the room, sent to every member
 *    (joiner included) after each join/leave/disconnect.
 *  - {@code <entityType>:created|updated}: post-mutation snapshot.
 *  - {@code <entityType>:deleted}: just the internal key.
 * <p>
 * Delivery failures are per recipient: logged at WARNING, never thrown, and never
 * stop delivery to the rest of the room. Callers only broadcast committed mutations.
 */
public final class BroadcastHub {
    private static final Logger log = Logger.getLogger(BroadcastHub.class.getName());

    public static final String PRESENCE_UPDATE = "presence:update";

    private final PresenceRegistry registry;
    private final ObjectMapper json;

    public BroadcastHub(PresenceRegistry registry) {
        this(registry, new ObjectMapper());
    }

    public BroadcastHub(PresenceRegistry registry, ObjectMapper json) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.json = Objects.requireNonNull(json, "json");
    }

    public PresenceRegistry registry() {
        return registry;
    }

    // ---------- membership ----------

    public void join(String productionId, String userId, String userName, SessionChannel channel) {
        registry.join(productionId, userId, userName, channel);
        log.fine(() -> String.format("%s joined %s (session %s)", userId,
                PresenceRegistry.roomKey(productionId), channel.id()));
        broadcastPresence(productionId);
    }

    /** Remove every connection of the user from the room and re-broadcast presence. */
    public void leave(String productionId, String userId) {
        if (registry.leave(productionId, userId)) {
            log.fine(() -> String.format("%s left %s", userId, PresenceRegistry.roomKey(productionId)));
            broadcastPresence(productionId);
        }
    }

    /** Remove one connection from the room and re-broadcast presence. */
    public void leave(String productionId, SessionChannel channel) {
        if (registry.leave(productionId, channel)) {
            log.fine(() -> String.format("session %s left %s", channel.id(), PresenceRegistry.roomKey(productionId)));
            broadcastPresence(productionId);
        }
    }

    /** Implicit leave from every room, on connection close. */
    public void disconnect(SessionChannel channel) {
        Set<String> left = registry.disconnect(channel);
        for (String productionId : left) {
            log.fine(() -> String.format("session %s dropped from %s", channel.id(), PresenceRegistry.roomKey(productionId)));
            broadcastPresence(productionId);
        }
    }

    // ---------- fan-out ----------

    public void broadcastPresence(String productionId) {
        List<Presence> presence = registry.presence(productionId);
        fanOut(productionId, PRESENCE_UPDATE, presence, null);
    }

    public void broadcastCreated(String productionId, EntityType type, EntityKey key,
                                 Map<String, Object> snapshot, String excludeSessionId) {
        fanOut(productionId, topic(type, ChangeOperation.CREATE), snapshot, excludeSessionId);
    }

    public void broadcastUpdated(String productionId, EntityType type, EntityKey key,
                                 Map<String, Object> snapshot, String excludeSessionId) {
        fanOut(productionId, topic(type, ChangeOperation.UPDATE), snapshot, excludeSessionId);
    }

    public void broadcastDeleted(String productionId, EntityType type, EntityKey key, String excludeSessionId) {
        fanOut(productionId, topic(type, ChangeOperation.DELETE),
                Map.of(EntityRecord.KEY_FIELD, key.value()), excludeSessionId);
    }

    /** e.g. {@code "media-server:updated"}. */
    public static String topic(EntityType type, ChangeOperation op) {
        return type.wireName() + ":" + op.topicSuffix();
    }

    private void fanOut(String productionId, String event, Object data, String excludeSessionId) {
        List<PresenceRegistry.Member> members = registry.members(productionId);
        if (members.isEmpty()) return;

        String frame;
        try {
            frame = json.writeValueAsString(new SocketFrame(event, data));
        } catch (JsonProcessingException e) {
            log.log(Level.WARNING, "cannot serialize " + event + " for " + PresenceRegistry.roomKey(productionId), e);
            return;
        }

        for (PresenceRegistry.Member m : members) {
            if (m.channel().id().equals(excludeSessionId)) continue;
            try {
                m.channel().send(frame);
            } catch (Exception e) {
                log.log(Level.WARNING, String.format("delivery of %s to session %s (%s) failed",
                        event, m.channel().id(), m.userId()), e);
            }
        }
    }
}

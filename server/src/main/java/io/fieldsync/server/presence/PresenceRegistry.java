package io.fieldsync.server.presence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Per-process membership of production rooms.
 * <p>
 * Rooms are keyed {@code production:<id>} and hold one member per connection.
 * Each room value is an immutable map replaced inside {@link ConcurrentHashMap#compute},
 * so mutations of one room are serialized while reads never block.
 * A connection may sit in several rooms; each is tracked independently.
 * Empty rooms are dropped.
 * <p>
 * Process-local only: several server processes each see their own members.
 */
public final class PresenceRegistry {

    /** One joined connection. */
    public record Member(String userId, String userName, SessionChannel channel) {}

    private static final String ROOM_PREFIX = "production:";

    private final ConcurrentHashMap<String, Map<String, Member>> rooms = new ConcurrentHashMap<>();

    public static String roomKey(String productionId) {
        return ROOM_PREFIX + productionId;
    }

    public void join(String productionId, String userId, String userName, SessionChannel channel) {
        Objects.requireNonNull(channel, "channel");
        var member = new Member(userId, userName, channel);
        rooms.compute(roomKey(productionId), (k, room) -> {
            var next = room == null ? new LinkedHashMap<String, Member>() : new LinkedHashMap<>(room);
            next.put(channel.id(), member);
            return Collections.unmodifiableMap(next);
        });
    }

    /** Remove every connection of {@code userId} from the room. @return true if anything was removed */
    public boolean leave(String productionId, String userId) {
        return removeIf(roomKey(productionId), m -> m.userId().equals(userId));
    }

    /** Remove one connection from the room. @return true if it was a member */
    public boolean leave(String productionId, SessionChannel channel) {
        return removeIf(roomKey(productionId), m -> m.channel().id().equals(channel.id()));
    }

    /**
     * Remove a connection from every room it joined.
     *
     * @return production ids of the rooms it left
     */
    public Set<String> disconnect(SessionChannel channel) {
        var left = new LinkedHashSet<String>();
        for (String key : new ArrayList<>(rooms.keySet())) {
            if (removeIf(key, m -> m.channel().id().equals(channel.id()))) {
                left.add(key.substring(ROOM_PREFIX.length()));
            }
        }
        return left;
    }

    /** Connections currently in the room, in join order. */
    public List<Member> members(String productionId) {
        Map<String, Member> room = rooms.get(roomKey(productionId));
        return room == null ? List.of() : List.copyOf(room.values());
    }

    /** Presence list: one entry per user, first join wins, in join order. */
    public List<Presence> presence(String productionId) {
        var byUser = new LinkedHashMap<String, Presence>();
        for (Member m : members(productionId)) {
            byUser.putIfAbsent(m.userId(), new Presence(m.userId(), m.userName()));
        }
        return List.copyOf(byUser.values());
    }

    /** Number of non-empty rooms. */
    public int roomCount() {
        return rooms.size();
    }

    private boolean removeIf(String key, Predicate<Member> match) {
        boolean[] removed = {false};
        rooms.computeIfPresent(key, (k, room) -> {
            var next = new LinkedHashMap<String, Member>();
            for (var e : room.entrySet()) {
                if (match.test(e.getValue())) {
                    removed[0] = true;
                } else {
                    next.put(e.getKey(), e.getValue());
                }
            }
            if (!removed[0]) return room;
            return next.isEmpty() ? null : Collections.unmodifiableMap(next);
        });
        return removed[0];
    }
}

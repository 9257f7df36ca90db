package io.fieldsync.server.presence;

/** One entry of a room's presence list, as broadcast to clients. */
public record Presence(String userId, String userName) {}

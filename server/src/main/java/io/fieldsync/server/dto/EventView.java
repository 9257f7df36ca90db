package io.fieldsync.server.dto;

import io.fieldsync.core.ChangeEvent;
import io.fieldsync.core.SnapshotDiff;

import java.util.Map;

/**
 * JSON view of one audit event.
 * {@code changes} is {"all":"created"} for CREATE, {field: {from, to}} for an
 * UPDATE, or null.
 */
public class EventView {
    public String id;
    public long sequence;
    public String productionId;
    public String eventType;
    public String operation;
    public String entityId;
    public Map<String, Object> entityData;
    public Map<String, Object> changes;
    public String userId;
    public String userName;
    public long version;
    public String timestamp;        // ISO-8601
    public long timestampMillis;    // for /events/since/{millis}

    public static EventView of(ChangeEvent e) {
        var v = new EventView();
        v.id = e.eventId();
        v.sequence = e.sequence();
        v.productionId = e.productionId();
        v.eventType = e.entityType().wireName();
        v.operation = e.operation().name();
        v.entityId = e.entityKey().value();
        v.entityData = e.snapshot();
        v.changes = SnapshotDiff.toJson(e.diff());
        v.userId = e.userId();
        v.userName = e.userName();
        v.version = e.revision();
        v.timestamp = e.timestamp().toString();
        v.timestampMillis = e.timestamp().toEpochMilli();
        return v;
    }
}

package io.fieldsync.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.core.ChangeEvent;
import io.fieldsync.core.ChangeOperation;
import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;
import io.fieldsync.core.EntityType;
import io.fieldsync.core.FieldVersions;
import io.fieldsync.core.SnapshotDiff;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Binary framing for WAL records.
 * <p>
 * Full on-disk layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xD17E   (helps detect garbage)
 *     - version (1B)  = 1       (for future upgrades)
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 *     - kind:     1 byte (ENTITY_PUT, ENTITY_REMOVED, EVENT)
 *     - document: UTF-8 JSON object
 * <p>
 * Documents are read back with integers as Integer/Long/BigInteger by size and
 * floats as BigDecimal, so attribute values never pass through a double.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xD17E;
    static final byte  VERSION = 1;
    static final int   HEADER_BYTES = 2 + 1 + 4 + 4;

    static final byte ENTITY_PUT = 1;
    static final byte ENTITY_REMOVED = 2;
    static final byte EVENT = 3;

    static final ObjectMapper JSON = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {};

    private RecordCodec() {
        // utility
    }

    /** Immutable view of a decoded record. */
    sealed interface LogRecord permits EntityPut, EntityRemoved, EventAppended {}

    /** Full new state of one entity. */
    record EntityPut(EntityRecord entity) implements LogRecord {}

    /** Entity erased (compensation of a create that never got its event). */
    record EntityRemoved(EntityKey key) implements LogRecord {}

    record EventAppended(ChangeEvent event) implements LogRecord {}

    /** Encode a log record into header+payload bytes ready for append. */
    static byte[] encode(LogRecord record) {
        byte kind;
        Map<String, Object> doc;
        if (record instanceof EntityPut put) {
            kind = ENTITY_PUT;
            doc = entityToDocument(put.entity());
        } else if (record instanceof EntityRemoved removed) {
            kind = ENTITY_REMOVED;
            doc = Map.of("key", removed.key().value());
        } else {
            kind = EVENT;
            doc = eventToDocument(((EventAppended) record).event());
        }

        byte[] body;
        try {
            body = JSON.writeValueAsBytes(doc);
        } catch (JsonProcessingException e) {
            throw new StorageException("cannot serialize WAL record", e);
        }
        byte[] payload = new byte[1 + body.length];
        payload[0] = kind;
        System.arraycopy(body, 0, payload, 1, body.length);

        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        header.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        header.flip();

        byte[] out = new byte[HEADER_BYTES + payload.length];
        header.get(out, 0, HEADER_BYTES);
        System.arraycopy(payload, 0, out, HEADER_BYTES, payload.length);
        return out;
    }

    /** Decode a full payload (not including header). */
    static LogRecord decode(byte[] payload) {
        if (payload.length < 1) throw new StorageException("empty WAL payload");
        Map<String, Object> doc;
        try {
            doc = JSON.readValue(payload, 1, payload.length - 1, DOCUMENT);
        } catch (IOException e) {
            throw new StorageException("undecodable WAL payload", e);
        }
        try {
            switch (payload[0]) {
                case ENTITY_PUT:
                    return new EntityPut(entityFromDocument(doc));
                case ENTITY_REMOVED:
                    return new EntityRemoved(new EntityKey((String) doc.get("key")));
                case EVENT:
                    return new EventAppended(eventFromDocument(doc));
                default:
                    throw new StorageException("unknown WAL record kind " + payload[0]);
            }
        } catch (RuntimeException e) {
            if (e instanceof StorageException) throw e;
            throw new StorageException("malformed WAL document", e);
        }
    }

    // ----------------- documents -----------------

    static Map<String, Object> entityToDocument(EntityRecord e) {
        var doc = new LinkedHashMap<String, Object>();
        doc.put("key", e.key().value());
        doc.put("type", e.type().wireName());
        doc.put("productionId", e.productionId());
        doc.put("label", e.label());
        doc.put("attributes", e.attributes());
        doc.put("fieldVersions", e.fieldVersions().toJson());
        doc.put("revision", e.revision());
        doc.put("createdAt", e.createdAt().toString());
        doc.put("updatedAt", e.updatedAt().toString());
        doc.put("lastModifiedBy", e.lastModifiedBy());
        doc.put("deleted", e.deleted());
        return doc;
    }

    static EntityRecord entityFromDocument(Map<String, Object> doc) {
        return new EntityRecord(
                new EntityKey((String) doc.get("key")),
                EntityType.fromWireName((String) doc.get("type")),
                (String) doc.get("productionId"),
                (String) doc.get("label"),
                object(doc.get("attributes"), "attributes"),
                FieldVersions.fromUntrusted(doc.get("fieldVersions")),
                ((Number) doc.get("revision")).longValue(),
                Instant.parse((String) doc.get("createdAt")),
                Instant.parse((String) doc.get("updatedAt")),
                (String) doc.get("lastModifiedBy"),
                Boolean.TRUE.equals(doc.get("deleted")));
    }

    static Map<String, Object> eventToDocument(ChangeEvent ev) {
        var doc = new LinkedHashMap<String, Object>();
        doc.put("eventId", ev.eventId());
        doc.put("sequence", ev.sequence());
        doc.put("productionId", ev.productionId());
        doc.put("entityType", ev.entityType().wireName());
        doc.put("operation", ev.operation().name());
        doc.put("entityKey", ev.entityKey().value());
        doc.put("snapshot", ev.snapshot());
        doc.put("diff", SnapshotDiff.toJson(ev.diff()));
        doc.put("userId", ev.userId());
        doc.put("userName", ev.userName());
        doc.put("revision", ev.revision());
        doc.put("timestamp", ev.timestamp().toString());
        return doc;
    }

    static ChangeEvent eventFromDocument(Map<String, Object> doc) {
        return new ChangeEvent(
                (String) doc.get("eventId"),
                ((Number) doc.get("sequence")).longValue(),
                (String) doc.get("productionId"),
                EntityType.fromWireName((String) doc.get("entityType")),
                ChangeOperation.valueOf((String) doc.get("operation")),
                new EntityKey((String) doc.get("entityKey")),
                object(doc.get("snapshot"), "snapshot"),
                SnapshotDiff.fromJson(object(doc.get("diff"), "diff")),
                (String) doc.get("userId"),
                (String) doc.get("userName"),
                ((Number) doc.get("revision")).longValue(),
                Instant.parse((String) doc.get("timestamp")));
    }

    /** Nested JSON object as a string-keyed map; null stays null. */
    private static Map<String, Object> object(Object value, String field) {
        if (value == null) return null;
        if (!(value instanceof Map<?, ?> raw)) {
            throw new StorageException("'" + field + "' is not a JSON object");
        }
        var out = new LinkedHashMap<String, Object>();
        raw.forEach((k, v) -> out.put(String.valueOf(k), v));
        return out;
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue(); // CRC32 fits in unsigned int; Java int is fine for compare
    }
}

package io.fieldsync.server.dto;

import java.util.Map;

/**
 * JSON body for PUT /entities/{entityType}/{key}.
 * Example:
 *   {
 *     "fieldVersions": { "name": { "version": 2, "updatedAt": "2026-02-10T10:00:00Z" } },
 *     "data":          { "name": "Beta", "id": "CAM 2" },
 *     "userId":        "u-17",
 *     "userName":      "Alice"
 *   }
 * Without fieldVersions, "version" (the record revision last read) enables a
 * whole-record check instead.
 */
public class UpdateRequest {
    public Object fieldVersions;       // validated by the service, never coerced
    public Long version;
    public Map<String, Object> data;
    public String userId;
    public String userName;
}

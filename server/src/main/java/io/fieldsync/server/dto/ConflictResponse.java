package io.fieldsync.server.dto;

import io.fieldsync.core.FieldConflict;

import java.util.List;
import java.util.Map;

/**
 * 409 body for a field-level conflict. Fields that did not conflict have
 * already been applied; {@code entity} is the stored state after that.
 */
public class ConflictResponse {
    public String error = "Conflict detected";
    public String message = "Some fields were modified by another user";
    public List<FieldConflict> conflicts;
    public List<String> acceptedFields;
    public Map<String, Object> entity;
}

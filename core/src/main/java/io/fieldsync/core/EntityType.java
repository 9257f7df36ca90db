package io.fieldsync.core;

import java.util.List;
import java.util.Locale;

/**
 * Kinds of trackable equipment record, each with its default versioned-field list.
 * <p>
 * The wire name is used in URLs and broadcast topics ({@code "camera:updated"}).
 * None of the lists contains the display label ({@link EntityRecord#LABEL_FIELD}):
 * renaming a record must never conflict with edits to its other attributes.
 */
public enum EntityType {
    SOURCE("source", List.of(
            "type", "name", "category", "formatAssignmentMode", "hRes", "vRes",
            "rate", "standard", "note", "secondaryDevice", "blanking")),
    SEND("send", List.of(
            "type", "name", "hRes", "vRes", "rate", "standard", "note",
            "secondaryDevice", "outputConnector")),
    CAMERA("camera", List.of(
            "name", "model", "formatMode", "lensType", "maxZoom", "shootingDistance",
            "calculatedZoom", "hasTripod", "hasShortTripod", "hasDolly", "hasJib",
            "ccuId", "smpteCableLength", "note")),
    CCU("ccu", List.of(
            "name", "manufacturer", "model", "formatMode", "fiberInput",
            "referenceInput", "outputs", "note")),
    MEDIA_SERVER("media-server", List.of(
            "name", "platform", "manufacturer", "model", "outputs", "note")),
    ROUTER("router", List.of(
            "name", "manufacturer", "model", "inputs", "outputs", "note")),
    CHECKLIST_ITEM("checklist-item", List.of(
            "category", "task", "completed", "sortOrder", "notes"));

    private final String wireName;
    private final List<String> defaultVersionedFields;

    EntityType(String wireName, List<String> defaultVersionedFields) {
        this.wireName = wireName;
        this.defaultVersionedFields = defaultVersionedFields;
    }

    public String wireName() { return wireName; }

    public List<String> defaultVersionedFields() { return defaultVersionedFields; }

    /**
     * Resolve a wire name ("media-server") or enum name ("MEDIA_SERVER").
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static EntityType fromWireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("entity type must not be empty");
        }
        for (EntityType t : values()) {
            if (t.wireName.equals(name) || t.name().equals(name.toUpperCase(Locale.ROOT))) return t;
        }
        throw new IllegalArgumentException("unknown entity type: " + name);
    }
}

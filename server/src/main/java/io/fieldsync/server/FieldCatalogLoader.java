package io.fieldsync.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fieldsync.core.EntityType;
import io.fieldsync.core.VersionedFieldCatalog;
import io.fieldsync.server.dto.FieldCatalogJson;

import java.io.IOException;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads versioned-field overrides from a JSON file (see {@link FieldCatalogJson}).
 * A file naming an unknown type or a reserved field fails startup.
 */
public final class FieldCatalogLoader {

    private FieldCatalogLoader() {
        // utility
    }

    public static VersionedFieldCatalog fromJsonFile(Path path) {
        FieldCatalogJson cfg;
        try {
            cfg = new ObjectMapper().readValue(path.toFile(), FieldCatalogJson.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to load field catalog from " + path, e);
        }
        return fromJson(cfg);
    }

    static VersionedFieldCatalog fromJson(FieldCatalogJson cfg) {
        Map<EntityType, List<String>> overrides = new EnumMap<>(EntityType.class);
        if (cfg != null && cfg.versionedFields != null) {
            for (var e : cfg.versionedFields.entrySet()) {
                if (e.getValue() == null) {
                    throw new IllegalArgumentException(e.getKey() + ": versioned field list must not be null");
                }
                overrides.put(EntityType.fromWireName(e.getKey()), e.getValue());
            }
        }
        return VersionedFieldCatalog.of(overrides);
    }
}

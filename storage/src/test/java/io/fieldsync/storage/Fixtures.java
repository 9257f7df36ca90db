package io.fieldsync.storage;

import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityRecord;
import io.fieldsync.core.EntityType;
import io.fieldsync.core.FieldVersions;
import io.fieldsync.core.VersionedFieldCatalog;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

final class Fixtures {
    static final Instant T0 = Instant.parse("2026-02-10T10:00:00Z");

    private Fixtures() {
    }

    static EntityRecord camera(String key, String label, Map<String, Object> attrs) {
        var versions = FieldVersions.initialize(
                VersionedFieldCatalog.defaults().versionedFields(EntityType.CAMERA),
                Clock.fixed(T0, ZoneOffset.UTC));
        return EntityRecord.create(new EntityKey(key), EntityType.CAMERA, "p1", label, attrs, versions, "alice", T0);
    }
}

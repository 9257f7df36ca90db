package io.fieldsync.server;

import io.fieldsync.core.EntityKey;
import io.fieldsync.core.EntityType;

/** No live entity of the given type under the given key. */
public class EntityNotFoundException extends RuntimeException {
    public EntityNotFoundException(EntityType type, EntityKey key) {
        super(type.wireName() + " " + key + " not found");
    }
}

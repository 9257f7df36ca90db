package io.fieldsync.server;

import io.fieldsync.core.ChangeEvent;
import io.fieldsync.core.EntityRecord;
import io.fieldsync.core.FieldMerger;

/**
 * Outcome of {@link SyncService#proposeUpdate}.
 *
 * @param merge  conflicts and accepted fields of the final merge attempt
 * @param entity entity as stored after the call (unchanged if nothing was accepted)
 * @param event  recorded UPDATE event, or null if nothing was written
 */
public record UpdateResult(FieldMerger.MergeResult merge, EntityRecord entity, ChangeEvent event) {

    public boolean hasConflicts() {
        return merge.hasConflicts();
    }

    public boolean written() {
        return event != null;
    }
}

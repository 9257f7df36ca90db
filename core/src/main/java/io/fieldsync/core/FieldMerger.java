package io.fieldsync.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pure, field-by-field comparison and merge of a proposed update against the
 * current server state of one entity.
 * <p>
 * Rules:
 *  - Only keys present in the client data are considered.
 *  - A key in {@code versionedFields} conflicts when the client's version is
 *    strictly lower than the server's (missing versions read as 0). Equal
 *    versions are not a conflict.
 *  - A key outside {@code versionedFields} (the display label, for instance) is
 *    never compared and always overwrites.
 * <p>
 * This interface knows nothing about storage, transport or entity types; the
 * caller loads server state and supplies the versioned-field set.
 */
public interface FieldMerger {

    /**
     * List the stale fields of a proposed update, in client-data order.
     */
    List<FieldConflict> detectConflicts(
            FieldVersions clientVersions,
            FieldVersions serverVersions,
            Map<String, Object> clientData,
            Map<String, Object> serverData,
            Set<String> versionedFields);

    /**
     * Apply every non-conflicting key of {@code clientData} on top of {@code serverData}.
     * Accepted versioned fields are bumped by exactly one; conflicting fields keep the
     * server's value and version.
     */
    MergeResult merge(
            FieldVersions clientVersions,
            FieldVersions serverVersions,
            Map<String, Object> clientData,
            Map<String, Object> serverData,
            Set<String> versionedFields);

    /**
     * Outcome of a merge. Data maps may hold null values (a field cleared by the client).
     */
    record MergeResult(
            List<FieldConflict> conflicts,
            Map<String, Object> mergedData,
            FieldVersions mergedVersions,
            List<String> acceptedFields
    ) {
        public MergeResult {
            conflicts = List.copyOf(conflicts);
            mergedData = Collections.unmodifiableMap(new LinkedHashMap<>(mergedData));
            Objects.requireNonNull(mergedVersions, "mergedVersions");
            acceptedFields = List.copyOf(acceptedFields);
        }

        public boolean hasConflicts() { return !conflicts.isEmpty(); }
    }
}

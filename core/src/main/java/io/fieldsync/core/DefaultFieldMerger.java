package io.fieldsync.core;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Default field-version merge.
 * <p>
 * Algorithm:
 *  - conflicts = every versioned key k of clientData with
 *    client.versionOf(k) < server.versionOf(k).
 *  - mergedData starts as a copy of serverData, mergedVersions as serverVersions.
 *  - For each remaining key k of clientData:
 *      - versioned:   mergedData[k] = clientData[k], mergedVersions = bump(k)
 *      - unversioned: mergedData[k] = clientData[k], no version change
 * <p>
 * A field absent from serverVersions reads as 0, so the first write to it always wins.
 * The clock only stamps {@code updatedAt}; it never takes part in the comparison.
 */
public final class DefaultFieldMerger implements FieldMerger {
    private final Clock clock;

    public DefaultFieldMerger() {
        this(Clock.systemUTC());
    }

    public DefaultFieldMerger(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public List<FieldConflict> detectConflicts(FieldVersions clientVersions,
                                               FieldVersions serverVersions,
                                               Map<String, Object> clientData,
                                               Map<String, Object> serverData,
                                               Set<String> versionedFields) {
        var conflicts = new ArrayList<FieldConflict>();
        for (var e : clientData.entrySet()) {
            String field = e.getKey();
            if (!versionedFields.contains(field)) continue;

            int client = clientVersions.versionOf(field);
            int server = serverVersions.versionOf(field);
            if (client < server) {
                conflicts.add(new FieldConflict(field, client, server, e.getValue(), serverData.get(field)));
            }
        }
        return conflicts;
    }

    @Override
    public MergeResult merge(FieldVersions clientVersions,
                             FieldVersions serverVersions,
                             Map<String, Object> clientData,
                             Map<String, Object> serverData,
                             Set<String> versionedFields) {
        List<FieldConflict> conflicts =
                detectConflicts(clientVersions, serverVersions, clientData, serverData, versionedFields);

        Set<String> stale = new HashSet<>();
        for (FieldConflict c : conflicts) stale.add(c.field());

        var mergedData = new LinkedHashMap<>(serverData);
        FieldVersions mergedVersions = serverVersions;
        var accepted = new ArrayList<String>();

        for (var e : clientData.entrySet()) {
            String field = e.getKey();
            if (stale.contains(field)) continue;

            mergedData.put(field, e.getValue());
            if (versionedFields.contains(field)) {
                mergedVersions = mergedVersions.bump(field, clock);
            }
            accepted.add(field);
        }
        return new MergeResult(conflicts, mergedData, mergedVersions, accepted);
    }
}

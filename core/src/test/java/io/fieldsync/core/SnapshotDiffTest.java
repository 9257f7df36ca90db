package io.fieldsync.core;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotDiffTest {

    @Test
    void no_previous_snapshot_is_the_created_sentinel() {
        assertSame(SnapshotDiff.Created.INSTANCE, SnapshotDiff.diff(null, Map.of("name", "x")));
        assertEquals(Map.of("all", "created"), SnapshotDiff.toJson(SnapshotDiff.Created.INSTANCE));
    }

    @Test
    void identical_snapshots_have_no_diff() {
        var snap = Map.<String, Object>of("name", "CAM 1", "outputs", List.of(1, 2), "meta", Map.of("a", 1));
        assertNull(SnapshotDiff.diff(snap, Map.copyOf(snap)));
        assertNull(SnapshotDiff.toJson(null));
    }

    @Test
    void numbers_compare_by_value_not_java_type() {
        var before = Map.<String, Object>of("maxZoom", 3, "big", BigInteger.valueOf(9_007_199_254_740_993L), "rate", 59.94);
        var after = Map.<String, Object>of("maxZoom", 3L, "big", 9_007_199_254_740_993L, "rate", new BigDecimal("59.940"));

        assertNull(SnapshotDiff.diff(before, after));
    }

    @Test
    void integers_past_double_precision_still_differ() {
        var before = Map.<String, Object>of("big", 9_007_199_254_740_992L);
        var after = Map.<String, Object>of("big", 9_007_199_254_740_993L);

        assertInstanceOf(SnapshotDiff.Changes.class, SnapshotDiff.diff(before, after));
    }

    @Test
    void changes_cover_the_union_of_keys() {
        var before = new LinkedHashMap<String, Object>();
        before.put("name", "Alpha");
        before.put("note", "n");
        before.put("gone", true);
        var after = new LinkedHashMap<String, Object>();
        after.put("name", "Beta");
        after.put("note", "n");
        after.put("added", 7);

        var diff = (SnapshotDiff.Changes) SnapshotDiff.diff(before, after);

        assertEquals(List.of("name", "gone", "added"), List.copyOf(diff.fields().keySet()));
        assertEquals(new SnapshotDiff.Change("Alpha", "Beta"), diff.fields().get("name"));
        assertEquals(new SnapshotDiff.Change(true, null), diff.fields().get("gone"));
        assertEquals(new SnapshotDiff.Change(null, 7), diff.fields().get("added"));
    }

    @Test
    void explicit_null_and_missing_key_are_the_same_value() {
        var before = new LinkedHashMap<String, Object>();
        before.put("note", null);
        assertNull(SnapshotDiff.diff(before, Map.of()));
    }

    @Test
    void nested_maps_ignore_key_order() {
        var a = new LinkedHashMap<String, Object>();
        a.put("x", 1);
        a.put("y", 2);
        var b = new LinkedHashMap<String, Object>();
        b.put("y", 2);
        b.put("x", 1);

        assertNull(SnapshotDiff.diff(Map.of("fv", a), Map.of("fv", b)));
    }

    @Test
    void wire_form_parses_back() {
        var diff = SnapshotDiff.diff(Map.of("name", "Alpha"), Map.of("name", "Beta"));
        var json = SnapshotDiff.toJson(diff);

        assertEquals(Map.of("name", Map.of("from", "Alpha", "to", "Beta")), json);
        assertEquals(diff, SnapshotDiff.fromJson(json));
        assertSame(SnapshotDiff.Created.INSTANCE, SnapshotDiff.fromJson(Map.of("all", "created")));
    }

    @Test
    void wire_form_rejects_non_object_entries() {
        assertThrows(IllegalArgumentException.class, () -> SnapshotDiff.fromJson(Map.of("name", "Beta")));
    }
}

package com.p14n.shadowsync.shadow;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;

class ShadowReconcilerTest {

    private final ShadowReconciler reconciler = new ShadowReconciler(false);
    private final ShadowDocument empty = ShadowDocument.create("wh-1", 0);

    private static Map<String, JsonNode> props(String name, JsonNode value) {
        Map<String, JsonNode> map = new HashMap<>();
        map.put(name, value);
        return map;
    }

    private static Map<String, JsonNode> temperature(int value) {
        return props("temperature", IntNode.valueOf(value));
    }

    @Test
    void firstReportAddsPropertyAndBumpsVersion() {
        Reconciliation result = reconciler.applyReported(empty, temperature(125), 100, 100);

        ShadowDelta delta = result.delta();
        assertTrue(result.modified());
        assertEquals(0, delta.fromVersion());
        assertEquals(1, delta.toVersion());
        assertEquals(DeltaKind.REPORTED_CHANGED, delta.kind());
        assertEquals(List.of(PropertyChange.added(Section.REPORTED, "temperature", IntNode.valueOf(125))),
                delta.changes());
        assertEquals(1, result.document().version());
        assertEquals(125, result.document().reportedValue("temperature").asInt());
        assertEquals(100, result.document().reported().get("temperature").timestamp());
    }

    @Test
    void repeatedIdenticalReportIsANoop() {
        ShadowDocument once = reconciler.applyReported(empty, temperature(125), 100, 100).document();

        Reconciliation same = reconciler.applyReported(once, temperature(125), 100, 101);
        Reconciliation older = reconciler.applyReported(once, temperature(125), 50, 101);

        assertTrue(same.delta().isEmpty());
        assertFalse(same.modified());
        assertSame(once, same.document());
        assertTrue(older.delta().isEmpty());
        assertEquals(1, older.document().version());
    }

    @Test
    void numericallyEqualValuesAreIdentical() {
        ShadowDocument once = reconciler.applyReported(empty, temperature(125), 100, 100).document();
        Reconciliation asDouble = reconciler.applyReported(once, props("temperature", DoubleNode.valueOf(125.0)),
                100, 100);
        assertTrue(asDouble.delta().isEmpty());
    }

    @Test
    void newerIdenticalReportRefreshesTimestampWithoutVersionChange() {
        ShadowDocument once = reconciler.applyReported(empty, temperature(1), 5, 5).document();

        Reconciliation refreshed = reconciler.applyReported(once, temperature(1), 10, 10);
        assertTrue(refreshed.delta().isEmpty());
        assertTrue(refreshed.modified());
        assertEquals(1, refreshed.document().version());
        assertEquals(10, refreshed.document().reported().get("temperature").timestamp());

        Reconciliation stale = reconciler.applyReported(refreshed.document(), temperature(2), 7, 11);
        assertTrue(stale.delta().isEmpty());
        assertEquals(1, stale.document().reportedValue("temperature").asInt());
    }

    @Test
    void lastWriterWinsRegardlessOfArrivalOrder() {
        ShadowDocument inOrder = reconciler.applyReported(
                reconciler.applyReported(empty, temperature(5), 5, 1).document(), temperature(10), 10, 2)
                .document();
        Reconciliation lateArrival = reconciler.applyReported(
                reconciler.applyReported(empty, temperature(10), 10, 1).document(), temperature(5), 5, 2);

        assertEquals(10, inOrder.reportedValue("temperature").asInt());
        assertEquals(10, lateArrival.document().reportedValue("temperature").asInt());
        assertTrue(lateArrival.delta().isEmpty());
    }

    @Test
    void equalTimestampWithNewValueReplaces() {
        ShadowDocument once = reconciler.applyReported(empty, temperature(1), 5, 5).document();
        Reconciliation result = reconciler.applyReported(once, temperature(2), 5, 6);

        assertEquals(ChangeType.CHANGED, result.delta().changes().get(0).type());
        assertEquals(1, result.delta().changes().get(0).previous().asInt());
        assertEquals(2, result.document().version());
    }

    @Test
    void nullValueRemovesProperty() {
        ShadowDocument once = reconciler.applyReported(empty, temperature(1), 5, 5).document();

        Reconciliation stale = reconciler.applyReported(once, props("temperature", null), 4, 6);
        assertTrue(stale.delta().isEmpty());

        Reconciliation removed = reconciler.applyReported(once, props("temperature", NullNode.getInstance()), 6,
                6);
        assertEquals(ChangeType.REMOVED, removed.delta().changes().get(0).type());
        assertNull(removed.document().reportedValue("temperature"));
        assertEquals(2, removed.document().version());

        Reconciliation again = reconciler.applyReported(removed.document(), props("temperature", null), 7, 7);
        assertTrue(again.delta().isEmpty());
    }

    @Test
    void removalOutlivesOlderWritesInEitherOrder() {
        ShadowDocument setThenRemove = reconciler.applyReported(
                reconciler.applyReported(empty, temperature(1), 5, 5).document(), props("temperature", null), 10, 10)
                .document();
        Reconciliation removedFirst = reconciler.applyReported(empty, props("temperature", null), 10, 10);
        Reconciliation removeThenSet = reconciler.applyReported(removedFirst.document(), temperature(1), 5, 11);

        assertNull(setThenRemove.reportedValue("temperature"));
        assertEquals(Map.of("temperature", 10L), setThenRemove.reportedRemoved());
        assertTrue(removedFirst.modified());
        assertTrue(removedFirst.delta().isEmpty());
        assertTrue(removeThenSet.delta().isEmpty());
        assertNull(removeThenSet.document().reportedValue("temperature"));
        assertEquals(setThenRemove.reported(), removeThenSet.document().reported());
    }

    @Test
    void newerWriteReplacesRemoval() {
        ShadowDocument removed = reconciler.applyReported(empty, props("temperature", null), 10, 10).document();

        Reconciliation revived = reconciler.applyReported(removed, temperature(7), 12, 12);

        assertEquals(ChangeType.ADDED, revived.delta().changes().get(0).type());
        assertEquals(7, revived.document().reportedValue("temperature").asInt());
        assertTrue(revived.document().reportedRemoved().isEmpty());
    }

    @Test
    void desiredRemovalOutlivesOlderRequests() {
        ShadowDocument removed = reconciler.applyDesired(empty, props("temperature", null), 10, 10).document();

        Reconciliation late = reconciler.applyDesired(removed, temperature(130), 5, 11);

        assertTrue(late.delta().isEmpty());
        assertTrue(late.document().desired().isEmpty());
        assertEquals(Map.of("temperature", 10L), late.document().desiredRemoved());
    }

    @Test
    void severalPropertiesBumpVersionOnce() {
        Map<String, JsonNode> values = new HashMap<>();
        values.put("temperature", IntNode.valueOf(120));
        values.put("mode", TextNode.valueOf("eco"));
        values.put("pressure", IntNode.valueOf(3));

        Reconciliation result = reconciler.applyReported(empty, values, 1, 1);

        assertEquals(1, result.document().version());
        assertEquals(List.of("mode", "pressure", "temperature"),
                result.delta().changes().stream().map(PropertyChange::name).toList());
    }

    @Test
    void desiredIsPendingUntilReported() {
        Reconciliation requested = reconciler.applyDesired(empty, props("target_temperature", IntNode.valueOf(130)),
                90, 90);

        assertEquals(DeltaKind.DESIRED_CHANGED, requested.delta().kind());
        assertEquals(1, requested.document().version());
        assertFalse(requested.document().desired().get("target_temperature").applied());
        assertEquals(Map.of("target_temperature", IntNode.valueOf(130)), requested.document().pendingDelta());

        Reconciliation reported = reconciler.applyReported(requested.document(),
                props("target_temperature", IntNode.valueOf(130)), 100, 100);

        assertEquals(DeltaKind.REPORTED_CHANGED, reported.delta().kind());
        assertTrue(reported.delta().changes(Section.DESIRED).isEmpty());
        assertEquals(2, reported.document().version());
        assertTrue(reported.document().desired().get("target_temperature").applied());
        assertTrue(reported.document().isInSync("target_temperature"));
        assertTrue(reported.document().pendingDelta().isEmpty());
    }

    @Test
    void desiredMatchingReportedIsAppliedImmediately() {
        ShadowDocument reported = reconciler.applyReported(empty, temperature(125), 100, 100).document();
        Reconciliation result = reconciler.applyDesired(reported, temperature(125), 110, 110);

        assertEquals(2, result.document().version());
        assertTrue(result.document().desired().get("temperature").applied());
    }

    @Test
    void pruneRemovesAppliedDesired() {
        ShadowReconciler pruning = new ShadowReconciler(true);
        ShadowDocument requested = pruning.applyDesired(empty, temperature(130), 90, 90).document();

        Reconciliation reported = pruning.applyReported(requested, temperature(130), 100, 100);

        assertTrue(reported.document().desired().isEmpty());
        assertTrue(reported.delta().changes(Section.DESIRED).isEmpty());
    }

    @Test
    void changedDesiredValueResetsAppliedFlag() {
        ShadowDocument applied = reconciler.applyReported(
                reconciler.applyDesired(empty, temperature(130), 90, 90).document(), temperature(130), 100, 100)
                .document();

        Reconciliation result = reconciler.applyDesired(applied, temperature(140), 110, 110);

        assertEquals(ChangeType.CHANGED, result.delta().changes().get(0).type());
        assertFalse(result.document().desired().get("temperature").applied());
    }

    @Test
    void markAppliedKeepsVersion() {
        ShadowDocument requested = reconciler.applyDesired(empty, temperature(130), 90, 90).document();

        Reconciliation marked = reconciler.markApplied(requested, List.of("temperature", "unknown"), 95);

        assertTrue(marked.modified());
        assertTrue(marked.delta().isEmpty());
        assertEquals(1, marked.document().version());
        assertTrue(marked.document().desired().get("temperature").applied());

        assertFalse(reconciler.markApplied(marked.document(), List.of("temperature"), 96).modified());
    }

    @Test
    void clearDesiredRemovesEntries() {
        ShadowDocument requested = reconciler.applyDesired(empty, temperature(130), 90, 90).document();

        Reconciliation cleared = reconciler.clearDesired(requested, List.of("temperature", "unknown"), 95);

        assertEquals(2, cleared.document().version());
        assertEquals(ChangeType.REMOVED, cleared.delta().changes().get(0).type());
        assertEquals(DeltaKind.DESIRED_CHANGED, cleared.delta().kind());
        assertTrue(cleared.document().desired().isEmpty());

        assertFalse(reconciler.clearDesired(cleared.document(), List.of("temperature"), 96).modified());
        assertTrue(reconciler.applyDesired(cleared.document(), temperature(120), 92, 97).delta().isEmpty());
    }

    @Test
    void emptyPropertyNameIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> reconciler.applyReported(empty, props("", IntNode.valueOf(1)), 1, 1));
    }
}

package org.absint.dataflow.interval;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class IntervalTest {

    @Test
    public void emptyIntervalIsBottom() {
        assertSame(Interval.BOTTOM, Interval.of(3, 2));
        assertTrue(Interval.BOTTOM.isLessOrEqual(Interval.constant(0)));
        assertEquals(Interval.constant(4), Interval.BOTTOM.join(Interval.constant(4)));
    }

    @Test
    public void joinAndMeet() {
        Interval a = Interval.of(0, 5);
        Interval b = Interval.of(3, 9);
        assertEquals(Interval.of(0, 9), a.join(b));
        assertEquals(Interval.of(3, 5), a.meet(b));
        assertTrue(Interval.of(10, 12).meet(a).isBottom());
    }

    @Test
    public void widenJumpsUnstableBoundsToInfinity() {
        Interval prev = Interval.of(0, 1);
        assertEquals(Interval.of(0, Interval.PLUS_INFINITY), prev.widen(Interval.of(0, 2)));
        assertEquals(Interval.of(Interval.MINUS_INFINITY, 1), prev.widen(Interval.of(-1, 1)));
        assertEquals(prev, prev.widen(Interval.constant(1)));
        assertTrue(prev.widen(Interval.of(-1, 2)).isTop());
    }

    @Test
    public void addSaturates() {
        assertEquals(Interval.of(1, 11), Interval.of(0, 10).add(1));
        assertEquals(
                Interval.of(1, Interval.PLUS_INFINITY),
                Interval.of(0, Interval.PLUS_INFINITY).add(1));
        assertEquals(
                Interval.constant(Interval.PLUS_INFINITY),
                Interval.constant(Long.MAX_VALUE - 1).add(5));
    }

    @Test
    public void printsInfiniteBounds() {
        assertEquals("[0, +oo]", Interval.of(0, Interval.PLUS_INFINITY).toString());
        assertEquals("[-oo, +oo]", Interval.TOP.toString());
        assertEquals("bottom", Interval.BOTTOM.toString());
    }

    @Test
    public void storeTreatsMissingVariablesAsTop() {
        IntervalStore store = IntervalStore.top().set("i", Interval.constant(0));
        assertEquals(Interval.constant(0), store.get("i"));
        assertTrue(store.get("j").isTop());
        assertTrue(store.isLessOrEqual(IntervalStore.top()));
        assertFalse(IntervalStore.top().isLessOrEqual(store));
        assertTrue(store.set("i", Interval.BOTTOM).isBottom());
    }

    @Test
    public void storeJoinDropsVariablesBoundOnOneSideOnly() {
        IntervalStore left =
                IntervalStore.top()
                        .set("i", Interval.constant(0))
                        .set("j", Interval.constant(1));
        IntervalStore right = IntervalStore.top().set("i", Interval.constant(5));
        IntervalStore joined = left.leastUpperBound(right);
        assertEquals(Interval.of(0, 5), joined.get("i"));
        assertTrue(joined.get("j").isTop());
        assertSame(left, left.leastUpperBound(IntervalStore.bottom()));
    }

    @Test
    public void instructions() {
        IntervalTransferFunction<String, Void> transfer = new IntervalTransferFunction<>();
        IntervalStore store = IntervalStore.top();
        store = transfer.execInstr(store, null, "n", 0, IntervalInstruction.assign("i", 3));
        store = transfer.execInstr(store, null, "n", 1, IntervalInstruction.increment("i", 2));
        assertEquals(Interval.constant(5), store.get("i"));
        assertTrue(
                transfer.execInstr(store, null, "n", 2, IntervalInstruction.assumeLessThan("i", 5))
                        .isBottom());
        assertEquals(
                Interval.constant(5),
                transfer.execInstr(store, null, "n", 2, IntervalInstruction.assumeAtLeast("i", 5))
                        .get("i"));
        assertEquals("i += 2", IntervalInstruction.increment("i", 2).toString());
    }
}

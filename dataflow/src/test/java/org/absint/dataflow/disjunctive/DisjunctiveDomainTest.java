package org.absint.dataflow.disjunctive;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.absint.dataflow.interval.Interval;
import org.absint.dataflow.interval.IntervalStore;
import org.junit.Test;

public class DisjunctiveDomainTest {

    private final Path a = Path.normal("a");
    private final Path b = Path.normal("b");
    private final Path c = Path.normal("c");
    private final Path d = Path.normal("d");

    private static IntervalStore i(long value) {
        return IntervalStore.top().set("i", Interval.constant(value));
    }

    private static List<Path> list(Path... paths) {
        return Arrays.asList(paths);
    }

    @Test
    public void joinAllKeepsLimitButJoinsEveryNonDisjunctivePart() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(2);
        List<DisjunctiveState<Path, IntervalStore>> states = new ArrayList<>();
        states.add(domain.singleton(a, i(0)));
        states.add(domain.singleton(b, i(1)));
        states.add(domain.singleton(c, i(2)));

        DisjunctiveState<Path, IntervalStore> joined = domain.joinAll(states, null);
        assertEquals(list(a, b), joined.getDisjuncts());
        assertEquals(Interval.of(0, 2), joined.getNonDisjunct().get("i"));
    }

    @Test
    public void joinAllTakesDisjunctsRoundRobin() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(3);
        Path a2 = Path.normal("a2");
        Path b2 = Path.normal("b2");
        List<DisjunctiveState<Path, IntervalStore>> states = new ArrayList<>();
        states.add(domain.state(list(a, a2), i(0)));
        states.add(domain.state(list(b, b2), i(0)));

        assertEquals(list(a, b, a2), domain.joinAll(states, null).getDisjuncts());
    }

    @Test
    public void joinAllAppendsAfterIntoAndSkipsDuplicates() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(5);
        DisjunctiveState<Path, IntervalStore> into = domain.singleton(a, i(0));
        List<DisjunctiveState<Path, IntervalStore>> states = new ArrayList<>();
        states.add(domain.state(list(a, b), i(1)));
        states.add(domain.singleton(b, i(2)));

        DisjunctiveState<Path, IntervalStore> joined = domain.joinAll(states, into);
        assertEquals(list(a, b), joined.getDisjuncts());
        assertEquals(Interval.of(0, 2), joined.getNonDisjunct().get("i"));
    }

    @Test
    public void joinAllOfNothing() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(5);
        DisjunctiveState<Path, IntervalStore> single = domain.singleton(a, i(0));
        List<DisjunctiveState<Path, IntervalStore>> none = Collections.emptyList();
        assertNull(domain.joinAll(none, null));
        assertSame(single, domain.joinAll(none, single));
        assertSame(single, domain.joinAll(Collections.singletonList(single), null));
    }

    @Test
    public void joinKeepsLeftDisjunctsFirst() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(3);
        DisjunctiveState<Path, IntervalStore> lhs = domain.state(list(a, b), i(0));
        DisjunctiveState<Path, IntervalStore> rhs = domain.state(list(b, c, d), i(1));

        DisjunctiveState<Path, IntervalStore> joined = lhs.leastUpperBound(rhs);
        assertEquals(list(a, b, c), joined.getDisjuncts());
        assertEquals(Interval.of(0, 1), joined.getNonDisjunct().get("i"));
    }

    @Test
    public void joinCapsOverfullLeftSideToOldest() {
        assertEquals(list(a, b), DisjunctiveDomain.joinUpTo(2, list(a, b, c), list(d)));
        assertEquals(list(a, b), DisjunctiveDomain.joinUpTo(2, list(a, b), list(c)));
    }

    @Test
    public void incomingDisjunctsAreCheckedAgainstOriginalLeftOnly() {
        assertEquals(list(a, c, c), DisjunctiveDomain.joinUpTo(5, list(a), list(a, c, c)));
    }

    @Test
    public void joinIsAboveLeftOperand() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(3);
        List<DisjunctiveState<Path, IntervalStore>> states = new ArrayList<>();
        states.add(domain.bottom());
        states.add(domain.singleton(a, i(0)));
        states.add(domain.state(list(b, c), i(4)));
        states.add(domain.state(list(a, b, c), i(1)));
        for (DisjunctiveState<Path, IntervalStore> lhs : states) {
            for (DisjunctiveState<Path, IntervalStore> rhs : states) {
                DisjunctiveState<Path, IntervalStore> joined = lhs.leastUpperBound(rhs);
                assertTrue(lhs + " <= " + joined, lhs.isLessOrEqual(joined));
                assertTrue(joined.size() <= 3);
            }
        }
    }

    @Test
    public void leqIsOrderedSubsequence() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(5);
        DisjunctiveState<Path, IntervalStore> all =
                domain.state(list(a, b, c), IntervalStore.top());

        assertTrue(all.isLessOrEqual(all));
        assertTrue(domain.state(list(a, c), i(0)).isLessOrEqual(all));
        assertFalse(domain.state(list(c, a), i(0)).isLessOrEqual(all));
        assertFalse(
                domain.state(list(a), IntervalStore.top())
                        .isLessOrEqual(domain.singleton(a, i(0))));
        // structurally equal but distinct disjuncts are not recognized
        assertFalse(domain.singleton(Path.normal("a"), i(0)).isLessOrEqual(all));
    }

    @Test
    public void widenFreezesPastIterationLimit() {
        DisjunctiveDomain<Path, IntervalStore> domain =
                new DisjunctiveDomain<>(
                        DisjunctiveConfig.builder().widenIterations(2).build(), Path.STORES);
        DisjunctiveState<Path, IntervalStore> prev = domain.singleton(a, i(0));
        DisjunctiveState<Path, IntervalStore> next = domain.state(list(a, b), i(1));

        assertSame(prev, prev.widenedUpperBound(prev, 1));
        assertSame(prev, prev.widenedUpperBound(next, 3));
        DisjunctiveState<Path, IntervalStore> widened = prev.widenedUpperBound(next, 2);
        assertEquals(list(a, b), widened.getDisjuncts());
        assertEquals(
                Interval.of(0, Interval.PLUS_INFINITY), widened.getNonDisjunct().get("i"));
    }

    @Test
    public void widenDropsSubsumedDisjuncts() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(5);
        Path star = Path.normal("*");
        DisjunctiveState<Path, IntervalStore> prev = domain.singleton(star, i(0));
        DisjunctiveState<Path, IntervalStore> next = domain.state(list(a, b), i(0));

        assertSame(prev, prev.widenedUpperBound(next, 1));
    }

    @Test
    public void disjunctCountNeverExceedsLimit() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(4);
        DisjunctiveState<Path, IntervalStore> state = domain.bottom();
        for (int n = 0; n < 20; n++) {
            DisjunctiveState<Path, IntervalStore> incoming =
                    domain.state(list(Path.normal("p" + n), Path.normal("q" + n)), i(n));
            state =
                    n % 2 == 0
                            ? state.leastUpperBound(incoming)
                            : state.widenedUpperBound(incoming, n);
            assertTrue(state.size() <= 4);
        }
    }

    @Test
    public void filtersByKind() {
        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(5);
        Path thrown = new Path("t", Path.Kind.EXCEPTIONAL);
        DisjunctiveState<Path, IntervalStore> mixed = domain.state(list(a, thrown), i(3));

        assertEquals(list(a), domain.filterNormal(mixed).getDisjuncts());
        assertEquals(list(thrown), domain.filterExceptional(mixed).getDisjuncts());

        DisjunctiveState<Path, IntervalStore> normalOnly = domain.singleton(a, i(3));
        DisjunctiveState<Path, IntervalStore> noExceptions = domain.filterExceptional(normalOnly);
        assertTrue(noExceptions.getDisjuncts().isEmpty());
        assertTrue(noExceptions.getNonDisjunct().isBottom());

        DisjunctiveState<Path, IntervalStore> empty = domain.state(list(), i(3));
        assertSame(empty, domain.filterExceptional(empty));

        DisjunctiveState<Path, IntervalStore> caught = domain.transformOnExceptionalEdge(mixed);
        assertEquals(1, caught.size());
        assertEquals("t!", caught.getDisjuncts().get(0).name);
        assertTrue(caught.getDisjuncts().get(0).isNormal());
        assertEquals(i(3), caught.getNonDisjunct());
    }

    @Test
    public void parsesConfiguration() {
        Map<String, String> options = new HashMap<>();
        options.put("disjunctLimit", "7");
        options.put("bottomWhenExhausted", "TRUE");
        DisjunctiveConfig config = DisjunctiveConfig.fromOptions(options);
        assertEquals(7, config.getDisjunctLimit());
        assertEquals(DisjunctiveConfig.DEFAULT_WIDEN_ITERATIONS, config.getWidenIterations());
        assertTrue(config.isBottomWhenExhausted());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsZeroDisjunctLimit() {
        DisjunctiveConfig.builder().disjunctLimit(0);
    }
}

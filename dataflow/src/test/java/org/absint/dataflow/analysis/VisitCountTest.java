package org.absint.dataflow.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class VisitCountTest {

    @Test
    public void countsUpToMaximum() {
        VisitCount count = VisitCount.first();
        assertEquals(1, count.intValue());
        count = count.next(3).next(3);
        assertEquals(3, count.intValue());
        assertTrue(VisitCount.first().compareTo(count) < 0);
    }

    @Test
    public void exceedingMaximumIsDivergence() {
        VisitCount count = VisitCount.first().next(2);
        try {
            count.next(2);
            fail("expected DivergenceException");
        } catch (DivergenceException e) {
            assertEquals(2, e.getMaxWidens());
            assertTrue(e.getMessage().contains("threshold 2"));
        }
    }
}

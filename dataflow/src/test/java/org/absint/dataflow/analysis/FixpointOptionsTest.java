package org.absint.dataflow.analysis;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashMap;
import java.util.Map;
import org.junit.Test;

public class FixpointOptionsTest {

    @Test
    public void defaults() {
        FixpointOptions options = FixpointOptions.defaults();
        assertEquals(FixpointOptions.DEFAULT_MAX_WIDENS, options.getMaxWidens());
        assertEquals(FixpointOptions.DEFAULT_MAX_NARROWS, options.getMaxNarrows());
        assertEquals(0, options.getTimeoutMillis());
        assertSame(CancellationCheck.NONE, options.newCancellationCheck());
    }

    @Test
    public void parsesKnownKeysAndIgnoresOthers() {
        Map<String, String> map = new HashMap<>();
        map.put("maxWidens", "50");
        map.put("maxNarrows", " 2 ");
        map.put("timeoutMillis", "1000");
        map.put("disjunctLimit", "4");
        FixpointOptions options = FixpointOptions.fromOptions(map);
        assertEquals(50, options.getMaxWidens());
        assertEquals(2, options.getMaxNarrows());
        assertEquals(1000, options.getTimeoutMillis());
        assertTrue(options.newCancellationCheck() instanceof Deadline);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsMalformedNumber() {
        Map<String, String> map = new HashMap<>();
        map.put("maxWidens", "many");
        FixpointOptions.fromOptions(map);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNonPositiveMaxWidens() {
        FixpointOptions.builder().maxWidens(0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectsNegativeTimeout() {
        Map<String, String> map = new HashMap<>();
        map.put("timeoutMillis", "-1");
        FixpointOptions.fromOptions(map);
    }
}

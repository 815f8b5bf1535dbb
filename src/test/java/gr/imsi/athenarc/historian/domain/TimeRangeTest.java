package gr.imsi.athenarc.historian.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class TimeRangeTest {

    @Test
    public void testHalfOpen() {
        TimeRange range = new TimeRange(100, 200);
        assertTrue(range.contains(100));
        assertTrue(range.contains(199));
        assertFalse(range.contains(200));
        assertEquals(100, range.length());
    }

    @Test
    public void testRejectsEmptyRange() {
        assertThrows(IllegalArgumentException.class, () -> new TimeRange(200, 200));
        assertThrows(IllegalArgumentException.class, () -> new TimeRange(300, 200));
    }
}

package com.stationpath.gtfs.loader;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class TimeFieldTest {

    @Test
    public void testParseTimes () {
        assertEquals(0, TimeField.getSeconds("00:00:00"));
        assertEquals(8 * 3600 + 5 * 60 + 30, TimeField.getSeconds("08:05:30"));
        assertEquals(8 * 3600 + 5 * 60 + 30, TimeField.getSeconds("8:05:30"));
        assertEquals(8 * 3600 + 5 * 60 + 30, TimeField.getSeconds(" 8:05:30 "));
        // Trips continuing past midnight.
        assertEquals(91800, TimeField.getSeconds("25:30:00"));
    }

    @Test
    public void testInvalidTimes () {
        assertNull(TimeField.getSeconds(null));
        assertNull(TimeField.getSeconds(""));
        assertNull(TimeField.getSeconds("08:05"));
        assertNull(TimeField.getSeconds("08:65:00"));
        assertNull(TimeField.getSeconds("08:05:60"));
        assertNull(TimeField.getSeconds("ab:cd:ef"));
        assertNull(TimeField.getSeconds("-1:00:00"));
        // Hours this large would overflow an int when converted to seconds.
        assertNull(TimeField.getSeconds("48:00:00"));
        assertNull(TimeField.getSeconds("600000:00:00"));
        assertNull(TimeField.getSeconds("2147483647:59:59"));
        assertEquals(47 * 3600 + 59 * 60 + 59, TimeField.getSeconds("47:59:59"));
    }

}

package com.stationpath.gtfs.loader;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DateFieldTest {

    @Test
    public void testNormalize () {
        assertEquals("2024-01-31", DateField.normalize("20240131"));
        assertEquals("2024-02-29", DateField.normalize(" 20240229 "));
        assertNull(DateField.normalize("20230229"));
        assertNull(DateField.normalize("2024-01-31"));
        assertNull(DateField.normalize(""));
        assertNull(DateField.normalize(null));
    }

    /** Days past the end of the month are invalid rather than moved back to its last day. */
    @Test
    public void testImpossibleDates () {
        assertNull(DateField.normalize("20230230"));
        assertNull(DateField.normalize("20231131"));
        assertNull(DateField.normalize("20241301"));
        assertNull(DateField.normalize("20240100"));
        assertEquals("2023-11-30", DateField.normalize("20231130"));
    }

    @Test
    public void testDateColumns () {
        assertTrue(DateField.isDateColumn("date"));
        assertTrue(DateField.isDateColumn("start_date"));
        assertTrue(DateField.isDateColumn("END_DATE"));
        assertFalse(DateField.isDateColumn("service_id"));
        assertFalse(DateField.isDateColumn("arrival_time"));
    }

}

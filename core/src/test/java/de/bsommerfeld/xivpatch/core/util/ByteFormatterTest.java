package de.bsommerfeld.xivpatch.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ByteFormatterTest {

    @Test
    void format_shouldReturnBytesForSmallValues() {
        assertEquals("0 B", ByteFormatter.format(0));
        assertEquals("1023 B", ByteFormatter.format(1023));
    }

    @Test
    void format_shouldScaleToLargestFittingUnit() {
        assertTrue(ByteFormatter.format(1024).endsWith("KB"));
        assertTrue(ByteFormatter.format(1024L * 1024).endsWith("MB"));
        assertTrue(ByteFormatter.format(1024L * 1024 * 1024).endsWith("GB"));
        assertTrue(ByteFormatter.format(1024L * 1024 * 1024 * 1024).endsWith("TB"));
    }

    @Test
    void format_shouldKeepOneDecimalRegardlessOfLocale() {
        String result = ByteFormatter.format(1536);
        String numeric = result.replace(" KB", "").replace(",", ".");
        assertEquals(1.5, Double.parseDouble(numeric), 0.01);
    }

    @Test
    void format_shouldHandleNegativeValues() {
        assertEquals("? B", ByteFormatter.format(-1));
    }

    @Test
    void formatRate_shouldAppendPerSecond() {
        assertEquals("512 B/s", ByteFormatter.formatRate(512));
    }

    @Test
    void formatDuration_shouldPickCoarsestUnits() {
        assertEquals("42s", ByteFormatter.formatDuration(42));
        assertEquals("3m 5s", ByteFormatter.formatDuration(185));
        assertEquals("2h 10m", ByteFormatter.formatDuration(7800));
        assertEquals("?", ByteFormatter.formatDuration(-1));
    }
}

package com.linecalc.app.evaluators;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class DateTimeSupportTest {

    private static final ZoneId UTC = ZoneId.of("UTC");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-06-15T12:00:00Z"), UTC);

    /**
     * A formatted timestamp parses back to the same instant.
     */
    @Test
    void testFormatParsesBack() {
        ZonedDateTime time = ZonedDateTime.of(2025, 12, 17, 16, 0, 0, 0, ZoneId.of("America/New_York"));
        String text = DateTimeSupport.format(time);
        assertEquals("2025-12-17 16:00 EST", text);
        ZonedDateTime parsed = DateTimeSupport.parseDateTime(text, UTC, CLOCK).orElseThrow();
        assertEquals(time.toInstant(), parsed.toInstant());
    }

    @Test
    void testParseVariants() {
        assertEquals(LocalDate.of(2025, 3, 11),
                DateTimeSupport.parseDateTime("3/11/2025", UTC, CLOCK).orElseThrow().toLocalDate());
        assertEquals(LocalDate.of(2025, 12, 6),
                DateTimeSupport.parseDateTime("Dec 6, 2025", UTC, CLOCK).orElseThrow().toLocalDate());
        assertEquals(LocalDate.of(2025, 12, 6), DateTimeSupport.parseDate("dec 6", UTC, CLOCK).orElseThrow());
        assertTrue(DateTimeSupport.parseDateTime("not a date", UTC, CLOCK).isEmpty());
    }

    @Test
    void testTimeOfDayUsesToday() {
        ZonedDateTime t = DateTimeSupport.parseDateTime("6:30 pm", UTC, CLOCK).orElseThrow();
        assertEquals(LocalDate.of(2025, 6, 15), t.toLocalDate());
        assertEquals(18, t.getHour());
        assertEquals(30, t.getMinute());
    }

    @Test
    void testFormatDuration() {
        assertEquals("2 days 3.5 hours", DateTimeSupport.formatDuration(Duration.ofMinutes(51 * 60 + 30)));
        assertEquals("3 days", DateTimeSupport.formatDuration(Duration.ofDays(3)));
        assertEquals("5.5 hours", DateTimeSupport.formatDuration(Duration.ofMinutes(330)));
        assertEquals("45 minutes", DateTimeSupport.formatDuration(Duration.ofMinutes(45)));
        assertEquals("30 seconds", DateTimeSupport.formatDuration(Duration.ofSeconds(30)));
    }

    @Test
    void testUnits() {
        assertEquals(3600, DateTimeSupport.unitSeconds("Hours"));
        assertTrue(DateTimeSupport.isUnit("wks"));
        assertFalse(DateTimeSupport.isUnit("parsecs"));
        assertEquals(2.0, DateTimeSupport.convert(Duration.ofHours(48), "days"), 1e-9);
    }

    @Test
    void testTimezoneDirectory() {
        assertEquals(ZoneId.of("Asia/Tokyo"), TimezoneDirectory.lookup("Tokyo").orElseThrow());
        assertEquals(ZoneId.of("America/Los_Angeles"), TimezoneDirectory.lookup("PST").orElseThrow());
        assertEquals(ZoneId.of("Europe/Paris"), TimezoneDirectory.lookup("Europe/Paris").orElseThrow());
        assertTrue(TimezoneDirectory.lookup("atlantis").isEmpty());
        assertTrue(TimezoneDirectory.lookup("Mars/Olympus").isEmpty());
    }
}

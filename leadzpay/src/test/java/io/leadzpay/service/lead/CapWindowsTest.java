package io.leadzpay.service.lead;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class CapWindowsTest {

    private static CapWindows at(String instant, ZoneId zone) {
        return new CapWindows(Clock.fixed(Instant.parse(instant), ZoneOffset.UTC), zone);
    }

    @Test
    void testMidweek() {
        CapWindows windows = at("2025-06-11T10:00:00Z", ZoneOffset.UTC);

        assertEquals(Instant.parse("2025-06-09T00:00:00Z"), windows.weekStart());
        assertEquals(Instant.parse("2025-06-01T00:00:00Z"), windows.monthStart());
    }

    @Test
    void testSundayBelongsToPreviousMonday() {
        CapWindows windows = at("2025-06-15T23:59:59Z", ZoneOffset.UTC);

        assertEquals(Instant.parse("2025-06-09T00:00:00Z"), windows.weekStart());
    }

    @Test
    void testMondayMidnightStartsNewWeek() {
        CapWindows windows = at("2025-06-16T00:00:00Z", ZoneOffset.UTC);

        assertEquals(Instant.parse("2025-06-16T00:00:00Z"), windows.weekStart());
    }

    @Test
    void testWeekSpanningMonths() {
        // Tuesday 1 July: week started Monday 30 June, month started today
        CapWindows windows = at("2025-07-01T08:00:00Z", ZoneOffset.UTC);

        assertEquals(Instant.parse("2025-06-30T00:00:00Z"), windows.weekStart());
        assertEquals(Instant.parse("2025-07-01T00:00:00Z"), windows.monthStart());
    }

    @Test
    void testReferenceZoneShiftsBoundaries() {
        ZoneId newYork = ZoneId.of("America/New_York");

        // 02:00 UTC Monday is still Sunday evening in New York
        CapWindows windows = at("2025-06-16T02:00:00Z", newYork);
        assertEquals(Instant.parse("2025-06-09T04:00:00Z"), windows.weekStart());

        CapWindows monthEnd = at("2025-07-01T02:00:00Z", newYork);
        assertEquals(Instant.parse("2025-06-01T04:00:00Z"), monthEnd.monthStart());
    }

    @Test
    void testNowFollowsClock() {
        assertEquals(Instant.parse("2025-06-11T10:00:00Z"), at("2025-06-11T10:00:00Z", ZoneOffset.UTC).now());
    }
}

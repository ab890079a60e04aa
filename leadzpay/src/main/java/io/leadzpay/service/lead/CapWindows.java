package io.leadzpay.service.lead;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;

/**
 * Cap Windows - weekly and monthly counting boundaries for lead caps.
 *
 * Week: Monday 00:00 to the following Monday 00:00 in the reference zone.
 * Month: the 1st 00:00 to the next 1st 00:00 in the reference zone.
 * Boundaries are recomputed from the clock on every call; nothing is reset by a job.
 */
public final class CapWindows {

    private final Clock clock;
    private final ZoneId zone;

    public CapWindows(Clock clock, ZoneId zone) {
        this.clock = clock;
        this.zone = zone;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Start of the current week (Monday 00:00).
     */
    public Instant weekStart() {
        return weekStart(today());
    }

    /**
     * Start of the current month (1st 00:00).
     */
    public Instant monthStart() {
        return monthStart(today());
    }

    public Instant weekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)).atStartOfDay(zone).toInstant();
    }

    public Instant monthStart(LocalDate date) {
        return date.withDayOfMonth(1).atStartOfDay(zone).toInstant();
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(zone));
    }
}

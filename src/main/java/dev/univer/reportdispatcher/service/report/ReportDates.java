package dev.univer.reportdispatcher.service.report;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/** Inclusive date filters as half-open instant bounds. */
final class ReportDates {

    private ReportDates() {
    }

    static Instant startOf(LocalDate date, ZoneId zone) {
        return date.atStartOfDay(zone).toInstant();
    }

    static Instant endOf(LocalDate date, ZoneId zone) {
        return date.plusDays(1).atStartOfDay(zone).toInstant();
    }
}

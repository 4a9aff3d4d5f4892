package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.model.ReportSchedule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;

/**
 * Computes when a schedule fires next. No I/O; the result is always strictly after {@code now}.
 *
 * <p>Monthly schedules anchored past the end of a short month fire on that month's last day
 * (31 -> 30 April, 29 February in leap years, 28 otherwise).
 */
@Component
@RequiredArgsConstructor
public class NextRunCalculator {
    private final ReportSchedulerProperties props;

    public Instant nextRun(ReportSchedule schedule, Instant now) {
        ScheduleCadence cadence = ScheduleCadence.of(schedule, props.defaultZone());
        return nextRun(cadence, now.atZone(cadence.getZone())).toInstant();
    }

    public static ZonedDateTime nextRun(ScheduleCadence cadence, ZonedDateTime now) {
        LocalDate today = now.toLocalDate();
        ZonedDateTime candidate = at(cadence, today);

        switch (cadence.getFrequency()) {
            case DAILY:
                if (!candidate.isAfter(now)) {
                    candidate = at(cadence, today.plusDays(1));
                }
                return candidate;

            case WEEKLY: {
                LocalDate date = today.with(TemporalAdjusters.nextOrSame(cadence.weekDay()));
                candidate = at(cadence, date);
                if (!candidate.isAfter(now)) {
                    candidate = at(cadence, date.plusDays(7));
                }
                return candidate;
            }

            case MONTHLY:
            default: {
                candidate = at(cadence, clampedDay(today, cadence.getDayOfMonth()));
                if (!candidate.isAfter(now)) {
                    candidate = at(cadence, clampedDay(today.withDayOfMonth(1).plusMonths(1), cadence.getDayOfMonth()));
                }
                return candidate;
            }
        }
    }

    /** {@code dayOfMonth} in the month of {@code anyDayInMonth}, limited to the month's length. */
    public static LocalDate clampedDay(LocalDate anyDayInMonth, int dayOfMonth) {
        return anyDayInMonth.withDayOfMonth(Math.min(dayOfMonth, anyDayInMonth.lengthOfMonth()));
    }

    private static ZonedDateTime at(ScheduleCadence cadence, LocalDate date) {
        return ZonedDateTime.of(date, cadence.getTimeOfDay(), cadence.getZone());
    }
}

package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.exception.InvalidScheduleException;
import dev.univer.reportdispatcher.model.ReportSchedule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NextRunCalculatorTest {

    private final NextRunCalculator calculator = new NextRunCalculator(new ReportSchedulerProperties());

    static ReportSchedule schedule(String frequency, String time, Integer dayOfWeek, Integer dayOfMonth) {
        return ReportSchedule.builder()
                .id("r-1")
                .tenantId("acme")
                .name("Report")
                .reportType("orders")
                .frequency(frequency)
                .timeOfDay(time)
                .dayOfWeek(dayOfWeek)
                .dayOfMonth(dayOfMonth)
                .active(true)
                .build();
    }

    private static Instant utc(String localDateTime) {
        return Instant.parse(localDateTime + "Z");
    }

    @Test
    void dailyLaterToday() {
        ReportSchedule s = schedule("daily", "09:00", null, null);
        assertEquals(utc("2024-03-10T09:00:00"), calculator.nextRun(s, utc("2024-03-10T08:00:00")));
    }

    @Test
    void dailyAlreadyPassedMovesToTomorrow() {
        ReportSchedule s = schedule("daily", "09:00", null, null);
        assertEquals(utc("2024-03-11T09:00:00"), calculator.nextRun(s, utc("2024-03-10T09:30:00")));
    }

    @Test
    void dailyExactlyAtTriggerTimeMovesToTomorrow() {
        ReportSchedule s = schedule("daily", "09:00", null, null);
        assertEquals(utc("2024-03-11T09:00:00"), calculator.nextRun(s, utc("2024-03-10T09:00:00")));
    }

    @Test
    void weeklyFromSundayToMonday() {
        ReportSchedule s = schedule("weekly", "07:30", 1, null);
        assertEquals(utc("2024-03-11T07:30:00"), calculator.nextRun(s, utc("2024-03-10T12:00:00")));
    }

    @Test
    void weeklySameDayBeforeAndAfterTriggerTime() {
        ReportSchedule monday = schedule("weekly", "07:30", 1, null);
        assertEquals(utc("2024-03-11T07:30:00"), calculator.nextRun(monday, utc("2024-03-11T07:00:00")));
        assertEquals(utc("2024-03-18T07:30:00"), calculator.nextRun(monday, utc("2024-03-11T07:30:00")));
    }

    @Test
    void weeklyDefaultsToMonday() {
        ReportSchedule s = schedule("weekly", "10:00", null, null);
        assertEquals(utc("2024-03-11T10:00:00"), calculator.nextRun(s, utc("2024-03-09T10:00:00")));
    }

    @Test
    void weeklySundayIsZero() {
        ReportSchedule s = schedule("weekly", "18:00", 0, null);
        assertEquals(utc("2024-03-17T18:00:00"), calculator.nextRun(s, utc("2024-03-11T08:00:00")));
    }

    @Test
    void monthlyPassedMovesToNextMonth() {
        ReportSchedule s = schedule("monthly", "00:00", null, 1);
        assertEquals(utc("2024-04-01T00:00:00"), calculator.nextRun(s, utc("2024-03-15T00:00:00")));
    }

    @Test
    void monthlyLaterThisMonth() {
        ReportSchedule s = schedule("monthly", "06:00", null, 20);
        assertEquals(utc("2024-03-20T06:00:00"), calculator.nextRun(s, utc("2024-03-15T00:00:00")));
    }

    @Test
    void monthlyClampsToLastDayOfShortMonths() {
        ReportSchedule s = schedule("monthly", "12:00", null, 31);
        assertEquals(utc("2024-04-30T12:00:00"), calculator.nextRun(s, utc("2024-04-02T00:00:00")));
        assertEquals(utc("2024-02-29T12:00:00"), calculator.nextRun(s, utc("2024-02-10T00:00:00")));
        assertEquals(utc("2025-02-28T12:00:00"), calculator.nextRun(s, utc("2025-02-10T00:00:00")));
    }

    @Test
    void monthlyClampAppliesToTheFollowingMonthToo() {
        ReportSchedule s = schedule("monthly", "12:00", null, 31);
        assertEquals(utc("2024-04-30T12:00:00"), calculator.nextRun(s, utc("2024-03-31T13:00:00")));
        assertEquals(utc("2024-05-31T12:00:00"), calculator.nextRun(s, utc("2024-04-30T12:00:00")));
    }

    @Test
    void wallClockIsReadInTheScheduleZone() {
        ReportSchedule s = schedule("daily", "09:00", null, null);
        s.setZoneId("Europe/Warsaw");
        Instant next = calculator.nextRun(s, utc("2024-03-10T07:00:00"));
        assertEquals(ZonedDateTime.of(2024, 3, 10, 9, 0, 0, 0, ZoneId.of("Europe/Warsaw")).toInstant(), next);
        assertEquals(utc("2024-03-10T08:00:00"), next);
    }

    @Test
    void sameInputSameOutput() {
        ReportSchedule s = schedule("weekly", "07:30", 4, null);
        Instant now = utc("2024-06-01T17:45:12");
        assertEquals(calculator.nextRun(s, now), calculator.nextRun(s, now));
    }

    @Test
    void resultIsAlwaysInTheFuture() {
        ReportSchedule[] schedules = {
                schedule("daily", "00:00", null, null),
                schedule("daily", "23:59", null, null),
                schedule("weekly", "12:30", 0, null),
                schedule("weekly", "06:15", 6, null),
                schedule("monthly", "08:00", null, 1),
                schedule("monthly", "08:00", null, 29),
                schedule("monthly", "23:59", null, 31),
        };
        Instant now = utc("2023-12-25T00:00:00");
        // every 7 hours 13 minutes across a bit more than a year
        for (int i = 0; i < 1300; i++) {
            for (ReportSchedule s : schedules) {
                Instant next = calculator.nextRun(s, now);
                assertTrue(next.isAfter(now), () -> s.getFrequency() + " " + s.getTimeOfDay() + " at " + next);
            }
            now = now.plusSeconds(7 * 3600 + 13 * 60 + 7);
        }
    }

    @Test
    void unknownFrequencyIsRejected() {
        ReportSchedule s = schedule("hourly", "09:00", null, null);
        InvalidScheduleException e = assertThrows(InvalidScheduleException.class,
                () -> calculator.nextRun(s, utc("2024-03-10T08:00:00")));
        assertEquals("r-1", e.getScheduleId());
    }

    @Test
    void missingFrequencyIsRejected() {
        ReportSchedule s = schedule(null, "09:00", null, null);
        assertThrows(InvalidScheduleException.class, () -> calculator.nextRun(s, utc("2024-03-10T08:00:00")));
    }

    @Test
    void malformedCadenceFieldsAreRejected() {
        Instant now = utc("2024-03-10T08:00:00");
        assertThrows(InvalidScheduleException.class, () -> calculator.nextRun(schedule("daily", "25:00", null, null), now));
        assertThrows(InvalidScheduleException.class, () -> calculator.nextRun(schedule("daily", null, null, null), now));
        assertThrows(InvalidScheduleException.class, () -> calculator.nextRun(schedule("weekly", "09:00", 7, null), now));
        assertThrows(InvalidScheduleException.class, () -> calculator.nextRun(schedule("monthly", "09:00", null, 0), now));
        assertThrows(InvalidScheduleException.class, () -> calculator.nextRun(schedule("monthly", "09:00", null, 32), now));

        ReportSchedule badZone = schedule("daily", "09:00", null, null);
        badZone.setZoneId("Nowhere/City");
        assertThrows(InvalidScheduleException.class, () -> calculator.nextRun(badZone, now));
    }

    @Test
    void frequencyIsCaseInsensitive() {
        ReportSchedule s = schedule("DAILY", "09:00", null, null);
        assertEquals(utc("2024-03-10T09:00:00"), calculator.nextRun(s, utc("2024-03-10T08:00:00")));
    }

    @Test
    void dailyTimeInsideSpringForwardGapRunsAfterTheGap() {
        ReportSchedule s = schedule("daily", "02:30", null, null);
        s.setZoneId("Europe/Warsaw");
        // 02:30 does not exist on 2024-03-31 in Warsaw, 03:30 CEST is used
        assertEquals(utc("2024-03-31T01:30:00"), calculator.nextRun(s, utc("2024-03-31T00:00:00")));
        assertEquals(utc("2024-04-01T00:30:00"), calculator.nextRun(s, utc("2024-03-31T01:30:00")));
    }

    @Test
    void dailyTimeInsideFallBackOverlapRunsOnce() {
        ReportSchedule s = schedule("daily", "02:30", null, null);
        s.setZoneId("Europe/Warsaw");
        assertEquals(utc("2024-10-27T00:30:00"), calculator.nextRun(s, utc("2024-10-26T22:00:00")));
        assertEquals(utc("2024-10-28T01:30:00"), calculator.nextRun(s, utc("2024-10-27T00:30:00")));
    }
}

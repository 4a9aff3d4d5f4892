package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.exception.InvalidScheduleException;
import dev.univer.reportdispatcher.model.ReportSchedule;
import dev.univer.reportdispatcher.model.ScheduleFrequency;
import dev.univer.reportdispatcher.util.ScheduleParseUtil;
import lombok.Value;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Validated cadence fields of a {@link ReportSchedule}, with the defaults applied
 * (weekly on Monday, monthly on the 1st).
 */
@Value
public class ScheduleCadence {
    public static final int DEFAULT_DAY_OF_WEEK = 1;
    public static final int DEFAULT_DAY_OF_MONTH = 1;

    ScheduleFrequency frequency;
    LocalTime timeOfDay;
    int dayOfWeek;  // Sunday = 0
    int dayOfMonth;
    ZoneId zone;

    public static ScheduleCadence of(ReportSchedule s, ZoneId defaultZone) {
        String id = s.getId();
        ScheduleFrequency frequency = ScheduleFrequency.fromValue(s.getFrequency())
                .orElseThrow(() -> new InvalidScheduleException(id, "Unknown frequency: " + s.getFrequency()));

        LocalTime time = ScheduleParseUtil.parseTimeOfDay(s.getTimeOfDay());
        if (time == null) {
            throw new InvalidScheduleException(id, "Malformed time of day: " + s.getTimeOfDay());
        }

        int dow = s.getDayOfWeek() == null ? DEFAULT_DAY_OF_WEEK : s.getDayOfWeek();
        if (frequency == ScheduleFrequency.WEEKLY && (dow < 0 || dow > 6)) {
            throw new InvalidScheduleException(id, "Day of week out of range 0-6: " + dow);
        }

        int dom = s.getDayOfMonth() == null ? DEFAULT_DAY_OF_MONTH : s.getDayOfMonth();
        if (frequency == ScheduleFrequency.MONTHLY && (dom < 1 || dom > 31)) {
            throw new InvalidScheduleException(id, "Day of month out of range 1-31: " + dom);
        }

        ZoneId zone = ScheduleParseUtil.parseZone(s.getZoneId(), defaultZone);
        if (zone == null) {
            throw new InvalidScheduleException(id, "Unknown time zone: " + s.getZoneId());
        }
        return new ScheduleCadence(frequency, time, dow, dom, zone);
    }

    public DayOfWeek weekDay() {
        return ScheduleParseUtil.dayOfWeekFromIndex(dayOfWeek);
    }
}

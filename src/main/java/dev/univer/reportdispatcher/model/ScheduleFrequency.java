package dev.univer.reportdispatcher.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum ScheduleFrequency {
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String value;

    public static Optional<ScheduleFrequency> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        String norm = raw.trim().toLowerCase(Locale.ROOT);
        for (ScheduleFrequency f : values()) {
            if (f.value.equals(norm)) return Optional.of(f);
        }
        return Optional.empty();
    }

    /** First day of the period a report sent on {@code today} covers. */
    public LocalDate periodStart(LocalDate today) {
        switch (this) {
            case DAILY:
                return today.minusDays(1);
            case WEEKLY:
                return today.minusWeeks(1);
            default:
                return today.minusMonths(1);
        }
    }
}

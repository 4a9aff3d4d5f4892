package dev.univer.reportdispatcher.util;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ScheduleParseUtil {
    // "9:05", "09:05"
    private static final Pattern TIME_OF_DAY = Pattern.compile("^\\s*(?<hour>\\d{1,2}):(?<minute>\\d{2})\\s*$");

    private ScheduleParseUtil() {
    }

    /** Parses HH:MM into a time with zero seconds; null when malformed or out of range. */
    public static LocalTime parseTimeOfDay(String text) {
        if (text == null) return null;
        Matcher m = TIME_OF_DAY.matcher(text);
        if (!m.matches()) return null;
        int hour = Integer.parseInt(m.group("hour"));
        int minute = Integer.parseInt(m.group("minute"));
        if (hour > 23 || minute > 59) return null;
        return LocalTime.of(hour, minute);
    }

    /** Zone by id, {@code fallback} for blank input, null for an unknown id. */
    public static ZoneId parseZone(String zoneId, ZoneId fallback) {
        if (zoneId == null || zoneId.isBlank()) return fallback;
        try {
            return ZoneId.of(zoneId.trim());
        } catch (DateTimeException e) {
            return null;
        }
    }

    /** Sunday = 0 ... Saturday = 6, as stored on schedules and used by cron. */
    public static DayOfWeek dayOfWeekFromIndex(int index) {
        return index == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(index);
    }

    public static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public static String escapeHtml(String text) {
        if (text == null) return "";
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '&': sb.append("&amp;"); break;
                case '"': sb.append("&quot;"); break;
                case '\'': sb.append("&#39;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}

package dev.univer.reportdispatcher.exception;

import lombok.Getter;

/**
 * A schedule whose cadence cannot be turned into fire times: unknown frequency,
 * malformed time of day or zone, anchor day out of range, unparsable filters.
 */
@Getter
public class InvalidScheduleException extends RuntimeException {
    private final String scheduleId;

    public InvalidScheduleException(String scheduleId, String message) {
        super(message);
        this.scheduleId = scheduleId;
    }

    public InvalidScheduleException(String scheduleId, String message, Throwable cause) {
        super(message, cause);
        this.scheduleId = scheduleId;
    }
}

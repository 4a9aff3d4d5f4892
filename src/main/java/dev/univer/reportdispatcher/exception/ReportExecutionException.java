package dev.univer.reportdispatcher.exception;

import lombok.Getter;

/**
 * Failure of one report run. Always handled inside the executor, never rethrown to the trigger.
 */
@Getter
public class ReportExecutionException extends RuntimeException {

    public enum Step { LOAD_SCHEDULE, GENERATE, FORMAT, RESOLVE_TENANT, NOTIFY, PERSIST }

    private final String scheduleId;
    private final Step step;

    public ReportExecutionException(String scheduleId, Step step, String message) {
        super(message);
        this.scheduleId = scheduleId;
        this.step = step;
    }

    public ReportExecutionException(String scheduleId, Step step, String message, Throwable cause) {
        super(message, cause);
        this.scheduleId = scheduleId;
        this.step = step;
    }
}

package dev.univer.reportdispatcher.service;

import lombok.Getter;
import org.springframework.lang.Nullable;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Trigger of one report schedule. Fire times come from {@link NextRunCalculator}, so a
 * wall-clock time skipped by a DST change fires after the gap and a repeated one fires once.
 * The cron expression only describes the cadence.
 */
@Getter
public class ReportTrigger implements Trigger {
    // five fields: minute hour day-of-month month day-of-week
    private final String cronExpression;
    private final ScheduleCadence cadence;

    ReportTrigger(String cronExpression, ScheduleCadence cadence) {
        this.cronExpression = cronExpression;
        this.cadence = cadence;
    }

    public ZoneId getZone() {
        return cadence.getZone();
    }

    @Override
    @Nullable
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant base = triggerContext.getClock().instant();
        Instant lastScheduled = triggerContext.lastScheduledExecution();
        if (lastScheduled != null && lastScheduled.isAfter(base)) {
            base = lastScheduled;
        }
        return nextFireAfter(base);
    }

    /** First fire time strictly after {@code after}. */
    public Instant nextFireAfter(Instant after) {
        return NextRunCalculator.nextRun(cadence, after.atZone(cadence.getZone())).toInstant();
    }

    @Override
    public String toString() {
        return cronExpression + " [" + cadence.getZone() + "]";
    }
}

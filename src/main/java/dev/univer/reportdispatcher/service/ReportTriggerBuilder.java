package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.model.ReportSchedule;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Turns a schedule's cadence into a {@link ReportTrigger}: daily {@code m h * * *},
 * weekly {@code m h * * d}, monthly {@code m h D * *}.
 */
@Component
@RequiredArgsConstructor
public class ReportTriggerBuilder {
    private final ReportSchedulerProperties props;

    public ReportTrigger build(ReportSchedule schedule) {
        return build(ScheduleCadence.of(schedule, props.defaultZone()));
    }

    public ReportTrigger build(ScheduleCadence cadence) {
        int minute = cadence.getTimeOfDay().getMinute();
        int hour = cadence.getTimeOfDay().getHour();

        switch (cadence.getFrequency()) {
            case DAILY:
                return new ReportTrigger(minute + " " + hour + " * * *", cadence);

            case WEEKLY:
                return new ReportTrigger(minute + " " + hour + " * * " + cadence.getDayOfWeek(), cadence);

            case MONTHLY:
            default:
                // anchors past a month's end fire on its last day
                return new ReportTrigger(minute + " " + hour + " " + cadence.getDayOfMonth() + " * *", cadence);
        }
    }
}

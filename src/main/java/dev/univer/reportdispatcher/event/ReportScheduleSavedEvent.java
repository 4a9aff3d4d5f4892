package dev.univer.reportdispatcher.event;

import dev.univer.reportdispatcher.model.ReportSchedule;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** Published after a schedule is created or edited; its trigger is (re)armed or, if inactive, removed. */
@Getter
@RequiredArgsConstructor
public class ReportScheduleSavedEvent {
    private final ReportSchedule schedule;
}

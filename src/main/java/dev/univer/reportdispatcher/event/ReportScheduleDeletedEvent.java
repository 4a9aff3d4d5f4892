package dev.univer.reportdispatcher.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public class ReportScheduleDeletedEvent {
    private final String scheduleId;
}

package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class TimeReportSummary implements ReportSummary {
    double totalHours;
    long activeSessions; // running or paused timers
    LocalDate dateFrom;
    LocalDate dateTo;

    @Override
    public ReportType reportType() {
        return ReportType.TIME;
    }
}

package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;

/** Small typed result of one report generator. */
public interface ReportSummary {
    ReportType reportType();
}

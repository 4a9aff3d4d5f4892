package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;

import java.time.LocalDate;

/**
 * Filter payload of a schedule. Each report type has its own implementation,
 * see {@link ReportType#getFiltersType()}.
 */
public interface ReportFilters {

    ReportType reportType();

    /**
     * Fills a missing date range with the period the run covers.
     * Types without a mandatory range return themselves.
     */
    default ReportFilters withReportingPeriod(LocalDate from, LocalDate to) {
        return this;
    }
}

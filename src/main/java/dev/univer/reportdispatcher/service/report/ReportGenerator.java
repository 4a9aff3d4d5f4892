package dev.univer.reportdispatcher.service.report;

import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.report.ReportFilters;
import dev.univer.reportdispatcher.model.report.ReportSummary;

import java.time.ZoneId;

/**
 * Stateless, tenant-scoped aggregation for one report type.
 * Empty data yields a zero-valued summary, never an error.
 */
public interface ReportGenerator<F extends ReportFilters, S extends ReportSummary> {

    ReportType reportType();

    Class<F> filtersType();

    /** {@code zone} turns the filters' calendar dates into instants. */
    S generate(String tenantId, F filters, ZoneId zone);
}

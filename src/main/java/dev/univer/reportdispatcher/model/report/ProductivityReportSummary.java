package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.Builder;
import lombok.Value;

import java.util.OptionalDouble;

@Value
@Builder
public class ProductivityReportSummary implements ReportSummary {
    long totalEmployees;

    /** Null until there is a source for efficiency data. */
    Double averageEfficiency;

    public OptionalDouble efficiency() {
        return averageEfficiency == null ? OptionalDouble.empty() : OptionalDouble.of(averageEfficiency);
    }

    @Override
    public ReportType reportType() {
        return ReportType.PRODUCTIVITY;
    }
}

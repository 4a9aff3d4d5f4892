package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RevenueReportSummary implements ReportSummary {
    BigDecimal totalRevenue;
    BigDecimal averageOrderValue;
    long orderCount;

    @Override
    public ReportType reportType() {
        return ReportType.REVENUE;
    }
}

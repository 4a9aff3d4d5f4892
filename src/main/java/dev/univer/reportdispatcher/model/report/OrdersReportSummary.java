package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class OrdersReportSummary implements ReportSummary {
    long totalOrders;
    long completedOrders;
    long pendingOrders; // in_progress

    @Override
    public ReportType reportType() {
        return ReportType.ORDERS;
    }
}

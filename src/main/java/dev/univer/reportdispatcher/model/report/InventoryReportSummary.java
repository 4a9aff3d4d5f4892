package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InventoryReportSummary implements ReportSummary {
    long totalItems;
    long lowStockItems;

    @Override
    public ReportType reportType() {
        return ReportType.INVENTORY;
    }
}

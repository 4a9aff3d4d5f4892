package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class InventoryReportFilters implements ReportFilters {
    private String category;
    private String searchQuery; // name or SKU substring
    private boolean lowStockOnly;

    @Override
    public ReportType reportType() {
        return ReportType.INVENTORY;
    }
}

package dev.univer.reportdispatcher.model;

import dev.univer.reportdispatcher.model.report.InventoryReportFilters;
import dev.univer.reportdispatcher.model.report.OrdersReportFilters;
import dev.univer.reportdispatcher.model.report.ProductivityReportFilters;
import dev.univer.reportdispatcher.model.report.ReportFilters;
import dev.univer.reportdispatcher.model.report.RevenueReportFilters;
import dev.univer.reportdispatcher.model.report.TimeReportFilters;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Optional;

@Getter
@RequiredArgsConstructor
public enum ReportType {
    ORDERS("orders", OrdersReportFilters.class),
    INVENTORY("inventory", InventoryReportFilters.class),
    TIME("time", TimeReportFilters.class),
    REVENUE("revenue", RevenueReportFilters.class),
    PRODUCTIVITY("productivity", ProductivityReportFilters.class);

    private final String value;
    // filter shape accepted by this report type
    private final Class<? extends ReportFilters> filtersType;

    public static Optional<ReportType> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        String norm = raw.trim().toLowerCase(Locale.ROOT);
        for (ReportType t : values()) {
            if (t.value.equals(norm)) return Optional.of(t);
        }
        return Optional.empty();
    }
}

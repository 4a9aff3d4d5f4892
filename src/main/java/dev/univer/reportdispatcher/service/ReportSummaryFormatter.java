package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.model.report.*;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

/** One-line, human-readable text of a report summary. */
@Component
@RequiredArgsConstructor
public class ReportSummaryFormatter {
    private final ReportSchedulerProperties props;

    public String format(ReportSummary summary) {
        Locale locale = props.resolvedLocale();
        switch (summary.reportType()) {
            case ORDERS: {
                OrdersReportSummary s = (OrdersReportSummary) summary;
                return String.format(locale, "Orders report: %d orders, %d completed, %d in progress.",
                        s.getTotalOrders(), s.getCompletedOrders(), s.getPendingOrders());
            }
            case INVENTORY: {
                InventoryReportSummary s = (InventoryReportSummary) summary;
                return String.format(locale, "Inventory report: %d items, %d low on stock.",
                        s.getTotalItems(), s.getLowStockItems());
            }
            case TIME: {
                TimeReportSummary s = (TimeReportSummary) summary;
                return String.format(locale, "Time report (%s - %s): %.1f hours logged, %d active sessions.",
                        s.getDateFrom(), s.getDateTo(), s.getTotalHours(), s.getActiveSessions());
            }
            case REVENUE: {
                RevenueReportSummary s = (RevenueReportSummary) summary;
                return String.format(locale, "Revenue report: %.2f total over %d orders, average order value %.2f.",
                        s.getTotalRevenue(), s.getOrderCount(), s.getAverageOrderValue());
            }
            case PRODUCTIVITY:
            default: {
                ProductivityReportSummary s = (ProductivityReportSummary) summary;
                String efficiency = s.efficiency().isPresent()
                        ? String.format(locale, "%.1f%%", s.efficiency().getAsDouble())
                        : "not yet computed";
                return String.format(locale, "Productivity report: %d employees, average efficiency %s.",
                        s.getTotalEmployees(), efficiency);
            }
        }
    }
}

package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.model.report.*;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReportSummaryFormatterTest {
    private final ReportSummaryFormatter formatter = new ReportSummaryFormatter(new ReportSchedulerProperties());

    @Test
    void orders() {
        assertEquals("Orders report: 10 orders, 4 completed, 3 in progress.",
                formatter.format(OrdersReportSummary.builder().totalOrders(10).completedOrders(4).pendingOrders(3).build()));
    }

    @Test
    void inventory() {
        assertEquals("Inventory report: 120 items, 5 low on stock.",
                formatter.format(InventoryReportSummary.builder().totalItems(120).lowStockItems(5).build()));
    }

    @Test
    void time() {
        assertEquals("Time report (2024-03-01 - 2024-03-07): 37.5 hours logged, 2 active sessions.",
                formatter.format(TimeReportSummary.builder().totalHours(37.5).activeSessions(2)
                        .dateFrom(LocalDate.of(2024, 3, 1)).dateTo(LocalDate.of(2024, 3, 7)).build()));
    }

    @Test
    void revenue() {
        assertEquals("Revenue report: 1500.00 total over 4 orders, average order value 375.00.",
                formatter.format(RevenueReportSummary.builder().totalRevenue(new BigDecimal("1500"))
                        .averageOrderValue(new BigDecimal("375.00")).orderCount(4).build()));
    }

    @Test
    void productivityWithoutEfficiencyData() {
        assertEquals("Productivity report: 12 employees, average efficiency not yet computed.",
                formatter.format(ProductivityReportSummary.builder().totalEmployees(12).build()));
    }

    @Test
    void productivityWithEfficiency() {
        assertEquals("Productivity report: 12 employees, average efficiency 87.5%.",
                formatter.format(ProductivityReportSummary.builder().totalEmployees(12).averageEfficiency(87.5).build()));
    }
}

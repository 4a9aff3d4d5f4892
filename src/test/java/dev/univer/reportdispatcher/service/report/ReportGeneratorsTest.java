package dev.univer.reportdispatcher.service.report;

import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.report.InventoryReportFilters;
import dev.univer.reportdispatcher.model.report.OrdersReportFilters;
import dev.univer.reportdispatcher.model.report.OrdersReportSummary;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportGeneratorsTest {

    @Test
    void routesToTheGeneratorOfTheType() {
        ReportGenerators generators = new ReportGenerators(List.of(new FixedOrdersGenerator(7)));

        OrdersReportSummary s = (OrdersReportSummary) generators.generate(ReportType.ORDERS, "acme", new OrdersReportFilters(), ZoneOffset.UTC);

        assertEquals(7, s.getTotalOrders());
    }

    @Test
    void typeWithoutGeneratorFails() {
        ReportGenerators generators = new ReportGenerators(List.of(new FixedOrdersGenerator(7)));

        assertThrows(IllegalStateException.class,
                () -> generators.generate(ReportType.REVENUE, "acme", new OrdersReportFilters(), ZoneOffset.UTC));
    }

    @Test
    void filtersOfAnotherTypeAreRejected() {
        ReportGenerators generators = new ReportGenerators(List.of(new FixedOrdersGenerator(7)));

        assertThrows(IllegalArgumentException.class,
                () -> generators.generate(ReportType.ORDERS, "acme", new InventoryReportFilters(), ZoneOffset.UTC));
    }

    @Test
    void twoGeneratorsForOneTypeAreAConfigurationError() {
        assertThrows(IllegalStateException.class,
                () -> new ReportGenerators(List.of(new FixedOrdersGenerator(1), new FixedOrdersGenerator(2))));
    }

    private static class FixedOrdersGenerator implements ReportGenerator<OrdersReportFilters, OrdersReportSummary> {
        private final long total;

        FixedOrdersGenerator(long total) {
            this.total = total;
        }

        @Override
        public ReportType reportType() {
            return ReportType.ORDERS;
        }

        @Override
        public Class<OrdersReportFilters> filtersType() {
            return OrdersReportFilters.class;
        }

        @Override
        public OrdersReportSummary generate(String tenantId, OrdersReportFilters filters, ZoneId zone) {
            return OrdersReportSummary.builder().totalOrders(total).build();
        }
    }
}

package dev.univer.reportdispatcher.service.report;

import dev.univer.reportdispatcher.model.ProductionOrder;
import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.report.RevenueReportFilters;
import dev.univer.reportdispatcher.model.report.RevenueReportSummary;
import dev.univer.reportdispatcher.repo.ProductionOrderRepository;
import dev.univer.reportdispatcher.util.ScheduleParseUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.ZoneId;
import java.util.List;

@Component
@RequiredArgsConstructor
public class RevenueReportGenerator implements ReportGenerator<RevenueReportFilters, RevenueReportSummary> {
    private final ProductionOrderRepository orderRepository;

    @Override
    public ReportType reportType() {
        return ReportType.REVENUE;
    }

    @Override
    public Class<RevenueReportFilters> filtersType() {
        return RevenueReportFilters.class;
    }

    @Override
    public RevenueReportSummary generate(String tenantId, RevenueReportFilters filters, ZoneId zone) {
        List<ProductionOrder> orders = orderRepository.findAll(matching(tenantId, filters, zone));

        BigDecimal total = BigDecimal.ZERO;
        for (ProductionOrder o : orders) total = total.add(o.getTotalCost());

        BigDecimal average = orders.isEmpty()
                ? BigDecimal.ZERO
                : total.divide(BigDecimal.valueOf(orders.size()), 2, RoundingMode.HALF_UP);

        return RevenueReportSummary.builder()
                .totalRevenue(total)
                .averageOrderValue(average)
                .orderCount(orders.size())
                .build();
    }

    static Specification<ProductionOrder> matching(String tenantId, RevenueReportFilters f, ZoneId zone) {
        Specification<ProductionOrder> spec = OrderSpecifications.ofTenant(tenantId).and(OrderSpecifications.hasTotalCost());
        if (f == null) return spec;
        if (!ScheduleParseUtil.isBlank(f.getCustomer())) {
            spec = spec.and(OrderSpecifications.customerContains(f.getCustomer()));
        }
        if (f.getDateFrom() != null) {
            spec = spec.and(OrderSpecifications.createdAtOrAfter(ReportDates.startOf(f.getDateFrom(), zone)));
        }
        if (f.getDateTo() != null) {
            spec = spec.and(OrderSpecifications.createdBefore(ReportDates.endOf(f.getDateTo(), zone)));
        }
        return spec;
    }
}

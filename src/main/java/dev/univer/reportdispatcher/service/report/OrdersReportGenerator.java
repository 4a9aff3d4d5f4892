package dev.univer.reportdispatcher.service.report;

import dev.univer.reportdispatcher.model.ProductionOrder;
import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.report.OrdersReportFilters;
import dev.univer.reportdispatcher.model.report.OrdersReportSummary;
import dev.univer.reportdispatcher.repo.ProductionOrderRepository;
import dev.univer.reportdispatcher.util.ScheduleParseUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

@Component
@RequiredArgsConstructor
public class OrdersReportGenerator implements ReportGenerator<OrdersReportFilters, OrdersReportSummary> {
    private final ProductionOrderRepository orderRepository;

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
        Specification<ProductionOrder> spec = matching(tenantId, filters, zone);
        return OrdersReportSummary.builder()
                .totalOrders(orderRepository.count(spec))
                .completedOrders(orderRepository.count(spec.and(OrderSpecifications.hasStatus(ProductionOrder.STATUS_COMPLETED))))
                .pendingOrders(orderRepository.count(spec.and(OrderSpecifications.hasStatus(ProductionOrder.STATUS_IN_PROGRESS))))
                .build();
    }

    static Specification<ProductionOrder> matching(String tenantId, OrdersReportFilters f, ZoneId zone) {
        Specification<ProductionOrder> spec = OrderSpecifications.ofTenant(tenantId);
        if (f == null) return spec;
        if (!ScheduleParseUtil.isBlank(f.getStatus()) && !"all".equalsIgnoreCase(f.getStatus().trim())) {
            spec = spec.and(OrderSpecifications.hasStatus(f.getStatus().trim()));
        }
        if (!ScheduleParseUtil.isBlank(f.getCustomer())) {
            spec = spec.and(OrderSpecifications.customerContains(f.getCustomer()));
        }
        if (f.getOperatorId() != null) {
            spec = spec.and(OrderSpecifications.createdBy(f.getOperatorId()));
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

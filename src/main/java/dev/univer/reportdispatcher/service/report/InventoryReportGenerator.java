package dev.univer.reportdispatcher.service.report;

import dev.univer.reportdispatcher.model.InventoryItem;
import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.report.InventoryReportFilters;
import dev.univer.reportdispatcher.model.report.InventoryReportSummary;
import dev.univer.reportdispatcher.repo.InventoryItemRepository;
import dev.univer.reportdispatcher.util.ScheduleParseUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.Locale;

@Component
@RequiredArgsConstructor
public class InventoryReportGenerator implements ReportGenerator<InventoryReportFilters, InventoryReportSummary> {
    private final InventoryItemRepository inventoryRepository;

    @Override
    public ReportType reportType() {
        return ReportType.INVENTORY;
    }

    @Override
    public Class<InventoryReportFilters> filtersType() {
        return InventoryReportFilters.class;
    }

    @Override
    public InventoryReportSummary generate(String tenantId, InventoryReportFilters filters, ZoneId zone) {
        Specification<InventoryItem> spec = matching(tenantId, filters);
        long lowStock = inventoryRepository.count(spec.and(lowStock()));
        long total = filters != null && filters.isLowStockOnly() ? lowStock : inventoryRepository.count(spec);
        return InventoryReportSummary.builder()
                .totalItems(total)
                .lowStockItems(lowStock)
                .build();
    }

    // below threshold; items without a threshold never count as low
    static Specification<InventoryItem> lowStock() {
        return (root, query, cb) -> cb.and(
                cb.isNotNull(root.get("lowStockThreshold")),
                cb.lessThan(root.<Integer>get("quantity"), root.<Integer>get("lowStockThreshold")));
    }

    static Specification<InventoryItem> matching(String tenantId, InventoryReportFilters f) {
        Specification<InventoryItem> spec = (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);
        if (f == null) return spec;
        if (!ScheduleParseUtil.isBlank(f.getCategory())) {
            String category = f.getCategory().trim();
            spec = spec.and((root, query, cb) -> cb.equal(root.get("category"), category));
        }
        if (!ScheduleParseUtil.isBlank(f.getSearchQuery())) {
            String pattern = "%" + f.getSearchQuery().trim().toLowerCase(Locale.ROOT) + "%";
            spec = spec.and((root, query, cb) -> cb.or(
                    cb.like(cb.lower(root.get("name")), pattern),
                    cb.like(cb.lower(root.get("sku")), pattern)));
        }
        return spec;
    }
}

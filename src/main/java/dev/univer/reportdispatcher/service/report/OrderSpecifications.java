package dev.univer.reportdispatcher.service.report;

import dev.univer.reportdispatcher.model.ProductionOrder;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;
import java.util.Locale;

final class OrderSpecifications {

    private OrderSpecifications() {
    }

    static Specification<ProductionOrder> ofTenant(String tenantId) {
        return (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);
    }

    static Specification<ProductionOrder> hasStatus(String status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    static Specification<ProductionOrder> customerContains(String customer) {
        String pattern = "%" + customer.trim().toLowerCase(Locale.ROOT) + "%";
        return (root, query, cb) -> cb.like(cb.lower(root.get("customerName")), pattern);
    }

    static Specification<ProductionOrder> createdBy(Long userId) {
        return (root, query, cb) -> cb.equal(root.get("createdBy"), userId);
    }

    static Specification<ProductionOrder> createdAtOrAfter(Instant from) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("createdAt"), from);
    }

    static Specification<ProductionOrder> createdBefore(Instant to) {
        return (root, query, cb) -> cb.lessThan(root.get("createdAt"), to);
    }

    static Specification<ProductionOrder> hasTotalCost() {
        return (root, query, cb) -> cb.isNotNull(root.get("totalCost"));
    }
}

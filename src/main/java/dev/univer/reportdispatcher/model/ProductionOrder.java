package dev.univer.reportdispatcher.model;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_company_status", columnList = "company_id, status")
})
public class ProductionOrder {
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_IN_PROGRESS = "in_progress";

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private String tenantId;

    private String orderNumber;
    private String customerName;
    private String partName;
    private Integer quantity;

    // pending | in_progress | completed | delayed | cancelled
    private String status;

    private LocalDate deadline;
    private Instant createdAt;

    @Column(precision = 19, scale = 2)
    private BigDecimal totalCost;

    private Long createdBy;
}

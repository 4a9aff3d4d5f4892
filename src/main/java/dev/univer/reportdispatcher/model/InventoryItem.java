package dev.univer.reportdispatcher.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "inventory", indexes = {
        @Index(name = "idx_inventory_company", columnList = "company_id")
})
public class InventoryItem {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private String tenantId;

    private String sku;
    private String name;
    private String category;

    private Integer quantity;
    private Integer lowStockThreshold;
}

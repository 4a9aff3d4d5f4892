package dev.univer.reportdispatcher.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One tenant-configured recurring report. Created and edited by the CRUD layer;
 * the dispatcher only reads it and writes back the run timestamps.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "scheduled_reports", indexes = {
        @Index(name = "idx_scheduled_reports_active", columnList = "is_active")
})
public class ReportSchedule {
    @Id
    private String id;

    @Column(name = "company_id", nullable = false)
    private String tenantId;

    private String name;

    // orders | inventory | time | revenue | productivity
    @Column(name = "report_type", nullable = false)
    private String reportType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "scheduled_report_recipients", joinColumns = @JoinColumn(name = "report_id"))
    @OrderColumn(name = "recipient_index")
    @Column(name = "email", nullable = false)
    @Builder.Default
    private List<String> recipients = new ArrayList<>();

    // daily | weekly | monthly
    private String frequency;

    // 0-6, Sunday = 0
    private Integer dayOfWeek;

    // 1-31
    private Integer dayOfMonth;

    // HH:MM
    @Column(length = 5)
    private String timeOfDay;

    // wall clock zone, falls back to reports.default-zone-id
    private String zoneId;

    // JSON, shape depends on reportType
    @Column(length = 4000)
    private String filters;

    @Column(name = "is_active")
    private boolean active;

    private Instant lastSentAt;
    private Instant nextSendAt;

    @Column(length = 1024)
    private String lastError;
}

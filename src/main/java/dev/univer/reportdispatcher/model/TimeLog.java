package dev.univer.reportdispatcher.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "time_logs", indexes = {
        @Index(name = "idx_time_logs_company_start", columnList = "company_id, start_time")
})
public class TimeLog {
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_PAUSED = "paused";

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "company_id", nullable = false)
    private String tenantId;

    private Long userId;
    private Long orderId;

    @Column(name = "start_time")
    private Instant startTime;
    private Instant endTime; // null while the timer runs

    // running | paused | completed
    private String status;
}

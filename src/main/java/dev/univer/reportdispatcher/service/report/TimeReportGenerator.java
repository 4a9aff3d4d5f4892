package dev.univer.reportdispatcher.service.report;

import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.TimeLog;
import dev.univer.reportdispatcher.model.report.TimeReportFilters;
import dev.univer.reportdispatcher.model.report.TimeReportSummary;
import dev.univer.reportdispatcher.repo.TimeLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

@Component
@RequiredArgsConstructor
public class TimeReportGenerator implements ReportGenerator<TimeReportFilters, TimeReportSummary> {
    private static final double SECONDS_PER_HOUR = 3600.0;

    private final TimeLogRepository timeLogRepository;

    @Override
    public ReportType reportType() {
        return ReportType.TIME;
    }

    @Override
    public Class<TimeReportFilters> filtersType() {
        return TimeReportFilters.class;
    }

    @Override
    public TimeReportSummary generate(String tenantId, TimeReportFilters filters, ZoneId zone) {
        if (filters == null || filters.getDateFrom() == null || filters.getDateTo() == null) {
            throw new IllegalArgumentException("Time report needs both dateFrom and dateTo");
        }
        Instant from = ReportDates.startOf(filters.getDateFrom(), zone);
        Instant to = ReportDates.endOf(filters.getDateTo(), zone);

        Specification<TimeLog> completed = scoped(tenantId, filters)
                .and(hasStatus(TimeLog.STATUS_COMPLETED))
                .and((root, query, cb) -> cb.greaterThanOrEqualTo(root.get("startTime"), from))
                .and((root, query, cb) -> cb.lessThan(root.get("startTime"), to));

        long seconds = 0;
        for (TimeLog log : timeLogRepository.findAll(completed)) {
            if (log.getStartTime() != null && log.getEndTime() != null && log.getEndTime().isAfter(log.getStartTime())) {
                seconds += Duration.between(log.getStartTime(), log.getEndTime()).getSeconds();
            }
        }

        Specification<TimeLog> active = scoped(tenantId, filters)
                .and((root, query, cb) -> root.get("status").in(List.of(TimeLog.STATUS_RUNNING, TimeLog.STATUS_PAUSED)));

        return TimeReportSummary.builder()
                .totalHours(seconds / SECONDS_PER_HOUR)
                .activeSessions(timeLogRepository.count(active))
                .dateFrom(filters.getDateFrom())
                .dateTo(filters.getDateTo())
                .build();
    }

    private static Specification<TimeLog> hasStatus(String status) {
        return (root, query, cb) -> cb.equal(root.get("status"), status);
    }

    private static Specification<TimeLog> scoped(String tenantId, TimeReportFilters f) {
        Specification<TimeLog> spec = (root, query, cb) -> cb.equal(root.get("tenantId"), tenantId);
        if (f.getUserId() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("userId"), f.getUserId()));
        }
        if (f.getOrderId() != null) {
            spec = spec.and((root, query, cb) -> cb.equal(root.get("orderId"), f.getOrderId()));
        }
        return spec;
    }
}

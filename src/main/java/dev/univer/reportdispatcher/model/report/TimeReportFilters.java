package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.*;

import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder(toBuilder = true)
public class TimeReportFilters implements ReportFilters {
    private Long userId;
    private Long orderId;
    private LocalDate dateFrom; // inclusive
    private LocalDate dateTo;   // inclusive

    @Override
    public ReportType reportType() {
        return ReportType.TIME;
    }

    @Override
    public TimeReportFilters withReportingPeriod(LocalDate from, LocalDate to) {
        if (dateFrom != null && dateTo != null) return this;
        return toBuilder()
                .dateFrom(dateFrom != null ? dateFrom : from)
                .dateTo(dateTo != null ? dateTo : to)
                .build();
    }
}

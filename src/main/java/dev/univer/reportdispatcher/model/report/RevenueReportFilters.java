package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.*;

import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class RevenueReportFilters implements ReportFilters {
    private String customer;
    private LocalDate dateFrom;
    private LocalDate dateTo;

    @Override
    public ReportType reportType() {
        return ReportType.REVENUE;
    }
}

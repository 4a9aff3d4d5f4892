package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.*;

import java.time.LocalDate;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class OrdersReportFilters implements ReportFilters {
    private String status;      // "all" or blank means any
    private String customer;    // case-insensitive substring
    private LocalDate dateFrom; // creation date, inclusive
    private LocalDate dateTo;   // creation date, inclusive
    private Long operatorId;

    @Override
    public ReportType reportType() {
        return ReportType.ORDERS;
    }
}

package dev.univer.reportdispatcher.model.report;

import dev.univer.reportdispatcher.model.ReportType;
import lombok.*;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class ProductivityReportFilters implements ReportFilters {
    private String role;

    @Override
    public ReportType reportType() {
        return ReportType.PRODUCTIVITY;
    }
}

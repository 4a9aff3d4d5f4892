package dev.univer.reportdispatcher.service.report;

import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.report.ProductivityReportFilters;
import dev.univer.reportdispatcher.model.report.ProductivityReportSummary;
import dev.univer.reportdispatcher.repo.EmployeeRepository;
import dev.univer.reportdispatcher.util.ScheduleParseUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

@Component
@RequiredArgsConstructor
public class ProductivityReportGenerator implements ReportGenerator<ProductivityReportFilters, ProductivityReportSummary> {
    private final EmployeeRepository employeeRepository;

    @Override
    public ReportType reportType() {
        return ReportType.PRODUCTIVITY;
    }

    @Override
    public Class<ProductivityReportFilters> filtersType() {
        return ProductivityReportFilters.class;
    }

    @Override
    public ProductivityReportSummary generate(String tenantId, ProductivityReportFilters filters, ZoneId zone) {
        long employees = filters != null && !ScheduleParseUtil.isBlank(filters.getRole())
                ? employeeRepository.countByTenantIdAndRoleIgnoreCase(tenantId, filters.getRole().trim())
                : employeeRepository.countByTenantId(tenantId);

        // TODO: average efficiency needs planned-vs-logged hours per operator, which the store does not track yet
        return ProductivityReportSummary.builder()
                .totalEmployees(employees)
                .averageEfficiency(null)
                .build();
    }
}

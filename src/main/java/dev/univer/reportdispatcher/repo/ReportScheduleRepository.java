package dev.univer.reportdispatcher.repo;

import dev.univer.reportdispatcher.model.ReportSchedule;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ReportScheduleRepository extends JpaRepository<ReportSchedule, String> {
    List<ReportSchedule> findAllByActiveTrue();
    List<ReportSchedule> findAllByTenantIdAndActiveTrue(String tenantId);
}

package dev.univer.reportdispatcher.repo;

import dev.univer.reportdispatcher.model.Employee;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EmployeeRepository extends JpaRepository<Employee, Long> {
    long countByTenantId(String tenantId);
    long countByTenantIdAndRoleIgnoreCase(String tenantId, String role);
}

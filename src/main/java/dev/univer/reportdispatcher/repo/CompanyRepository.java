package dev.univer.reportdispatcher.repo;

import dev.univer.reportdispatcher.model.Company;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CompanyRepository extends JpaRepository<Company, String> {
}

package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.model.Company;
import dev.univer.reportdispatcher.repo.CompanyRepository;
import dev.univer.reportdispatcher.util.ScheduleParseUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class TenantDirectory {
    private final CompanyRepository companyRepository;

    public Optional<String> getTenantName(String tenantId) {
        if (tenantId == null) return Optional.empty();
        return companyRepository.findById(tenantId)
                .map(Company::getName)
                .filter(name -> !ScheduleParseUtil.isBlank(name));
    }
}

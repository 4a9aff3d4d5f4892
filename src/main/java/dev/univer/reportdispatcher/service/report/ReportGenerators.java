package dev.univer.reportdispatcher.service.report;

import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.report.ReportFilters;
import dev.univer.reportdispatcher.model.report.ReportSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Routes a report type to its generator. */
@Component
@Slf4j
public class ReportGenerators {
    private final Map<ReportType, ReportGenerator<?, ?>> byType = new EnumMap<>(ReportType.class);

    public ReportGenerators(List<ReportGenerator<?, ?>> generators) {
        for (ReportGenerator<?, ?> g : generators) {
            ReportGenerator<?, ?> previous = byType.put(g.reportType(), g);
            if (previous != null) {
                throw new IllegalStateException("Two generators for " + g.reportType() + ": "
                        + previous.getClass().getSimpleName() + ", " + g.getClass().getSimpleName());
            }
        }
        log.debug("Report generators: {}", byType.keySet());
    }

    public ReportSummary generate(ReportType type, String tenantId, ReportFilters filters, ZoneId zone) {
        ReportGenerator<?, ?> generator = byType.get(type);
        if (generator == null) {
            throw new IllegalStateException("No generator for report type " + type);
        }
        return invoke(generator, tenantId, filters, zone);
    }

    private static <F extends ReportFilters> ReportSummary invoke(ReportGenerator<F, ?> generator,
                                                                 String tenantId, ReportFilters filters, ZoneId zone) {
        if (!generator.filtersType().isInstance(filters)) {
            throw new IllegalArgumentException("Expected " + generator.filtersType().getSimpleName()
                    + " for " + generator.reportType() + " but got " + filters.getClass().getSimpleName());
        }
        return generator.generate(tenantId, generator.filtersType().cast(filters), zone);
    }
}

package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.exception.InvalidScheduleException;
import dev.univer.reportdispatcher.exception.ReportExecutionException;
import dev.univer.reportdispatcher.exception.ReportExecutionException.Step;
import dev.univer.reportdispatcher.model.ReportSchedule;
import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.report.ReportFilters;
import dev.univer.reportdispatcher.model.report.ReportSummary;
import dev.univer.reportdispatcher.service.report.ReportGenerators;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.util.List;
import java.util.Optional;

/**
 * One run of a scheduled report: load, generate, mail, write back the run timestamps.
 * Never throws; a failed run is logged and recorded on the schedule.
 */
@Service
@Slf4j
public class ReportExecutor {
    private final ReportScheduleStore store;
    private final ReportGenerators generators;
    private final ReportFiltersParser filtersParser;
    private final ReportSummaryFormatter summaryFormatter;
    private final ReportEmailRenderer emailRenderer;
    private final TenantDirectory tenantDirectory;
    private final NotificationSender notificationSender;
    private final NextRunCalculator nextRunCalculator;
    private final ReportSchedulerProperties props;
    private final RetryTemplate retryTemplate;
    private final Clock clock;

    public ReportExecutor(ReportScheduleStore store,
                          ReportGenerators generators,
                          ReportFiltersParser filtersParser,
                          ReportSummaryFormatter summaryFormatter,
                          ReportEmailRenderer emailRenderer,
                          TenantDirectory tenantDirectory,
                          NotificationSender notificationSender,
                          NextRunCalculator nextRunCalculator,
                          ReportSchedulerProperties props,
                          @Qualifier("reportRetryTemplate") RetryTemplate retryTemplate,
                          Clock clock) {
        this.store = store;
        this.generators = generators;
        this.filtersParser = filtersParser;
        this.summaryFormatter = summaryFormatter;
        this.emailRenderer = emailRenderer;
        this.tenantDirectory = tenantDirectory;
        this.notificationSender = notificationSender;
        this.nextRunCalculator = nextRunCalculator;
        this.props = props;
        this.retryTemplate = retryTemplate;
        this.clock = clock;
    }

    public void execute(String scheduleId) {
        Step step = Step.LOAD_SCHEDULE;
        try {
            // re-read so edits made after registration apply to this run
            Optional<ReportSchedule> found = retryTemplate.execute(ctx -> store.getSchedule(scheduleId));
            if (found.isEmpty()) {
                log.info("Schedule {} no longer exists, run skipped", scheduleId);
                return;
            }
            ReportSchedule schedule = found.get();
            if (!schedule.isActive()) {
                log.info("Schedule {} is inactive, run skipped", scheduleId);
                return;
            }
            log.info("Executing report '{}' ({}, {})", schedule.getName(), scheduleId, schedule.getReportType());

            ScheduleCadence cadence = ScheduleCadence.of(schedule, props.defaultZone());
            ZonedDateTime startedAt = ZonedDateTime.now(clock.withZone(cadence.getZone()));

            step = Step.GENERATE;
            ReportType type = ReportType.fromValue(schedule.getReportType())
                    .orElseThrow(() -> new InvalidScheduleException(scheduleId, "Unknown report type: " + schedule.getReportType()));
            LocalDate today = startedAt.toLocalDate();
            ReportFilters filters = filtersParser.parse(scheduleId, type, schedule.getFilters())
                    .withReportingPeriod(cadence.getFrequency().periodStart(today), today);
            ReportSummary summary = retryTemplate.execute(
                    ctx -> generators.generate(type, schedule.getTenantId(), filters, cadence.getZone()));

            step = Step.FORMAT;
            String summaryText = summaryFormatter.format(summary);

            step = Step.RESOLVE_TENANT;
            String tenantName = resolveTenantName(schedule.getTenantId());

            step = Step.NOTIFY;
            List<String> recipients = schedule.getRecipients();
            String subject = schedule.getName() + " - "
                    + startedAt.format(DateTimeFormatter.ofPattern(props.getSubjectDatePattern(), props.resolvedLocale()));
            String reportDate = startedAt.format(DateTimeFormatter.ofLocalizedDate(FormatStyle.FULL).withLocale(props.resolvedLocale()));
            String body = emailRenderer.render(tenantName, schedule.getName(), reportDate, summaryText);
            boolean sent = retryTemplate.execute(ctx -> notificationSender.send(recipients, subject, body));
            if (!sent) {
                throw new ReportExecutionException(scheduleId, step, "Notification was not accepted");
            }

            step = Step.PERSIST;
            Instant now = clock.instant();
            Instant next = nextRunCalculator.nextRun(schedule, now);
            retryTemplate.execute(ctx -> {
                store.updateScheduleRunTimestamps(scheduleId, now, next);
                return null;
            });

            log.info("Report '{}' sent to {} recipient(s), next run at {}", schedule.getName(), recipients.size(), next);
        } catch (Exception e) {
            ReportExecutionException failure = e instanceof ReportExecutionException
                    ? (ReportExecutionException) e
                    : new ReportExecutionException(scheduleId, step, e.getMessage(), e);
            log.error("Report {} failed at step {}: {}", scheduleId, failure.getStep(), failure.getMessage(), e);
            recordFailure(scheduleId, failure);
        }
    }

    // best-effort: a missing or failing lookup falls back to a generic label
    private String resolveTenantName(String tenantId) {
        try {
            return tenantDirectory.getTenantName(tenantId).orElse(props.getFallbackTenantName());
        } catch (RuntimeException e) {
            log.warn("Tenant name lookup failed for {}: {}", tenantId, e.getMessage());
            return props.getFallbackTenantName();
        }
    }

    private void recordFailure(String scheduleId, ReportExecutionException failure) {
        try {
            store.recordFailure(scheduleId, failure.getStep() + ": " + failure.getMessage());
        } catch (RuntimeException e) {
            log.warn("Could not record failure of schedule {}: {}", scheduleId, e.getMessage());
        }
    }
}

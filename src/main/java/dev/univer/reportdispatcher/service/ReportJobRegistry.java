package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.event.ReportScheduleDeletedEvent;
import dev.univer.reportdispatcher.event.ReportScheduleSavedEvent;
import dev.univer.reportdispatcher.model.ReportSchedule;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live recurring triggers, one per active report schedule.
 *
 * <p>Register and unregister are serialized. A trigger fire only hands the run to
 * the report executor pool; a fire that arrives while the previous run of the same
 * schedule is still going is skipped. Cancelling a schedule stops future fires and
 * lets a run already in progress finish.
 */
@Service
@Slf4j
public class ReportJobRegistry {
    private final TaskScheduler taskScheduler;
    private final AsyncTaskExecutor taskExecutor;
    private final ReportTriggerBuilder triggerBuilder;
    private final ReportExecutor reportExecutor;
    private final ReportScheduleStore store;
    private final ReportSchedulerProperties props;
    private final Clock clock;

    private final Map<String, ScheduledFuture<?>> activeJobs = new ConcurrentHashMap<>();
    // schedule id -> token of the run holding the guard
    private final Map<String, Object> inFlight = new ConcurrentHashMap<>();
    private final Object lock = new Object();
    private final AtomicBoolean bootstrapped = new AtomicBoolean();

    public ReportJobRegistry(@Qualifier("reportTaskScheduler") TaskScheduler taskScheduler,
                             @Qualifier("reportTaskExecutor") AsyncTaskExecutor taskExecutor,
                             ReportTriggerBuilder triggerBuilder,
                             ReportExecutor reportExecutor,
                             ReportScheduleStore store,
                             ReportSchedulerProperties props,
                             Clock clock) {
        this.taskScheduler = taskScheduler;
        this.taskExecutor = taskExecutor;
        this.triggerBuilder = triggerBuilder;
        this.reportExecutor = reportExecutor;
        this.store = store;
        this.props = props;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        bootstrap();
    }

    /**
     * Registers every active schedule. Runs once per registry; a schedule that fails
     * to register is logged and skipped.
     */
    public BootstrapResult bootstrap() {
        if (!bootstrapped.compareAndSet(false, true)) {
            log.warn("Report scheduler already bootstrapped, ignoring");
            return BootstrapResult.empty();
        }

        List<ReportSchedule> schedules;
        try {
            schedules = store.listActiveSchedules();
        } catch (RuntimeException e) {
            log.error("Error loading scheduled reports: {}", e.getMessage(), e);
            return BootstrapResult.empty();
        }

        List<String> registered = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (ReportSchedule s : schedules) {
            try {
                if (register(s)) registered.add(s.getId());
            } catch (RuntimeException e) {
                log.error("Failed to register scheduled report {} ('{}'): {}", s.getId(), s.getName(), e.getMessage());
                failed.add(s.getId());
            }
        }
        log.info("Initialized {} scheduled reports ({} failed)", registered.size(), failed.size());
        return new BootstrapResult(registered, failed);
    }

    /**
     * Arms the schedule's trigger, replacing any existing one for the same id.
     * An inactive schedule is unregistered instead.
     *
     * @return whether a trigger is now armed for the schedule
     * @throws dev.univer.reportdispatcher.exception.InvalidScheduleException when the cadence is malformed;
     *         an existing trigger is then left as it was
     */
    public boolean register(ReportSchedule schedule) {
        String id = schedule.getId();
        if (!schedule.isActive()) {
            unregister(id);
            return false;
        }

        ReportTrigger trigger = triggerBuilder.build(schedule);

        synchronized (lock) {
            ScheduledFuture<?> previous = activeJobs.remove(id);
            if (previous != null) {
                previous.cancel(false);
            }
            ScheduledFuture<?> future = taskScheduler.schedule(() -> dispatch(id), trigger);
            if (future == null) {
                log.warn("Trigger {} of report {} never fires, not registered", trigger, id);
                return false;
            }
            activeJobs.put(id, future);
        }
        log.info("Scheduled report: {} ({})", schedule.getName(), trigger);
        return true;
    }

    public void unregister(String id) {
        ScheduledFuture<?> future;
        synchronized (lock) {
            future = activeJobs.remove(id);
            if (future != null) {
                future.cancel(false);
            }
        }
        if (future != null) {
            log.info("Unscheduled report: {}", id);
        }
    }

    @EventListener
    public void onScheduleSaved(ReportScheduleSavedEvent event) {
        register(event.getSchedule());
    }

    @EventListener
    public void onScheduleDeleted(ReportScheduleDeletedEvent event) {
        unregister(event.getScheduleId());
    }

    public boolean isRegistered(String id) {
        return activeJobs.containsKey(id);
    }

    public Set<String> registeredIds() {
        return Collections.unmodifiableSet(new TreeSet<>(activeJobs.keySet()));
    }

    public boolean isRunning(String id) {
        return inFlight.containsKey(id);
    }

    /** Called on every trigger fire. */
    void dispatch(String id) {
        Object token = new Object();
        if (inFlight.putIfAbsent(id, token) != null) {
            log.warn("Previous run of report {} still in progress, skipping this fire", id);
            return;
        }

        Future<?> run;
        try {
            run = taskExecutor.submit(() -> {
                try {
                    reportExecutor.execute(id);
                } finally {
                    inFlight.remove(id, token);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(id, token);
            log.error("Report executor rejected run of {}: {}", id, e.getMessage());
            return;
        }

        Duration timeout = props.getExecutionTimeout();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            taskScheduler.schedule(() -> expire(id, token, run, timeout), clock.instant().plus(timeout));
        }
    }

    private void expire(String id, Object token, Future<?> run, Duration timeout) {
        if (run.isDone()) return;
        log.warn("Run of report {} exceeded {} and is being cancelled", id, timeout);
        run.cancel(true);
        inFlight.remove(id, token);
    }

    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            activeJobs.values().forEach(f -> f.cancel(false));
            activeJobs.clear();
        }
    }

    @Getter
    @RequiredArgsConstructor
    public static class BootstrapResult {
        private final List<String> registeredIds;
        private final List<String> failedIds;

        static BootstrapResult empty() {
            return new BootstrapResult(List.of(), List.of());
        }
    }
}

package dev.univer.reportdispatcher.service;

import dev.univer.reportdispatcher.exception.StoreUnavailableException;
import dev.univer.reportdispatcher.model.ReportSchedule;
import dev.univer.reportdispatcher.repo.ReportScheduleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Schedule reads and run-timestamp writes. Connection-level failures surface as
 * {@link StoreUnavailableException} so callers can retry them.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReportScheduleStore {
    static final int MAX_ERROR_LENGTH = 1024;

    private final ReportScheduleRepository repo;

    public List<ReportSchedule> listActiveSchedules() {
        return call("list active schedules", repo::findAllByActiveTrue);
    }

    /** Active schedules of one tenant; all tenants when {@code tenantId} is null. */
    public List<ReportSchedule> listActiveSchedules(String tenantId) {
        if (tenantId == null) return listActiveSchedules();
        return call("list active schedules of " + tenantId, () -> repo.findAllByTenantIdAndActiveTrue(tenantId));
    }

    public Optional<ReportSchedule> getSchedule(String id) {
        return call("load schedule " + id, () -> repo.findById(id));
    }

    @Transactional
    public void updateScheduleRunTimestamps(String id, Instant lastSentAt, Instant nextSendAt) {
        call("update run timestamps of " + id, () -> {
            Optional<ReportSchedule> found = repo.findById(id);
            if (found.isEmpty()) {
                log.warn("Schedule {} disappeared before its run timestamps were saved", id);
                return null;
            }
            ReportSchedule s = found.get();
            s.setLastSentAt(lastSentAt);
            s.setNextSendAt(nextSendAt);
            s.setLastError(null);
            return repo.save(s);
        });
    }

    @Transactional
    public void recordFailure(String id, String message) {
        call("record failure of " + id, () -> {
            Optional<ReportSchedule> found = repo.findById(id);
            if (found.isEmpty()) return null;
            ReportSchedule s = found.get();
            s.setLastError(truncate(message));
            return repo.save(s);
        });
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) return message;
        return message.substring(0, MAX_ERROR_LENGTH);
    }

    private static <T> T call(String what, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | RecoverableDataAccessException | DataAccessResourceFailureException e) {
            throw new StoreUnavailableException("Store unavailable: " + what, e);
        }
    }
}

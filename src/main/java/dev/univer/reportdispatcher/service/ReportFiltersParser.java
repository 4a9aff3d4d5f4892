package dev.univer.reportdispatcher.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.univer.reportdispatcher.exception.InvalidScheduleException;
import dev.univer.reportdispatcher.model.ReportType;
import dev.univer.reportdispatcher.model.report.ReportFilters;
import dev.univer.reportdispatcher.util.ScheduleParseUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** Reads a schedule's JSON filters into the shape its report type expects. */
@Component
@RequiredArgsConstructor
public class ReportFiltersParser {
    private final ObjectMapper objectMapper;

    public ReportFilters parse(String scheduleId, ReportType type, String json) {
        // no stored filters reads as an empty object
        String body = ScheduleParseUtil.isBlank(json) || "null".equals(json.trim()) ? "{}" : json;
        try {
            return objectMapper.readerFor(type.getFiltersType())
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(body);
        } catch (JsonProcessingException e) {
            throw new InvalidScheduleException(scheduleId,
                    "Malformed " + type.getValue() + " filters: " + e.getOriginalMessage(), e);
        }
    }
}

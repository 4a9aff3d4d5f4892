package dev.univer.reportdispatcher.service;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;

@Configuration
@ConfigurationProperties(prefix = "reports")
@Getter @Setter
public class ReportSchedulerProperties {
    // zone for schedules without their own zoneId
    private String defaultZoneId = "UTC";
    private String fallbackTenantName = "Your company";
    private String locale = "en-GB";
    private String subjectDatePattern = "dd.MM.yyyy";

    private int schedulerPoolSize = 2;
    private int executorPoolSize = 4;
    private int executorQueueCapacity = 100;

    // zero or negative disables the limit
    private Duration executionTimeout = Duration.ofMinutes(10);

    private Retry retry = new Retry();
    private Mail mail = new Mail();

    public ZoneId defaultZone() {
        return ZoneId.of(defaultZoneId);
    }

    public Locale resolvedLocale() {
        return Locale.forLanguageTag(locale);
    }

    @Getter @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private Duration initialInterval = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxInterval = Duration.ofSeconds(10);
    }

    @Getter @Setter
    public static class Mail {
        private String from;
        private String senderName = "Production Reports";
    }
}

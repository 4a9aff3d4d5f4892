package dev.univer.reportdispatcher.config;

import dev.univer.reportdispatcher.exception.NotificationUnavailableException;
import dev.univer.reportdispatcher.exception.StoreUnavailableException;
import dev.univer.reportdispatcher.service.ReportSchedulerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.HashMap;
import java.util.Map;

@Configuration
public class RetryConfig {

    @Bean(name = "reportRetryTemplate")
    public RetryTemplate reportRetryTemplate(ReportSchedulerProperties props) {
        ReportSchedulerProperties.Retry retry = props.getRetry();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(retry.getInitialInterval().toMillis());
        backOffPolicy.setMultiplier(retry.getMultiplier());
        backOffPolicy.setMaxInterval(retry.getMaxInterval().toMillis());

        return transientFailureRetry(retry.getMaxAttempts(), backOffPolicy);
    }

    /** Retries only transient store and mail failures; anything else fails on the first attempt. */
    public static RetryTemplate transientFailureRetry(int maxAttempts, BackOffPolicy backOffPolicy) {
        Map<Class<? extends Throwable>, Boolean> retryable = new HashMap<>();
        retryable.put(StoreUnavailableException.class, true);
        retryable.put(NotificationUnavailableException.class, true);
        retryable.put(TransientDataAccessException.class, true);
        retryable.put(RecoverableDataAccessException.class, true);
        retryable.put(DataAccessResourceFailureException.class, true);

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new SimpleRetryPolicy(maxAttempts, retryable, true));
        retryTemplate.setBackOffPolicy(backOffPolicy);
        return retryTemplate;
    }
}

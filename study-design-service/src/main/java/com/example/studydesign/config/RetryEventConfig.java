package com.example.studydesign.config;

import com.example.studydesign.client.LiteratureSearchClient;
import com.example.studydesign.client.ParameterExtractionClient;
import com.example.studydesign.client.ReportRenderer;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.retry.event.RetryOnErrorEvent;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import io.github.resilience4j.retry.event.RetryOnSuccessEvent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Logs retry attempts, recoveries and exhaustion for every collaborator retry instance.
 *
 * Exhaustion is logged at WARN; the fallback decides whether it is an error for the pipeline.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RetryEventConfig {

    private static final List<String> RETRY_INSTANCES = List.of(
            LiteratureSearchClient.NAME,
            ParameterExtractionClient.NAME,
            ReportRenderer.NAME);

    private final RetryRegistry retryRegistry;

    @PostConstruct
    public void configureRetryEventLogging() {
        RETRY_INSTANCES.forEach(this::configureRetryEvents);
    }

    /**
     * Only instances declared in application.yml are decorated; looking up a missing one
     * would create it with default settings.
     */
    private void configureRetryEvents(String retryName) {
        retryRegistry.getAllRetries()
                .stream()
                .filter(retry -> retry.getName().equals(retryName))
                .findFirst()
                .ifPresentOrElse(
                        retry -> retry.getEventPublisher()
                                .onRetry(this::logRetryAttempt)
                                .onSuccess(this::logRetrySuccess)
                                .onError(this::logRetryError),
                        () -> log.warn("Retry not found in registry, skipping event config: {}", retryName));
    }

    private void logRetryAttempt(RetryOnRetryEvent event) {
        log.warn("RETRY_ATTEMPT name={} attempt={}/{} error={}",
                event.getName(),
                event.getNumberOfRetryAttempts(),
                event.getRetry().getRetryConfig().getMaxAttempts(),
                event.getLastThrowable().getClass().getSimpleName());
    }

    private void logRetrySuccess(RetryOnSuccessEvent event) {
        if (event.getNumberOfRetryAttempts() > 0) {
            log.info("RETRY_SUCCESS name={} attempts={}", event.getName(), event.getNumberOfRetryAttempts());
        }
    }

    private void logRetryError(RetryOnErrorEvent event) {
        log.warn("RETRY_EXHAUSTED name={} attempts={} error={}",
                event.getName(),
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable().getClass().getSimpleName());
    }
}

package com.kreasipositif.baiprocessor.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

/**
 * Resilience4j configuration for the invoice-service client.
 *
 * <ul>
 *   <li><b>SemaphoreBulkhead</b> — caps concurrent page fetches so that several cash-application
 *       jobs launched together cannot flood the invoice service.</li>
 *   <li><b>Retry</b> — re-issues a page request after an I/O failure or a 5xx answer. Client errors
 *       (4xx) are not retried.</li>
 * </ul>
 *
 * <p>Values come from {@code application.yml} under {@code resilience4j.*}.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    // ── SemaphoreBulkhead — invoice-service ──────────────────────────────────

    @Value("${resilience4j.bulkhead.instances.invoiceServiceBulkhead.max-concurrent-calls:5}")
    private int invoiceServiceMaxConcurrent;

    @Value("${resilience4j.bulkhead.instances.invoiceServiceBulkhead.max-wait-duration:2s}")
    private Duration invoiceServiceMaxWait;

    // ── Retry — invoice-service ──────────────────────────────────────────────

    @Value("${resilience4j.retry.instances.invoiceServiceRetry.max-attempts:3}")
    private int invoiceServiceMaxAttempts;

    @Value("${resilience4j.retry.instances.invoiceServiceRetry.wait-duration:500ms}")
    private Duration invoiceServiceRetryWait;

    // ─── Beans ───────────────────────────────────────────────────────────────

    @Bean("invoiceServiceBulkhead")
    public Bulkhead invoiceServiceBulkhead(BulkheadRegistry registry) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(invoiceServiceMaxConcurrent)
                .maxWaitDuration(invoiceServiceMaxWait)
                .build();
        Bulkhead bh = registry.bulkhead("invoiceServiceBulkhead", cfg);
        log.info("SemaphoreBulkhead 'invoiceServiceBulkhead' created — maxConcurrent={}, maxWait={}",
                invoiceServiceMaxConcurrent, invoiceServiceMaxWait);
        return bh;
    }

    @Bean("invoiceServiceRetry")
    public Retry invoiceServiceRetry(RetryRegistry registry) {
        RetryConfig cfg = RetryConfig.custom()
                .maxAttempts(invoiceServiceMaxAttempts)
                .waitDuration(invoiceServiceRetryWait)
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        Retry retry = registry.retry("invoiceServiceRetry", cfg);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying invoice-service call (attempt {}): {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "n/a"));
        log.info("Retry 'invoiceServiceRetry' created — maxAttempts={}, wait={}",
                invoiceServiceMaxAttempts, invoiceServiceRetryWait);
        return retry;
    }

    // ─── Registries (default instances — auto-configured by resilience4j-spring-boot3) ─

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        return BulkheadRegistry.ofDefaults();
    }

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }
}

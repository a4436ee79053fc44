package com.cred.freestyle.checkout.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.concurrent.TimeUnit;

/**
 * Metrics service for monitoring and observability.
 * Records custom metrics through the Micrometer registry exposed by Actuator.
 *
 * Key Metrics:
 * - Checkout success/failure rates (failure tagged by reason)
 * - Checkout latency (p50, p95, p99)
 * - Revenue
 * - Signup and login outcomes
 * - Error rates
 *
 * @author Checkout Team
 */
@Service
public class CommerceMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(CommerceMetricsService.class);

    private final MeterRegistry meterRegistry;

    // Metric name prefixes
    private static final String METRIC_PREFIX = "commerce.";
    private static final String CHECKOUT_PREFIX = METRIC_PREFIX + "checkout.";
    private static final String AUTH_PREFIX = METRIC_PREFIX + "auth.";

    public CommerceMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a committed checkout.
     *
     * @param itemCount Number of line items in the order
     */
    public void recordCheckoutSuccess(int itemCount) {
        Counter.builder(CHECKOUT_PREFIX + "success")
                .description("Committed checkouts")
                .register(meterRegistry)
                .increment();
        Counter.builder(CHECKOUT_PREFIX + "line_items")
                .description("Line items in committed checkouts")
                .register(meterRegistry)
                .increment(itemCount);
        logger.debug("Recorded checkout success with {} line items", itemCount);
    }

    /**
     * Record a rolled back checkout.
     *
     * @param reason Failure reason (e.g., "INSUFFICIENT_STOCK", "PRODUCT_NOT_FOUND")
     */
    public void recordCheckoutFailure(String reason) {
        Counter.builder(CHECKOUT_PREFIX + "failure")
                .tag("reason", reason)
                .description("Rolled back checkouts")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded checkout failure, reason: {}", reason);
    }

    /**
     * Record checkout latency.
     *
     * @param durationMs Duration in milliseconds
     */
    public void recordCheckoutLatency(long durationMs) {
        Timer.builder(CHECKOUT_PREFIX + "latency")
                .description("Checkout latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record revenue of a committed order.
     *
     * @param amount Order total
     */
    public void recordRevenue(BigDecimal amount) {
        Counter.builder(METRIC_PREFIX + "revenue")
                .description("Revenue from committed orders")
                .register(meterRegistry)
                .increment(amount.doubleValue());
        logger.debug("Recorded revenue: {}", amount);
    }

    /**
     * Record signup outcome.
     *
     * @param success true if the account was created
     */
    public void recordSignup(boolean success) {
        Counter.builder(AUTH_PREFIX + "signup")
                .tag("outcome", success ? "success" : "failure")
                .description("Signup attempts")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record login outcome.
     *
     * @param success true if a token was issued
     */
    public void recordLogin(boolean success) {
        Counter.builder(AUTH_PREFIX + "login")
                .tag("outcome", success ? "success" : "failure")
                .description("Login attempts")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record error occurrence.
     *
     * @param errorType Error type (e.g., "DATABASE_ERROR")
     * @param operation Operation where error occurred
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "error")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("System errors")
                .register(meterRegistry)
                .increment();
        logger.warn("Recorded error: type={}, operation={}", errorType, operation);
    }
}

package com.aegis.adminapi.infrastructure.web;

import com.aegis.adminapi.config.AdminApiProperties;
import com.aegis.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Route guard outcome counters and latency.
 *
 * <ul>
 *   <li>{@code aegis.authz.decisions{outcome=allowed|denied|error}}
 *   <li>{@code aegis.authz.duration}
 * </ul>
 */
@Component
public class AuthorizationMetrics {

    public static final String DECISIONS = "aegis.authz.decisions";
    public static final String DURATION = "aegis.authz.duration";

    private final Counter allowed;
    private final Counter denied;
    private final Counter error;
    private final Timer duration;

    public AuthorizationMetrics(MeterRegistry registry, AdminApiProperties properties) {
        MetricFactory metrics = new MetricFactory(registry, properties.name());
        String description = "Route guard decisions by outcome";
        this.allowed = metrics.counter(DECISIONS, description, "outcome", "allowed");
        this.denied = metrics.counter(DECISIONS, description, "outcome", "denied");
        this.error = metrics.counter(DECISIONS, description, "outcome", "error");
        this.duration = metrics.timer(DURATION, "Route guard evaluation time");
    }

    public Timer duration() {
        return duration;
    }

    public void allowed() {
        allowed.increment();
    }

    /** Authentication, tenant and permission rejections. */
    public void denied() {
        denied.increment();
    }

    /** Configuration and evaluation failures. */
    public void error() {
        error.increment();
    }
}

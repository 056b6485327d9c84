package com.pumainbox.api.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {

    @Bean
    public Counter emailsInsertedCounter(MeterRegistry registry) {
        return Counter.builder("inbox.emails.inserted")
                .description("Total number of emails stored in the inbox")
                .tag("service", "inbox-api")
                .register(registry);
    }

    @Bean
    public Counter emailInsertFailureCounter(MeterRegistry registry) {
        return Counter.builder("inbox.emails.insert.failure")
                .description("Total number of failed email inserts")
                .tag("service", "inbox-api")
                .register(registry);
    }

    @Bean
    public Counter paginationValidationFailureCounter(MeterRegistry registry) {
        return Counter.builder("validation.failure")
                .description("Total number of rejected limit/offset pairs")
                .tag("service", "inbox-api")
                .tag("type", "pagination")
                .register(registry);
    }

    @Bean
    public Counter dbHealthFailureCounter(MeterRegistry registry) {
        return Counter.builder("db.health.failure")
                .description("Total number of failed database health checks")
                .tag("service", "inbox-api")
                .register(registry);
    }

    @Bean
    public Timer dbQueryTimer(MeterRegistry registry) {
        return Timer.builder("db.query.duration")
                .description("Time taken by a single inbox database statement")
                .tag("service", "inbox-api")
                .register(registry);
    }
}

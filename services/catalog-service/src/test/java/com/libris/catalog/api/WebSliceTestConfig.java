package com.libris.catalog.api;

import com.libris.observability.MetricFactory;
import com.libris.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/** Beans the web layer needs that {@code @WebMvcTest} does not pick up. */
@TestConfiguration
class WebSliceTestConfig {

    @Bean
    SimpleMeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    MetricFactory metricFactory(SimpleMeterRegistry registry) {
        return new MetricFactory(registry, "catalog-test");
    }

    @Bean
    SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}

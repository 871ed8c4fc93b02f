package com.libris.catalog.config;

import com.libris.catalog.domain.User;
import com.libris.catalog.infrastructure.persistence.JdbcTokenStore;
import com.libris.database.jdbc.PagedQueryExecutor;
import com.libris.database.migration.FlywayMigrationConfig;
import com.libris.database.query.PaginationPlanner;
import com.libris.observability.MetricFactory;
import com.libris.observability.SensitiveDataRedactor;
import com.libris.observability.SpanHelper;
import com.libris.security.BearerAuthenticator;
import com.libris.security.TokenCodec;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.security.SecureRandom;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/** Wires the shared Libris libraries into the service. */
@Configuration
@Import(FlywayMigrationConfig.class)
public class CatalogConfig {

    static final int BCRYPT_STRENGTH = 12;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenCodec tokenCodec(Clock clock) {
        return new TokenCodec(new SecureRandom(), clock);
    }

    @Bean
    public BearerAuthenticator<User> bearerAuthenticator(JdbcTokenStore tokenStore, TokenCodec tokenCodec) {
        return new BearerAuthenticator<>(tokenStore, tokenCodec);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder(BCRYPT_STRENGTH);
    }

    @Bean
    public PaginationPlanner paginationPlanner(PaginationProperties pagination) {
        return new PaginationPlanner(pagination.maxPageSize());
    }

    @Bean
    public PagedQueryExecutor pagedQueryExecutor(JdbcTemplate jdbcTemplate) {
        return new PagedQueryExecutor(jdbcTemplate);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, CatalogProperties properties) {
        return new MetricFactory(registry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("com.libris.catalog"));
    }

    @Bean
    public SensitiveDataRedactor sensitiveDataRedactor() {
        return new SensitiveDataRedactor();
    }
}

package com.libris.catalog.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token lifetimes, bound from {@code libris.tokens.*}.
 *
 * @param activationTtl     lifetime of account activation tokens (default 3 days)
 * @param authenticationTtl lifetime of login tokens (default 24 hours)
 */
@ConfigurationProperties(prefix = "libris.tokens")
@Validated
public record TokenProperties(Duration activationTtl, Duration authenticationTtl) {

    public static final Duration DEFAULT_ACTIVATION_TTL = Duration.ofDays(3);
    public static final Duration DEFAULT_AUTHENTICATION_TTL = Duration.ofHours(24);

    public TokenProperties {
        if (activationTtl == null || activationTtl.isNegative() || activationTtl.isZero()) {
            activationTtl = DEFAULT_ACTIVATION_TTL;
        }
        if (authenticationTtl == null || authenticationTtl.isNegative() || authenticationTtl.isZero()) {
            authenticationTtl = DEFAULT_AUTHENTICATION_TTL;
        }
    }
}

package com.wifi.insights.config.properties;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for generated insight cards.
 *
 * <p>{@code cardTtl} is optional. When set, every card carries an {@code expiresAt} of its
 * creation time plus the TTL; when absent, cards have no expiry.
 */
@ConfigurationProperties(prefix = "insights")
@Validated
public record InsightsConfigurationProperties(Duration cardTtl) {}

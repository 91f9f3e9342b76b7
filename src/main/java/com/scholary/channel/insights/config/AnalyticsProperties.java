package com.scholary.channel.insights.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for discovery and aggregation.
 *
 * <p>{@code chunkSize} and {@code searchPageSize} are capped at the provider limits (200 ids per
 * analytics filter, 50 results per search page).
 */
@ConfigurationProperties(prefix = "analytics")
@Validated
public record AnalyticsProperties(
    @Positive int cacheTtlMinutes,
    @Positive @Max(200) int chunkSize,
    @Positive @Max(50) int searchPageSize,
    @Positive int maxEnumerationPages,
    @Positive int maxItems) {}
